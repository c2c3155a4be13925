package com.fieldgrouping.infrastructure.grouping.pipeline;

public class GroupingCancelledException extends RuntimeException {

    private final String scopeId;

    public GroupingCancelledException(String scopeId, GroupingStage stage) {
        super("Grouping of scope '" + scopeId + "' cancelled before " + stage);
        this.scopeId = scopeId;
    }

    public String getScopeId() {
        return scopeId;
    }
}
