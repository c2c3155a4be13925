package com.fieldgrouping.domain.grouping.service;

import com.fieldgrouping.domain.grouping.model.Field;
import com.fieldgrouping.domain.grouping.model.GroupingStrategy;

import java.util.List;

/**
 * Domain service deciding how the fields of one scope are visually grouped.
 */
public interface FieldGroupingService {

    /**
     * Partition the fields of one scope into grouping strategies.
     *
     * @param scopeId          scope (section) the fields belong to, used for logging
     * @param fields           fields in display order; may be empty
     * @param metadataSource   server category metadata, may fail
     * @param cancellation     checked between pipeline stages
     * @return strategies whose members together are exactly {@code fields}
     */
    List<GroupingStrategy> group(String scopeId,
                                 List<Field> fields,
                                 CategoryMetadataSource metadataSource,
                                 CancellationToken cancellation);
}
