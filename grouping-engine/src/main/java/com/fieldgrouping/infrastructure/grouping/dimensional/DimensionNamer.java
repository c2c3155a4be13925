package com.fieldgrouping.infrastructure.grouping.dimensional;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Names a dimension from the shape of its values, e.g. {@code P1, P2} is a "Grade" axis.
 * A rule applies when more than half of the values match it.
 */
@Component
public class DimensionNamer {

    private static final Pattern GRADE = Pattern.compile("(?i)^(p|s|jss|sss|grade|class|form)\\s*\\.?\\s*\\d+$");
    private static final Pattern NUMERIC = Pattern.compile("^\\d+(\\.\\d+)?$");

    private static final Set<String> GENDER = Set.of("male", "female", "boys", "girls", "boy", "girl", "men", "women");
    private static final Set<String> BOARDING = Set.of("day", "boarding", "boarder", "boarders", "day scholar");
    private static final Set<String> LOCATION = Set.of("urban", "rural", "peri-urban", "semi-urban");

    private record Rule(String name, Predicate<String> matcher) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule("Grade", v -> GRADE.matcher(v).matches()),
            new Rule("Gender", v -> GENDER.contains(v.toLowerCase(Locale.ROOT))),
            new Rule("Boarding Status", v -> BOARDING.contains(v.toLowerCase(Locale.ROOT))),
            new Rule("Disability Status", v -> v.toLowerCase(Locale.ROOT).contains("disabled")),
            new Rule("Location", v -> LOCATION.contains(v.toLowerCase(Locale.ROOT))),
            new Rule("Numeric Category", v -> NUMERIC.matcher(v).matches())
    );

    /**
     * Name for the axis at {@code position}, unique among {@code taken}.
     */
    public String name(Collection<String> values, int position, Set<String> taken) {
        String base = "Dimension " + position;
        for (Rule rule : RULES) {
            long matches = values.stream().filter(rule.matcher()).count();
            if (matches * 2 > values.size()) {
                base = rule.name();
                break;
            }
        }

        String candidate = base;
        int suffix = 2;
        while (taken.contains(candidate)) {
            candidate = base + " " + suffix++;
        }
        return candidate;
    }
}
