package io.github.yok.timesheetlink.core;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Categories of non-fatal findings reported by an import validation.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum ImportWarningType {

    // Work item dated on a Saturday or Sunday
    WEEKEND_WORK("weekend_work"),

    // Work item with more than ten hours
    HIGH_HOURS("high_hours");

    // Identifier used in reports
    private final String type;
}
