package io.github.yok.timesheetlink.validation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Named validation unit registered with a {@link TimesheetValidator}.
 *
 * <p>
 * A rule holds an item-level check, a row-level check, or both. Rules are plain values; the
 * validator applies them in registration order and stops at the first failure.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class ValidationRule {

    // Unique name, used for removal and in error messages
    @NonNull
    String name;

    String description;

    // Applied to parsed work items; may be null
    ItemValidator itemValidator;

    // Applied to raw rows; may be null
    RowValidator rowValidator;

    /**
     * Creates a rule that checks work items.
     *
     * @param name rule name
     * @param description human-readable purpose
     * @param validator item check
     * @return new rule
     */
    public static ValidationRule ofItem(String name, String description, ItemValidator validator) {
        return ValidationRule.builder().name(name).description(description)
                .itemValidator(validator).build();
    }

    /**
     * Creates a rule that checks raw rows.
     *
     * @param name rule name
     * @param description human-readable purpose
     * @param validator row check
     * @return new rule
     */
    public static ValidationRule ofRow(String name, String description, RowValidator validator) {
        return ValidationRule.builder().name(name).description(description)
                .rowValidator(validator).build();
    }
}
