package io.github.yok.timesheetlink.validation;

import io.github.yok.timesheetlink.model.WorkItem;
import io.github.yok.timesheetlink.util.CancellationToken;
import java.util.List;

/**
 * Validates timesheet data at item, row and batch level through an ordered list of
 * {@link ValidationRule}s.
 *
 * <p>
 * Every operation checks the cancellation token before doing any work. Failures are reported as
 * {@link io.github.yok.timesheetlink.exception.TimesheetException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface TimesheetValidator {

    /**
     * Applies every item-level rule to the work item.
     *
     * @param item work item
     * @param token cancellation token
     */
    void validateWorkItem(WorkItem item, CancellationToken token);

    /**
     * Applies every row-level rule to a raw row.
     *
     * @param row raw fields
     * @param line 1-based line number
     * @param token cancellation token
     */
    void validateRow(List<String> row, int line, CancellationToken token);

    /**
     * Validates every item of a batch and then the batch as a whole.
     *
     * @param items work items of one import
     * @param token cancellation token
     */
    void validateBatch(List<WorkItem> items, CancellationToken token);

    /**
     * Appends a rule to the end of the rule list.
     *
     * @param rule rule to add
     */
    void addRule(ValidationRule rule);

    /**
     * Removes the first rule with the given name.
     *
     * @param name rule name
     * @return {@code true} if a rule was removed
     */
    boolean removeRule(String name);

    /**
     * Returns a snapshot of the current rule list.
     *
     * @return rules in application order
     */
    List<ValidationRule> getRules();
}
