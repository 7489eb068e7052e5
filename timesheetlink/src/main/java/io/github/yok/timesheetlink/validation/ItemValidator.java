package io.github.yok.timesheetlink.validation;

import io.github.yok.timesheetlink.model.WorkItem;
import io.github.yok.timesheetlink.util.CancellationToken;

/**
 * Check applied to a parsed work item.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface ItemValidator {

    /**
     * Validates the work item.
     *
     * @param item work item to check
     * @param token cancellation token
     * @throws io.github.yok.timesheetlink.exception.TimesheetException if the item is rejected
     */
    void validate(WorkItem item, CancellationToken token);
}
