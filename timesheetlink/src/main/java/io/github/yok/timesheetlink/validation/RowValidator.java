package io.github.yok.timesheetlink.validation;

import io.github.yok.timesheetlink.util.CancellationToken;
import java.util.List;

/**
 * Check applied to a raw row before it is parsed.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface RowValidator {

    /**
     * Validates the row.
     *
     * @param row raw fields
     * @param line 1-based line number
     * @param token cancellation token
     * @throws io.github.yok.timesheetlink.exception.TimesheetException if the row is rejected
     */
    void validate(List<String> row, int line, CancellationToken token);
}
