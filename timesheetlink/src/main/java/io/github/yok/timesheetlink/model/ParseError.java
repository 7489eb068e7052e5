package io.github.yok.timesheetlink.model;

import com.google.common.collect.ImmutableList;
import io.github.yok.timesheetlink.exception.TimesheetException;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Describes why one data row could not be turned into a work item.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class ParseError {

    // 1-based line number, always >= 1
    int line;

    // Canonical field name that failed, or null when the failure concerns the whole row
    String column;

    // Offending raw value, or null
    String value;

    String message;

    String suggestion;

    // Complete raw row
    List<String> row;

    /**
     * Builds the error entry for a failed row.
     *
     * @param line 1-based line number
     * @param row raw row
     * @param message message to record
     * @param cause failure raised while parsing or validating the row
     * @return error entry
     */
    public static ParseError of(int line, List<String> row, String message,
            TimesheetException cause) {
        return ParseError.builder().line(Math.max(1, line)).column(cause.getField())
                .value(cause.getValue()).message(message).suggestion(cause.getSuggestion())
                .row(ImmutableList.copyOf(row)).build();
    }
}
