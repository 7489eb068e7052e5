package io.github.yok.timesheetlink.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Closed set of failure categories raised while reading, parsing and validating timesheets.
 *
 * <p>
 * Each kind carries a short default message and a suggestion that is shown to the user next to a
 * failed row. Kinds are grouped as follows:
 * </p>
 * <ul>
 * <li><strong>structural</strong>: the whole input is unusable and the parse aborts before any
 * data row is processed</li>
 * <li><strong>per-row</strong>: a single row failed; recoverable when continue-on-error is
 * enabled</li>
 * <li><strong>cancellation</strong>: the caller cancelled the operation</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum TimesheetErrorKind {

    // Structural: input has no rows
    EMPTY_INPUT("CSV file is empty", "Provide a header row followed by at least one data row",
            true),

    // Structural: the reader failed or quoting is malformed
    READ_FAILURE("failed to read CSV data", "Check quoting and make sure the file is UTF-8 encoded",
            true),

    // Structural: nothing to inspect for delimiter detection
    EMPTY_CONTENT("cannot detect format of empty content",
            "Provide a header row such as Date,Hours,Rate,Description", true),

    // Structural: more than one delimiter type on the first line
    AMBIGUOUS_FORMAT("ambiguous format: multiple delimiter types detected",
            "Specify the format explicitly (standard, tab, semicolon, ...)", true),

    // Structural: first line contains no known delimiter
    NO_DELIMITERS("no delimiters found", "Separate columns with commas, tabs or semicolons", true),

    // Structural: fewer than three columns detected
    TOO_FEW_COLUMNS("too few columns detected",
            "Provide at least Date, Hours, Rate and Description columns", true),

    // Structural: more than fifty columns detected
    TOO_MANY_COLUMNS("too many columns detected", "Remove unused columns from the file", true),

    // Structural: requested or detected format is not supported
    UNSUPPORTED_FORMAT("unsupported CSV format",
            "Use one of standard, rfc4180, tab, tsv, semicolon or excel", true),

    // Structural: a canonical column is missing from the header
    REQUIRED_FIELD_MISSING("required field not found in header",
            "Add Date, Hours, Rate and Description columns to the header row", true),

    // Per-row: the row has no fields
    EMPTY_ROW("empty row", "Remove the empty row or enable skipping of empty rows", false),

    // Per-row: the row is shorter than the header
    FIELD_MISSING_IN_ROW("field missing in row", "Make sure every row has a value for each column",
            false),

    // Per-row: a canonical field is blank
    FIELD_EMPTY("field is empty", "Fill in the missing value", false),

    // Per-row: the date text matched none of the supported formats
    UNSUPPORTED_DATE_FORMAT("unsupported date format",
            "Use YYYY-MM-DD, MM/DD/YYYY or a month name such as 'Jan 2, 2024'", false),

    // Per-row: hours or rate is not a decimal number
    INVALID_NUMBER("invalid number", "Use plain decimal numbers such as 7.5 or 125.00", false),

    // Per-row: a validation rule rejected the work item or row
    VALIDATION_FAILED("validation failed", "Correct the value so that it satisfies the rule",
            false),

    // Cancellation requested by the caller
    CANCELLED("operation cancelled", "Retry the operation", true);

    // Default message used when no specific message is supplied
    private final String defaultMessage;

    // Suggested fix presented alongside the error
    private final String suggestion;

    // Whether the error aborts a parse regardless of continue-on-error
    private final boolean fatal;
}
