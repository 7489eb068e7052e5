package io.github.yok.timesheetlink.exception;

import lombok.Getter;

/**
 * Unchecked exception raised by the timesheet parser and validators.
 *
 * <p>
 * Every occurrence carries its {@link TimesheetErrorKind} plus the context needed to show the
 * failure to a user: the 1-based line number (or {@code 0} when the failure is not tied to a line),
 * the canonical field name and the offending raw value.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class TimesheetException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // Failure category
    private final TimesheetErrorKind kind;

    // 1-based line number, 0 when unknown
    private final int line;

    // Canonical field name (date, hours, rate, description) or null
    private final String field;

    // Raw offending value or null
    private final String value;

    /**
     * Creates an exception that is not tied to a line or field.
     *
     * @param kind failure category
     * @param message user-displayable message
     */
    public TimesheetException(TimesheetErrorKind kind, String message) {
        this(kind, message, 0, null, null, null);
    }

    /**
     * Creates an exception that wraps a lower-level cause.
     *
     * @param kind failure category
     * @param message user-displayable message
     * @param cause underlying exception
     */
    public TimesheetException(TimesheetErrorKind kind, String message, Throwable cause) {
        this(kind, message, 0, null, null, cause);
    }

    /**
     * Creates an exception describing a problem with a single field value.
     *
     * @param kind failure category
     * @param message user-displayable message
     * @param field canonical field name
     * @param value offending raw value
     */
    public TimesheetException(TimesheetErrorKind kind, String message, String field,
            String value) {
        this(kind, message, 0, field, value, null);
    }

    /**
     * Creates an exception with full context.
     *
     * @param kind failure category
     * @param message user-displayable message
     * @param line 1-based line number, or {@code 0} when unknown
     * @param field canonical field name, may be {@code null}
     * @param value offending raw value, may be {@code null}
     * @param cause underlying exception, may be {@code null}
     */
    public TimesheetException(TimesheetErrorKind kind, String message, int line, String field,
            String value, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.line = line;
        this.field = field;
        this.value = value;
    }

    /**
     * Returns the suggestion associated with the error kind.
     *
     * @return suggested fix
     */
    public String getSuggestion() {
        return kind.getSuggestion();
    }
}
