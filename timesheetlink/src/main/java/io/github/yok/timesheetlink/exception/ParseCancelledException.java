package io.github.yok.timesheetlink.exception;

/**
 * Raised when a caller cancels a parse or validation through its cancellation token.
 *
 * <p>
 * Catch blocks that collect per-row failures must rethrow this type rather than record it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ParseCancelledException extends TimesheetException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception with the reason reported by the token.
     *
     * @param reason why the operation stopped (cancelled or deadline exceeded)
     */
    public ParseCancelledException(String reason) {
        super(TimesheetErrorKind.CANCELLED, reason);
    }
}
