/**
 * Error model of TimesheetLink.
 *
 * <p>
 * Failures are described by a closed {@link TimesheetErrorKind} attached to a
 * {@link TimesheetException}, together with the line, field and raw value that caused them.
 * Cancellation has its own subtype so that it can be told apart from data errors.
 * </p>
 */
package io.github.yok.timesheetlink.exception;
