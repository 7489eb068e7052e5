/**
 * Utility package for TimesheetLink.
 *
 * <p>
 * Provides reusable helpers used across the project: buffered CSV reading on top of Apache Commons
 * CSV and the cooperative cancellation token threaded through parsing and validation.
 * </p>
 *
 * <p>
 * Utilities in this package are stateless apart from the token itself.
 * </p>
 */
package io.github.yok.timesheetlink.util;
