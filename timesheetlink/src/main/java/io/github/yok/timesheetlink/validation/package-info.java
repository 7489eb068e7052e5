/**
 * Rule-based validation of timesheet data.
 *
 * <p>
 * A {@link ValidationRule} is a named value holding an item check, a row check, or both.
 * {@link WorkItemValidator} applies its rules in order at item, row and batch level and lets
 * callers add or remove rules by name at runtime.
 * </p>
 */
package io.github.yok.timesheetlink.validation;
