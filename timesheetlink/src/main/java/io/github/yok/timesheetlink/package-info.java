/**
 * TimesheetLink: parsing and validation of delimiter-separated timesheets into billable work items.
 *
 * <p>
 * Register {@link io.github.yok.timesheetlink.config.TimesheetLinkConfiguration} in a Spring
 * context, or construct the components directly, and call
 * {@link io.github.yok.timesheetlink.parser.TimesheetParser#parseTimesheet}.
 * </p>
 */
package io.github.yok.timesheetlink;
