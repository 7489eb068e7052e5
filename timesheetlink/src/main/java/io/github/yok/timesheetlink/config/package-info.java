/**
 * Configuration of the timesheet engine: supported formats, per-parse options, properties bound
 * from the {@code timesheet} prefix and the Spring wiring.
 */
package io.github.yok.timesheetlink.config;
