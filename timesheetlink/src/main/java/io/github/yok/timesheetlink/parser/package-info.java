/**
 * Timesheet parsing pipeline.
 *
 * <p>
 * {@link CsvTimesheetParser} drives the pipeline: {@link FormatDetector} infers the delimiter,
 * {@link HeaderNormalizer} maps header spellings to canonical fields, {@link RowParser} converts
 * each data row with the help of {@link DateInterpreter}, and the result is validated before it is
 * collected.
 * </p>
 */
package io.github.yok.timesheetlink.parser;
