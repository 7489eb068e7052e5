package io.github.yok.timesheetlink.parser;

import io.github.yok.timesheetlink.config.ParseOptions;
import io.github.yok.timesheetlink.model.FormatInfo;
import io.github.yok.timesheetlink.model.ParseResult;
import io.github.yok.timesheetlink.util.CancellationToken;
import java.io.InputStream;
import java.io.Reader;

/**
 * Entry point for turning delimiter-separated timesheet text into work items.
 *
 * <p>
 * Readers and streams are consumed completely but never closed. Byte streams are decoded as UTF-8.
 * All failures are reported as {@link io.github.yok.timesheetlink.exception.TimesheetException};
 * cancellation as its subtype
 * {@link io.github.yok.timesheetlink.exception.ParseCancelledException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface TimesheetParser {

    /**
     * Parses a timesheet.
     *
     * @param reader timesheet text
     * @param options parse options; {@code null} uses the configured defaults
     * @param token cancellation token
     * @return parse result
     */
    ParseResult parseTimesheet(Reader reader, ParseOptions options, CancellationToken token);

    /**
     * Parses a UTF-8 encoded timesheet.
     *
     * @param in timesheet bytes
     * @param options parse options; {@code null} uses the configured defaults
     * @param token cancellation token
     * @return parse result
     */
    ParseResult parseTimesheet(InputStream in, ParseOptions options, CancellationToken token);

    /**
     * Parses a timesheet without cancellation.
     *
     * @param reader timesheet text
     * @param options parse options; {@code null} uses the configured defaults
     * @return parse result
     */
    default ParseResult parseTimesheet(Reader reader, ParseOptions options) {
        return parseTimesheet(reader, options, CancellationToken.NONE);
    }

    /**
     * Detects the format of a timesheet from its first line.
     *
     * @param reader timesheet text
     * @param token cancellation token
     * @return detected format
     */
    FormatInfo detectFormat(Reader reader, CancellationToken token);

    /**
     * Detects the format of a UTF-8 encoded timesheet from its first line.
     *
     * @param in timesheet bytes
     * @param token cancellation token
     * @return detected format
     */
    FormatInfo detectFormat(InputStream in, CancellationToken token);

    /**
     * Detects the format of a timesheet without cancellation.
     *
     * @param reader timesheet text
     * @return detected format
     */
    default FormatInfo detectFormat(Reader reader) {
        return detectFormat(reader, CancellationToken.NONE);
    }

    /**
     * Detects the format and checks that it is supported.
     *
     * @param reader timesheet text
     * @param token cancellation token
     */
    void validateFormat(Reader reader, CancellationToken token);

    /**
     * Detects the format and checks that it is supported, without cancellation.
     *
     * @param reader timesheet text
     */
    default void validateFormat(Reader reader) {
        validateFormat(reader, CancellationToken.NONE);
    }
}
