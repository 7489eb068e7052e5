package io.github.yok.timesheetlink.parser;

import io.github.yok.timesheetlink.config.TimesheetFormat;
import io.github.yok.timesheetlink.exception.TimesheetErrorKind;
import io.github.yok.timesheetlink.exception.TimesheetException;
import io.github.yok.timesheetlink.model.FormatInfo;
import io.github.yok.timesheetlink.util.CsvUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Infers the delimiter of timesheet content from its first line.
 *
 * <p>
 * Only comma, tab and semicolon are considered, and only the first line is sampled. A line that
 * mixes delimiter types is rejected as ambiguous rather than guessed, so callers must name the
 * format explicitly for such files.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class FormatDetector {

    // Fewest columns a work item needs
    static final int MIN_COLUMNS = 3;

    // Most columns accepted
    static final int MAX_COLUMNS = 50;

    /**
     * Detects the format of the given content.
     *
     * @param content complete or partial text content; may be {@code null}
     * @return detected format with header flag set and UTF-8 encoding
     * @throws TimesheetException with kind {@code EMPTY_CONTENT}, {@code AMBIGUOUS_FORMAT},
     *         {@code NO_DELIMITERS}, {@code TOO_FEW_COLUMNS} or {@code TOO_MANY_COLUMNS}
     */
    public FormatInfo detect(String content) {
        String firstLine = StringUtils.strip(CsvUtils.firstLine(content));
        if (StringUtils.isEmpty(firstLine)) {
            throw new TimesheetException(TimesheetErrorKind.EMPTY_CONTENT,
                    TimesheetErrorKind.EMPTY_CONTENT.getDefaultMessage());
        }

        int commas = StringUtils.countMatches(firstLine, ',');
        int tabs = StringUtils.countMatches(firstLine, '\t');
        int semicolons = StringUtils.countMatches(firstLine, ';');

        int kinds = (commas > 0 ? 1 : 0) + (tabs > 0 ? 1 : 0) + (semicolons > 0 ? 1 : 0);
        if (kinds > 1) {
            throw new TimesheetException(TimesheetErrorKind.AMBIGUOUS_FORMAT,
                    TimesheetErrorKind.AMBIGUOUS_FORMAT.getDefaultMessage());
        }
        if (kinds == 0) {
            throw new TimesheetException(TimesheetErrorKind.NO_DELIMITERS,
                    TimesheetErrorKind.NO_DELIMITERS.getDefaultMessage());
        }

        int columns = Math.max(commas, Math.max(tabs, semicolons)) + 1;
        if (columns < MIN_COLUMNS) {
            throw new TimesheetException(TimesheetErrorKind.TOO_FEW_COLUMNS,
                    String.format("too few columns detected (%d), need at least %d for work items",
                            columns, MIN_COLUMNS));
        }
        if (columns > MAX_COLUMNS) {
            throw new TimesheetException(TimesheetErrorKind.TOO_MANY_COLUMNS,
                    String.format("too many columns detected (%d), maximum supported is %d",
                            columns, MAX_COLUMNS));
        }

        TimesheetFormat format = TimesheetFormat.STANDARD;
        if (tabs > commas && tabs > semicolons) {
            format = TimesheetFormat.TAB;
        } else if (semicolons > commas && semicolons > tabs) {
            format = TimesheetFormat.SEMICOLON;
        }
        log.debug("Detected format: {} ({} columns)", format.getFormatName(), columns);
        return FormatInfo.detected(format.getFormatName(), format.getDelimiter());
    }
}
