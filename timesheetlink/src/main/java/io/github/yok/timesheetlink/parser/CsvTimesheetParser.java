package io.github.yok.timesheetlink.parser;

import io.github.yok.timesheetlink.config.ParseOptions;
import io.github.yok.timesheetlink.config.TimesheetFormat;
import io.github.yok.timesheetlink.config.TimesheetProperties;
import io.github.yok.timesheetlink.exception.ParseCancelledException;
import io.github.yok.timesheetlink.exception.TimesheetErrorKind;
import io.github.yok.timesheetlink.exception.TimesheetException;
import io.github.yok.timesheetlink.model.CanonicalField;
import io.github.yok.timesheetlink.model.FormatInfo;
import io.github.yok.timesheetlink.model.HeaderMap;
import io.github.yok.timesheetlink.model.ParseError;
import io.github.yok.timesheetlink.model.ParseResult;
import io.github.yok.timesheetlink.model.WorkItem;
import io.github.yok.timesheetlink.util.CancellationToken;
import io.github.yok.timesheetlink.util.CsvUtils;
import io.github.yok.timesheetlink.validation.TimesheetValidator;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * {@link TimesheetParser} for delimiter-separated timesheets.
 *
 * <p>
 * <strong>Processing flow:</strong>
 * </p>
 * <ol>
 * <li>Buffer the whole input.</li>
 * <li>Resolve the format: the one named in the options, or the one detected from the first line
 * when none is named.</li>
 * <li>Split the content into rows with Apache Commons CSV; no rows is a fatal error.</li>
 * <li>Map the header row to canonical fields; a missing field is a fatal error.</li>
 * <li>Parse and validate each data row. A failed row is recorded as a {@link ParseError} when
 * continue-on-error is enabled and its kind is not {@linkplain TimesheetErrorKind#isFatal() fatal};
 * otherwise the parse stops with an exception naming the line and no result is returned.</li>
 * </ol>
 *
 * <p>
 * Line numbers are 1-based record positions: the header is line 1, the first data row line 2.
 * Blank lines are dropped by the reader and do not count. Cancellation is checked before reading,
 * after the header is processed and before each row.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CsvTimesheetParser implements TimesheetParser {

    private final FormatDetector formatDetector;

    private final RowParser rowParser;

    private final TimesheetValidator validator;

    private final TimesheetProperties properties;

    @Override
    public ParseResult parseTimesheet(Reader reader, ParseOptions options,
            CancellationToken token) {
        token.throwIfCancelled();
        ParseOptions opts = options != null ? options : properties.toParseOptions();
        log.info("Starting timesheet parsing: format={}",
                StringUtils.defaultIfBlank(opts.getFormat(), "auto"));
        if (StringUtils.isNotBlank(opts.getDateFormat())) {
            log.debug("Preferred date format hint: {}", opts.getDateFormat());
        }

        String content = read(reader);
        TimesheetFormat format = resolveFormat(opts.getFormat(), content);
        List<List<String>> rows = readRows(content, format.toCsvFormat());
        if (rows.isEmpty()) {
            throw new TimesheetException(TimesheetErrorKind.EMPTY_INPUT,
                    TimesheetErrorKind.EMPTY_INPUT.getDefaultMessage());
        }

        HeaderMap headerMap = processHeader(rows.get(0));
        token.throwIfCancelled();

        List<WorkItem> workItems = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();
        for (int i = 1; i < rows.size(); i++) {
            token.throwIfCancelled();
            int line = i + 1;
            List<String> row = rows.get(i);
            if (opts.isSkipEmptyRows() && CsvUtils.isBlankRow(row)) {
                log.debug("Skipping empty row at line {}", line);
                continue;
            }

            WorkItem item;
            try {
                item = rowParser.parseRow(row, headerMap, line, token);
            } catch (ParseCancelledException e) {
                throw e;
            } catch (TimesheetException e) {
                if (!opts.isContinueOnError() || e.getKind().isFatal()) {
                    throw fatal("parsing failed", line, e);
                }
                errors.add(ParseError.of(line, row, e.getMessage(), e));
                continue;
            }

            try {
                validator.validateWorkItem(item, token);
            } catch (ParseCancelledException e) {
                throw e;
            } catch (TimesheetException e) {
                if (!opts.isContinueOnError() || e.getKind().isFatal()) {
                    throw fatal("validation failed", line, e);
                }
                errors.add(ParseError.of(line, row, "validation failed: " + e.getMessage(), e));
                continue;
            }
            workItems.add(item);
        }

        ParseResult result =
                ParseResult.of(workItems, errors, headerMap, format.getFormatName());
        log.info("Timesheet parsing completed: total_rows={}, success_rows={}, error_rows={}",
                result.getTotalRows(), result.getSuccessRows(), result.getErrorRows());
        return result;
    }

    @Override
    public ParseResult parseTimesheet(InputStream in, ParseOptions options,
            CancellationToken token) {
        return parseTimesheet(toReader(in), options, token);
    }

    @Override
    public FormatInfo detectFormat(Reader reader, CancellationToken token) {
        token.throwIfCancelled();
        String content = read(reader);
        FormatInfo format = formatDetector.detect(content);
        log.debug("Format detection completed: detected_format={}, delimiter_code={}",
                format.getName(), (int) format.getDelimiter());
        return format;
    }

    @Override
    public FormatInfo detectFormat(InputStream in, CancellationToken token) {
        return detectFormat(toReader(in), token);
    }

    @Override
    public void validateFormat(Reader reader, CancellationToken token) {
        token.throwIfCancelled();
        FormatInfo format;
        try {
            format = detectFormat(reader, token);
        } catch (ParseCancelledException e) {
            throw e;
        } catch (TimesheetException e) {
            throw new TimesheetException(e.getKind(), "format detection failed: " + e.getMessage(),
                    e);
        }
        if (!TimesheetFormat.isSupported(format.getName())) {
            throw new TimesheetException(TimesheetErrorKind.UNSUPPORTED_FORMAT,
                    TimesheetErrorKind.UNSUPPORTED_FORMAT.getDefaultMessage() + ": "
                            + format.getName());
        }
    }

    /**
     * Determines the format used to read the content.
     *
     * @param name format name from the options; blank requests detection
     * @param content buffered content
     * @return format to read with
     */
    private TimesheetFormat resolveFormat(String name, String content) {
        if (StringUtils.isNotBlank(name)) {
            return TimesheetFormat.fromName(name)
                    .orElseThrow(() -> new TimesheetException(TimesheetErrorKind.UNSUPPORTED_FORMAT,
                            TimesheetErrorKind.UNSUPPORTED_FORMAT.getDefaultMessage() + ": "
                                    + name.trim()));
        }
        if (StringUtils.isBlank(content)) {
            throw new TimesheetException(TimesheetErrorKind.EMPTY_INPUT,
                    TimesheetErrorKind.EMPTY_INPUT.getDefaultMessage());
        }
        FormatInfo detected = detectForParse(content);
        log.debug("Detected format {} for content without explicit format", detected.getName());
        return TimesheetFormat.fromName(detected.getName())
                .orElseThrow(() -> new TimesheetException(TimesheetErrorKind.UNSUPPORTED_FORMAT,
                        TimesheetErrorKind.UNSUPPORTED_FORMAT.getDefaultMessage() + ": "
                                + detected.getName()));
    }

    private FormatInfo detectForParse(String content) {
        try {
            return formatDetector.detect(content);
        } catch (TimesheetException e) {
            throw new TimesheetException(e.getKind(), "format detection failed: " + e.getMessage(),
                    e);
        }
    }

    /**
     * Builds the header map and checks that every canonical field is present.
     *
     * @param headerRow raw header cells
     * @return header map
     */
    private HeaderMap processHeader(List<String> headerRow) {
        HeaderMap headerMap = HeaderNormalizer.buildHeaderMap(headerRow);
        List<CanonicalField> missing = headerMap.missingFields();
        if (!missing.isEmpty()) {
            String field = missing.get(0).getKey();
            throw new TimesheetException(TimesheetErrorKind.REQUIRED_FIELD_MISSING,
                    "header processing failed: "
                            + TimesheetErrorKind.REQUIRED_FIELD_MISSING.getDefaultMessage() + ": "
                            + field,
                    1, field, null, null);
        }
        log.debug("Header processed: fields={}, mapping={}", headerMap.size(), headerMap.asMap());
        return headerMap;
    }

    private static String read(Reader reader) {
        try {
            return CsvUtils.readFully(reader);
        } catch (IOException e) {
            throw new TimesheetException(TimesheetErrorKind.READ_FAILURE,
                    TimesheetErrorKind.READ_FAILURE.getDefaultMessage() + ": " + e.getMessage(), e);
        }
    }

    private static Reader toReader(InputStream in) {
        try {
            return CsvUtils.toUtf8Reader(in);
        } catch (IOException e) {
            throw new TimesheetException(TimesheetErrorKind.READ_FAILURE,
                    TimesheetErrorKind.READ_FAILURE.getDefaultMessage() + ": " + e.getMessage(), e);
        }
    }

    private static List<List<String>> readRows(String content, CSVFormat csvFormat) {
        try {
            return CsvUtils.readRows(content, csvFormat);
        } catch (IOException e) {
            throw new TimesheetException(TimesheetErrorKind.READ_FAILURE,
                    TimesheetErrorKind.READ_FAILURE.getDefaultMessage() + ": " + e.getMessage(), e);
        }
    }

    private static TimesheetException fatal(String stage, int line, TimesheetException cause) {
        return new TimesheetException(cause.getKind(),
                String.format("%s at line %d: %s", stage, line, cause.getMessage()), line,
                cause.getField(), cause.getValue(), cause);
    }
}
