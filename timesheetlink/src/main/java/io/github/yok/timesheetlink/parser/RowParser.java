package io.github.yok.timesheetlink.parser;

import io.github.yok.timesheetlink.exception.TimesheetErrorKind;
import io.github.yok.timesheetlink.exception.TimesheetException;
import io.github.yok.timesheetlink.model.CanonicalField;
import io.github.yok.timesheetlink.model.HeaderMap;
import io.github.yok.timesheetlink.model.WorkItem;
import io.github.yok.timesheetlink.util.CancellationToken;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.OptionalInt;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Converts one raw data row into a {@link WorkItem}.
 *
 * <p>
 * The four canonical fields are located through the header map, trimmed and converted: the date by
 * {@link DateInterpreter}, hours and rate as {@link BigDecimal}. A row either yields a complete
 * work item or fails with a {@link TimesheetException} naming the line, the field and the raw
 * value. Whether a failure stops the parse is decided by the caller.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@RequiredArgsConstructor
public class RowParser {

    // Largest accepted number of fraction digits (after removing trailing zeros)
    static final int MAX_FRACTION_DIGITS = 10;

    // Largest accepted number of integer digits
    static final int MAX_INTEGER_DIGITS = 12;

    private final DateInterpreter dateInterpreter;

    private final IdGenerator idGenerator;

    private final Clock clock;

    /**
     * Parses a data row.
     *
     * @param row raw fields of the row
     * @param headerMap header mapping of the timesheet
     * @param line 1-based line number used in error context
     * @param token cancellation token
     * @return work item with computed total
     * @throws TimesheetException if a field is missing, blank or cannot be converted
     * @throws io.github.yok.timesheetlink.exception.ParseCancelledException if cancelled
     */
    public WorkItem parseRow(List<String> row, HeaderMap headerMap, int line,
            CancellationToken token) {
        token.throwIfCancelled();
        if (row.isEmpty()) {
            throw new TimesheetException(TimesheetErrorKind.EMPTY_ROW,
                    TimesheetErrorKind.EMPTY_ROW.getDefaultMessage(), line, null, null, null);
        }

        String dateText = fieldValue(row, headerMap, CanonicalField.DATE, line);
        String hoursText = fieldValue(row, headerMap, CanonicalField.HOURS, line);
        String rateText = fieldValue(row, headerMap, CanonicalField.RATE, line);
        String description = fieldValue(row, headerMap, CanonicalField.DESCRIPTION, line);

        LocalDate date;
        try {
            date = dateInterpreter.parse(dateText);
        } catch (TimesheetException e) {
            throw new TimesheetException(e.getKind(),
                    String.format("invalid date '%s': %s", dateText, e.getMessage()), line,
                    CanonicalField.DATE.getKey(), dateText, e);
        }
        BigDecimal hours = parseDecimal(CanonicalField.HOURS, hoursText, line);
        BigDecimal rate = parseDecimal(CanonicalField.RATE, rateText, line);

        return WorkItem.create(idGenerator.generateId(), date, hours, rate, description,
                clock.instant());
    }

    /**
     * Returns the trimmed value of a canonical field.
     *
     * @param row raw fields
     * @param headerMap header mapping
     * @param field canonical field to look up
     * @param line 1-based line number
     * @return trimmed, non-blank value
     */
    private static String fieldValue(List<String> row, HeaderMap headerMap, CanonicalField field,
            int line) {
        OptionalInt index = headerMap.indexOf(field);
        if (!index.isPresent()) {
            throw new TimesheetException(TimesheetErrorKind.REQUIRED_FIELD_MISSING,
                    "field not found in header: " + field.getKey(), line, field.getKey(), null,
                    null);
        }
        if (index.getAsInt() >= row.size()) {
            throw new TimesheetException(TimesheetErrorKind.FIELD_MISSING_IN_ROW,
                    "field missing in row: " + field.getKey(), line, field.getKey(), null, null);
        }
        String value = StringUtils.strip(row.get(index.getAsInt()));
        if (StringUtils.isEmpty(value)) {
            throw new TimesheetException(TimesheetErrorKind.FIELD_EMPTY,
                    "field is empty: " + field.getKey(), line, field.getKey(), value, null);
        }
        return value;
    }

    /**
     * Parses a plain decimal number.
     *
     * <p>
     * Values with more than {@value #MAX_INTEGER_DIGITS} integer digits or more than
     * {@value #MAX_FRACTION_DIGITS} significant fraction digits are rejected. A value written with
     * a negative scale or with more fraction digits than that (such as {@code 1e3} or
     * {@code 0e-999999999}) is returned in plain form without trailing zeros, so the scale of every
     * returned value stays within {@code 0..}{@value #MAX_FRACTION_DIGITS}.
     * </p>
     *
     * @param field hours or rate
     * @param text trimmed text
     * @param line 1-based line number
     * @return parsed value
     */
    private static BigDecimal parseDecimal(CanonicalField field, String text, int line) {
        BigDecimal value;
        try {
            value = new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new TimesheetException(TimesheetErrorKind.INVALID_NUMBER,
                    String.format("invalid %s '%s': not a valid decimal number", field.getKey(),
                            text),
                    line, field.getKey(), text, e);
        }
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() > MAX_FRACTION_DIGITS
                || stripped.precision() - stripped.scale() > MAX_INTEGER_DIGITS) {
            throw new TimesheetException(TimesheetErrorKind.INVALID_NUMBER,
                    String.format("invalid %s '%s': value out of range", field.getKey(), text),
                    line, field.getKey(), text, null);
        }
        if (value.scale() < 0 || value.scale() > MAX_FRACTION_DIGITS) {
            return stripped.setScale(Math.max(0, stripped.scale()));
        }
        return value;
    }
}
