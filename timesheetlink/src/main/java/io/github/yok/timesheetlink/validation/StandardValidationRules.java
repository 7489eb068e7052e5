package io.github.yok.timesheetlink.validation;

import com.google.common.collect.ImmutableList;
import io.github.yok.timesheetlink.config.TimesheetProperties;
import io.github.yok.timesheetlink.exception.TimesheetErrorKind;
import io.github.yok.timesheetlink.exception.TimesheetException;
import io.github.yok.timesheetlink.model.WorkItem;
import io.github.yok.timesheetlink.util.CancellationToken;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Factory of the standard validation rules.
 *
 * <p>
 * The rules, in application order:
 * </p>
 * <ol>
 * <li>{@value #DATE}: the date is set, at most {@code maxFutureDays} days ahead and at most
 * {@code maxPastYears} years back</li>
 * <li>{@value #HOURS}: {@code 0 < hours <= maxHours} with at most two decimal places</li>
 * <li>{@value #RATE}: {@code minRate <= rate <= maxRate}</li>
 * <li>{@value #DESCRIPTION}: non-blank, length within bounds and not a generic word</li>
 * <li>{@value #TOTAL}: {@code total} equals {@code hours * rate} within the tolerance</li>
 * <li>{@value #ROW_FORMAT}: a raw row has between {@code minRowFields} and {@code maxRowFields}
 * fields</li>
 * </ol>
 *
 * <p>
 * Unusually high hours and rates are logged at debug level and do not fail.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class StandardValidationRules {

    public static final String DATE = "DateValidation";
    public static final String HOURS = "HoursValidation";
    public static final String RATE = "RateValidation";
    public static final String DESCRIPTION = "DescriptionValidation";
    public static final String TOTAL = "TotalValidation";
    public static final String ROW_FORMAT = "RowFormatValidation";

    private final Clock clock;

    private final TimesheetProperties.Validation limits;

    // Lower-cased generic descriptions
    private final Set<String> genericDescriptions;

    /**
     * Creates the factory.
     *
     * @param clock source of today's date for the date rule
     * @param limits configured limits
     */
    public StandardValidationRules(Clock clock, TimesheetProperties.Validation limits) {
        this.clock = clock;
        this.limits = limits;
        this.genericDescriptions = limits.getGenericDescriptions().stream()
                .filter(Objects::nonNull).map(s -> s.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Creates the standard rules in application order.
     *
     * @return new list of rules
     */
    public List<ValidationRule> createRules() {
        return ImmutableList.of(
                ValidationRule.ofItem(DATE, "Validates work item dates are reasonable",
                        this::validateDate),
                ValidationRule.ofItem(HOURS, "Validates hours are within reasonable limits",
                        this::validateHours),
                ValidationRule.ofItem(RATE, "Validates hourly rates are positive and reasonable",
                        this::validateRate),
                ValidationRule.ofItem(DESCRIPTION, "Validates work descriptions are meaningful",
                        this::validateDescription),
                ValidationRule.ofItem(TOTAL, "Validates calculated totals are correct",
                        this::validateTotal),
                ValidationRule.ofRow(ROW_FORMAT, "Validates row format and field count",
                        this::validateRowFormat));
    }

    void validateDate(WorkItem item, CancellationToken token) {
        LocalDate date = item.getDate();
        if (date == null) {
            throw failure("work date cannot be empty", "date", null);
        }
        LocalDate today = LocalDate.now(clock);
        if (date.isAfter(today.plusDays(limits.getMaxFutureDays()))) {
            throw failure(String.format(
                    "work date is too far in the future (more than %d days from now): %s",
                    limits.getMaxFutureDays(), date), "date", date.toString());
        }
        if (date.isBefore(today.minusYears(limits.getMaxPastYears()))) {
            throw failure(String.format(
                    "work date is too far in the past (more than %d years ago): %s",
                    limits.getMaxPastYears(), date), "date", date.toString());
        }
    }

    void validateHours(WorkItem item, CancellationToken token) {
        BigDecimal hours = item.getHours();
        if (hours == null || hours.signum() <= 0) {
            throw failure("hours must be positive, got " + plain(hours), "hours", plain(hours));
        }
        if (hours.compareTo(limits.getMaxHours()) > 0) {
            throw failure(String.format("hours cannot exceed %s per day, got %s",
                    limits.getMaxHours().toPlainString(), plain(hours)), "hours", plain(hours));
        }
        if (hours.compareTo(limits.getHighHoursThreshold()) > 0) {
            log.debug("Unusually high hours detected: hours={}, date={}", plain(hours),
                    item.getDate());
        }
        if (hours.setScale(2, RoundingMode.HALF_UP).compareTo(hours) != 0) {
            throw failure("hours should not have more than 2 decimal places, got " + plain(hours),
                    "hours", plain(hours));
        }
    }

    void validateRate(WorkItem item, CancellationToken token) {
        BigDecimal rate = item.getRate();
        if (rate == null || rate.signum() <= 0) {
            throw failure("hourly rate must be positive, got " + plain(rate), "rate", plain(rate));
        }
        if (rate.compareTo(limits.getMinRate()) < 0) {
            throw failure(String.format("hourly rate seems too low: $%s per hour", plain(rate)),
                    "rate", plain(rate));
        }
        if (rate.compareTo(limits.getMaxRate()) > 0) {
            throw failure(String.format("hourly rate seems too high: $%s per hour", plain(rate)),
                    "rate", plain(rate));
        }
        if (rate.compareTo(limits.getHighRateThreshold()) > 0) {
            log.debug("Unusually high rate detected: rate={}, date={}", plain(rate),
                    item.getDate());
        }
    }

    void validateDescription(WorkItem item, CancellationToken token) {
        String description = StringUtils.strip(item.getDescription());
        if (StringUtils.isEmpty(description)) {
            throw failure("work description cannot be empty", "description",
                    item.getDescription());
        }
        int length = description.codePointCount(0, description.length());
        if (length < limits.getMinDescriptionLength()) {
            throw failure(String.format("work description too short: '%s' (minimum %d characters)",
                    description, limits.getMinDescriptionLength()), "description", description);
        }
        if (length > limits.getMaxDescriptionLength()) {
            throw failure(String.format("work description too long: %d characters (maximum %d)",
                    length, limits.getMaxDescriptionLength()), "description", description);
        }
        if (genericDescriptions.contains(description.toLowerCase(Locale.ROOT))) {
            throw failure(String.format(
                    "work description too generic: '%s' (please be more specific)", description),
                    "description", description);
        }
    }

    void validateTotal(WorkItem item, CancellationToken token) {
        BigDecimal total = item.getTotal();
        if (item.getHours() == null || item.getRate() == null || total == null) {
            throw failure("total amount does not match calculated value: hours, rate and total"
                    + " must be set", "total", plain(total));
        }
        BigDecimal expected = item.getHours().multiply(item.getRate());
        if (total.subtract(expected).abs().compareTo(limits.getTotalTolerance()) > 0) {
            throw failure(String.format(
                    "total amount does not match calculated value %s vs %s (hours: %s, rate: %s)",
                    plain(total), plain(expected), plain(item.getHours()),
                    plain(item.getRate())), "total", plain(total));
        }
    }

    void validateRowFormat(List<String> row, int line, CancellationToken token) {
        if (row.size() < limits.getMinRowFields()) {
            throw failure(String.format(
                    "row has invalid number of fields: has %d fields, expected at least %d"
                            + " (date, hours, rate, description)",
                    row.size(), limits.getMinRowFields()), null, null);
        }
        if (row.size() > limits.getMaxRowFields()) {
            throw failure(String.format(
                    "row has too many fields: has %d fields, which seems excessive"
                            + " (maximum expected: %d)",
                    row.size(), limits.getMaxRowFields()), null, null);
        }
    }

    private static String plain(BigDecimal value) {
        return value == null ? null : value.toPlainString();
    }

    private static TimesheetException failure(String message, String field, String value) {
        return new TimesheetException(TimesheetErrorKind.VALIDATION_FAILED, message, field, value);
    }
}
