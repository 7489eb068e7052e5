package io.github.yok.timesheetlink.parser;

import static java.time.temporal.ChronoField.DAY_OF_MONTH;
import static java.time.temporal.ChronoField.HOUR_OF_DAY;
import static java.time.temporal.ChronoField.MINUTE_OF_HOUR;
import static java.time.temporal.ChronoField.MONTH_OF_YEAR;
import static java.time.temporal.ChronoField.SECOND_OF_MINUTE;
import static java.time.temporal.ChronoField.YEAR;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.timesheetlink.config.TimesheetProperties;
import io.github.yok.timesheetlink.exception.TimesheetErrorKind;
import io.github.yok.timesheetlink.exception.TimesheetException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Parses free-form timesheet dates into {@link LocalDate} values.
 *
 * <p>
 * Formats are tried in a fixed order and the first one that matches wins:
 * </p>
 * <ol>
 * <li>four-digit years: {@code yyyy-MM-dd}, {@code MM/dd/yyyy}, {@code dd/MM/yyyy},
 * {@code yyyy/MM/dd}, {@code MMM d, yyyy}, {@code MMMM d, yyyy}, {@code yyyy-MM-dd HH:mm:ss}</li>
 * <li>two-digit years: {@code MM/dd/yy}, {@code dd/MM/yy}, {@code M/d/yy}, {@code d/M/yy},
 * {@code yy-MM-dd}</li>
 * <li>no year: {@code MM/dd}, {@code M/d}, {@code MMM d}</li>
 * </ol>
 *
 * <p>
 * A two-digit year up to the pivot (default {@code 50}) lands in the 2000s, above it in the 1900s.
 * A date without a year is placed in the current year, or in the previous year when that would be
 * more than {@code noYearFutureMonths} (default {@code 6}) months after today. Today is taken from
 * the injected {@link Clock}. Month names are English and matched case-insensitively; calendar
 * checks are strict, so {@code 02/30/2024} is rejected.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
public class DateInterpreter {

    private final Clock clock;

    // Months after today beyond which a year-less date is moved to the previous year
    @Getter
    private final int noYearFutureMonths;

    private final List<DateTimeFormatter> fullYearFormats;

    private final List<DateTimeFormatter> twoDigitYearFormats;

    private final List<DateTimeFormatter> noYearFormats;

    /**
     * Creates an interpreter using the year inference policy from the given properties.
     *
     * @param clock source of today's date
     * @param properties configuration holding the two-digit-year pivot and the future threshold
     */
    public DateInterpreter(Clock clock, TimesheetProperties properties) {
        int pivot = properties.getDate().getTwoDigitYearPivot();
        Preconditions.checkArgument(pivot >= 0 && pivot < 99,
                "two-digit-year pivot must be between 0 and 98: %s", pivot);
        Preconditions.checkArgument(properties.getDate().getNoYearFutureMonths() >= 0,
                "no-year future months must not be negative");
        this.clock = clock;
        this.noYearFutureMonths = properties.getDate().getNoYearFutureMonths();

        // Smallest year a two-digit year can map to; pivot 50 gives 1951..2050
        int baseYear = 1900 + pivot + 1;

        this.fullYearFormats = ImmutableList.of(
                formatter(b -> appendYearMonthDay(b, '-')),
                formatter(b -> b.appendValue(MONTH_OF_YEAR, 2).appendLiteral('/')
                        .appendValue(DAY_OF_MONTH, 2).appendLiteral('/').appendValue(YEAR, 4)),
                formatter(b -> b.appendValue(DAY_OF_MONTH, 2).appendLiteral('/')
                        .appendValue(MONTH_OF_YEAR, 2).appendLiteral('/').appendValue(YEAR, 4)),
                formatter(b -> appendYearMonthDay(b, '/')),
                formatter(b -> b.appendText(MONTH_OF_YEAR, TextStyle.SHORT).appendLiteral(' ')
                        .appendValue(DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE)
                        .appendLiteral(", ").appendValue(YEAR, 4)),
                formatter(b -> b.appendText(MONTH_OF_YEAR, TextStyle.FULL).appendLiteral(' ')
                        .appendValue(DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE)
                        .appendLiteral(", ").appendValue(YEAR, 4)),
                formatter(b -> appendYearMonthDay(b, '-').appendLiteral(' ')
                        .appendValue(HOUR_OF_DAY, 2).appendLiteral(':')
                        .appendValue(MINUTE_OF_HOUR, 2).appendLiteral(':')
                        .appendValue(SECOND_OF_MINUTE, 2)));

        this.twoDigitYearFormats = ImmutableList.of(
                formatter(b -> b.appendValue(MONTH_OF_YEAR, 2).appendLiteral('/')
                        .appendValue(DAY_OF_MONTH, 2).appendLiteral('/')
                        .appendValueReduced(YEAR, 2, 2, baseYear)),
                formatter(b -> b.appendValue(DAY_OF_MONTH, 2).appendLiteral('/')
                        .appendValue(MONTH_OF_YEAR, 2).appendLiteral('/')
                        .appendValueReduced(YEAR, 2, 2, baseYear)),
                formatter(b -> appendShortNumber(b, MONTH_OF_YEAR).appendLiteral('/')
                        .appendValue(DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE)
                        .appendLiteral('/').appendValueReduced(YEAR, 2, 2, baseYear)),
                formatter(b -> appendShortNumber(b, DAY_OF_MONTH).appendLiteral('/')
                        .appendValue(MONTH_OF_YEAR, 1, 2, SignStyle.NOT_NEGATIVE)
                        .appendLiteral('/').appendValueReduced(YEAR, 2, 2, baseYear)),
                formatter(b -> b.appendValueReduced(YEAR, 2, 2, baseYear).appendLiteral('-')
                        .appendValue(MONTH_OF_YEAR, 2).appendLiteral('-')
                        .appendValue(DAY_OF_MONTH, 2)));

        this.noYearFormats = ImmutableList.of(
                formatter(b -> b.appendValue(MONTH_OF_YEAR, 2).appendLiteral('/')
                        .appendValue(DAY_OF_MONTH, 2)),
                formatter(b -> appendShortNumber(b, MONTH_OF_YEAR).appendLiteral('/')
                        .appendValue(DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE)),
                formatter(b -> b.appendText(MONTH_OF_YEAR, TextStyle.SHORT).appendLiteral(' ')
                        .appendValue(DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE)));
    }

    /**
     * Parses a date string.
     *
     * @param text date text; surrounding whitespace is ignored
     * @return parsed date
     * @throws TimesheetException with kind {@code UNSUPPORTED_DATE_FORMAT} when no format matches
     *         (including {@code null} and blank input)
     */
    public LocalDate parse(String text) {
        String trimmed = StringUtils.strip(text);
        if (StringUtils.isEmpty(trimmed)) {
            throw unsupported(text);
        }

        for (DateTimeFormatter format : fullYearFormats) {
            LocalDate date = tryParseDate(format, trimmed);
            if (date != null) {
                return date;
            }
        }
        for (DateTimeFormatter format : twoDigitYearFormats) {
            LocalDate date = tryParseDate(format, trimmed);
            if (date != null) {
                return date;
            }
        }
        for (DateTimeFormatter format : noYearFormats) {
            MonthDay monthDay = tryParseMonthDay(format, trimmed);
            if (monthDay != null) {
                return inferYear(monthDay);
            }
        }
        throw unsupported(text);
    }

    /**
     * Places a month and day in the current or previous year.
     *
     * @param monthDay month and day without a year
     * @return date in the current year, or in the previous year when the current-year date is after
     *         the limit {@link #futureLimit(LocalDate)}
     */
    LocalDate inferYear(MonthDay monthDay) {
        LocalDate today = LocalDate.now(clock);
        LocalDate candidate = monthDay.atYear(today.getYear());
        if (candidate.isAfter(futureLimit(today))) {
            candidate = monthDay.atYear(today.getYear() - 1);
        }
        return candidate;
    }

    /**
     * Returns today moved forward by {@link #getNoYearFutureMonths()} months.
     *
     * <p>
     * A day of month that does not exist in the target month rolls over into the next month
     * instead of being clamped: March 31 plus six months is October 1, not September 30.
     * </p>
     *
     * @param today current date
     * @return last date that still counts as the current year
     */
    LocalDate futureLimit(LocalDate today) {
        return today.withDayOfMonth(1).plusMonths(noYearFutureMonths)
                .plusDays(today.getDayOfMonth() - 1L);
    }

    private static LocalDate tryParseDate(DateTimeFormatter format, String text) {
        try {
            return format.parse(text, LocalDate::from);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static MonthDay tryParseMonthDay(DateTimeFormatter format, String text) {
        try {
            return format.parse(text, MonthDay::from);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static DateTimeFormatterBuilder appendYearMonthDay(DateTimeFormatterBuilder builder,
            char separator) {
        return builder.appendValue(YEAR, 4).appendLiteral(separator)
                .appendValue(MONTH_OF_YEAR, 2).appendLiteral(separator)
                .appendValue(DAY_OF_MONTH, 2);
    }

    private static DateTimeFormatterBuilder appendShortNumber(DateTimeFormatterBuilder builder,
            ChronoField field) {
        return builder.appendValue(field, 1, 2, SignStyle.NOT_NEGATIVE);
    }

    private static DateTimeFormatter formatter(Consumer<DateTimeFormatterBuilder> pattern) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder().parseCaseInsensitive();
        pattern.accept(builder);
        return builder.toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }

    private static TimesheetException unsupported(String text) {
        return new TimesheetException(TimesheetErrorKind.UNSUPPORTED_DATE_FORMAT,
                TimesheetErrorKind.UNSUPPORTED_DATE_FORMAT.getDefaultMessage(), "date", text);
    }
}
