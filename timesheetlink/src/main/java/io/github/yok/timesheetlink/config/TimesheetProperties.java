package io.github.yok.timesheetlink.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code timesheet} section in {@code application.yml}.
 * Centralizes the defaults of {@code CsvTimesheetParser}, the year inference policy of
 * {@code DateInterpreter} and the limits enforced by the standard validation rules.
 *
 * <p>
 * All values have defaults, so an instance created with {@code new} can be used as is outside a
 * Spring context.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "timesheet")
@Data
public class TimesheetProperties {

    /**
     * Format used when a parse does not name one. Blank means the format is detected from the first
     * line of the content.
     */
    private String defaultFormat = "";

    /**
     * When {@code true}, failed rows are collected as errors instead of aborting the parse.
     */
    private boolean continueOnError = false;

    /**
     * When {@code true}, rows whose fields are all blank are ignored.
     */
    private boolean skipEmptyRows = false;

    /**
     * Year inference policy for dates written without a four-digit year.
     */
    private Date date = new Date();

    /**
     * Limits applied by the standard validation rules.
     */
    private Validation validation = new Validation();

    /**
     * Creates parse options populated from the configured defaults.
     *
     * @return new mutable options instance
     */
    public ParseOptions toParseOptions() {
        return ParseOptions.builder().format(defaultFormat).continueOnError(continueOnError)
                .skipEmptyRows(skipEmptyRows).build();
    }

    /**
     * Settings of the {@code timesheet.date} section.
     */
    @Data
    public static class Date {

        /**
         * Largest two-digit year mapped into the 2000s. {@code 50} maps {@code 00-50} to
         * {@code 2000-2050} and {@code 51-99} to {@code 1951-1999}.
         */
        private int twoDigitYearPivot = 50;

        /**
         * A date without a year that would fall more than this many months after today is placed
         * in the previous year.
         */
        private int noYearFutureMonths = 6;
    }

    /**
     * Settings of the {@code timesheet.validation} section.
     */
    @Data
    public static class Validation {

        // Work dates later than today plus this many days are rejected
        private int maxFutureDays = 7;

        // Work dates earlier than today minus this many years are rejected
        private int maxPastYears = 2;

        private BigDecimal maxHours = new BigDecimal("24");

        // Hours above this value are logged
        private BigDecimal highHoursThreshold = new BigDecimal("12");

        private BigDecimal minRate = BigDecimal.ONE;

        private BigDecimal maxRate = new BigDecimal("1000");

        // Rates above this value are logged
        private BigDecimal highRateThreshold = new BigDecimal("500");

        private int minDescriptionLength = 3;

        private int maxDescriptionLength = 500;

        // Accepted difference between total and hours * rate
        private BigDecimal totalTolerance = new BigDecimal("0.01");

        private int minRowFields = 4;

        private int maxRowFields = 20;

        // Largest allowed distance between the earliest and latest date of a batch
        private int maxDateSpanDays = 365;

        // More distinct rates than this in one batch are logged as a warning
        private int maxDistinctRates = 3;

        // Batch hour sums above this value are logged
        private BigDecimal largeTotalHours = new BigDecimal("200");

        /**
         * Descriptions rejected as too generic (compared case-insensitively).
         */
        private List<String> genericDescriptions = new ArrayList<>(Arrays.asList("work",
                "development", "coding", "programming", "task", "project", "meeting", "call",
                "todo", "fix", "bug", "feature"));
    }
}
