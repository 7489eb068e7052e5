package io.github.yok.timesheetlink.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.timesheetlink.config.ParseOptions;
import io.github.yok.timesheetlink.exception.ParseCancelledException;
import io.github.yok.timesheetlink.exception.TimesheetException;
import io.github.yok.timesheetlink.model.ParseResult;
import io.github.yok.timesheetlink.model.WorkItem;
import io.github.yok.timesheetlink.parser.TimesheetParser;
import io.github.yok.timesheetlink.util.CancellationToken;
import io.github.yok.timesheetlink.validation.TimesheetValidator;
import java.io.Reader;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Validates a timesheet import without persisting anything.
 *
 * <p>
 * The content is parsed with the given options, the resulting work items are validated as a batch
 * and the outcome is summarized in an {@link ImportValidationReport} together with warnings about
 * weekend work and long days, suggestions for fixing the file and the estimated amount.
 * </p>
 *
 * <p>
 * A parse that fails as a whole (structural error, or a row failure without continue-on-error) is
 * not turned into a report; its {@link TimesheetException} propagates to the caller.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImportValidationService {

    // Hours above which a work item is reported as a long day
    static final BigDecimal HIGH_HOURS_WARNING = BigDecimal.TEN;

    private final TimesheetParser parser;

    private final TimesheetValidator validator;

    /**
     * Validates an import without cancellation.
     *
     * @param reader timesheet text
     * @param options parse options; {@code null} uses the configured defaults
     * @return validation report
     */
    public ImportValidationReport validateImport(Reader reader, ParseOptions options) {
        return validateImport(reader, options, CancellationToken.NONE);
    }

    /**
     * Validates an import.
     *
     * @param reader timesheet text
     * @param options parse options; {@code null} uses the configured defaults
     * @param token cancellation token
     * @return validation report
     * @throws TimesheetException if the content cannot be parsed
     */
    public ImportValidationReport validateImport(Reader reader, ParseOptions options,
            CancellationToken token) {
        token.throwIfCancelled();
        log.info("Starting import validation: format={}",
                options != null ? options.getFormat() : null);

        ParseResult parseResult = parser.parseTimesheet(reader, options, token);

        String batchError = null;
        try {
            validator.validateBatch(parseResult.getWorkItems(), token);
        } catch (ParseCancelledException e) {
            throw e;
        } catch (TimesheetException e) {
            batchError = e.getMessage();
        }

        boolean valid = parseResult.getErrorRows() == 0 && batchError == null;
        ImportValidationReport report = ImportValidationReport.builder().valid(valid)
                .parseResult(parseResult).warnings(warnings(parseResult.getWorkItems()))
                .suggestions(suggestions(parseResult, batchError != null))
                .estimatedTotal(estimatedTotal(parseResult.getWorkItems()))
                .batchError(batchError).build();

        log.info("Import validation completed: valid={}, work_items={}", valid,
                parseResult.getWorkItems().size());
        return report;
    }

    private static List<ImportWarning> warnings(List<WorkItem> items) {
        ImmutableList.Builder<ImportWarning> warnings = ImmutableList.builder();
        for (WorkItem item : items) {
            DayOfWeek day = item.getDate().getDayOfWeek();
            if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
                warnings.add(new ImportWarning(ImportWarningType.WEEKEND_WORK,
                        "Work item on weekend: " + item.getDate()));
            }
        }
        for (WorkItem item : items) {
            if (item.getHours().compareTo(HIGH_HOURS_WARNING) > 0) {
                warnings.add(new ImportWarning(ImportWarningType.HIGH_HOURS, String.format(
                        "High hours on %s: %s hours", item.getDate(),
                        item.getHours().toPlainString())));
            }
        }
        return warnings.build();
    }

    private static List<String> suggestions(ParseResult parseResult, boolean batchFailed) {
        ImmutableList.Builder<String> suggestions = ImmutableList.builder();
        if (parseResult.getErrorRows() > 0) {
            suggestions.add("Check data format in rows with errors",
                    "Ensure dates are in YYYY-MM-DD format",
                    "Verify numeric fields (hours, rates) contain valid numbers");
        }
        if (batchFailed) {
            suggestions.add("Review work item validation rules",
                    "Check for unusual values (very high hours, extreme rates)");
        }
        if (parseResult.getWorkItems().isEmpty()) {
            suggestions.add("File appears to be empty or header-only",
                    "Ensure CSV contains data rows after header");
        }
        return suggestions.build();
    }

    private static BigDecimal estimatedTotal(List<WorkItem> items) {
        return items.stream().map(WorkItem::getTotal).reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(WorkItem.AMOUNT_SCALE);
    }
}
