package io.github.yok.timesheetlink.validation;

import com.google.common.collect.ImmutableList;
import io.github.yok.timesheetlink.config.TimesheetProperties;
import io.github.yok.timesheetlink.exception.ParseCancelledException;
import io.github.yok.timesheetlink.exception.TimesheetErrorKind;
import io.github.yok.timesheetlink.exception.TimesheetException;
import io.github.yok.timesheetlink.model.WorkItem;
import io.github.yok.timesheetlink.util.CancellationToken;
import io.github.yok.timesheetlink.util.CsvUtils;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default {@link TimesheetValidator} backed by an ordered, mutable list of rules.
 *
 * <p>
 * The list starts with the rules created by {@link StandardValidationRules}. Rules are applied in
 * registration order and the first failure ends the check; its message is prefixed with
 * {@code validation rule '<name>' failed: }.
 * </p>
 *
 * <p>
 * <strong>Thread safety:</strong> validation may run concurrently, but {@link #addRule} and
 * {@link #removeRule} must not be called while any validation is in progress.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class WorkItemValidator implements TimesheetValidator {

    private final TimesheetProperties.Validation limits;

    private final List<ValidationRule> rules;

    /**
     * Creates a validator with the standard rules.
     *
     * @param clock source of today's date for the date rule
     * @param properties configured limits
     */
    public WorkItemValidator(Clock clock, TimesheetProperties properties) {
        this.limits = properties.getValidation();
        this.rules = new ArrayList<>(new StandardValidationRules(clock, limits).createRules());
    }

    @Override
    public void validateWorkItem(WorkItem item, CancellationToken token) {
        token.throwIfCancelled();
        if (item == null) {
            throw new TimesheetException(TimesheetErrorKind.VALIDATION_FAILED,
                    "work item cannot be null");
        }
        for (ValidationRule rule : rules) {
            if (rule.getItemValidator() == null) {
                continue;
            }
            try {
                rule.getItemValidator().validate(item, token);
            } catch (ParseCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                throw ruleFailure("validation rule", rule, e, 0);
            }
        }
    }

    @Override
    public void validateRow(List<String> row, int line, CancellationToken token) {
        token.throwIfCancelled();
        if (row.isEmpty()) {
            throw new TimesheetException(TimesheetErrorKind.EMPTY_ROW, "row is empty", line, null,
                    null, null);
        }
        if (CsvUtils.isBlankRow(row)) {
            throw new TimesheetException(TimesheetErrorKind.EMPTY_ROW, "row contains no data",
                    line, null, null, null);
        }
        for (ValidationRule rule : rules) {
            if (rule.getRowValidator() == null) {
                continue;
            }
            try {
                rule.getRowValidator().validate(row, line, token);
            } catch (ParseCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                throw ruleFailure("row validation rule", rule, e, line);
            }
        }
    }

    @Override
    public void validateBatch(List<WorkItem> items, CancellationToken token) {
        token.throwIfCancelled();
        if (items.isEmpty()) {
            throw new TimesheetException(TimesheetErrorKind.VALIDATION_FAILED,
                    "no work items to validate");
        }
        log.debug("Validating work item batch: count={}", items.size());

        for (int i = 0; i < items.size(); i++) {
            token.throwIfCancelled();
            try {
                validateWorkItem(items.get(i), token);
            } catch (ParseCancelledException e) {
                throw e;
            } catch (TimesheetException e) {
                throw new TimesheetException(e.getKind(),
                        String.format("work item %d validation failed: %s", i + 1, e.getMessage()),
                        e.getLine(), e.getField(), e.getValue(), e);
            }
        }

        validateDateRange(items);
        checkRateConsistency(items);
        validateTotalHours(items);

        log.debug("Batch validation completed: items={}", items.size());
    }

    @Override
    public void addRule(ValidationRule rule) {
        rules.add(Objects.requireNonNull(rule, "rule"));
        log.debug("Validation rule added: {}", rule.getName());
    }

    @Override
    public boolean removeRule(String name) {
        Iterator<ValidationRule> it = rules.iterator();
        while (it.hasNext()) {
            if (it.next().getName().equals(name)) {
                it.remove();
                log.debug("Validation rule removed: {}", name);
                return true;
            }
        }
        return false;
    }

    @Override
    public List<ValidationRule> getRules() {
        return ImmutableList.copyOf(rules);
    }

    private void validateDateRange(List<WorkItem> items) {
        List<LocalDate> dates = items.stream().map(WorkItem::getDate).filter(Objects::nonNull)
                .collect(Collectors.toList());
        if (dates.size() <= 1) {
            return;
        }
        LocalDate min = Collections.min(dates);
        LocalDate max = Collections.max(dates);
        if (ChronoUnit.DAYS.between(min, max) > limits.getMaxDateSpanDays()) {
            throw new TimesheetException(TimesheetErrorKind.VALIDATION_FAILED, String.format(
                    "date range validation failed: work item date range is too large: %s to %s"
                            + " (more than %d days)",
                    min, max, limits.getMaxDateSpanDays()));
        }
    }

    private void checkRateConsistency(List<WorkItem> items) {
        if (items.size() <= 1) {
            return;
        }
        long distinctRates = items.stream().map(WorkItem::getRate).filter(Objects::nonNull)
                .map(BigDecimal::stripTrailingZeros).distinct().count();
        if (distinctRates > limits.getMaxDistinctRates()) {
            log.warn("Multiple different rates detected: unique_rates={}", distinctRates);
        }
    }

    private void validateTotalHours(List<WorkItem> items) {
        BigDecimal totalHours = items.stream().map(WorkItem::getHours).filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (totalHours.compareTo(limits.getLargeTotalHours()) > 0) {
            log.debug("Large total hours detected: total_hours={}", totalHours.toPlainString());
        }
        if (totalHours.signum() == 0) {
            throw new TimesheetException(TimesheetErrorKind.VALIDATION_FAILED,
                    "total hours validation failed: total hours cannot be zero");
        }
    }

    private static TimesheetException ruleFailure(String label, ValidationRule rule,
            RuntimeException cause, int line) {
        String message = String.format("%s '%s' failed: %s", label, rule.getName(),
                cause.getMessage());
        if (cause instanceof TimesheetException) {
            TimesheetException te = (TimesheetException) cause;
            return new TimesheetException(TimesheetErrorKind.VALIDATION_FAILED, message,
                    line > 0 ? line : te.getLine(), te.getField(), te.getValue(), te);
        }
        return new TimesheetException(TimesheetErrorKind.VALIDATION_FAILED, message, line, null,
                null, cause);
    }
}
