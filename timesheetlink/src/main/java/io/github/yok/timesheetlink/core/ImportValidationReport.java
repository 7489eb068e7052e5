package io.github.yok.timesheetlink.core;

import io.github.yok.timesheetlink.model.ParseResult;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a dry-run import validation.
 *
 * <p>
 * {@code valid} is {@code true} only when no row failed and the batch checks passed. Warnings and
 * suggestions are informational and never affect {@code valid}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class ImportValidationReport {

    boolean valid;

    ParseResult parseResult;

    List<ImportWarning> warnings;

    List<String> suggestions;

    // Sum of the totals of all parsed work items
    BigDecimal estimatedTotal;

    // Message of the failed batch check, or null when the batch passed
    String batchError;
}
