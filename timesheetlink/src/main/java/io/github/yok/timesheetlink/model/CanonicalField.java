package io.github.yok.timesheetlink.model;

import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;

/**
 * The four column roles a timesheet must provide.
 *
 * <p>
 * Each role owns the header spellings that map to it. Matching is done on already trimmed and
 * lower-cased header text, see {@code HeaderNormalizer}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum CanonicalField {

    // Day the work was performed
    DATE("date", "date", "work_date", "day"),

    // Worked hours
    HOURS("hours", "hours", "time", "duration", "hours_worked"),

    // Hourly rate
    RATE("rate", "rate", "hourly_rate", "hour_rate", "billing_rate"),

    // Free-text description of the work
    DESCRIPTION("description", "description", "desc", "task", "work_description", "notes");

    // Canonical key used in header maps and error messages
    private final String key;

    // Header spellings (lower case) recognized for this role
    private final Set<String> aliases;

    CanonicalField(String key, String... aliases) {
        this.key = key;
        this.aliases = ImmutableSet.copyOf(aliases);
    }

    /**
     * Finds the role whose aliases contain the given normalized header.
     *
     * @param normalizedHeader trimmed, lower-cased header text
     * @return matching role, or empty when the header is not recognized
     */
    public static Optional<CanonicalField> fromAlias(String normalizedHeader) {
        return Arrays.stream(values()).filter(f -> f.aliases.contains(normalizedHeader))
                .findFirst();
    }
}
