package io.github.yok.timesheetlink.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.csv.CSVFormat;

/**
 * Enumeration of supported timesheet formats.
 *
 * <p>
 * Each format names its delimiter and the Apache Commons CSV dialect used to read it. Leading and
 * trailing spaces around fields are ignored and blank lines are skipped for every format.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum TimesheetFormat {

    // Comma-separated values
    STANDARD("standard", ',', CSVFormat.DEFAULT, false),

    // Comma-separated values following RFC 4180 quoting
    RFC4180("rfc4180", ',', CSVFormat.RFC4180, false),

    // Tab-separated values
    TAB("tab", '\t', CSVFormat.TDF, false),

    // Tab-separated values (alias of TAB)
    TSV("tsv", '\t', CSVFormat.TDF, false),

    // Semicolon-separated values, common for spreadsheet exports in some regions
    SEMICOLON("semicolon", ';', CSVFormat.DEFAULT, false),

    // Excel export; quotes are handled leniently
    EXCEL("excel", ',', CSVFormat.EXCEL, true);

    // Name used in options, configuration and results
    private final String formatName;

    // Field separator
    private final char delimiter;

    // Commons CSV dialect the reader is derived from
    private final CSVFormat baseFormat;

    // Whether stray quotes and unterminated quoted fields are tolerated
    private final boolean lenientQuotes;

    /**
     * Resolves a format by its name.
     *
     * @param name format name (case-insensitive, surrounding whitespace ignored)
     * @return matching format, or empty when the name is unknown or {@code null}
     */
    public static Optional<TimesheetFormat> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> f.formatName.equals(normalized)).findFirst();
    }

    /**
     * Determines whether the given name denotes a supported format.
     *
     * @param name format name
     * @return {@code true} if supported
     */
    public static boolean isSupported(String name) {
        return fromName(name).isPresent();
    }

    /**
     * Builds the Commons CSV format used to read content of this format.
     *
     * @return reader configuration
     */
    public CSVFormat toCsvFormat() {
        CSVFormat.Builder builder = baseFormat.builder().setDelimiter(delimiter)
                .setIgnoreSurroundingSpaces(true).setIgnoreEmptyLines(true);
        if (lenientQuotes) {
            builder.setLenientEof(true).setTrailingData(true);
        }
        return builder.get();
    }
}
