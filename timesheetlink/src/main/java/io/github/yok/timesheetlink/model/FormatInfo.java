package io.github.yok.timesheetlink.model;

import lombok.Value;

/**
 * Structural shape of a timesheet file as reported by format detection.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class FormatInfo {

    // Encoding assumed for all input
    public static final String UTF_8 = "UTF-8";

    // Format name: standard, tab, semicolon, excel, rfc4180 or tsv
    String name;

    // Field separator
    char delimiter;

    // Whether the first row holds column names
    boolean header;

    // Text encoding of the content
    String encoding;

    /**
     * Creates the info for a detected format with a header row and UTF-8 content.
     *
     * @param name format name
     * @param delimiter field separator
     * @return format info
     */
    public static FormatInfo detected(String name, char delimiter) {
        return new FormatInfo(name, delimiter, true, UTF_8);
    }
}
