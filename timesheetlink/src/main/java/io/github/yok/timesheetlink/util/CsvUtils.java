package io.github.yok.timesheetlink.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BOMInputStream;
import org.apache.commons.lang3.StringUtils;

/**
 * Utility class for reading delimiter-separated timesheet text.
 *
 * <p>
 * Input is always buffered completely before it is split into rows, so callers can run format
 * detection on the same text that is later parsed. Records are read with Apache Commons CSV.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CsvUtils {

    // UTF-8 byte-order mark as it appears after decoding
    private static final String BOM = "\uFEFF";

    private CsvUtils() {
        // Utility class; do not instantiate.
    }

    /**
     * Wraps a byte stream in a UTF-8 reader that drops a leading byte-order mark.
     *
     * <p>
     * Malformed byte sequences are replaced with U+FFFD by the decoder instead of failing.
     * </p>
     *
     * @param in raw byte stream
     * @return character reader over {@code in}
     * @throws IOException if the stream cannot be inspected for a byte-order mark
     */
    public static Reader toUtf8Reader(InputStream in) throws IOException {
        BOMInputStream bomIn = BOMInputStream.builder().setInputStream(in).get();
        return new InputStreamReader(bomIn, StandardCharsets.UTF_8);
    }

    /**
     * Reads the whole reader into memory and removes a leading byte-order mark.
     *
     * @param reader source reader (not closed by this method)
     * @return complete text content
     * @throws IOException on read error
     */
    public static String readFully(Reader reader) throws IOException {
        return StringUtils.removeStart(IOUtils.toString(reader), BOM);
    }

    /**
     * Splits buffered content into raw rows using the given Commons CSV format.
     *
     * @param content complete text content
     * @param format delimiter and quoting configuration
     * @return list of rows; each inner list holds the fields of one record in column order
     * @throws IOException if the content is not well-formed for {@code format} (e.g. an
     *         unterminated quoted field)
     */
    public static List<List<String>> readRows(String content, CSVFormat format)
            throws IOException {
        List<List<String>> rows = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(new StringReader(content), format)) {
            for (CSVRecord record : parser) {
                rows.add(record.toList());
            }
        } catch (UncheckedIOException e) {
            // Record iteration reports lexer errors as unchecked
            throw e.getCause();
        }
        return rows;
    }

    /**
     * Returns the first line of the content, without its line terminator.
     *
     * @param content text content
     * @return first line, or an empty string when {@code content} is {@code null}
     */
    public static String firstLine(String content) {
        String line = StringUtils.substringBefore(StringUtils.defaultString(content), "\n");
        return StringUtils.removeEnd(line, "\r");
    }

    /**
     * Determines whether every field of the row is blank.
     *
     * @param row raw row
     * @return {@code true} for an empty row or a row of blank fields
     */
    public static boolean isBlankRow(List<String> row) {
        return row.stream().allMatch(StringUtils::isBlank);
    }
}
