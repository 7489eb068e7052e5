package io.github.yok.timesheetlink.parser;

import com.google.common.base.CharMatcher;
import io.github.yok.timesheetlink.model.CanonicalField;
import io.github.yok.timesheetlink.model.HeaderMap;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Utility class that maps header spellings to canonical field keys.
 *
 * <p>
 * Normalization trims whitespace, control characters and a byte-order mark from both ends, lower
 * cases the text and replaces a known alias with its canonical key. Unknown headers are returned
 * in their trimmed, lower-cased form. The function is pure and idempotent.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class HeaderNormalizer {

    // Characters removed from both ends of a header cell
    private static final CharMatcher TRIMMED = CharMatcher.whitespace()
            .or(CharMatcher.is('\uFEFF')).or(CharMatcher.javaIsoControl());

    private HeaderNormalizer() {
        // Utility class; do not instantiate.
    }

    /**
     * Normalizes a single header cell.
     *
     * @param rawHeader header text as read; may be {@code null}
     * @return canonical key ({@code date}, {@code hours}, {@code rate}, {@code description}) or the
     *         trimmed, lower-cased header; {@code ""} for {@code null}
     */
    public static String normalize(String rawHeader) {
        if (rawHeader == null) {
            return "";
        }
        String normalized = TRIMMED.trimFrom(rawHeader).toLowerCase(Locale.ROOT);
        return CanonicalField.fromAlias(normalized).map(CanonicalField::getKey).orElse(normalized);
    }

    /**
     * Builds the header map for a header row.
     *
     * @param headerRow raw header cells in column order
     * @return mapping from normalized header to column index
     */
    public static HeaderMap buildHeaderMap(List<String> headerRow) {
        return HeaderMap.of(
                headerRow.stream().map(HeaderNormalizer::normalize).collect(Collectors.toList()));
    }
}
