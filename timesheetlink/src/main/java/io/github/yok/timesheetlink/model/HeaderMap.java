package io.github.yok.timesheetlink.model;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Mapping from normalized header name to zero-based column index.
 *
 * <p>
 * Contains an entry for every header cell, recognized or not. When two cells normalize to the same
 * name, the later column wins.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
@ToString
public final class HeaderMap {

    private final Map<String, Integer> indexes;

    private HeaderMap(Map<String, Integer> indexes) {
        this.indexes = ImmutableMap.copyOf(indexes);
    }

    /**
     * Builds a header map from normalized header names in column order.
     *
     * @param normalizedHeaders normalized header names, one per column
     * @return header map
     */
    public static HeaderMap of(List<String> normalizedHeaders) {
        Map<String, Integer> indexes = new LinkedHashMap<>();
        for (int i = 0; i < normalizedHeaders.size(); i++) {
            indexes.put(normalizedHeaders.get(i), i);
        }
        return new HeaderMap(indexes);
    }

    /**
     * Returns the column index of the given canonical field.
     *
     * @param field canonical field
     * @return zero-based index, or empty when the header has no such column
     */
    public OptionalInt indexOf(CanonicalField field) {
        Integer index = indexes.get(field.getKey());
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    /**
     * Lists the canonical fields the header does not provide, in canonical order.
     *
     * @return missing fields; empty when the header is complete
     */
    public List<CanonicalField> missingFields() {
        return Arrays.stream(CanonicalField.values())
                .filter(f -> !indexes.containsKey(f.getKey())).collect(Collectors.toList());
    }

    /**
     * Returns the number of distinct normalized headers.
     *
     * @return entry count
     */
    public int size() {
        return indexes.size();
    }

    /**
     * Returns the mapping as an unmodifiable map.
     *
     * @return normalized header name to column index
     */
    public Map<String, Integer> asMap() {
        return indexes;
    }
}
