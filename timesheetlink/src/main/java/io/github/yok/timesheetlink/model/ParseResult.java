package io.github.yok.timesheetlink.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * Outcome of parsing one timesheet.
 *
 * <p>
 * Row counts are derived from the collected work items and errors, so
 * {@code successRows + errorRows == totalRows} always holds. Rows skipped as empty are not counted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ParseResult {

    List<WorkItem> workItems;

    int totalRows;

    int successRows;

    int errorRows;

    List<ParseError> errors;

    HeaderMap headerMap;

    // Name of the format used to read the content
    String format;

    /**
     * Creates a result from the collected work items and errors.
     *
     * @param workItems successfully parsed and validated items
     * @param errors one entry per failed row
     * @param headerMap header mapping used for the parse
     * @param format name of the format used
     * @return parse result
     */
    public static ParseResult of(List<WorkItem> workItems, List<ParseError> errors,
            HeaderMap headerMap, String format) {
        return new ParseResult(ImmutableList.copyOf(workItems), workItems.size() + errors.size(),
                workItems.size(), errors.size(), ImmutableList.copyOf(errors), headerMap, format);
    }
}
