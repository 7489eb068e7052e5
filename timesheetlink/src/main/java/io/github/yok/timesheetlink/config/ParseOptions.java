package io.github.yok.timesheetlink.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options for a single timesheet parse.
 *
 * <ul>
 * <li>{@code format}: explicit format name (see {@link TimesheetFormat}); blank means the format is
 * detected from the first line</li>
 * <li>{@code continueOnError}: collect failing rows instead of aborting on the first one</li>
 * <li>{@code skipEmptyRows}: ignore rows whose fields are all blank</li>
 * <li>{@code dateFormat}: preferred date format hint; advisory only</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ParseOptions {

    private String format;

    private boolean continueOnError;

    private boolean skipEmptyRows;

    private String dateFormat;
}
