package io.github.yok.timesheetlink.core;

import lombok.Value;

/**
 * Non-fatal finding about an imported work item.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ImportWarning {

    ImportWarningType type;

    String message;
}
