package io.github.yok.timesheetlink.parser;

/**
 * Source of work item identifiers.
 *
 * <p>
 * Called once per successfully parsed row. Values must be unique within a parse.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * Generates a new identifier.
     *
     * @return identifier, never {@code null}
     */
    String generateId();
}
