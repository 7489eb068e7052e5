/**
 * Data model produced by the parser: work items, per-row errors, header mappings, format
 * information and the aggregated parse result.
 */
package io.github.yok.timesheetlink.model;
