/**
 * Services built on top of the parser and validator.
 *
 * <p>
 * {@link ImportValidationService} performs a dry-run import and reports validity, warnings,
 * suggestions and the estimated amount.
 * </p>
 */
package io.github.yok.timesheetlink.core;
