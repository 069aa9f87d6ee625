/**
 * <strong>Purpose:</strong> Argument validation for configuration and CLI input.
 * <p>Violations raise {@link java.lang.IllegalArgumentException} naming the offending key.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.validation;
