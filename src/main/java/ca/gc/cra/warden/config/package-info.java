/**
 * <strong>Purpose:</strong> Configuration loading (YAML, CLI, defaults) and wiring of the inquiry use case.
 * <p><strong>Precedence:</strong> CLI over YAML over embedded defaults.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.config;
