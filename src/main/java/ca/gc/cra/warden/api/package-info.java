/**
 * <strong>Purpose:</strong> Command-line entry points for WARDEN.
 * <p><strong>Commands:</strong> {@code inquiry} prints the inquiry a moderator is working on.</p>
 * <p><strong>Exit codes:</strong> See {@link ca.gc.cra.warden.api.ExitCode}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.api;
