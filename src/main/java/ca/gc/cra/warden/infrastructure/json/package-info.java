/**
 * Jackson streaming helpers: parsing snapshot documents and rendering inquiries for the CLI.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure.json;
