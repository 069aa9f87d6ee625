package ca.gc.cra.warden.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Keeps user-authored text (report bodies, notes) short in operator logs.
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @implNote Decoding ignores a code point split by the byte budget instead of failing.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates {@code value} to at most {@code maxBytes} UTF-8 bytes, flattening line breaks.
   *
   * @param value text to render; {@code null} renders as {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the single-line value, suffixed with {@code "... (truncated, X of Y)"} when shortened
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    String singleLine = value.replace('\r', ' ').replace('\n', ' ');
    byte[] bytes = singleLine.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return singleLine;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }
}
