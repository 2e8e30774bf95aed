package ca.gc.cra.netsim.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/**
 * <strong>What:</strong> Helpers that keep packet and event renderings in logs bounded.
 * <p><strong>Why:</strong> Event messages and payload dumps can grow without limit in long lab runs.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so truncating mid-codepoint never throws.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }

  /**
   * Renders at most {@code maxBytes} of {@code data} as lowercase hex for DEBUG packet dumps.
   *
   * @param data bytes to render; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum bytes to render; must be positive
   * @return hex string, suffixed with the total length when cut short
   */
  public static String hex(byte[] data, int maxBytes) {
    if (data == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int shown = Math.min(data.length, maxBytes);
    String rendered = HexFormat.of().formatHex(data, 0, shown);
    return shown == data.length ? rendered : rendered + "... (" + data.length + " bytes)";
  }
}
