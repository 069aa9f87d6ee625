package ca.gc.cra.warden.domain.moderation;

import java.util.Locale;

/**
 * Reason a report was filed.
 *
 * @since 0.1.0
 */
public enum ReportReason {
  CHEAT,
  CHEATPRINT,
  BOOST,
  ABUSE,
  INSULT,
  TROLL,
  OTHER;

  /**
   * Parses a reason key case-insensitively.
   *
   * @param raw reason key such as {@code "cheat"}
   * @return matching reason
   * @throws IllegalArgumentException when the key is blank or unknown
   */
  public static ReportReason parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("report reason must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown report reason: " + raw, ex);
    }
  }

  /**
   * Returns the lowercase key used in snapshots and rendered output.
   *
   * @return reason key
   */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
