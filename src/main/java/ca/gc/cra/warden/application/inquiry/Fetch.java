package ca.gc.cra.warden.application.inquiry;

/**
 * Collaborator calls performed while assembling an inquiry, used to label failures.
 *
 * @since 0.1.0
 */
public enum Fetch {
  CAPABILITY("capability"),
  ACTIVE_REPORT("activeReport"),
  MORE_LIKE("moreLike"),
  ACCURACY("accuracy"),
  NOTES("notes"),
  HISTORY("history"),
  USER("user");

  private final String key;

  Fetch(String key) {
    this.key = key;
  }

  /**
   * Returns the short label used in logs and exception messages.
   *
   * @return fetch label
   */
  public String key() {
    return key;
  }
}
