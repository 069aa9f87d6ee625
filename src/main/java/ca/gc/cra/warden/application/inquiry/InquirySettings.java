package ca.gc.cra.warden.application.inquiry;

import ca.gc.cra.warden.domain.security.Permission;
import ca.gc.cra.warden.validation.Numbers;
import java.util.Objects;

/**
 * Tunables of the inquiry use case.
 *
 * @param requiredCapability capability a moderator needs before any data is fetched
 * @param moreLikeLimit maximum number of related reports requested (1-100)
 * @since 0.1.0
 */
public record InquirySettings(Permission requiredCapability, int moreLikeLimit) {
  /** Default capability gating inquiries. */
  public static final Permission DEFAULT_CAPABILITY = Permission.HUNTER;
  /** Default number of related reports. */
  public static final int DEFAULT_MORE_LIKE_LIMIT = 10;
  /** Upper bound accepted for {@link #moreLikeLimit()}. */
  public static final int MAX_MORE_LIKE_LIMIT = 100;

  public InquirySettings {
    Objects.requireNonNull(requiredCapability, "requiredCapability");
    Numbers.requireRange("moreLikeLimit", moreLikeLimit, 1, MAX_MORE_LIKE_LIMIT);
  }

  /**
   * Returns the defaults: {@link Permission#HUNTER} and ten related reports.
   *
   * @return default settings
   */
  public static InquirySettings defaults() {
    return new InquirySettings(DEFAULT_CAPABILITY, DEFAULT_MORE_LIKE_LIMIT);
  }
}
