package ca.gc.cra.warden.application.inquiry;

import java.util.Objects;

/**
 * Raised when a collaborator fails while an inquiry is being assembled.
 * <p>Absent data never raises this exception; it signals infrastructure faults only.</p>
 *
 * @since 0.1.0
 */
public final class InquiryAssemblyException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Fetch fetch;

  /**
   * Creates an exception for a failed collaborator call.
   *
   * @param fetch the call that failed; must not be {@code null}
   * @param cause underlying failure
   */
  public InquiryAssemblyException(Fetch fetch, Throwable cause) {
    super("inquiry " + Objects.requireNonNull(fetch, "fetch").key() + " fetch failed: "
        + (cause == null ? "unknown cause" : cause.getMessage()), cause);
    this.fetch = fetch;
  }

  /**
   * Returns the collaborator call that failed.
   *
   * @return failed fetch
   */
  public Fetch fetch() {
    return fetch;
  }
}
