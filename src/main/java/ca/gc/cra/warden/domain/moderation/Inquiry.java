package ca.gc.cra.warden.domain.moderation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Consolidated view of one report under active investigation.
 * <p><strong>Why:</strong> Gives the moderator the report, related reports, the subject's record, notes
 * and moderation history in a single value.</p>
 * <p><strong>Role:</strong> Output value of {@code InquiryAssembler}; built fresh per request and never
 * cached.</p>
 * <p><strong>Thread-safety:</strong> Immutable; list components are unmodifiable copies that keep the
 * order supplied by the collaborators.</p>
 *
 * @param mod moderator working the report
 * @param report primary report
 * @param accuracy reporter accuracy 0-100, empty when it cannot be scored
 * @param moreReports related reports, possibly empty
 * @param notes notes about the subject, possibly empty
 * @param history moderation history of the subject, possibly empty
 * @param user resolved subject user
 * @since 0.1.0
 */
public record Inquiry(
    LightUser mod,
    Report report,
    OptionalInt accuracy,
    List<Report> moreReports,
    List<Note> notes,
    List<ModlogEntry> history,
    User user) {

  public Inquiry {
    Objects.requireNonNull(mod, "mod");
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(accuracy, "accuracy");
    Objects.requireNonNull(user, "user");
    if (accuracy.isPresent() && (accuracy.getAsInt() < 0 || accuracy.getAsInt() > 100)) {
      throw new IllegalArgumentException("accuracy must be between 0 and 100 (was " + accuracy.getAsInt() + ")");
    }
    moreReports = List.copyOf(Objects.requireNonNull(moreReports, "moreReports"));
    notes = List.copyOf(Objects.requireNonNull(notes, "notes"));
    history = List.copyOf(Objects.requireNonNull(history, "history"));
  }

  /**
   * Returns the primary report followed by the related reports.
   *
   * @return unmodifiable list starting with {@link #report()}
   */
  public List<Report> allReports() {
    List<Report> all = new ArrayList<>(moreReports.size() + 1);
    all.add(report);
    all.addAll(moreReports);
    return List.copyOf(all);
  }
}
