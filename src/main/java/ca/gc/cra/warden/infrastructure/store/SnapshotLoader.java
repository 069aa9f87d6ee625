package ca.gc.cra.warden.infrastructure.store;

import ca.gc.cra.warden.domain.moderation.ActiveClaim;
import ca.gc.cra.warden.domain.moderation.Moderator;
import ca.gc.cra.warden.domain.moderation.ModlogEntry;
import ca.gc.cra.warden.domain.moderation.Note;
import ca.gc.cra.warden.domain.moderation.Report;
import ca.gc.cra.warden.domain.moderation.ReportReason;
import ca.gc.cra.warden.domain.moderation.User;
import ca.gc.cra.warden.domain.moderation.UserIds;
import ca.gc.cra.warden.domain.security.Permission;
import ca.gc.cra.warden.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads a {@link ModerationSnapshot} from a JSON document.
 * <p><strong>Format:</strong> a root object with optional arrays {@code moderators}, {@code users},
 * {@code reports}, {@code notes} and {@code modlog}. Instants are ISO-8601 strings. Report claims are
 * nested {@code inquiry} objects with {@code mod} and {@code seenAt}.</p>
 * <p><strong>Errors:</strong> structural problems raise {@link IllegalArgumentException} naming the entry,
 * e.g. {@code reports[2].createdAt}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the parser factory; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class SnapshotLoader {
  private static final Logger log = LoggerFactory.getLogger(SnapshotLoader.class);

  private final JsonSupport json = new JsonSupport();

  /**
   * Loads a snapshot file.
   *
   * @param path UTF-8 JSON file
   * @return parsed snapshot
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed
   */
  public ModerationSnapshot load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      ModerationSnapshot snapshot = fromDocument(json.parse(reader));
      log.info("Loaded snapshot {} with {} reports, {} users, {} moderators",
          path, snapshot.reports().size(), snapshot.users().size(), snapshot.moderators().size());
      return snapshot;
    }
  }

  /**
   * Parses a snapshot from JSON text.
   *
   * @param document JSON text
   * @return parsed snapshot
   * @throws IllegalArgumentException when the document is malformed
   */
  public ModerationSnapshot parse(String document) {
    return fromDocument(json.parse(document));
  }

  private ModerationSnapshot fromDocument(Object document) {
    Map<String, Object> root = Fields.object(document, "snapshot");
    List<Moderator> moderators = list(root, "moderators", SnapshotLoader::moderator);
    List<User> users = list(root, "users", SnapshotLoader::user);
    List<Report> reports = list(root, "reports", SnapshotLoader::report);
    requireUniqueIds(reports);
    List<Note> notes = list(root, "notes", SnapshotLoader::note);
    List<ModlogEntry> modlog = list(root, "modlog", SnapshotLoader::modlogEntry);
    return new ModerationSnapshot(moderators, users, reports, notes, modlog);
  }

  private static <T> List<T> list(
      Map<String, Object> root, String key, BiFunction<Map<String, Object>, String, T> mapper) {
    Object raw = root.get(key);
    if (raw == null) {
      return List.of();
    }
    if (!(raw instanceof List<?> entries)) {
      throw new IllegalArgumentException(key + " must be an array");
    }
    List<T> result = new ArrayList<>(entries.size());
    for (int i = 0; i < entries.size(); i++) {
      String context = key + "[" + i + "]";
      result.add(mapper.apply(Fields.object(entries.get(i), context), context));
    }
    return result;
  }

  private static Moderator moderator(Map<String, Object> node, String context) {
    String username = Fields.requiredString(node, "username", context);
    String id = Fields.optionalString(node, "id", context);
    Set<Permission> permissions = EnumSet.noneOf(Permission.class);
    for (String name : Fields.stringList(node, "permissions", context)) {
      try {
        permissions.add(Permission.parse(name));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException(context + ".permissions: " + ex.getMessage(), ex);
      }
    }
    return new Moderator(
        id == null ? UserIds.normalize(username) : UserIds.normalize(id),
        username,
        Fields.optionalString(node, "title", context),
        Fields.optionalBoolean(node, "enabled", context, true),
        permissions);
  }

  private static User user(Map<String, Object> node, String context) {
    String username = Fields.requiredString(node, "username", context);
    return new User(
        UserIds.normalize(username),
        username,
        Fields.optionalString(node, "title", context),
        Fields.optionalBoolean(node, "enabled", context, true),
        Fields.optionalBoolean(node, "engine", context, false),
        Fields.optionalBoolean(node, "booster", context, false),
        Fields.optionalBoolean(node, "troll", context, false),
        instant(node, "createdAt", context));
  }

  private static Report report(Map<String, Object> node, String context) {
    ReportReason reason;
    try {
      reason = ReportReason.parse(Fields.requiredString(node, "reason", context));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(context + ".reason: " + ex.getMessage(), ex);
    }
    ActiveClaim claim = null;
    Object inquiry = node.get("inquiry");
    if (inquiry != null) {
      String claimContext = context + ".inquiry";
      Map<String, Object> claimNode = Fields.object(inquiry, claimContext);
      claim = new ActiveClaim(
          UserIds.normalize(Fields.requiredString(claimNode, "mod", claimContext)),
          instant(claimNode, "seenAt", claimContext));
    }
    String processedBy = Fields.optionalString(node, "processedBy", context);
    return new Report(
        Fields.requiredString(node, "id", context),
        Fields.requiredString(node, "user", context),
        UserIds.normalize(Fields.requiredString(node, "reporter", context)),
        reason,
        Fields.optionalString(node, "text", context),
        instant(node, "createdAt", context),
        processedBy == null ? null : UserIds.normalize(processedBy),
        Fields.optionalBoolean(node, "actioned", context, false),
        claim);
  }

  private static Note note(Map<String, Object> node, String context) {
    return new Note(
        UserIds.normalize(Fields.requiredString(node, "from", context)),
        UserIds.normalize(Fields.requiredString(node, "to", context)),
        Fields.optionalString(node, "text", context),
        Fields.optionalBoolean(node, "modOnly", context, true),
        instant(node, "date", context));
  }

  private static ModlogEntry modlogEntry(Map<String, Object> node, String context) {
    return new ModlogEntry(
        UserIds.normalize(Fields.requiredString(node, "mod", context)),
        UserIds.normalize(Fields.requiredString(node, "user", context)),
        Fields.requiredString(node, "action", context),
        Fields.optionalString(node, "details", context),
        instant(node, "date", context));
  }

  private static Instant instant(Map<String, Object> node, String key, String context) {
    String raw = Fields.requiredString(node, key, context);
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(context + "." + key + " must be an ISO-8601 instant (was '" + raw + "')", ex);
    }
  }

  private static void requireUniqueIds(List<Report> reports) {
    Set<String> seen = new HashSet<>();
    for (Report report : reports) {
      if (!seen.add(report.id())) {
        throw new IllegalArgumentException("duplicate report id: " + report.id());
      }
    }
  }
}
