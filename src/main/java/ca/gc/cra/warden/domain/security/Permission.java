package ca.gc.cra.warden.domain.security;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> Named moderation capability, optionally implying narrower capabilities.
 * <p><strong>Why:</strong> Roles are granted coarse-grained ({@code ADMIN}) while checks ask for narrow
 * capabilities ({@code HUNTER}); the implication graph bridges the two.</p>
 * <p><strong>Thread-safety:</strong> Enum constants and their closures are immutable.</p>
 *
 * @since 0.1.0
 */
public enum Permission {
  /** Investigator able to open and work cheat inquiries. */
  HUNTER,
  /** Handles chat and abuse reports. */
  SHUSHER,
  /** Reads private notes left by other moderators. */
  MOD_NOTE,
  MODERATOR(HUNTER, SHUSHER, MOD_NOTE),
  ADMIN(MODERATOR),
  SUPER_ADMIN(ADMIN);

  private static final Map<Permission, Set<Permission>> CLOSURES = new EnumMap<>(Permission.class);

  static {
    for (Permission permission : values()) {
      EnumSet<Permission> seen = EnumSet.noneOf(Permission.class);
      collect(permission, seen);
      CLOSURES.put(permission, Collections.unmodifiableSet(seen));
    }
  }

  private final Set<Permission> children;

  Permission(Permission... children) {
    this.children = children.length == 0 ? Set.of() : Set.of(children);
  }

  /**
   * Returns this permission together with every permission it implies transitively.
   *
   * @return unmodifiable closure including {@code this}
   */
  public Set<Permission> closure() {
    return CLOSURES.get(this);
  }

  /**
   * Tests whether this permission grants {@code other}, directly or through implication.
   *
   * @param other capability being checked
   * @return {@code true} when {@code other} is in this permission's closure
   */
  public boolean grants(Permission other) {
    return closure().contains(other);
  }

  /**
   * Parses a permission name case-insensitively; {@code ROLE_} prefixes are accepted.
   *
   * @param raw permission name
   * @return matching permission
   * @throws IllegalArgumentException when blank or unknown
   */
  public static Permission parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("permission must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    if (normalized.startsWith("ROLE_")) {
      normalized = normalized.substring("ROLE_".length());
    }
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown permission: " + raw, ex);
    }
  }

  private static void collect(Permission permission, Set<Permission> seen) {
    if (!seen.add(permission)) {
      return;
    }
    for (Permission child : permission.children) {
      collect(child, seen);
    }
  }
}
