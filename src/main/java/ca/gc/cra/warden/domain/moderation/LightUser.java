package ca.gc.cra.warden.domain.moderation;

import java.util.Objects;

/**
 * Lightweight display form of an account: id, display name and optional title.
 *
 * @param id normalized user id
 * @param name display username
 * @param title optional title such as {@code GM}; {@code null} when untitled
 * @since 0.1.0
 */
public record LightUser(String id, String name, String title) {
  public LightUser {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
  }
}
