package ca.gc.cra.warden.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * File-system checks for paths supplied on the command line or in configuration.
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Resolves a path to its real location and checks it is a readable regular file.
   *
   * @param name parameter name used in messages
   * @param path candidate path
   * @return canonical path
   * @throws IllegalArgumentException when the file is missing, not regular, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Objects.requireNonNull(path, name == null ? "path" : name);
    Path real;
    try {
      real = path.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException(name + " does not exist: " + path, ex);
    }
    if (!Files.isRegularFile(real)) {
      throw new IllegalArgumentException(name + " must be a regular file: " + path);
    }
    if (!Files.isReadable(real)) {
      throw new IllegalArgumentException(name + " is not readable: " + path);
    }
    return real;
  }
}
