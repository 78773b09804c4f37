package io.wxpanel.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Directory validation for CLI-supplied paths.
 * <p><strong>Role:</strong> Checks the background and overlay directories are readable and that the
 * output directory can be created and written before a run touches the network.</p>
 * <p><strong>Thread-safety:</strong> Stateless; results reflect the file system at call time.</p>
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates an output directory, optionally creating it.
   *
   * @param path candidate directory
   * @param createIfMissing create the directory (and parents) when absent
   * @return normalized absolute path
   * @throws IllegalArgumentException if the path is malformed, not a directory, or not writable
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    Path normalized = normalize(path);
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        ensureWritableDirectory(normalized);
        return normalized;
      }
      if (createIfMissing) {
        Files.createDirectories(normalized);
        ensureWritableDirectory(normalized);
        return normalized;
      }
      Path ancestor = nearestExistingAncestor(normalized);
      if (!Files.isDirectory(ancestor) || !Files.isWritable(ancestor)) {
        throw new IllegalArgumentException("cannot create " + normalized + " under " + ancestor);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates that a directory exists and is readable.
   *
   * @param path candidate directory
   * @return normalized absolute path
   * @throws IllegalArgumentException if missing, not a directory, or unreadable
   */
  public static Path validateReadableDir(Path path) {
    Path normalized = normalize(path);
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("directory does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("directory is not readable: " + normalized);
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }

  private static void ensureWritableDirectory(Path dir) {
    if (!Files.isDirectory(dir)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath();
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
