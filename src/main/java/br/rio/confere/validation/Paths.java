package br.rio.confere.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for output, checkpoint, and input directories.
 * <p><strong>Why:</strong> A run writes results and checkpoints for hours; an unwritable directory must fail at
 * startup, not after the first processo.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked target is reported as such.
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a directory that will receive files, creating it when asked.
   *
   * @param name option name for diagnostics
   * @param path candidate directory
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is not a writable directory or cannot be created
   */
  public static Path validateWritableDir(String name, Path path, boolean createIfMissing) {
    Path normalized = normalize(name, path);
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
          throw new IllegalArgumentException(name + " is not a directory: " + normalized);
        }
        if (!Files.isWritable(normalized)) {
          throw new IllegalArgumentException(name + " is not writable: " + normalized);
        }
        return normalized;
      }
      if (createIfMissing) {
        Files.createDirectories(normalized);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to validate " + name + " " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates a directory that will be read.
   *
   * @param name option name for diagnostics
   * @param path candidate directory
   * @return real path of the directory
   * @throws IllegalArgumentException if the directory is missing or unreadable
   */
  public static Path requireReadableDir(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isDirectory(normalized) || !Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " must be a readable directory: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to access " + name + " " + normalized, ex);
    }
  }

  /**
   * Validates a file that will be read.
   *
   * @param name option name for diagnostics
   * @param path candidate file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isRegularFile(normalized) || !Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " must be a readable file: " + normalized);
    }
    return normalized;
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
