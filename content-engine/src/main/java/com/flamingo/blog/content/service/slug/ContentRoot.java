package com.flamingo.blog.content.service.slug;

import com.flamingo.blog.content.config.ContentConfig;
import com.flamingo.blog.content.service.slug.model.RelativePath;
import java.nio.file.Path;
import java.util.Optional;

/**
 * An absolute directory anchoring one naming convention.
 *
 * @param directory absolute, normalized directory
 */
public record ContentRoot(Path directory) {

  public ContentRoot {
    directory = directory.toAbsolutePath().normalize();
  }

  public static ContentRoot of(String configured) {
    return new ContentRoot(ContentConfig.resolveRoot(configured));
  }

  /** Parses a file path string the same way roots are resolved. */
  public static Path toAbsolute(String filePath) {
    return Path.of(filePath).toAbsolutePath().normalize();
  }

  /** Whether the file lies strictly below this root. */
  public boolean contains(Path file) {
    return file.startsWith(directory) && !file.equals(directory);
  }

  /**
   * Relativizes a file against this root.
   *
   * @param file absolute, normalized file path
   * @return the components below the root with the extension stripped, or empty when the file is
   *     not below this root
   */
  public Optional<RelativePath> relativize(Path file) {
    if (!contains(file)) {
      return Optional.empty();
    }
    return Optional.of(RelativePath.of(directory.relativize(file)));
  }

  @Override
  public String toString() {
    return directory.toString();
  }
}
