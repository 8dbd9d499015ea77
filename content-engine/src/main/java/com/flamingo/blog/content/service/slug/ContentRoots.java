package com.flamingo.blog.content.service.slug;

import com.flamingo.blog.content.exception.RootMismatchException;
import com.flamingo.blog.content.service.slug.model.RelativePath;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Ordered candidate roots for one convention. The first root containing a file wins.
 *
 * @param candidates roots in trial order, never empty
 */
public record ContentRoots(List<ContentRoot> candidates) {

  public ContentRoots {
    if (candidates.isEmpty()) {
      throw new IllegalArgumentException("At least one content root is required");
    }
    candidates = List.copyOf(candidates);
  }

  public static ContentRoots of(ContentRoot root) {
    return new ContentRoots(List.of(root));
  }

  public static ContentRoots of(List<String> configured) {
    return new ContentRoots(configured.stream().map(ContentRoot::of).toList());
  }

  /**
   * Finds the first root containing the file.
   *
   * @param file absolute, normalized file path
   * @return the matching root and the path below it, or empty when no root matches
   */
  public Optional<Located> locate(Path file) {
    return candidates.stream()
        .filter(root -> root.contains(file))
        .findFirst()
        .map(root -> new Located(root, root.relativize(file).orElseThrow()));
  }

  /**
   * Like {@link #locate(Path)} but fails when no root matches.
   *
   * @param filePath file path as given by the caller
   * @return the matching root and the path below it
   * @throws RootMismatchException when the file is below none of the roots
   */
  public Located require(String filePath) {
    Path file = ContentRoot.toAbsolute(filePath);
    return locate(file)
        .orElseThrow(
            () ->
                new RootMismatchException(
                    filePath, candidates.stream().map(ContentRoot::directory).toList()));
  }

  public boolean contains(Path file) {
    return candidates.stream().anyMatch(root -> root.contains(file));
  }

  /**
   * A file located below one of the roots.
   *
   * @param root the root that matched
   * @param relative the components below it
   */
  public record Located(ContentRoot root, RelativePath relative) {}
}
