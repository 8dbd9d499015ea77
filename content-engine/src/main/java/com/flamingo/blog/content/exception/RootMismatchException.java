package com.flamingo.blog.content.exception;

import java.nio.file.Path;
import java.util.List;

/** Exception thrown when a file does not live below any of the configured content roots. */
public class RootMismatchException extends SlugResolutionException {

  private final List<Path> roots;

  public RootMismatchException(String path, List<Path> roots) {
    super(
        path,
        "File path is not within content folder " + describe(roots) + ": " + path,
        "Content file is outside the content folders: " + path);
    this.roots = List.copyOf(roots);
  }

  public List<Path> getRoots() {
    return roots;
  }

  private static String describe(List<Path> roots) {
    return roots.size() == 1 ? roots.get(0).toString() : roots.toString();
  }
}
