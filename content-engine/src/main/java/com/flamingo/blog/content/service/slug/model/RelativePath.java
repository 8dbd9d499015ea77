package com.flamingo.blog.content.service.slug.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered components between a content root and the target file, with the extension removed from
 * the file name.
 *
 * @param segments path components, outermost first
 */
public record RelativePath(List<String> segments) {

  public RelativePath {
    segments = List.copyOf(segments);
  }

  /**
   * Splits a root-relative path and strips one extension from the last component.
   *
   * @param relative a path already relativized against its content root
   * @return the relative path
   */
  public static RelativePath of(Path relative) {
    List<String> names = new ArrayList<>(relative.getNameCount());
    for (Path name : relative) {
      names.add(name.toString());
    }
    if (!names.isEmpty()) {
      int last = names.size() - 1;
      names.set(last, stripExtension(names.get(last)));
    }
    return new RelativePath(names);
  }

  /**
   * Removes the text after the last dot, unless the dot opens the name (dotfiles) or ends it.
   *
   * @param fileName a single path component
   * @return the name without its extension
   */
  public static String stripExtension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot <= 0 || dot == fileName.length() - 1) {
      return fileName;
    }
    return fileName.substring(0, dot);
  }

  public boolean isEmpty() {
    return segments.isEmpty();
  }

  public int size() {
    return segments.size();
  }

  /** The file name without extension, or an empty string for an empty path. */
  public String fileName() {
    return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
  }

  /** The same path without its first component. */
  public RelativePath withoutFirst() {
    if (segments.isEmpty()) {
      return this;
    }
    return new RelativePath(segments.subList(1, segments.size()));
  }

  /** The same path without its last component. */
  public RelativePath parent() {
    if (segments.isEmpty()) {
      return this;
    }
    return new RelativePath(segments.subList(0, segments.size() - 1));
  }
}
