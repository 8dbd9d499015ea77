package com.flamingo.blog.content.service.slug.strategy;

import com.flamingo.blog.content.domain.enums.ContentConvention;
import com.flamingo.blog.content.service.slug.ContentRoots;
import java.nio.file.Path;

/**
 * Turns a content file path into its slug under one naming convention.
 *
 * <p>Implementations are pure functions of the path and their build-time roots. They are stateless
 * and safe for concurrent use.
 */
public interface SlugStrategy {

  ContentConvention convention();

  ContentRoots roots();

  /**
   * Computes the slug of a file.
   *
   * @param filePath absolute path of the content file
   * @return the slug, possibly empty
   * @throws com.flamingo.blog.content.exception.RootMismatchException if the file is not below the
   *     convention's roots
   */
  String slugFor(String filePath);

  /** Whether this convention is responsible for the file. */
  default boolean accepts(Path file) {
    return roots().contains(file);
  }
}
