package com.flamingo.blog.content.exception;

/** Exception thrown when no valid publication date can be read from a post path. */
public class InvalidPublishedDateException extends SlugResolutionException {

  public InvalidPublishedDateException(String path, String message) {
    super(path, message, "Post has no valid publication date: " + path);
  }

  public InvalidPublishedDateException(String path, String message, Throwable cause) {
    super(path, message, "Post has no valid publication date: " + path, cause);
  }
}
