package com.flamingo.blog.content.exception;

/**
 * Base class for content path failures. These reflect misplaced or misnamed content and are fatal
 * to the build step that hit them.
 */
public abstract class SlugResolutionException extends RuntimeException {

  private final String path;
  private final String userMessage;

  protected SlugResolutionException(String path, String message, String userMessage) {
    super(message);
    this.path = path;
    this.userMessage = userMessage;
  }

  protected SlugResolutionException(
      String path, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.path = path;
    this.userMessage = userMessage;
  }

  public String getPath() {
    return path;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
