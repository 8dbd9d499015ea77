package com.flamingo.blog.content.exception;

/** Exception thrown when a README-indexed content file is not named README. */
public class UnexpectedFilenameException extends SlugResolutionException {

  private final String expectedName;

  public UnexpectedFilenameException(String path, String expectedName) {
    super(
        path,
        "Expected " + expectedName + " file: " + path,
        "Topic content must be stored as " + expectedName + ": " + path);
    this.expectedName = expectedName;
  }

  public String getExpectedName() {
    return expectedName;
  }
}
