package com.flamingo.blog.content.service.slug.model;

/**
 * Classification of a single path component.
 *
 * <p>Produced by {@link com.flamingo.blog.content.service.slug.SegmentClassifier}; every string
 * classifies as exactly one variant.
 */
public sealed interface Segment
    permits Segment.DateOnly, Segment.DateWithSlug, Segment.IndexMarker, Segment.Plain {

  /** Raw text of the component as it appeared in the path (extension already stripped). */
  String raw();

  /** A component that is exactly {@code YYYY-MM-DD}. */
  record DateOnly(String raw) implements Segment {

    public String date() {
      return raw;
    }
  }

  /**
   * A component shaped {@code YYYY-MM-DD-<slug>}.
   *
   * @param raw the full component
   * @param slug the text after the date and its trailing dash, never empty
   */
  record DateWithSlug(String raw, String slug) implements Segment {

    public String date() {
      return raw.substring(0, raw.length() - slug.length() - 1);
    }
  }

  /** A trailing {@code index} or {@code README} file name. */
  record IndexMarker(String raw) implements Segment {}

  /** Any other folder or file name. */
  record Plain(String raw) implements Segment {}
}
