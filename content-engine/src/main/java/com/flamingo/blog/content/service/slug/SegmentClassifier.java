package com.flamingo.blog.content.service.slug;

import com.flamingo.blog.content.service.slug.model.Segment;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Classifies single path components.
 *
 * <p>Rules, first match wins:
 *
 * <ol>
 *   <li>the last component named {@code index} or {@code README} (any case) is an index marker
 *   <li>exactly {@code YYYY-MM-DD} is a bare date
 *   <li>{@code YYYY-MM-DD-} followed by at least one character is a date with a slug
 *   <li>anything else is a plain component
 * </ol>
 *
 * <p>The date shape is matched by scanning characters against a fixed template rather than with a
 * regular expression, so only ASCII digits count and there is no partial matching.
 */
@Component
public class SegmentClassifier {

  private static final Set<String> INDEX_NAMES = Set.of("index", "readme");

  /** {@code #} stands for one ASCII digit, anything else must match literally. */
  private static final String DATE_SHAPE = "####-##-##";

  private static final int DATE_LENGTH = DATE_SHAPE.length();

  /**
   * Classifies a component, recognizing dates.
   *
   * @param raw component text, extension already stripped
   * @param last whether the component is the final one of its path
   * @return the classification
   */
  public Segment classify(String raw, boolean last) {
    return classify(raw, last, true);
  }

  /**
   * Classifies a component.
   *
   * @param raw component text, extension already stripped
   * @param last whether the component is the final one of its path
   * @param recognizeDates when false, date-shaped text is treated as a plain component
   * @return the classification
   */
  public Segment classify(String raw, boolean last, boolean recognizeDates) {
    if (last && isIndexName(raw)) {
      return new Segment.IndexMarker(raw);
    }
    if (recognizeDates && startsWithDate(raw)) {
      if (raw.length() == DATE_LENGTH) {
        return new Segment.DateOnly(raw);
      }
      if (raw.charAt(DATE_LENGTH) == '-' && raw.length() > DATE_LENGTH + 1) {
        return new Segment.DateWithSlug(raw, raw.substring(DATE_LENGTH + 1));
      }
    }
    return new Segment.Plain(raw);
  }

  static boolean isIndexName(String raw) {
    return INDEX_NAMES.contains(raw.toLowerCase(Locale.ROOT));
  }

  static boolean startsWithDate(String raw) {
    if (raw.length() < DATE_LENGTH) {
      return false;
    }
    for (int i = 0; i < DATE_LENGTH; i++) {
      char expected = DATE_SHAPE.charAt(i);
      char actual = raw.charAt(i);
      boolean matches = expected == '#' ? actual >= '0' && actual <= '9' : actual == expected;
      if (!matches) {
        return false;
      }
    }
    return true;
  }
}
