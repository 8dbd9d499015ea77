package com.flamingo.blog.content.service.date;

import com.flamingo.blog.content.exception.InvalidPublishedDateException;
import com.flamingo.blog.content.service.slug.SegmentClassifier;
import com.flamingo.blog.content.service.slug.model.RelativePath;
import com.flamingo.blog.content.service.slug.model.Segment;
import com.flamingo.blog.content.service.slug.strategy.PostSlugStrategy;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Reads the publication date of a blog post from its path.
 *
 * <p>The date comes from the same component that starts the slug: the first {@code YYYY-MM-DD}
 * folder or {@code YYYY-MM-DD-*} name below the post-type folder.
 */
@Service
@RequiredArgsConstructor
public class PublishedDateExtractor {

  private final PostSlugStrategy postSlugStrategy;
  private final SegmentClassifier classifier;

  /**
   * Extracts the publication date of a post.
   *
   * @param filePath absolute path of the post file
   * @return the publication date
   * @throws com.flamingo.blog.content.exception.RootMismatchException if the file is not below the
   *     posts root
   * @throws InvalidPublishedDateException if the path carries no date or an impossible one
   */
  public LocalDate extract(String filePath) {
    RelativePath relative = postSlugStrategy.roots().require(filePath).relative().withoutFirst();
    List<String> segments = relative.segments();

    for (int i = 0; i < segments.size(); i++) {
      Segment segment = classifier.classify(segments.get(i), i == segments.size() - 1);
      if (segment instanceof Segment.DateOnly dateOnly) {
        return parse(dateOnly.date(), filePath);
      }
      if (segment instanceof Segment.DateWithSlug dated) {
        return parse(dated.date(), filePath);
      }
    }

    throw new InvalidPublishedDateException(
        filePath,
        "Invalid date format in path: "
            + filePath
            + ". Expected either folder pattern: /content/<type>/YYYY-MM-DD/... or filename"
            + " pattern: YYYY-MM-DD-*");
  }

  private LocalDate parse(String date, String filePath) {
    try {
      return LocalDate.parse(date, DateTimeFormatter.ISO_LOCAL_DATE);
    } catch (DateTimeParseException e) {
      throw new InvalidPublishedDateException(
          filePath, "Invalid date: " + date + " in path: " + filePath, e);
    }
  }
}
