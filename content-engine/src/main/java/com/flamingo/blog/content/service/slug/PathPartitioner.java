package com.flamingo.blog.content.service.slug;

import com.flamingo.blog.content.service.slug.model.Partition;
import com.flamingo.blog.content.service.slug.model.RelativePath;
import com.flamingo.blog.content.service.slug.model.Segment;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Splits a {@link RelativePath} into a folder prefix and slug parts.
 *
 * <p>Components before the first date-bearing component form the folder prefix. The date-bearing
 * component itself contributes its slug text (if any) to the slug parts, never to the prefix, and
 * every later component follows it into the slug parts. A date at the top of the path therefore
 * flattens everything into slug parts, while a deeper date keeps the folders above it.
 *
 * <p>Only the first date flips the walk. Later date-shaped components are kept verbatim. When no
 * component carries a date the whole path collapses into slug parts.
 */
@Component
@RequiredArgsConstructor
public class PathPartitioner {

  private final SegmentClassifier classifier;

  /**
   * Partitions a path, recognizing dates.
   *
   * @param path the root-relative path, extension stripped
   * @return folder prefix and slug parts
   */
  public Partition partition(RelativePath path) {
    return partition(path, true);
  }

  /**
   * Partitions a path.
   *
   * @param path the root-relative path, extension stripped
   * @param recognizeDates when false every component except a trailing index marker is plain
   * @return folder prefix and slug parts
   */
  public Partition partition(RelativePath path, boolean recognizeDates) {
    List<String> segments = path.segments();
    List<String> folderStructure = new ArrayList<>();
    List<String> slugParts = new ArrayList<>();
    boolean foundDate = false;

    for (int i = 0; i < segments.size(); i++) {
      boolean last = i == segments.size() - 1;
      Segment segment = classifier.classify(segments.get(i), last, recognizeDates && !foundDate);

      if (segment instanceof Segment.IndexMarker) {
        continue;
      }
      if (segment instanceof Segment.DateOnly) {
        foundDate = true;
      } else if (segment instanceof Segment.DateWithSlug dated) {
        foundDate = true;
        slugParts.add(dated.slug());
      } else if (foundDate) {
        slugParts.add(segment.raw());
      } else {
        folderStructure.add(segment.raw());
      }
    }

    if (!foundDate) {
      folderStructure.addAll(slugParts);
      return new Partition(List.of(), folderStructure);
    }
    return new Partition(folderStructure, slugParts);
  }
}
