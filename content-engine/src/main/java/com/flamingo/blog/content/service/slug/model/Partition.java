package com.flamingo.blog.content.service.slug.model;

import java.util.List;

/**
 * Outcome of walking a {@link RelativePath}.
 *
 * @param folderStructure components seen before the first date-bearing component, in order
 * @param slugParts components from the first date-bearing component onward, in order
 */
public record Partition(List<String> folderStructure, List<String> slugParts) {

  public Partition {
    folderStructure = List.copyOf(folderStructure);
    slugParts = List.copyOf(slugParts);
  }
}
