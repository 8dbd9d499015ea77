package com.flamingo.blog.content.service.slug;

import com.flamingo.blog.content.service.slug.model.Partition;
import org.springframework.stereotype.Component;

/** Joins a {@link Partition} into a slug and cleans up stray dashes. */
@Component
public class SlugAssembler {

  /**
   * Builds the slug: the folder prefix joined with {@code /}, then {@code /}, then the slug parts
   * joined with {@code -}. The separator is only written when both sides are non-empty.
   *
   * @param partition folder prefix and slug parts
   * @return the normalized slug, possibly empty
   */
  public String assemble(Partition partition) {
    String prefix = String.join("/", partition.folderStructure());
    String rest = String.join("-", partition.slugParts());

    String slug;
    if (!prefix.isEmpty() && !rest.isEmpty()) {
      slug = prefix + "/" + rest;
    } else if (!prefix.isEmpty()) {
      slug = prefix;
    } else {
      slug = rest;
    }
    return normalize(slug);
  }

  /**
   * Collapses dash runs, drops dashes touching a {@code /}, collapses doubled slashes, and trims
   * dashes and slashes at both ends. Applying it to its own output changes nothing.
   *
   * @param slug raw slug text
   * @return normalized slug
   */
  public String normalize(String slug) {
    StringBuilder out = new StringBuilder(slug.length());
    for (int i = 0; i < slug.length(); i++) {
      char c = slug.charAt(i);
      if (c == '-') {
        if (out.length() == 0 || isSeparator(out.charAt(out.length() - 1))) {
          continue;
        }
      } else if (c == '/') {
        if (out.length() > 0 && out.charAt(out.length() - 1) == '-') {
          out.setLength(out.length() - 1);
        }
        if (out.length() == 0 || out.charAt(out.length() - 1) == '/') {
          continue;
        }
      }
      out.append(c);
    }
    // only a single separator can trail: neither is ever appended after another
    if (out.length() > 0 && isSeparator(out.charAt(out.length() - 1))) {
      out.setLength(out.length() - 1);
    }
    return out.toString();
  }

  private static boolean isSeparator(char c) {
    return c == '-' || c == '/';
  }
}
