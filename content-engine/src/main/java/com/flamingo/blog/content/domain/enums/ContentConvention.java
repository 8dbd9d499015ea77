package com.flamingo.blog.content.domain.enums;

/** Naming conventions under which content files are turned into slugs. */
public enum ContentConvention {
  /** Date-prefixed blog posts; folders before the date stay as a prefix. */
  POST("Date-prefixed posts below a post-type folder"),

  /** README-per-topic articles; the folder path is the slug. */
  ARTICLE("README-indexed topics"),

  /** Generic pages below a single root, date-aware. */
  PAGE("Generic pages"),

  /** Unstructured research notes; dates are not interpreted. */
  IN_RESEARCH("In-research notes");

  private final String description;

  ContentConvention(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }
}
