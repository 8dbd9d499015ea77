package com.flamingo.blog.content.service.sitemap;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Decides which page URLs belong in the sitemap. Exact excluded URLs are checked first, then
 * site-relative prefixes such as {@code /in-research}.
 */
public final class SitemapFilter implements Predicate<String> {

  private final String siteUrl;
  private final Set<String> excludedUrls;
  private final List<String> excludedPrefixes;

  SitemapFilter(String siteUrl, Set<String> excludedUrls, List<String> excludedPrefixes) {
    this.siteUrl = siteUrl;
    this.excludedUrls = Set.copyOf(excludedUrls);
    this.excludedPrefixes = List.copyOf(excludedPrefixes);
  }

  /**
   * Whether a page belongs in the sitemap.
   *
   * @param page absolute page URL, with or without a trailing slash
   * @return false for drafts, vanity redirects and excluded paths
   */
  public boolean includes(String page) {
    String normalizedPage = page.endsWith("/") ? page.substring(0, page.length() - 1) : page;
    if (excludedUrls.contains(normalizedPage)) {
      return false;
    }

    String pagePath =
        normalizedPage.startsWith(siteUrl)
            ? normalizedPage.substring(siteUrl.length())
            : normalizedPage;
    for (String prefix : excludedPrefixes) {
      if (pagePath.equals(prefix) || pagePath.startsWith(prefix + "/")) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean test(String page) {
    return includes(page);
  }

  public Set<String> getExcludedUrls() {
    return excludedUrls;
  }
}
