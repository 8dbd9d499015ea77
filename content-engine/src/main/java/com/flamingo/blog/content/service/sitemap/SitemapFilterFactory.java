package com.flamingo.blog.content.service.sitemap;

import com.flamingo.blog.content.config.ContentConfig;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds the {@link SitemapFilter} for one build from configured exclusions, vanity redirects and
 * the draft files found by the caller.
 */
@Service
@Slf4j
public class SitemapFilterFactory {

  private final ContentConfig.Sitemap sitemapConfig;
  private final ContentUrlResolver urlResolver;

  public SitemapFilterFactory(ContentConfig config, ContentUrlResolver urlResolver) {
    this.sitemapConfig = config.getSitemap();
    this.urlResolver = urlResolver;
  }

  /**
   * Creates the filter.
   *
   * @param vanityIds ids of vanity redirect pages, published at {@code /<id>}
   * @param draftFiles absolute paths of draft posts
   * @return the sitemap filter
   */
  public SitemapFilter create(Collection<String> vanityIds, Collection<String> draftFiles) {
    String siteUrl = trimTrailingSlash(sitemapConfig.getSiteUrl());
    Set<String> excluded = new LinkedHashSet<>();

    for (String path : sitemapConfig.getExcludedPaths()) {
      excluded.add(siteUrl + path);
    }
    for (String vanityId : vanityIds) {
      excluded.add(siteUrl + "/" + vanityId);
    }
    for (String draft : draftFiles) {
      urlResolver
          .urlFor(draft)
          .ifPresentOrElse(
              url -> excluded.add(siteUrl + url),
              () -> log.debug("Draft {} has no published URL", draft));
    }

    log.info(
        "Sitemap filter excludes {} URLs and prefixes {}",
        excluded.size(),
        sitemapConfig.getExcludedPrefixes());
    return new SitemapFilter(siteUrl, excluded, sitemapConfig.getExcludedPrefixes());
  }

  private static String trimTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
