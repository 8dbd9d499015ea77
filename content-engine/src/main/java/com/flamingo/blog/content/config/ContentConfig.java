package com.flamingo.blog.content.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the content folders and the URLs derived from them.
 *
 * <p>Root values may be relative; they are resolved against the working directory of the build.
 */
@Configuration
@ConfigurationProperties(prefix = "content")
@Getter
@Setter
public class ContentConfig {

  /**
   * Root of the blog-post convention. The first folder below it ({@code posts}, {@code writing},
   * ...) is the post type.
   */
  private String postsRoot = "./content";

  /** Candidate roots for README-per-topic content, tried in order. */
  private List<String> readmeRoots =
      new ArrayList<>(List.of("./content/articles", "./content/blogs", "./content/projects"));

  private String pagesRoot = "./content/pages";

  /** Scratch content; date prefixes are not interpreted below this root. */
  private String researchRoot = "./content/in-research";

  private Links links = new Links();
  private Sitemap sitemap = new Sitemap();

  /** Resolves a configured root string the way the build resolves relative paths. */
  public static Path resolveRoot(String root) {
    return Path.of(root).toAbsolutePath().normalize();
  }

  @Getter
  @Setter
  public static class Links {
    /** URL prefix prepended to slugs of linked README articles. */
    private String articlesPrefix = "/articles";
  }

  @Getter
  @Setter
  public static class Sitemap {
    private String siteUrl = "https://example.com";

    /** Post-type folders that are published under {@code /<type>/<slug>}. */
    private List<String> contentTypes =
        new ArrayList<>(List.of("writing", "deep-dives", "work", "uses"));

    /** Site-relative paths that never appear in the sitemap. */
    private List<String> excludedPaths = new ArrayList<>(List.of("/drafts", "/posts/drafts"));

    /** Site-relative prefixes whose pages never appear in the sitemap. */
    private List<String> excludedPrefixes = new ArrayList<>(List.of("/in-research"));
  }
}
