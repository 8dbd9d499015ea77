package com.flamingo.blog.content.service.link;

import com.flamingo.blog.content.config.ContentConfig;
import com.flamingo.blog.content.exception.SlugResolutionException;
import com.flamingo.blog.content.service.slug.ContentRoot;
import com.flamingo.blog.content.service.slug.strategy.ArticleSlugStrategy;
import java.nio.file.Path;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Link;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.springframework.stereotype.Service;

/**
 * Rewrites markdown links between articles into site URLs.
 *
 * <p>Authors link article files so editors can navigate them, e.g. {@code
 * [CRDTs](../crdt-for-collaborative-systems/README.md#merging)}. In the rendered site the same link
 * must point at {@code /articles/<slug>#merging}. Links to anything other than a README below the
 * articles root are left untouched.
 */
@Service
@Slf4j
public class InternalLinkRewriter {

  private static final Parser PARSER = Parser.builder().build();

  private final ArticleSlugStrategy articleSlugStrategy;
  private final ContentRoot articlesRoot;
  private final String articlesPrefix;

  public InternalLinkRewriter(ContentConfig config, ArticleSlugStrategy articleSlugStrategy) {
    this.articleSlugStrategy = articleSlugStrategy;
    this.articlesRoot = articleSlugStrategy.roots().candidates().get(0);
    this.articlesPrefix = trimTrailingSlash(config.getLinks().getArticlesPrefix());
  }

  /**
   * Parses markdown and rewrites its article links.
   *
   * @param markdown markdown source
   * @param sourceFile absolute path of the file the markdown was read from
   * @return the parsed document with rewritten link destinations
   */
  public Node rewrite(String markdown, String sourceFile) {
    Node document = PARSER.parse(markdown);
    rewrite(document, sourceFile);
    return document;
  }

  /**
   * Rewrites article links of an already parsed document in place.
   *
   * @param document commonmark document
   * @param sourceFile absolute path of the file the document was read from
   * @return number of links rewritten
   */
  public int rewrite(Node document, String sourceFile) {
    LinkVisitor visitor = new LinkVisitor(sourceFile);
    document.accept(visitor);
    log.debug("Rewrote {} internal links in {}", visitor.rewritten, sourceFile);
    return visitor.rewritten;
  }

  /**
   * Maps a single link destination to a site URL.
   *
   * @param href link destination as written in markdown
   * @param sourceFile absolute path of the file containing the link
   * @return the site URL, or empty when the link should be left as is
   */
  public Optional<String> transformLink(String href, String sourceFile) {
    if (!isMarkdownLink(href)) {
      return Optional.empty();
    }

    int hash = href.indexOf('#');
    String linkPath = hash < 0 ? href : href.substring(0, hash);
    String anchor = hash < 0 ? "" : href.substring(hash + 1);
    if (linkPath.isEmpty()) {
      return Optional.empty();
    }

    Path source = ContentRoot.toAbsolute(sourceFile);
    Path base = source.getParent() != null ? source.getParent() : source;
    Path target = base.resolve(linkPath).normalize();

    if (!articlesRoot.contains(target)) {
      log.warn("Link target not in content directories: {} (from {})", target, sourceFile);
      return Optional.empty();
    }

    String slug;
    try {
      slug = articleSlugStrategy.slugFor(target.toString());
    } catch (SlugResolutionException e) {
      log.warn("Cannot rewrite link {} in {}: {}", href, sourceFile, e.getMessage());
      return Optional.empty();
    }

    String url = slug.isEmpty() ? articlesPrefix : articlesPrefix + "/" + slug;
    return Optional.of(anchor.isEmpty() ? url : url + "#" + anchor);
  }

  /** External URLs, protocol links and bare anchors are never markdown file links. */
  static boolean isMarkdownLink(String href) {
    if (href == null || href.startsWith("http") || href.startsWith("#") || href.contains("://")) {
      return false;
    }
    return href.endsWith(".md") || href.contains(".md#");
  }

  private static String trimTrailingSlash(String prefix) {
    return prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
  }

  private final class LinkVisitor extends AbstractVisitor {

    private final String sourceFile;
    private int rewritten;

    private LinkVisitor(String sourceFile) {
      this.sourceFile = sourceFile;
    }

    @Override
    public void visit(Link link) {
      transformLink(link.getDestination(), sourceFile)
          .ifPresent(
              url -> {
                link.setDestination(url);
                rewritten++;
              });
      visitChildren(link);
    }
  }
}
