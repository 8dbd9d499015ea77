package com.flamingo.blog.content.service.sitemap;

import com.flamingo.blog.content.config.ContentConfig;
import com.flamingo.blog.content.service.slug.ContentRoot;
import com.flamingo.blog.content.service.slug.strategy.PostSlugStrategy;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Site URLs of blog posts. A post below {@code <posts-root>/<type>/...} is published at {@code
 * /<type>/<slug>} when its type is one of the configured content types.
 */
@Service
public class ContentUrlResolver {

  private final PostSlugStrategy postSlugStrategy;
  private final List<String> contentTypes;

  public ContentUrlResolver(ContentConfig config, PostSlugStrategy postSlugStrategy) {
    this.postSlugStrategy = postSlugStrategy;
    this.contentTypes = List.copyOf(config.getSitemap().getContentTypes());
  }

  /**
   * The post-type folder of a file, if it is a configured content type.
   *
   * @param filePath absolute path of the content file
   * @return the content type
   */
  public Optional<String> contentType(String filePath) {
    return postSlugStrategy
        .roots()
        .locate(ContentRoot.toAbsolute(filePath))
        .map(located -> located.relative())
        // a file directly below the root has no type folder
        .filter(relative -> relative.size() > 1)
        .map(relative -> relative.segments().get(0))
        .filter(contentTypes::contains);
  }

  /**
   * The site-relative URL of a post.
   *
   * @param filePath absolute path of the content file
   * @return {@code /<type>/<slug>}, or empty when the file has no published type or no slug
   */
  public Optional<String> urlFor(String filePath) {
    return contentType(filePath)
        .flatMap(
            type -> {
              String slug = postSlugStrategy.slugFor(filePath);
              return slug.isEmpty() ? Optional.empty() : Optional.of("/" + type + "/" + slug);
            });
  }
}
