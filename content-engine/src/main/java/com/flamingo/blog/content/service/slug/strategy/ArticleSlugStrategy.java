package com.flamingo.blog.content.service.slug.strategy;

import com.flamingo.blog.content.config.ContentConfig;
import com.flamingo.blog.content.domain.enums.ContentConvention;
import com.flamingo.blog.content.exception.UnexpectedFilenameException;
import com.flamingo.blog.content.service.slug.ContentRoots;
import com.flamingo.blog.content.service.slug.model.RelativePath;
import org.springframework.stereotype.Component;

/**
 * README-per-topic convention. The slug is the folder path of the README below the first matching
 * root, kept verbatim.
 *
 * <pre>
 * articles/system-design/caching/cache-aside/README.md -> system-design/caching/cache-aside
 * blogs/my-first-blog/README.md                        -> my-first-blog
 * articles/README.md                                   -> (empty)
 * </pre>
 */
@Component
public class ArticleSlugStrategy implements SlugStrategy {

  static final String README = "README";

  private final ContentRoots roots;

  public ArticleSlugStrategy(ContentConfig config) {
    this.roots = ContentRoots.of(config.getReadmeRoots());
  }

  @Override
  public ContentConvention convention() {
    return ContentConvention.ARTICLE;
  }

  @Override
  public ContentRoots roots() {
    return roots;
  }

  /**
   * {@inheritDoc}
   *
   * @throws UnexpectedFilenameException if the file is not a README
   */
  @Override
  public String slugFor(String filePath) {
    RelativePath relative = roots.require(filePath).relative();
    if (!README.equals(relative.fileName())) {
      throw new UnexpectedFilenameException(filePath, README + ".md");
    }
    return String.join("/", relative.parent().segments());
  }
}
