package com.flamingo.blog.content.service.slug.strategy;

import com.flamingo.blog.content.config.ContentConfig;
import com.flamingo.blog.content.domain.enums.ContentConvention;
import com.flamingo.blog.content.service.slug.ContentRoot;
import com.flamingo.blog.content.service.slug.ContentRoots;
import com.flamingo.blog.content.service.slug.PathPartitioner;
import com.flamingo.blog.content.service.slug.SlugAssembler;
import com.flamingo.blog.content.service.slug.model.RelativePath;
import org.springframework.stereotype.Component;

/**
 * Blog-post convention.
 *
 * <pre>
 * posts/deep-dives/2023-08-10-some-text/some-file.md       -> deep-dives/some-text-some-file
 * posts/2023-08-10-deep-dives/some-text/some-file.md       -> deep-dives-some-text-some-file
 * posts/system-design-fundamentals/2025-04-01-caching.md  -> system-design-fundamentals/caching
 * </pre>
 *
 * <p>The post-type folder directly below the root is dropped before partitioning.
 */
@Component
public class PostSlugStrategy extends DateAwareSlugStrategy {

  public PostSlugStrategy(
      ContentConfig config, PathPartitioner partitioner, SlugAssembler assembler) {
    super(ContentRoots.of(ContentRoot.of(config.getPostsRoot())), partitioner, assembler);
  }

  @Override
  public ContentConvention convention() {
    return ContentConvention.POST;
  }

  @Override
  protected RelativePath preprocess(RelativePath relative) {
    return relative.withoutFirst();
  }
}
