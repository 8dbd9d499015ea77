package com.flamingo.blog.content.service.slug.strategy;

import com.flamingo.blog.content.config.ContentConfig;
import com.flamingo.blog.content.domain.enums.ContentConvention;
import com.flamingo.blog.content.service.slug.ContentRoot;
import com.flamingo.blog.content.service.slug.ContentRoots;
import com.flamingo.blog.content.service.slug.PathPartitioner;
import com.flamingo.blog.content.service.slug.SlugAssembler;
import org.springframework.stereotype.Component;

/** Generic pages: date-aware partitioning of the whole path below the pages root. */
@Component
public class PageSlugStrategy extends DateAwareSlugStrategy {

  public PageSlugStrategy(
      ContentConfig config, PathPartitioner partitioner, SlugAssembler assembler) {
    super(ContentRoots.of(ContentRoot.of(config.getPagesRoot())), partitioner, assembler);
  }

  @Override
  public ContentConvention convention() {
    return ContentConvention.PAGE;
  }
}
