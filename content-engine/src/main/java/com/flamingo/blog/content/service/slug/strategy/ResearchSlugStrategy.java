package com.flamingo.blog.content.service.slug.strategy;

import com.flamingo.blog.content.config.ContentConfig;
import com.flamingo.blog.content.domain.enums.ContentConvention;
import com.flamingo.blog.content.service.slug.ContentRoot;
import com.flamingo.blog.content.service.slug.ContentRoots;
import com.flamingo.blog.content.service.slug.PathPartitioner;
import com.flamingo.blog.content.service.slug.SlugAssembler;
import org.springframework.stereotype.Component;

/**
 * In-research notes. Dates are not interpreted, so every path collapses into one hyphenated slug
 * with only a trailing index marker removed.
 */
@Component
public class ResearchSlugStrategy extends DateAwareSlugStrategy {

  public ResearchSlugStrategy(
      ContentConfig config, PathPartitioner partitioner, SlugAssembler assembler) {
    super(ContentRoots.of(ContentRoot.of(config.getResearchRoot())), partitioner, assembler);
  }

  @Override
  public ContentConvention convention() {
    return ContentConvention.IN_RESEARCH;
  }

  @Override
  protected boolean recognizesDates() {
    return false;
  }
}
