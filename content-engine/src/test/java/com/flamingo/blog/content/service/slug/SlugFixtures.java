package com.flamingo.blog.content.service.slug;

import com.flamingo.blog.content.config.ContentConfig;
import com.flamingo.blog.content.service.slug.strategy.ArticleSlugStrategy;
import com.flamingo.blog.content.service.slug.strategy.PageSlugStrategy;
import com.flamingo.blog.content.service.slug.strategy.PostSlugStrategy;
import com.flamingo.blog.content.service.slug.strategy.ResearchSlugStrategy;
import java.nio.file.Path;

/** Wires slug components against the default content layout below the working directory. */
public final class SlugFixtures {

  public static final Path CONTENT = ContentConfig.resolveRoot("./content");

  private SlugFixtures() {}

  /** Absolute path of a file below the content folder. */
  public static String content(String relative) {
    return CONTENT.resolve(relative).toString();
  }

  public static PathPartitioner partitioner() {
    return new PathPartitioner(new SegmentClassifier());
  }

  public static PostSlugStrategy posts(ContentConfig config) {
    return new PostSlugStrategy(config, partitioner(), new SlugAssembler());
  }

  public static PageSlugStrategy pages(ContentConfig config) {
    return new PageSlugStrategy(config, partitioner(), new SlugAssembler());
  }

  public static ResearchSlugStrategy research(ContentConfig config) {
    return new ResearchSlugStrategy(config, partitioner(), new SlugAssembler());
  }

  public static ArticleSlugStrategy articles(ContentConfig config) {
    return new ArticleSlugStrategy(config);
  }
}
