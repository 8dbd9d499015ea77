package com.flamingo.blog.content.service.slug.strategy;

import com.flamingo.blog.content.service.slug.ContentRoots;
import com.flamingo.blog.content.service.slug.PathPartitioner;
import com.flamingo.blog.content.service.slug.SlugAssembler;
import com.flamingo.blog.content.service.slug.model.Partition;
import com.flamingo.blog.content.service.slug.model.RelativePath;

/**
 * Shared pipeline for conventions that partition on dates: locate the root, preprocess the
 * relative path, partition, assemble.
 */
public abstract class DateAwareSlugStrategy implements SlugStrategy {

  private final ContentRoots roots;
  private final PathPartitioner partitioner;
  private final SlugAssembler assembler;

  protected DateAwareSlugStrategy(
      ContentRoots roots, PathPartitioner partitioner, SlugAssembler assembler) {
    this.roots = roots;
    this.partitioner = partitioner;
    this.assembler = assembler;
  }

  @Override
  public ContentRoots roots() {
    return roots;
  }

  @Override
  public String slugFor(String filePath) {
    RelativePath relative = preprocess(roots.require(filePath).relative());
    Partition partition = partitioner.partition(relative, recognizesDates());
    return assembler.assemble(partition);
  }

  /** Hook for convention-specific trimming of the path before partitioning. */
  protected RelativePath preprocess(RelativePath relative) {
    return relative;
  }

  protected boolean recognizesDates() {
    return true;
  }
}
