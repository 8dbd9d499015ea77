package com.flamingo.blog.content.service.slug;

import com.flamingo.blog.content.domain.enums.ContentConvention;
import com.flamingo.blog.content.exception.RootMismatchException;
import com.flamingo.blog.content.exception.SlugResolutionException;
import com.flamingo.blog.content.service.slug.model.RelativePath;
import com.flamingo.blog.content.service.slug.strategy.SlugStrategy;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point used by the content pipeline to turn file paths into slugs.
 *
 * <p>Callers either name the convention explicitly or let the service pick one from the file's
 * location, most specific root first: in-research, README articles, pages, posts.
 */
@Service
@Slf4j
public class SlugService {

  private static final List<ContentConvention> SELECTION_ORDER =
      List.of(
          ContentConvention.IN_RESEARCH,
          ContentConvention.ARTICLE,
          ContentConvention.PAGE,
          ContentConvention.POST);

  private final Map<ContentConvention, SlugStrategy> strategies;
  private final MeterRegistry meterRegistry;

  public SlugService(List<SlugStrategy> strategies, MeterRegistry meterRegistry) {
    this.strategies = new EnumMap<>(ContentConvention.class);
    for (SlugStrategy strategy : strategies) {
      SlugStrategy previous = this.strategies.put(strategy.convention(), strategy);
      if (previous != null) {
        throw new IllegalStateException(
            "Duplicate slug strategy for "
                + strategy.convention()
                + ": "
                + previous
                + ", "
                + strategy);
      }
    }
    this.meterRegistry = meterRegistry;
    log.info("SlugService initialized with conventions {}", this.strategies.keySet());
  }

  /**
   * Resolves the slug of a file under an explicit convention.
   *
   * @param convention naming convention to apply
   * @param filePath absolute path of the content file
   * @return the slug, possibly empty
   * @throws SlugResolutionException if the file does not fit the convention
   */
  @Timed(value = "content.slug.resolve", description = "Time to resolve a content slug")
  public String resolve(ContentConvention convention, String filePath) {
    Objects.requireNonNull(convention, "convention");
    Objects.requireNonNull(filePath, "filePath");
    SlugStrategy strategy = strategyFor(convention);
    try {
      String slug = strategy.slugFor(filePath);
      countResolution(convention, "success");
      log.debug("Resolved {} slug '{}' for {}", convention, slug, filePath);
      return slug;
    } catch (SlugResolutionException e) {
      countResolution(convention, "failure");
      throw e;
    }
  }

  /**
   * Resolves the slug of a file, choosing the convention from its location.
   *
   * @param filePath absolute path of the content file
   * @return the slug, possibly empty
   * @throws RootMismatchException if no convention root contains the file
   */
  @Timed(value = "content.slug.resolve", description = "Time to resolve a content slug")
  public String resolve(String filePath) {
    Objects.requireNonNull(filePath, "filePath");
    return resolve(conventionFor(filePath), filePath);
  }

  /**
   * Picks the convention responsible for a file.
   *
   * @param filePath absolute path of the content file
   * @return the convention
   * @throws RootMismatchException if no convention root contains the file
   */
  public ContentConvention conventionFor(String filePath) {
    Path file = ContentRoot.toAbsolute(filePath);
    String fileName =
        file.getFileName() == null
            ? ""
            : RelativePath.stripExtension(file.getFileName().toString());
    for (ContentConvention convention : SELECTION_ORDER) {
      SlugStrategy strategy = strategies.get(convention);
      if (strategy == null || !strategy.accepts(file)) {
        continue;
      }
      if (convention == ContentConvention.ARTICLE && !"README".equals(fileName)) {
        continue;
      }
      return convention;
    }
    List<Path> roots = new ArrayList<>();
    for (SlugStrategy strategy : strategies.values()) {
      strategy.roots().candidates().forEach(root -> roots.add(root.directory()));
    }
    throw new RootMismatchException(filePath, roots);
  }

  public SlugStrategy strategyFor(ContentConvention convention) {
    SlugStrategy strategy = strategies.get(convention);
    if (strategy == null) {
      throw new IllegalStateException("No slug strategy registered for " + convention);
    }
    return strategy;
  }

  private void countResolution(ContentConvention convention, String outcome) {
    meterRegistry
        .counter(
            "content.slug.resolutions",
            "convention",
            convention.name().toLowerCase(Locale.ROOT),
            "outcome",
            outcome)
        .increment();
  }
}
