package com.flamingo.blog.content;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.blog.content.domain.enums.ContentConvention;
import com.flamingo.blog.content.service.date.PublishedDateExtractor;
import com.flamingo.blog.content.service.link.InternalLinkRewriter;
import com.flamingo.blog.content.service.sitemap.SitemapFilterFactory;
import com.flamingo.blog.content.service.slug.SlugFixtures;
import com.flamingo.blog.content.service.slug.SlugService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Verifies the application context wires every content service from application.yml. */
@SpringBootTest
class ContentEngineApplicationTest {

  @Autowired private ApplicationContext applicationContext;
  @Autowired private SlugService slugService;
  @Autowired private MeterRegistry meterRegistry;

  @Test
  @DisplayName("All content service beans should be available")
  void contentServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(PublishedDateExtractor.class)).isNotNull();
    assertThat(applicationContext.getBean(InternalLinkRewriter.class)).isNotNull();
    assertThat(applicationContext.getBean(SitemapFilterFactory.class)).isNotNull();
  }

  @Test
  @DisplayName("Every convention should have a strategy")
  void everyConventionShouldHaveStrategy() {
    for (ContentConvention convention : ContentConvention.values()) {
      assertThat(slugService.strategyFor(convention).convention()).isEqualTo(convention);
    }
  }

  @Test
  @DisplayName("Timed slug resolution should be recorded")
  void timedSlugResolutionShouldBeRecorded() {
    String slug =
        slugService.resolve(
            ContentConvention.POST,
            SlugFixtures.content("posts/system-design-fundamentals/2025-04-01-caching.md"));

    assertThat(slug).isEqualTo("system-design-fundamentals/caching");
    assertThat(meterRegistry.find("content.slug.resolve").timer()).isNotNull();
  }

  @Test
  @DisplayName("Slug resolution with automatic convention selection should be timed")
  void autoSelectedResolutionShouldBeTimed() {
    long before = resolveTimerCount();

    String slug = slugService.resolve(SlugFixtures.content("posts/2023-08-10-some-slug.md"));

    assertThat(slug).isEqualTo("some-slug");
    assertThat(resolveTimerCount()).isEqualTo(before + 1);
  }

  private long resolveTimerCount() {
    return meterRegistry.find("content.slug.resolve").timers().stream()
        .mapToLong(Timer::count)
        .sum();
  }
}
