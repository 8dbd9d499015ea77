package com.flamingo.blog.content.service.slug.strategy;

import static com.flamingo.blog.content.service.slug.SlugFixtures.content;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.blog.content.config.ContentConfig;
import com.flamingo.blog.content.exception.RootMismatchException;
import com.flamingo.blog.content.exception.UnexpectedFilenameException;
import com.flamingo.blog.content.service.slug.SlugFixtures;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ArticleSlugStrategy Tests")
class ArticleSlugStrategyTest {

  private final ArticleSlugStrategy strategy = SlugFixtures.articles(new ContentConfig());

  @Test
  @DisplayName("Should use the folder path of an article README")
  void shouldUseFolderPathOfArticleReadme() {
    String slug =
        strategy.slugFor(content("articles/system-design/caching/cache-aside/README.md"));

    assertThat(slug).isEqualTo("system-design/caching/cache-aside");
  }

  @Test
  @DisplayName("Should resolve category and topic READMEs")
  void shouldResolveCategoryAndTopicReadmes() {
    assertThat(strategy.slugFor(content("articles/system-design/README.md")))
        .isEqualTo("system-design");
    assertThat(strategy.slugFor(content("articles/system-design/caching/README.md")))
        .isEqualTo("system-design/caching");
  }

  @Test
  @DisplayName("Should try blogs and projects roots after articles")
  void shouldTryOtherRoots() {
    assertThat(strategy.slugFor(content("blogs/my-first-blog/README.md")))
        .isEqualTo("my-first-blog");
    assertThat(strategy.slugFor(content("projects/site-builder/README.md")))
        .isEqualTo("site-builder");
  }

  @Test
  @DisplayName("Should keep dated folders verbatim")
  void shouldKeepDatedFoldersVerbatim() {
    assertThat(strategy.slugFor(content("blogs/2024-03-01-launch/README.md")))
        .isEqualTo("2024-03-01-launch");
  }

  @Test
  @DisplayName("Should return empty slug for README directly in a root")
  void shouldReturnEmptySlugForRootReadme() {
    assertThat(strategy.slugFor(content("articles/README.md"))).isEmpty();
  }

  @Test
  @DisplayName("Should use the first matching root")
  void shouldUseFirstMatchingRoot() {
    ContentConfig config = new ContentConfig();
    config.setReadmeRoots(List.of("./content", "./content/articles"));
    ArticleSlugStrategy nested = SlugFixtures.articles(config);

    assertThat(nested.slugFor(content("articles/topic/README.md"))).isEqualTo("articles/topic");
  }

  @Test
  @DisplayName("Should reject files that are not README")
  void shouldRejectNonReadmeFiles() {
    assertThatThrownBy(() -> strategy.slugFor(content("articles/topic/notes.md")))
        .isInstanceOf(UnexpectedFilenameException.class)
        .hasMessageContaining("Expected README.md file");
  }

  @Test
  @DisplayName("Should match README case-sensitively")
  void shouldMatchReadmeCaseSensitively() {
    assertThatThrownBy(() -> strategy.slugFor(content("articles/topic/readme.md")))
        .isInstanceOf(UnexpectedFilenameException.class);
  }

  @Test
  @DisplayName("Should list every candidate root on mismatch")
  void shouldListEveryCandidateRootOnMismatch() {
    assertThatThrownBy(() -> strategy.slugFor(content("pages/about/README.md")))
        .isInstanceOfSatisfying(
            RootMismatchException.class,
            e -> {
              assertThat(e.getRoots()).hasSize(3);
              assertThat(e.getPath()).endsWith("pages/about/README.md");
            });
  }
}
