package com.flamingo.blog.content.service.slug;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.blog.content.service.slug.model.Partition;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SlugAssembler Tests")
class SlugAssemblerTest {

  private final SlugAssembler assembler = new SlugAssembler();

  @Test
  @DisplayName("Should join prefix and slug parts with a slash")
  void shouldJoinPrefixAndSlugParts() {
    String slug =
        assembler.assemble(new Partition(List.of("a", "b"), List.of("some-text", "some-file")));

    assertThat(slug).isEqualTo("a/b/some-text-some-file");
  }

  @Test
  @DisplayName("Should return whichever group is non-empty")
  void shouldReturnNonEmptyGroup() {
    assertThat(assembler.assemble(new Partition(List.of("a", "b"), List.of()))).isEqualTo("a/b");
    assertThat(assembler.assemble(new Partition(List.of(), List.of("x", "y")))).isEqualTo("x-y");
    assertThat(assembler.assemble(new Partition(List.of(), List.of()))).isEmpty();
  }

  @Test
  @DisplayName("Should remove stray dashes left by empty parts")
  void shouldRemoveStrayDashes() {
    String slug = assembler.assemble(new Partition(List.of("a"), List.of("", "b", "", "c", "")));

    assertThat(slug).isEqualTo("a/b-c");
  }

  @Test
  @DisplayName("Should normalize dashes around slashes and at the ends")
  void shouldNormalizeDashes() {
    assertThat(assembler.normalize("--a---b--")).isEqualTo("a-b");
    assertThat(assembler.normalize("a-/-b")).isEqualTo("a/b");
    assertThat(assembler.normalize("a--/b")).isEqualTo("a/b");
    assertThat(assembler.normalize("-")).isEmpty();
    assertThat(assembler.normalize("")).isEmpty();
  }

  @Test
  @DisplayName("Should not leave a dangling slash when a group normalizes away")
  void shouldNotLeaveDanglingSlash() {
    assertThat(assembler.normalize("a/-")).isEqualTo("a");
    assertThat(assembler.normalize("-/a")).isEqualTo("a");
    assertThat(assembler.normalize("-/-")).isEmpty();
    assertThat(assembler.normalize("a/-/b")).isEqualTo("a/b");
    assertThat(assembler.normalize("/a//b/")).isEqualTo("a/b");
    assertThat(assembler.assemble(new Partition(List.of("deep-dives"), List.of("-"))))
        .isEqualTo("deep-dives");
  }

  @Test
  @DisplayName("Should never start or end with a separator or double one")
  void shouldProduceLegalSlugs() {
    for (String raw : List.of("a/-", "-/-", "/", "--/--", "a-/", "/-a-/", "x//-/y", "-a-b-/")) {
      assertThat(assembler.normalize(raw))
          .doesNotStartWith("/")
          .doesNotStartWith("-")
          .doesNotEndWith("/")
          .doesNotEndWith("-")
          .doesNotContain("//")
          .doesNotContain("--")
          .doesNotContain("-/")
          .doesNotContain("/-");
    }
  }

  @Test
  @DisplayName("Should be idempotent")
  void shouldBeIdempotent() {
    List<String> raws =
        List.of("--a---b--", "a-/-b", "x/-y-/z-", "-/-", "a/-", "deep-dives/some-text");
    for (String raw : raws) {
      String once = assembler.normalize(raw);

      assertThat(assembler.normalize(once)).isEqualTo(once);
    }
  }
}
