package com.flamingo.ai.chunker.service.chunking.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chunker.service.chunking.model.SectionKind;
import com.flamingo.ai.chunker.service.chunking.model.SemanticSection;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ParagraphConsolidator Tests")
class ParagraphConsolidatorTest {

  private final ParagraphConsolidator consolidator = new ParagraphConsolidator();

  private static SemanticSection section(SectionKind kind, String content) {
    return new SemanticSection(kind, content, List.of("H"), 0, content.length());
  }

  @Test
  @DisplayName("should join consecutive text sections with a blank line")
  void shouldJoinConsecutiveText() {
    List<SemanticSection> result =
        consolidator.consolidate(
            List.of(
                section(SectionKind.TEXT, "Para A."),
                section(SectionKind.TEXT, "Para B."),
                section(SectionKind.TEXT, "Para C.")));

    assertThat(result).hasSize(1);
    assertThat(result.get(0).kind()).isEqualTo(SectionKind.TEXT);
    assertThat(result.get(0).content()).isEqualTo("Para A.\n\nPara B.\n\nPara C.");
    assertThat(result.get(0).breadcrumbs()).containsExactly("H");
  }

  @Test
  @DisplayName("should end a run at any non-text section")
  void shouldEndRunAtOtherKinds() {
    List<SemanticSection> result =
        consolidator.consolidate(
            List.of(
                section(SectionKind.TEXT, "One."),
                section(SectionKind.TEXT, "Two."),
                section(SectionKind.TABLE, "| a |"),
                section(SectionKind.TEXT, "Three."),
                section(SectionKind.MINOR_HEADER, "Sub"),
                section(SectionKind.TEXT, "Four.")));

    assertThat(result)
        .extracting(SemanticSection::content)
        .containsExactly("One.\n\nTwo.", "| a |", "Three.", "Sub", "Four.");
  }

  @Test
  @DisplayName("should not absorb text that looks like a list item")
  void shouldNotAbsorbListLikeText() {
    List<SemanticSection> result =
        consolidator.consolidate(
            List.of(
                section(SectionKind.TEXT, "Intro."),
                section(SectionKind.TEXT, "- stray item"),
                section(SectionKind.TEXT, "Outro.")));

    assertThat(result)
        .extracting(SemanticSection::content)
        .containsExactly("Intro.", "- stray item", "Outro.");
  }

  @Test
  @DisplayName("should return an empty list for no sections")
  void shouldHandleEmptyInput() {
    assertThat(consolidator.consolidate(List.of())).isEmpty();
  }
}
