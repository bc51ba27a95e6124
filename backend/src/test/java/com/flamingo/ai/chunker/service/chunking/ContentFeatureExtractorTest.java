package com.flamingo.ai.chunker.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chunker.service.chunking.model.QualityMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ContentFeatureExtractor Tests")
class ContentFeatureExtractorTest {

  private final ContentFeatureExtractor extractor = new ContentFeatureExtractor();

  @Test
  @DisplayName("should count words and sentences")
  void shouldCountWordsAndSentences() {
    QualityMetrics metrics = extractor.qualityMetrics("The cat sat. The dog ran away!");

    assertThat(metrics.wordCount()).isEqualTo(7);
    assertThat(metrics.sentenceCount()).isEqualTo(2);
    assertThat(metrics.avgSentenceLength()).isEqualTo(3.5);
  }

  @Test
  @DisplayName("should count at least one sentence")
  void shouldCountAtLeastOneSentence() {
    QualityMetrics metrics = extractor.qualityMetrics("no terminal punctuation here");

    assertThat(metrics.sentenceCount()).isEqualTo(1);
    assertThat(metrics.avgSentenceLength()).isEqualTo(4.0);
  }

  @Test
  @DisplayName("should flag numbers, dates, entities and exhibits")
  void shouldFlagContentFeatures() {
    QualityMetrics metrics =
        extractor.qualityMetrics(
            "On March 5, 2024 the Federal Reserve raised rates by 0.25% as shown in Exhibit 3.");

    assertThat(metrics.hasNumericalData()).isTrue();
    assertThat(metrics.hasDates()).isTrue();
    assertThat(metrics.hasNamedEntities()).isTrue();
    assertThat(metrics.hasExhibits()).isTrue();
  }

  @Test
  @DisplayName("should not flag plain lowercase prose")
  void shouldNotFlagPlainProse() {
    QualityMetrics metrics = extractor.qualityMetrics("plain words without anything special.");

    assertThat(metrics.hasNumericalData()).isFalse();
    assertThat(metrics.hasDates()).isFalse();
    assertThat(metrics.hasNamedEntities()).isFalse();
    assertThat(metrics.hasExhibits()).isFalse();
  }

  @Test
  @DisplayName("should extract the first figure path")
  void shouldExtractImagePath() {
    String content = "![chart](figures/page_3_img_1.png) and ![x](figures/page_3_img_2.png)";

    assertThat(extractor.imagePath(content)).isEqualTo("figures/page_3_img_1.png");
    assertThat(extractor.imagePath("no figures")).isNull();
  }

  @Test
  @DisplayName("should extract a source attribution line")
  void shouldExtractSourceAttribution() {
    String content = "| a | b |\n|---|---|\n| 1 | 2 |\n*Source: Company filings, 2023*";

    assertThat(extractor.sourceAttribution(content)).isEqualTo("Company filings, 2023");
    assertThat(extractor.sourceAttribution("No attribution.")).isNull();
  }
}
