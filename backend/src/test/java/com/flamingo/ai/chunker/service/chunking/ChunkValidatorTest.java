package com.flamingo.ai.chunker.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import com.flamingo.ai.chunker.service.chunking.model.ChunkMetadata;
import com.flamingo.ai.chunker.service.chunking.model.ChunkType;
import com.flamingo.ai.chunker.service.chunking.model.ChunkingOptions;
import com.flamingo.ai.chunker.service.chunking.model.HierarchicalContext;
import com.flamingo.ai.chunker.service.chunking.model.PageDocument;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkValidator Tests")
class ChunkValidatorTest {

  private static final ChunkingOptions OPTIONS = ChunkingOptions.of(30, 10, 60, true);

  private final ChunkValidator validator = new ChunkValidator();
  private final ChunkFactory chunkFactory = new ChunkFactory(new ContentFeatureExtractor());

  private static ChunkMetadata metadata(String source, Integer pageNumber) {
    return new ChunkMetadata(
        source,
        pageNumber,
        ChunkType.TEXT,
        List.of(),
        new HierarchicalContext(List.of()),
        null,
        null,
        false,
        4,
        null,
        null,
        false);
  }

  @Test
  @DisplayName("should accept a chunk built by the factory")
  void shouldAcceptFactoryChunk() {
    Chunk chunk =
        chunkFactory.create(
            "Valid content.", List.of("H"), new PageDocument(1, "p.md", ""), ChunkType.TEXT);

    assertThat(validator.isValid(chunk, OPTIONS)).isTrue();
  }

  @Test
  @DisplayName("should reject chunks with missing required fields")
  void shouldRejectMissingFields() {
    assertThat(validator.isValid(null, OPTIONS)).isFalse();
    assertThat(validator.isValid(new Chunk(null, "t", "c", metadata("p.md", 1)), OPTIONS))
        .isFalse();
    assertThat(validator.isValid(new Chunk("id", "t", "c", null), OPTIONS)).isFalse();
  }

  @Test
  @DisplayName("should reject chunks with incomplete metadata")
  void shouldRejectIncompleteMetadata() {
    assertThat(validator.isValid(new Chunk("id", "t", "c", metadata(null, 1)), OPTIONS)).isFalse();
    assertThat(validator.isValid(new Chunk("id", "t", "c", metadata("p.md", null)), OPTIONS))
        .isFalse();
  }

  @Test
  @DisplayName("should reject blank content")
  void shouldRejectBlankContent() {
    assertThat(validator.isValid(new Chunk("id", " ", " \n ", metadata("p.md", 1)), OPTIONS))
        .isFalse();
  }

  @Test
  @DisplayName("should only warn about oversized content")
  void shouldAcceptOversizedContent() {
    String big = "x".repeat(200);

    assertThat(validator.isValid(new Chunk("id", big, big, metadata("p.md", 1)), OPTIONS))
        .isTrue();
  }
}
