package com.flamingo.ai.chunker.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import com.flamingo.ai.chunker.service.chunking.model.ChunkType;
import com.flamingo.ai.chunker.service.chunking.model.PageDocument;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkFactory Tests")
class ChunkFactoryTest {

  private static final PageDocument PAGE = new PageDocument(3, "page_003.md", "");

  private final ChunkFactory factory = new ChunkFactory(new ContentFeatureExtractor());

  @Test
  @DisplayName("should prefix text with the breadcrumb path")
  void shouldPrefixTextWithContext() {
    Chunk chunk = factory.create("Body.", List.of("Report", "Risks"), PAGE, ChunkType.TEXT);

    assertThat(chunk.text()).isEqualTo("Context: Report > Risks\n\nBody.");
    assertThat(chunk.contentOnly()).isEqualTo("Body.");
    assertThat(chunk.metadata().hierarchicalContext().fullPath()).isEqualTo("Report > Risks");
    assertThat(chunk.metadata().hierarchicalContext().depth()).isEqualTo(2);
    assertThat(chunk.metadata().hierarchicalContext().levelEntries())
        .containsEntry("level_1", "Report")
        .containsEntry("level_2", "Risks");
  }

  @Test
  @DisplayName("should use bare content as text without breadcrumbs")
  void shouldUseBareContentWithoutBreadcrumbs() {
    Chunk chunk = factory.create("Body.", List.of(), PAGE, ChunkType.TEXT);

    assertThat(chunk.text()).isEqualTo("Body.");
  }

  @Test
  @DisplayName("should derive the id from the SHA-256 of the text")
  void shouldDeriveIdFromText() {
    Chunk chunk = factory.create("Body.", List.of("Report"), PAGE, ChunkType.TEXT);

    assertThat(chunk.id())
        .isEqualTo(Hashing.sha256().hashString(chunk.text(), StandardCharsets.UTF_8).toString())
        .hasSize(64);
    assertThat(factory.create("Body.", List.of("Report"), PAGE, ChunkType.TEXT).id())
        .isEqualTo(chunk.id());
  }

  @Test
  @DisplayName("should mark merged chunks with both page numbers")
  void shouldMarkMergedChunks() {
    Chunk chunk = factory.createMerged("Joined.", List.of(), PAGE, 4);

    assertThat(chunk.type()).isEqualTo(ChunkType.TEXT);
    assertThat(chunk.metadata().pageNumber()).isEqualTo(3);
    assertThat(chunk.metadata().source()).isEqualTo("page_003.md");
    assertThat(chunk.metadata().mergedFromPages()).containsExactly(3, 4);
    assertThat(chunk.metadata().isMerged()).isTrue();
  }

  @Test
  @DisplayName("should record citations when a source line is present")
  void shouldRecordCitations() {
    Chunk chunk =
        factory.create("Figures.\nSource: Annual report", List.of(), PAGE, ChunkType.TEXT);

    assertThat(chunk.metadata().sourceAttribution()).isEqualTo("Annual report");
    assertThat(chunk.metadata().hasCitations()).isTrue();
    assertThat(chunk.metadata().charCount()).isEqualTo(chunk.contentOnly().length());
  }
}
