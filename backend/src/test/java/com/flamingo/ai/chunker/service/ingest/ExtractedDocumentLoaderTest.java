package com.flamingo.ai.chunker.service.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.chunker.exception.DocumentProcessingException;
import com.flamingo.ai.chunker.service.chunking.model.PageDocument;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ExtractedDocumentLoader Tests")
class ExtractedDocumentLoaderTest {

  @TempDir Path tempDir;

  private ExtractedDocumentLoader loader;

  @BeforeEach
  void setUp() {
    loader = new ExtractedDocumentLoader(new ObjectMapper());
  }

  @Test
  @DisplayName("should load pages listed in the manifest")
  void shouldLoadPages() throws IOException {
    ExtractedDocumentFixture.write(tempDir, "annual_report", "# One\nFirst.", "Second.");

    ExtractedDocument document = loader.load(tempDir);

    assertThat(document.name()).isEqualTo("annual_report");
    assertThat(document.pages())
        .extracting(PageDocument::pageNumber, PageDocument::fileName, PageDocument::text)
        .containsExactly(
            tuple(1, "page_001.md", "# One\nFirst."),
            tuple(2, "page_002.md", "Second."));
  }

  @Test
  @DisplayName("should sort pages by number and accept the 'file' alias")
  void shouldSortPagesAndAcceptFileAlias() throws IOException {
    Path pages = Files.createDirectories(tempDir.resolve("pages"));
    Files.writeString(pages.resolve("b.md"), "page two");
    Files.writeString(pages.resolve("a.md"), "page one");
    Files.writeString(
        tempDir.resolve("metadata.json"),
        "{\"pages\":[{\"page_number\":2,\"file\":\"b.md\"},"
            + "{\"page_number\":1,\"file_name\":\"a.md\",\"width\":612}],\"extractor\":\"v2\"}");

    ExtractedDocument document = loader.load(tempDir);

    assertThat(document.pages())
        .extracting(PageDocument::text)
        .containsExactly("page one", "page two");
    assertThat(document.name()).isEqualTo(tempDir.getFileName().toString());
  }

  @Nested
  @DisplayName("Invalid input")
  class InvalidInput {

    @Test
    @DisplayName("should fail when the directory does not exist")
    void shouldFailForMissingDirectory() {
      assertThatThrownBy(() -> loader.load(tempDir.resolve("absent")))
          .isInstanceOf(DocumentProcessingException.class)
          .hasMessageContaining("Input directory not found");
    }

    @Test
    @DisplayName("should fail when metadata.json is missing")
    void shouldFailForMissingManifest() {
      assertThatThrownBy(() -> loader.load(tempDir))
          .isInstanceOf(DocumentProcessingException.class)
          .hasMessageContaining("metadata.json not found");
    }

    @Test
    @DisplayName("should fail when a listed page file is missing")
    void shouldFailForMissingPageFile() throws IOException {
      ExtractedDocumentFixture.write(tempDir, "doc", "only page");
      Files.delete(tempDir.resolve("pages").resolve("page_001.md"));

      assertThatThrownBy(() -> loader.load(tempDir))
          .isInstanceOf(DocumentProcessingException.class)
          .hasMessageContaining("page_001.md");
    }

    @Test
    @DisplayName("should fail for malformed JSON")
    void shouldFailForMalformedManifest() throws IOException {
      Files.writeString(tempDir.resolve("metadata.json"), "{ not json");

      assertThatThrownBy(() -> loader.load(tempDir))
          .isInstanceOf(DocumentProcessingException.class)
          .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("should fail for a manifest without pages")
    void shouldFailForManifestWithoutPages() throws IOException {
      Files.writeString(tempDir.resolve("metadata.json"), "{\"document\":\"doc\"}");

      assertThatThrownBy(() -> loader.load(tempDir))
          .isInstanceOf(DocumentProcessingException.class)
          .hasMessageContaining("does not list any pages");
    }

    @Test
    @DisplayName("should fail for duplicate page numbers")
    void shouldFailForDuplicatePageNumbers() throws IOException {
      Path pages = Files.createDirectories(tempDir.resolve("pages"));
      Files.writeString(pages.resolve("a.md"), "a");
      Files.writeString(
          tempDir.resolve("metadata.json"),
          "{\"pages\":[{\"page_number\":1,\"file_name\":\"a.md\"},"
              + "{\"page_number\":1,\"file_name\":\"a.md\"}]}");

      assertThatThrownBy(() -> loader.load(tempDir))
          .isInstanceOf(DocumentProcessingException.class)
          .hasMessageContaining("Duplicate page number");
    }
  }
}
