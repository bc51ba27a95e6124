package com.flamingo.ai.chunker.cli;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chunker.config.ChunkingConfig;
import com.flamingo.ai.chunker.service.chunking.model.ChunkingOptions;
import com.flamingo.ai.chunker.service.document.DocumentChunkingService;
import com.flamingo.ai.chunker.service.report.ChunkReportWriter;
import com.flamingo.ai.chunker.service.report.ChunkingReport;
import com.flamingo.ai.chunker.service.report.DetailedStatistics;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChunkingCommandLineRunner Tests")
class ChunkingCommandLineRunnerTest {

  @Mock private DocumentChunkingService documentChunkingService;
  @Mock private ChunkReportWriter reportWriter;

  @TempDir Path tempDir;

  private ChunkingCommandLineRunner runner;

  @BeforeEach
  void setUp() {
    runner =
        new ChunkingCommandLineRunner(documentChunkingService, reportWriter, new ChunkingConfig());
  }

  private static ChunkingReport report(ChunkingOptions options) {
    return new ChunkingReport("annual", 2, 0, options, DetailedStatistics.empty(), List.of());
  }

  @Test
  @DisplayName("should chunk with overrides and write to the default location")
  void shouldRunWithOverrides() {
    ChunkingOptions expected = ChunkingOptions.of(1000, 800, 2500, false);
    ChunkingReport report = report(expected);
    when(documentChunkingService.chunkDocument(tempDir, expected)).thenReturn(report);

    runner.run(
        new DefaultApplicationArguments(
            "--input-dir=" + tempDir, "--target-size=1000", "--no-merging"));

    verify(reportWriter)
        .write(report, tempDir.resolve("chunks").resolve("annual_semantic_chunks.json"));
  }

  @Test
  @DisplayName("should write to an explicit output path")
  void shouldHonorOutputOption() {
    ChunkingOptions defaults = new ChunkingConfig().toOptions();
    ChunkingReport report = report(defaults);
    when(documentChunkingService.chunkDocument(tempDir, defaults)).thenReturn(report);
    Path output = tempDir.resolve("out.json");

    runner.run(new DefaultApplicationArguments("--input-dir=" + tempDir, "--output=" + output));

    verify(reportWriter).write(report, output);
  }

  @Test
  @DisplayName("should do nothing without --input-dir")
  void shouldSkipWithoutInputDir() {
    runner.run(new DefaultApplicationArguments("--target-size=1000"));

    verifyNoInteractions(documentChunkingService, reportWriter);
  }

  @Test
  @DisplayName("should reject a non-numeric size")
  void shouldRejectNonNumericSize() {
    assertThatThrownBy(
            () ->
                runner.run(
                    new DefaultApplicationArguments(
                        "--input-dir=" + tempDir, "--min-size=small")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("--min-size");
    verifyNoInteractions(documentChunkingService);
  }

  @Test
  @DisplayName("should reject sizes out of order before chunking")
  void shouldRejectInconsistentSizes() {
    assertThatThrownBy(
            () ->
                runner.run(
                    new DefaultApplicationArguments(
                        "--input-dir=" + tempDir, "--max-size=100")))
        .isInstanceOf(IllegalArgumentException.class);
    verify(documentChunkingService, never()).chunkDocument(any(), any());
  }
}
