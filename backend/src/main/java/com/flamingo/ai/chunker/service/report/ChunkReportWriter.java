package com.flamingo.ai.chunker.service.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.chunker.exception.DocumentProcessingException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Writes chunking reports as pretty-printed JSON. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChunkReportWriter {

  static final String OUTPUT_DIR = "chunks";
  static final String FILE_SUFFIX = "_semantic_chunks.json";

  private final ObjectMapper objectMapper;

  /** Default location of the report for a document read from {@code inputDir}. */
  public static Path defaultOutputPath(Path inputDir, String documentName) {
    return inputDir.resolve(OUTPUT_DIR).resolve(documentName + FILE_SUFFIX);
  }

  /**
   * Writes the report, creating parent directories as needed.
   *
   * @param report the report
   * @param outputPath target file, overwritten if present
   * @return the written path
   */
  public Path write(ChunkingReport report, Path outputPath) {
    try {
      Path parent = outputPath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), report);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          report.document(), "Failed to write chunks to " + outputPath, e);
    }
    log.info("Wrote {} chunks to {}", report.totalChunks(), outputPath);
    return outputPath;
  }
}
