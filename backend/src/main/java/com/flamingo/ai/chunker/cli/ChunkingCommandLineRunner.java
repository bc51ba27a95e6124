package com.flamingo.ai.chunker.cli;

import com.flamingo.ai.chunker.config.ChunkingConfig;
import com.flamingo.ai.chunker.service.chunking.model.ChunkingOptions;
import com.flamingo.ai.chunker.service.document.DocumentChunkingService;
import com.flamingo.ai.chunker.service.report.ChunkReportWriter;
import com.flamingo.ai.chunker.service.report.ChunkingReport;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs one chunking job from the command line.
 *
 * <pre>
 * java -jar semantic-chunker.jar --input-dir=extracted_docs [--target-size=1500]
 *     [--min-size=800] [--max-size=2500] [--no-merging] [--output=out.json]
 * </pre>
 *
 * <p>Does nothing when {@code --input-dir} is absent, so the same jar can serve HTTP. Failures
 * propagate and abort startup, which gives a non-zero exit code.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChunkingCommandLineRunner implements ApplicationRunner {

  static final String INPUT_DIR = "input-dir";
  static final String TARGET_SIZE = "target-size";
  static final String MIN_SIZE = "min-size";
  static final String MAX_SIZE = "max-size";
  static final String NO_MERGING = "no-merging";
  static final String OUTPUT = "output";

  private final DocumentChunkingService documentChunkingService;
  private final ChunkReportWriter reportWriter;
  private final ChunkingConfig chunkingConfig;

  @Override
  public void run(ApplicationArguments args) {
    String inputDirValue = singleValue(args, INPUT_DIR);
    if (inputDirValue == null) {
      log.debug("No --{} given, skipping command-line run", INPUT_DIR);
      return;
    }

    ChunkingOptions options =
        chunkingConfig
            .toOptions()
            .withOverrides(
                intValue(args, TARGET_SIZE),
                intValue(args, MIN_SIZE),
                intValue(args, MAX_SIZE),
                args.containsOption(NO_MERGING) ? Boolean.FALSE : null);

    Path inputDir = Path.of(inputDirValue);
    ChunkingReport report = documentChunkingService.chunkDocument(inputDir, options);

    String outputValue = singleValue(args, OUTPUT);
    Path outputPath =
        outputValue != null
            ? Path.of(outputValue)
            : ChunkReportWriter.defaultOutputPath(inputDir, report.document());
    reportWriter.write(report, outputPath);

    log.info(
        "Processing complete: document={}, pages={}, chunks={}, output={}",
        report.document(),
        report.totalPages(),
        report.totalChunks(),
        outputPath);
  }

  private static String singleValue(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return null;
    }
    String value = values.get(values.size() - 1);
    return value.isBlank() ? null : value;
  }

  private static Integer intValue(ApplicationArguments args, String name) {
    String value = singleValue(args, name);
    if (value == null) {
      return null;
    }
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("--" + name + " must be an integer, got: " + value, e);
    }
  }
}
