package com.flamingo.ai.chunker.service.document;

import com.flamingo.ai.chunker.service.chunking.PageChunker;
import com.flamingo.ai.chunker.service.chunking.PageChunkingResult;
import com.flamingo.ai.chunker.service.chunking.continuation.CrossPageMerger;
import com.flamingo.ai.chunker.service.chunking.continuation.CrossPageMerger.MergeResult;
import com.flamingo.ai.chunker.service.chunking.model.ChunkingOptions;
import com.flamingo.ai.chunker.service.chunking.model.PageDocument;
import com.flamingo.ai.chunker.service.chunking.model.RegionKind;
import com.flamingo.ai.chunker.service.ingest.ExtractedDocument;
import com.flamingo.ai.chunker.service.ingest.ExtractedDocumentLoader;
import com.flamingo.ai.chunker.service.report.ChunkStatisticsCalculator;
import com.flamingo.ai.chunker.service.report.ChunkingReport;
import com.flamingo.ai.chunker.service.report.DetailedStatistics;
import com.flamingo.ai.chunker.service.report.DetailedStatistics.ProcessingStats;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Orchestrates chunking of one extracted document: load, chunk pages in parallel, merge across page
 * boundaries, and compute statistics.
 *
 * <p>Pages are independent until merging, so they are chunked concurrently on the {@code
 * pageChunkingExecutor} and joined back in page order. A page that fails is logged, reported in
 * {@code failed_pages} and contributes no chunks; the rest of the document is still processed.
 */
@Service
@Slf4j
public class DocumentChunkingService {

  private final ExtractedDocumentLoader documentLoader;
  private final PageChunker pageChunker;
  private final CrossPageMerger crossPageMerger;
  private final ChunkStatisticsCalculator statisticsCalculator;
  private final MeterRegistry meterRegistry;
  private final Executor pageChunkingExecutor;

  public DocumentChunkingService(
      ExtractedDocumentLoader documentLoader,
      PageChunker pageChunker,
      CrossPageMerger crossPageMerger,
      ChunkStatisticsCalculator statisticsCalculator,
      MeterRegistry meterRegistry,
      @Qualifier("pageChunkingExecutor") Executor pageChunkingExecutor) {
    this.documentLoader = documentLoader;
    this.pageChunker = pageChunker;
    this.crossPageMerger = crossPageMerger;
    this.statisticsCalculator = statisticsCalculator;
    this.meterRegistry = meterRegistry;
    this.pageChunkingExecutor = pageChunkingExecutor;
  }

  /**
   * Chunks the document found in {@code inputDir}.
   *
   * @param inputDir directory holding {@code metadata.json} and {@code pages/}
   * @param options sizing and merging options for this run
   * @return the full report, chunks included
   * @throws com.flamingo.ai.chunker.exception.DocumentProcessingException if the input directory
   *     is not a valid extracted document
   */
  @Timed(value = "chunking.document", description = "Time to chunk one document")
  public ChunkingReport chunkDocument(Path inputDir, ChunkingOptions options) {
    ExtractedDocument document = documentLoader.load(inputDir);
    log.info(
        "Chunking document '{}' ({} pages) with target={}, min={}, max={}, merging={}",
        document.name(),
        document.pages().size(),
        options.targetSize(),
        options.minSize(),
        options.maxSize(),
        options.enableMerging());

    List<PageChunkingResult> pageResults = chunkPages(document.pages(), options);

    MergeResult merged =
        options.enableMerging()
            ? crossPageMerger.merge(pageResults, options)
            : MergeResult.unmerged(pageResults);

    ProcessingStats processingStats = processingStats(document, pageResults, merged);
    DetailedStatistics statistics =
        statisticsCalculator.calculate(merged.chunks(), processingStats);

    recordMetrics(processingStats);
    log.info(
        "Document '{}' chunked: {} chunks, {} merged boundaries, {} duplicates prevented, "
            + "{} failed pages",
        document.name(),
        merged.chunks().size(),
        merged.mergedBoundaries(),
        processingStats.duplicatesPrevented(),
        processingStats.failedPages().size());

    return new ChunkingReport(
        document.name(),
        document.pages().size(),
        merged.chunks().size(),
        options,
        statistics,
        merged.chunks());
  }

  private List<PageChunkingResult> chunkPages(List<PageDocument> pages, ChunkingOptions options) {
    List<CompletableFuture<PageChunkingResult>> futures = new ArrayList<>(pages.size());
    for (PageDocument page : pages) {
      futures.add(
          CompletableFuture.supplyAsync(
              () -> chunkPageSafely(page, options), pageChunkingExecutor));
    }
    return futures.stream().map(CompletableFuture::join).toList();
  }

  private PageChunkingResult chunkPageSafely(PageDocument page, ChunkingOptions options) {
    try {
      PageChunkingResult result = pageChunker.chunkPage(page, options);
      log.debug("Page {} produced {} chunks", page.pageNumber(), result.chunks().size());
      return result;
    } catch (RuntimeException e) {
      log.error(
          "Failed to chunk page {} ({}): {}",
          page.pageNumber(),
          page.fileName(),
          e.getMessage(),
          e);
      return PageChunkingResult.failed(page);
    }
  }

  private ProcessingStats processingStats(
      ExtractedDocument document, List<PageChunkingResult> pageResults, MergeResult merged) {
    int duplicates = 0;
    int validationFailures = 0;
    Map<RegionKind, Integer> protectedBlocks = new EnumMap<>(RegionKind.class);
    List<Integer> failedPages = new ArrayList<>();

    for (PageChunkingResult result : pageResults) {
      duplicates += result.duplicatesPrevented();
      validationFailures += result.validationFailures();
      result
          .protectedBlocks()
          .forEach((kind, count) -> protectedBlocks.merge(kind, count, Integer::sum));
      if (result.failed()) {
        failedPages.add(result.page().pageNumber());
      }
    }

    Map<String, Integer> protectedByKind = new LinkedHashMap<>();
    for (RegionKind kind : RegionKind.values()) {
      protectedByKind.put(
          kind.name().toLowerCase(Locale.ROOT), protectedBlocks.getOrDefault(kind, 0));
    }
    Map<String, Integer> signals = new LinkedHashMap<>();
    merged.signalCounts().entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .forEach(entry -> signals.put(entry.getKey().getValue(), entry.getValue()));

    return new ProcessingStats(
        document.pages().size(),
        merged.chunks().size(),
        duplicates,
        validationFailures,
        merged.mergedBoundaries(),
        protectedByKind,
        signals,
        failedPages);
  }

  private void recordMetrics(ProcessingStats stats) {
    meterRegistry.counter("chunking.chunks.created").increment(stats.totalChunks());
    meterRegistry.counter("chunking.duplicates.prevented").increment(stats.duplicatesPrevented());
    meterRegistry.counter("chunking.validation.failures").increment(stats.validationFailures());
    meterRegistry.counter("chunking.pages.merged").increment(stats.mergedBoundaries());
    meterRegistry.counter("chunking.pages.failed").increment(stats.failedPages().size());
  }
}
