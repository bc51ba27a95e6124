package com.flamingo.ai.chunker.service.chunking.continuation;

import com.flamingo.ai.chunker.service.chunking.ChunkFactory;
import com.flamingo.ai.chunker.service.chunking.ChunkValidator;
import com.flamingo.ai.chunker.service.chunking.PageChunkingResult;
import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import com.flamingo.ai.chunker.service.chunking.model.ChunkType;
import com.flamingo.ai.chunker.service.chunking.model.ChunkingOptions;
import com.flamingo.ai.chunker.service.chunking.model.PageDocument;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Joins the boundary chunks of consecutive pages when content runs on across the page break.
 *
 * <p>Boundaries are visited in page order. When the {@link ContinuationDetector} fires and both the
 * last chunk of page N and the first chunk of page N+1 are text, the two are replaced by one chunk
 * at the end of page N whose content is both contents joined by a blank line and whose breadcrumbs
 * are the deeper of the two paths. Tables, images and code are never merged.
 *
 * <p>A page whose only chunk was absorbed has no chunk left for the following boundary, which is
 * then left as is.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CrossPageMerger {

  static final String MERGE_SEPARATOR = "\n\n";

  private final ContinuationDetector continuationDetector;
  private final ChunkFactory chunkFactory;
  private final ChunkValidator chunkValidator;

  /**
   * Applies cross-page merging.
   *
   * @param pages per-page results, ordered by page number
   * @param options sizing of the current run
   * @return all chunks in page order with the merges applied
   */
  public MergeResult merge(List<PageChunkingResult> pages, ChunkingOptions options) {
    List<List<Chunk>> chunksByPage = new ArrayList<>();
    for (PageChunkingResult page : pages) {
      chunksByPage.add(new ArrayList<>(page.chunks()));
    }

    Map<ContinuationSignal, Integer> signalCounts = new EnumMap<>(ContinuationSignal.class);
    int merges = 0;

    for (int i = 0; i + 1 < pages.size(); i++) {
      PageDocument current = pages.get(i).page();
      PageDocument next = pages.get(i + 1).page();

      ContinuationAssessment assessment =
          continuationDetector.assess(current.text(), next.text());
      assessment.signals().forEach(signal -> signalCounts.merge(signal, 1, Integer::sum));
      if (!assessment.isContinuation()) {
        continue;
      }

      List<Chunk> currentChunks = chunksByPage.get(i);
      List<Chunk> nextChunks = chunksByPage.get(i + 1);
      if (currentChunks.isEmpty() || nextChunks.isEmpty()) {
        continue;
      }

      Chunk last = currentChunks.get(currentChunks.size() - 1);
      Chunk first = nextChunks.get(0);
      if (last.type() != ChunkType.TEXT || first.type() != ChunkType.TEXT) {
        log.debug(
            "Continuation between pages {} and {} not merged: {} / {} boundary",
            current.pageNumber(),
            next.pageNumber(),
            last.type().getValue(),
            first.type().getValue());
        continue;
      }

      List<String> breadcrumbs =
          first.metadata().breadcrumbs().size() > last.metadata().breadcrumbs().size()
              ? first.metadata().breadcrumbs()
              : last.metadata().breadcrumbs();
      Chunk merged =
          chunkFactory.createMerged(
              last.contentOnly() + MERGE_SEPARATOR + first.contentOnly(),
              breadcrumbs,
              current,
              next.pageNumber());
      if (!chunkValidator.isValid(merged, options)) {
        continue;
      }

      currentChunks.set(currentChunks.size() - 1, merged);
      nextChunks.remove(0);
      merges++;
      log.info(
          "Merged boundary chunks of pages {} and {} ({} chars)",
          current.pageNumber(),
          next.pageNumber(),
          merged.contentOnly().length());
    }

    List<Chunk> all = new ArrayList<>();
    chunksByPage.forEach(all::addAll);
    return new MergeResult(all, merges, signalCounts);
  }

  /**
   * Chunks of the whole document after merging.
   *
   * @param chunks chunks in page order
   * @param mergedBoundaries number of page boundaries whose chunks were merged
   * @param signalCounts how often each continuation signal fired
   */
  public record MergeResult(
      List<Chunk> chunks, int mergedBoundaries, Map<ContinuationSignal, Integer> signalCounts) {

    public MergeResult {
      chunks = List.copyOf(chunks);
      signalCounts = Map.copyOf(signalCounts);
    }

    /** Result for a run with merging disabled. */
    public static MergeResult unmerged(List<PageChunkingResult> pages) {
      List<Chunk> all = new ArrayList<>();
      pages.forEach(page -> all.addAll(page.chunks()));
      return new MergeResult(all, 0, Map.of());
    }
  }
}
