package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import com.flamingo.ai.chunker.service.chunking.model.PageDocument;
import com.flamingo.ai.chunker.service.chunking.model.RegionKind;
import java.util.List;
import java.util.Map;

/**
 * Chunks of one page plus what happened while producing them.
 *
 * @param page the source page
 * @param chunks accepted chunks in document order
 * @param duplicatesPrevented drafts dropped as duplicates
 * @param validationFailures drafts dropped by validation
 * @param protectedBlocks protected regions detected on the page, per kind
 * @param failed {@code true} if chunking the page threw and it contributed no chunks
 */
public record PageChunkingResult(
    PageDocument page,
    List<Chunk> chunks,
    int duplicatesPrevented,
    int validationFailures,
    Map<RegionKind, Integer> protectedBlocks,
    boolean failed) {

  public PageChunkingResult {
    chunks = List.copyOf(chunks);
    protectedBlocks = Map.copyOf(protectedBlocks);
  }

  public static PageChunkingResult failed(PageDocument page) {
    return new PageChunkingResult(page, List.of(), 0, 0, Map.of(), true);
  }
}
