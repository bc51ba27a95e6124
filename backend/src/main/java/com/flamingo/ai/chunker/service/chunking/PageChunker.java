package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.chunking.model.ChunkingOptions;
import com.flamingo.ai.chunker.service.chunking.model.PageDocument;

/**
 * Turns the markdown of a single page into validated, deduplicated chunks.
 *
 * <p>Implementations must be stateless and safe for concurrent use: pages of one document are
 * chunked in parallel.
 */
public interface PageChunker {

  /**
   * Chunks one page.
   *
   * @param page the page with its text loaded
   * @param options sizing of the current run
   * @return accepted chunks of the page in document order, with counters
   */
  PageChunkingResult chunkPage(PageDocument page, ChunkingOptions options);
}
