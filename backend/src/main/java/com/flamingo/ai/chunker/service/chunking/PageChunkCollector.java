package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import com.flamingo.ai.chunker.service.chunking.model.ChunkingOptions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Accepts chunk drafts of one page: validates each, then drops exact duplicates.
 *
 * <p>Duplicates are looked up by id among the last {@value #DEDUP_WINDOW} accepted chunks only.
 * Overlapping detector matches and repeated boilerplate produce duplicates next to each other;
 * identical content further apart is accepted twice.
 */
@Slf4j
public class PageChunkCollector {

  static final int DEDUP_WINDOW = 5;

  private final ChunkValidator validator;
  private final ChunkingOptions options;
  private final List<Chunk> accepted = new ArrayList<>();
  private final ProcessingCounters counters = new ProcessingCounters();

  public PageChunkCollector(ChunkValidator validator, ChunkingOptions options) {
    this.validator = validator;
    this.options = options;
  }

  /**
   * Offers a draft.
   *
   * @param chunk the draft
   * @return {@code true} if it was accepted
   */
  public boolean offer(Chunk chunk) {
    if (!validator.isValid(chunk, options)) {
      counters.recordValidationFailure();
      return false;
    }

    int from = Math.max(0, accepted.size() - DEDUP_WINDOW);
    for (Chunk existing : accepted.subList(from, accepted.size())) {
      if (existing.id().equals(chunk.id())) {
        log.debug("Duplicate detected: {}...", chunk.id().substring(0, 8));
        counters.recordDuplicate();
        return false;
      }
    }

    accepted.add(chunk);
    return true;
  }

  public List<Chunk> acceptedChunks() {
    return Collections.unmodifiableList(accepted);
  }

  public ProcessingCounters counters() {
    return counters;
  }
}
