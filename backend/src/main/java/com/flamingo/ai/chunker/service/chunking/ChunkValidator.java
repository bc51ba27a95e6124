package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import com.flamingo.ai.chunker.service.chunking.model.ChunkMetadata;
import com.flamingo.ai.chunker.service.chunking.model.ChunkingOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Structural gatekeeper applied to every chunk draft before it is accepted.
 *
 * <p>A draft fails when any of {@code id}, {@code text}, {@code content_only}, {@code metadata} or
 * the metadata's {@code source}, {@code page_number}, {@code type}, {@code breadcrumbs} is missing,
 * or when its content is blank. Failed drafts are discarded, never repaired. Oversized content
 * (more than 1.5 x {@code max_size}) only produces a warning since protected blocks cannot shrink.
 */
@Component
@Slf4j
public class ChunkValidator {

  static final double OVERSIZE_TOLERANCE = 1.5;

  /**
   * Validates one chunk draft.
   *
   * @param chunk the draft
   * @param options sizing of the current run
   * @return {@code true} if the draft may be accepted
   */
  public boolean isValid(Chunk chunk, ChunkingOptions options) {
    if (chunk == null
        || chunk.id() == null
        || chunk.text() == null
        || chunk.contentOnly() == null
        || chunk.metadata() == null) {
      log.error("Chunk missing required fields: {}", chunk != null ? chunk.id() : "unknown");
      return false;
    }

    ChunkMetadata metadata = chunk.metadata();
    if (metadata.source() == null
        || metadata.pageNumber() == null
        || metadata.type() == null
        || metadata.breadcrumbs() == null) {
      log.error("Chunk metadata incomplete: {}", chunk.id());
      return false;
    }

    if (chunk.contentOnly().isBlank()) {
      log.warn("Empty chunk content: {}", chunk.id());
      return false;
    }

    int contentLength = chunk.contentOnly().length();
    if (contentLength > options.maxSize() * OVERSIZE_TOLERANCE) {
      log.warn(
          "Chunk {} on page {} exceeds max size: {} chars ({})",
          chunk.id(),
          metadata.pageNumber(),
          contentLength,
          metadata.type().getValue());
    }
    return true;
  }
}
