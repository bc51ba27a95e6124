package com.flamingo.ai.chunker.service.chunking.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A finished chunk, the unit handed to embedding and retrieval.
 *
 * @param id SHA-256 hex digest of {@code text}
 * @param text content prefixed with {@code "Context: <breadcrumb path>\n\n"} when the chunk has
 *     breadcrumbs; this is what gets embedded
 * @param contentOnly raw content without the context prefix
 * @param metadata source, structure and quality information
 */
public record Chunk(
    String id,
    String text,
    @JsonProperty("content_only") String contentOnly,
    ChunkMetadata metadata) {

  @JsonIgnore
  public ChunkType type() {
    return metadata.type();
  }
}
