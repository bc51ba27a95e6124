package com.flamingo.ai.chunker.service.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import com.flamingo.ai.chunker.service.chunking.model.ChunkingOptions;
import java.util.List;

/** Result of chunking one document, as written to {@code <document>_semantic_chunks.json}. */
@JsonPropertyOrder({
  "document",
  "total_pages",
  "total_chunks",
  "chunking_config",
  "detailed_statistics",
  "chunks"
})
public record ChunkingReport(
    @JsonProperty("document") String document,
    @JsonProperty("total_pages") int totalPages,
    @JsonProperty("total_chunks") int totalChunks,
    @JsonProperty("chunking_config") ChunkingOptions chunkingConfig,
    @JsonProperty("detailed_statistics") DetailedStatistics detailedStatistics,
    @JsonProperty("chunks") List<Chunk> chunks) {

  public ChunkingReport {
    chunks = List.copyOf(chunks);
  }
}
