package com.flamingo.ai.chunker.service.chunking.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Metadata attached to every {@link Chunk}.
 *
 * @param source page file the chunk came from
 * @param pageNumber page number of the source page (first page for merged chunks)
 * @param type content type
 * @param breadcrumbs header path of the chunk
 * @param hierarchicalContext breadcrumbs broken out by level
 * @param imagePath {@code figures/...png} reference found in the content, or {@code null}
 * @param sourceAttribution text of a {@code Source:} line found in the content, or {@code null}
 * @param hasCitations {@code true} when a source attribution was found
 * @param charCount length of {@link Chunk#contentOnly()}
 * @param qualityMetrics content features
 * @param mergedFromPages {@code [N, N+1]} for chunks merged across a page boundary, else {@code
 *     null}
 * @param isMerged whether the chunk was produced by the cross-page merger
 */
public record ChunkMetadata(
    String source,
    @JsonProperty("page_number") Integer pageNumber,
    ChunkType type,
    List<String> breadcrumbs,
    @JsonProperty("hierarchical_context") HierarchicalContext hierarchicalContext,
    @JsonProperty("image_path") String imagePath,
    @JsonProperty("source_attribution") String sourceAttribution,
    @JsonProperty("has_citations") boolean hasCitations,
    @JsonProperty("char_count") int charCount,
    @JsonProperty("quality_metrics") QualityMetrics qualityMetrics,
    @JsonProperty("merged_from_pages") List<Integer> mergedFromPages,
    @JsonProperty("is_merged") boolean isMerged) {}
