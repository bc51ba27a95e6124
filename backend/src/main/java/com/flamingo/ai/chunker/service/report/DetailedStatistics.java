package com.flamingo.ai.chunker.service.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Statistics section of the chunking report. All members are {@code null} for a document without
 * chunks, which serializes as an empty object.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetailedStatistics(
    @JsonProperty("size_distribution") SizeDistribution sizeDistribution,
    @JsonProperty("type_distribution") Map<String, Integer> typeDistribution,
    @JsonProperty("chunks_per_page") Map<Integer, Integer> chunksPerPage,
    @JsonProperty("avg_chunks_per_page") Double avgChunksPerPage,
    @JsonProperty("content_analysis") ContentAnalysis contentAnalysis,
    @JsonProperty("processing_stats") ProcessingStats processingStats) {

  public static DetailedStatistics empty() {
    return new DetailedStatistics(null, null, null, null, null, null);
  }

  /** Distribution of {@code content_only} lengths in characters. */
  public record SizeDistribution(
      @JsonProperty("min") int min,
      @JsonProperty("max") int max,
      @JsonProperty("mean") double mean,
      @JsonProperty("median") int median,
      @JsonProperty("std_dev") double stdDev,
      @JsonProperty("percentile_25") int percentile25,
      @JsonProperty("percentile_75") int percentile75) {}

  /** Aggregated quality metrics over all chunks. */
  public record ContentAnalysis(
      @JsonProperty("total_words") int totalWords,
      @JsonProperty("total_sentences") int totalSentences,
      @JsonProperty("avg_words_per_chunk") double avgWordsPerChunk,
      @JsonProperty("chunks_with_numerical_data") int chunksWithNumericalData,
      @JsonProperty("chunks_with_dates") int chunksWithDates,
      @JsonProperty("chunks_with_entities") int chunksWithEntities,
      @JsonProperty("chunks_with_exhibits") int chunksWithExhibits,
      @JsonProperty("chunks_with_citations") int chunksWithCitations) {}

  /** Counters collected while the document was processed. */
  public record ProcessingStats(
      @JsonProperty("total_pages") int totalPages,
      @JsonProperty("total_chunks") int totalChunks,
      @JsonProperty("duplicates_prevented") int duplicatesPrevented,
      @JsonProperty("validation_failures") int validationFailures,
      @JsonProperty("merged_boundaries") int mergedBoundaries,
      @JsonProperty("protected_blocks") Map<String, Integer> protectedBlocks,
      @JsonProperty("continuation_signals") Map<String, Integer> continuationSignals,
      @JsonProperty("failed_pages") List<Integer> failedPages) {}
}
