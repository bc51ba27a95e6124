package com.flamingo.ai.chunker.service.chunking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable sizing parameters for one chunking run.
 *
 * @param targetSize buffer length that triggers a flush
 * @param minSize minimum buffer length before a semantic boundary may flush
 * @param maxSize largest text chunk before sentence splitting
 * @param enableMerging whether cross-page continuation merging runs
 */
public record ChunkingOptions(
    @JsonProperty("target_size") int targetSize,
    @JsonProperty("min_size") int minSize,
    @JsonProperty("max_size") int maxSize,
    @JsonProperty("merging_enabled") boolean enableMerging) {

  public ChunkingOptions {
    if (minSize <= 0 || targetSize <= 0 || maxSize <= 0) {
      throw new IllegalArgumentException("Chunk sizes must be positive");
    }
    if (minSize > targetSize || targetSize > maxSize) {
      throw new IllegalArgumentException(
          "Chunk sizes must satisfy min_size <= target_size <= max_size, got "
              + minSize
              + "/"
              + targetSize
              + "/"
              + maxSize);
    }
  }

  public static ChunkingOptions of(
      int targetSize, int minSize, int maxSize, boolean enableMerging) {
    return new ChunkingOptions(targetSize, minSize, maxSize, enableMerging);
  }

  /**
   * Returns a copy with any non-null override applied.
   *
   * @return new options; this instance is unchanged
   */
  public ChunkingOptions withOverrides(
      Integer targetSize, Integer minSize, Integer maxSize, Boolean enableMerging) {
    return new ChunkingOptions(
        targetSize != null ? targetSize : this.targetSize,
        minSize != null ? minSize : this.minSize,
        maxSize != null ? maxSize : this.maxSize,
        enableMerging != null ? enableMerging : this.enableMerging);
  }
}
