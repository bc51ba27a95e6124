package com.flamingo.ai.chunker.service.chunking.model;

/**
 * A contiguous span of page text that must end up whole in exactly one chunk.
 *
 * @param start offset of the first character (inclusive)
 * @param end offset after the last character (exclusive)
 * @param kind what the region contains
 * @param rawContent {@code text.substring(start, end)}
 */
public record ProtectedRegion(int start, int end, RegionKind kind, String rawContent) {

  public boolean overlaps(ProtectedRegion other) {
    return other.start < end && start < other.end;
  }
}
