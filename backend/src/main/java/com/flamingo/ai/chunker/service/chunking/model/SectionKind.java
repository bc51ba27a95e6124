package com.flamingo.ai.chunker.service.chunking.model;

/** Classification of a {@link SemanticSection}. */
public enum SectionKind {
  MAJOR_HEADER,
  MINOR_HEADER,
  TEXT,
  LIST,
  TABLE,
  IMAGE,
  CODE;

  public boolean isHeader() {
    return this == MAJOR_HEADER || this == MINOR_HEADER;
  }

  /** Chunk type for content of this kind; headers never become chunks. */
  public ChunkType toChunkType() {
    return switch (this) {
      case TABLE -> ChunkType.TABLE;
      case IMAGE -> ChunkType.IMAGE;
      case CODE -> ChunkType.CODE;
      default -> ChunkType.TEXT;
    };
  }
}
