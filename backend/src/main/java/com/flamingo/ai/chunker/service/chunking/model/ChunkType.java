package com.flamingo.ai.chunker.service.chunking.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Type of content carried by a {@link Chunk}. */
public enum ChunkType {
  TEXT("text"),
  TABLE("table"),
  IMAGE("image"),
  CODE("code");

  private final String value;

  ChunkType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
