package com.flamingo.ai.chunker.service.chunking.continuation;

import com.fasterxml.jackson.annotation.JsonValue;

/** Heuristic hints that a page boundary cut content rather than ending it. */
public enum ContinuationSignal {
  CONJUNCTION("conjunction"),
  NO_TERMINAL_PUNCTUATION("no_punctuation"),
  NUMBERED_LIST("numbered_list"),
  BULLET_LIST("bullet_list"),
  TABLE("table"),
  HEADER("header");

  private final String value;

  ContinuationSignal(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
