package com.flamingo.ai.chunker.service.chunking.model;

/** Kinds of content that must never be split across chunks. */
public enum RegionKind {
  TABLE,
  IMAGE,
  CODE;

  public SectionKind toSectionKind() {
    return switch (this) {
      case TABLE -> SectionKind.TABLE;
      case IMAGE -> SectionKind.IMAGE;
      case CODE -> SectionKind.CODE;
    };
  }
}
