package com.flamingo.ai.chunker.service.chunking.model;

import java.util.List;

/**
 * One classified unit of page structure produced by the section parser.
 *
 * @param kind header, text, list run or protected block
 * @param content raw text of the unit; for headers, the header title
 * @param breadcrumbs header path active at this unit, e.g. {@code ["Report", "Chapter 2"]}
 * @param start offset in the page text where the unit begins
 * @param end offset in the page text where the unit ends (exclusive)
 */
public record SemanticSection(
    SectionKind kind, String content, List<String> breadcrumbs, int start, int end) {

  public SemanticSection {
    breadcrumbs = List.copyOf(breadcrumbs);
  }
}
