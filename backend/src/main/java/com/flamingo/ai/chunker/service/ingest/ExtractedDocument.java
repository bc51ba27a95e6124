package com.flamingo.ai.chunker.service.ingest;

import com.flamingo.ai.chunker.service.chunking.model.PageDocument;
import java.util.List;

/**
 * A document as produced by the extraction step, pages in ascending page number order.
 *
 * @param name document name used in the report
 * @param pages the pages with their text loaded
 */
public record ExtractedDocument(String name, List<PageDocument> pages) {

  public ExtractedDocument {
    pages = List.copyOf(pages);
  }
}
