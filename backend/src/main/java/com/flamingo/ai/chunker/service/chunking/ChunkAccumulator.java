package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.chunking.model.ChunkType;
import com.flamingo.ai.chunker.service.chunking.model.ChunkingOptions;
import com.flamingo.ai.chunker.service.chunking.model.PageDocument;
import com.flamingo.ai.chunker.service.chunking.model.SemanticSection;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Greedily packs the consolidated sections of one page into size-bounded chunk drafts.
 *
 * <p>Rules per section:
 *
 * <ul>
 *   <li>protected block: flush the buffer, then emit the block as its own chunk, unsplit;
 *   <li>major header: flush when the buffer holds at least {@code minSize}; a shorter non-empty
 *       buffer keeps accumulating under the old breadcrumbs until it reaches {@code minSize}, then
 *       flushes under the old path and the header's path takes over;
 *   <li>minor header: switch breadcrumbs (or the pending path), no flush;
 *   <li>list run: flush a buffer of at least {@code minSize} first, then accumulate;
 *   <li>text: accumulate, flush at {@code targetSize}.
 * </ul>
 *
 * <p>A flushed buffer longer than {@code maxSize} is split at sentence boundaries. One instance
 * serves one page and is not thread-safe.
 */
@Slf4j
class ChunkAccumulator {

  static final String PIECE_SEPARATOR = "\n\n";

  private final PageDocument page;
  private final ChunkingOptions options;
  private final ChunkFactory chunkFactory;
  private final PageChunkCollector collector;

  private final StringBuilder buffer = new StringBuilder();
  private List<String> breadcrumbs = List.of();
  private List<String> pendingBreadcrumbs;

  ChunkAccumulator(
      PageDocument page,
      ChunkingOptions options,
      ChunkFactory chunkFactory,
      PageChunkCollector collector) {
    this.page = page;
    this.options = options;
    this.chunkFactory = chunkFactory;
    this.collector = collector;
  }

  void accept(SemanticSection section) {
    switch (section.kind()) {
      case TABLE, IMAGE, CODE -> {
        flush();
        emit(section.content(), section.breadcrumbs(), section.kind().toChunkType());
      }
      case MAJOR_HEADER -> onMajorHeader(section.breadcrumbs());
      case MINOR_HEADER -> {
        if (pendingBreadcrumbs != null) {
          pendingBreadcrumbs = section.breadcrumbs();
        } else {
          breadcrumbs = section.breadcrumbs();
        }
      }
      case LIST -> {
        if (buffer.length() >= options.minSize()) {
          flush();
        }
        append(section.content());
      }
      case TEXT -> append(section.content());
    }
  }

  /** Flushes whatever is left at the end of the page. */
  void finish() {
    flush();
  }

  private void onMajorHeader(List<String> headerBreadcrumbs) {
    if (buffer.length() == 0 || buffer.length() >= options.minSize()) {
      flush();
      breadcrumbs = headerBreadcrumbs;
      pendingBreadcrumbs = null;
    } else {
      log.debug(
          "Carrying {} chars past major header on page {} until min size",
          buffer.length(),
          page.pageNumber());
      pendingBreadcrumbs = headerBreadcrumbs;
    }
  }

  private void append(String content) {
    if (buffer.length() > 0) {
      buffer.append(PIECE_SEPARATOR);
    }
    buffer.append(content);

    if (buffer.length() >= options.targetSize()
        || (pendingBreadcrumbs != null && buffer.length() >= options.minSize())) {
      flush();
    }
  }

  private void flush() {
    String fullText = buffer.toString().strip();
    buffer.setLength(0);

    if (!fullText.isEmpty()) {
      log.debug("Flushing buffer: {} chars", fullText.length());
      if (fullText.length() <= options.maxSize()) {
        emit(fullText, breadcrumbs, ChunkType.TEXT);
      } else {
        List<String> pieces =
            SentenceSplitter.split(fullText, options.targetSize(), options.minSize());
        for (String piece : pieces) {
          emit(piece, breadcrumbs, ChunkType.TEXT);
        }
        log.debug("Split {} chars into {} sub-chunks", fullText.length(), pieces.size());
      }
    }

    if (pendingBreadcrumbs != null) {
      breadcrumbs = pendingBreadcrumbs;
      pendingBreadcrumbs = null;
    }
  }

  private void emit(String content, List<String> path, ChunkType type) {
    collector.offer(chunkFactory.create(content, path, page, type));
  }
}
