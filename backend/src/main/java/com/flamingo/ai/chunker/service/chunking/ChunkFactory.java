package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import com.flamingo.ai.chunker.service.chunking.model.ChunkMetadata;
import com.flamingo.ai.chunker.service.chunking.model.ChunkType;
import com.flamingo.ai.chunker.service.chunking.model.HierarchicalContext;
import com.flamingo.ai.chunker.service.chunking.model.PageDocument;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Builds {@link Chunk}s: context-prefixed text, content-hash id and metadata. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChunkFactory {

  private final ContentFeatureExtractor featureExtractor;

  /**
   * Creates a chunk for content found on one page.
   *
   * @param content raw chunk content
   * @param breadcrumbs header path the content belongs to
   * @param page page the content came from
   * @param type content type
   * @return the chunk draft, not yet validated
   */
  public Chunk create(String content, List<String> breadcrumbs, PageDocument page, ChunkType type) {
    return build(content, breadcrumbs, page, type, null);
  }

  /**
   * Creates the replacement for two text chunks joined across a page boundary.
   *
   * @param content joined content of both chunks
   * @param breadcrumbs the deeper of the two breadcrumb paths
   * @param page the earlier of the two pages
   * @param nextPageNumber page number of the later page
   * @return merged chunk carrying {@code merged_from_pages} and {@code is_merged}
   */
  public Chunk createMerged(
      String content, List<String> breadcrumbs, PageDocument page, int nextPageNumber) {
    return build(
        content,
        breadcrumbs,
        page,
        ChunkType.TEXT,
        List.of(page.pageNumber(), nextPageNumber));
  }

  /** Renders the text that gets embedded: content prefixed by its breadcrumb path, if any. */
  public static String renderText(String content, List<String> breadcrumbs) {
    if (breadcrumbs.isEmpty()) {
      return content;
    }
    return "Context: " + String.join(HierarchicalContext.PATH_SEPARATOR, breadcrumbs) + "\n\n"
        + content;
  }

  private Chunk build(
      String content,
      List<String> breadcrumbs,
      PageDocument page,
      ChunkType type,
      List<Integer> mergedFromPages) {
    List<String> path = List.copyOf(breadcrumbs);
    String text = renderText(content, path);
    String id = Hashing.sha256().hashString(text, StandardCharsets.UTF_8).toString();
    String sourceAttribution = featureExtractor.sourceAttribution(content);

    ChunkMetadata metadata =
        new ChunkMetadata(
            page.fileName(),
            page.pageNumber(),
            type,
            path,
            new HierarchicalContext(path),
            featureExtractor.imagePath(content),
            sourceAttribution,
            sourceAttribution != null,
            content.length(),
            featureExtractor.qualityMetrics(content),
            mergedFromPages,
            mergedFromPages != null);

    log.debug(
        "Created {} chunk {} ({} chars) on page {}",
        type.getValue(),
        id.substring(0, 8),
        content.length(),
        page.pageNumber());
    return new Chunk(id, text, content, metadata);
  }
}
