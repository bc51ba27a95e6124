package com.flamingo.ai.chunker.service.chunking.parsing;

import com.flamingo.ai.chunker.service.chunking.model.ProtectedRegion;
import com.flamingo.ai.chunker.service.chunking.model.SectionKind;
import com.flamingo.ai.chunker.service.chunking.model.SemanticSection;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Walks page text with a cursor and classifies it into {@link SemanticSection}s.
 *
 * <p>At every cursor position, in priority order:
 *
 * <ol>
 *   <li>a protected region starting exactly here is emitted whole and skipped over;
 *   <li>otherwise one line is read (never past the start of the next protected region); blank
 *       lines and HTML comment lines are dropped;
 *   <li>an ATX header updates the breadcrumb stack and is emitted as a major (H1/H2) or minor
 *       (H3-H6) header;
 *   <li>a list item is appended to the open list run;
 *   <li>any other line is emitted as a text section.
 * </ol>
 *
 * <p>A list run is emitted as one {@link SectionKind#LIST} section when anything else is
 * encountered or at end of input. Sections come out in document order.
 */
@Component
@Slf4j
public class SemanticSectionParser {

  /**
   * Parses one page.
   *
   * @param text raw page markdown
   * @param regions protected regions of {@code text}, sorted and non-overlapping
   * @return sections in document order
   */
  public List<SemanticSection> parse(String text, List<ProtectedRegion> regions) {
    ParseState state = new ParseState();
    int cursor = 0;
    int regionIndex = 0;

    while (cursor < text.length()) {
      ProtectedRegion nextRegion = regionIndex < regions.size() ? regions.get(regionIndex) : null;

      if (nextRegion != null && nextRegion.start() < cursor) {
        // can only happen with unmerged input; the region's text was already consumed
        log.warn("Skipping protected region at {} behind cursor {}", nextRegion.start(), cursor);
        regionIndex++;
        continue;
      }

      if (nextRegion != null && nextRegion.start() == cursor) {
        state.flushList();
        state.emit(
            nextRegion.kind().toSectionKind(),
            nextRegion.rawContent(),
            nextRegion.start(),
            nextRegion.end());
        cursor = nextRegion.end();
        regionIndex++;
        continue;
      }

      int lineEnd = text.indexOf('\n', cursor);
      if (lineEnd < 0) {
        lineEnd = text.length();
      }
      boolean cutAtRegion = nextRegion != null && nextRegion.start() < lineEnd;
      if (cutAtRegion) {
        lineEnd = nextRegion.start();
      }

      int lineStart = cursor;
      String line = text.substring(lineStart, lineEnd);
      cursor = !cutAtRegion && lineEnd < text.length() ? lineEnd + 1 : lineEnd;

      if (line.isBlank() || MarkdownPatterns.HTML_COMMENT.matcher(line).matches()) {
        continue;
      }

      Matcher header = MarkdownPatterns.HEADER.matcher(line);
      if (header.matches()) {
        state.flushList();
        state.header(header.group(1).length(), header.group(2).trim(), lineStart, lineEnd);
      } else if (MarkdownPatterns.isListItem(line)) {
        state.appendListLine(line, lineStart, cursor);
      } else {
        state.flushList();
        state.emit(SectionKind.TEXT, line, lineStart, lineEnd);
      }
    }

    state.flushList();
    log.debug("Parsed {} sections", state.sections.size());
    return state.sections;
  }

  /** Mutable state of one parse: emitted sections, breadcrumb stack and the open list run. */
  private static final class ParseState {

    private final List<SemanticSection> sections = new ArrayList<>();
    private List<String> breadcrumbs = List.of();
    private final StringBuilder listBuffer = new StringBuilder();
    private int listStart;
    private int listEnd;

    void emit(SectionKind kind, String content, int start, int end) {
      sections.add(new SemanticSection(kind, content, breadcrumbs, start, end));
    }

    void header(int level, String title, int start, int end) {
      if (level == 1 && MarkdownPatterns.PAGE_ARTIFACT.matcher(title).matches()) {
        return;
      }
      List<String> updated;
      if (level == 1) {
        updated = List.of(title);
      } else {
        List<String> kept =
            new ArrayList<>(breadcrumbs.subList(0, Math.min(level - 1, breadcrumbs.size())));
        kept.add(title);
        updated = List.copyOf(kept);
      }
      breadcrumbs = updated;
      emit(level <= 2 ? SectionKind.MAJOR_HEADER : SectionKind.MINOR_HEADER, title, start, end);
    }

    void appendListLine(String line, int start, int end) {
      if (listBuffer.length() == 0) {
        listStart = start;
      }
      listBuffer.append(line).append('\n');
      listEnd = end;
    }

    void flushList() {
      if (listBuffer.length() == 0) {
        return;
      }
      emit(SectionKind.LIST, listBuffer.toString(), listStart, listEnd);
      listBuffer.setLength(0);
    }
  }
}
