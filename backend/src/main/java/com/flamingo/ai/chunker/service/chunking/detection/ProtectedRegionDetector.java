package com.flamingo.ai.chunker.service.chunking.detection;

import com.flamingo.ai.chunker.service.chunking.model.ProtectedRegion;
import com.flamingo.ai.chunker.service.chunking.model.RegionKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds the spans of a page that must never be split: tables, image/figure blocks and fenced code.
 *
 * <p>Each kind has its own pattern family. All matches are then merged so the returned regions are
 * sorted by start offset and mutually non-overlapping; a match nested inside another is absorbed
 * by the widest enclosing region.
 *
 * <p>Banner text from an extractor variant the patterns do not know simply stays unprotected and
 * is parsed as ordinary text.
 */
@Component
@Slf4j
public class ProtectedRegionDetector {

  /** Next major header, horizontal rule or end of text; never consumed. */
  private static final String BLOCK_BOUNDARY =
      "(?=\\n[ \\t]*#{1,2}[ \\t]|\\n[ \\t]*(?:-{3,}|\\*{3,}|_{3,})[ \\t]*$|\\z)";

  private static final int IMAGE_FLAGS = Pattern.MULTILINE | Pattern.DOTALL;

  private static final List<Pattern> IMAGE_PATTERNS =
      List.of(
          // extractor blocks fenced by ">$$$$$ ... $$$$$"
          Pattern.compile("^[ \\t]*>\\$\\$\\$\\$\\$.*?\\$\\$\\$\\$\\$", IMAGE_FLAGS),
          Pattern.compile(
              "^[ \\t]*>\\$\\$\\$\\$\\$[ \\t]*\\n\\s*\\*\\*Visual Element\\*\\*.*?\\$\\$\\$\\$\\$",
              IMAGE_FLAGS),
          Pattern.compile(
              "^[ \\t]*>\\$\\$\\$\\$\\$[ \\t]*\\n\\s*\\*\\*Table/Chart\\*\\*.*?\\$\\$\\$\\$\\$",
              IMAGE_FLAGS),
          // batch banner: "**Images on this page:**"
          Pattern.compile(
              "^[ \\t]*\\*\\*Images? on this page:?\\*\\*.*?" + BLOCK_BOUNDARY, IMAGE_FLAGS),
          // "**Image 3:** caption ... *AI description:* ..."
          Pattern.compile(
              "^[ \\t]*\\*\\*Image[ \\t]+\\d+:?\\*\\*.*?" + BLOCK_BOUNDARY, IMAGE_FLAGS),
          Pattern.compile(
              "^[ \\t]*\\*\\*Visual Content[^\\n]*?\\*\\*.*?" + BLOCK_BOUNDARY, IMAGE_FLAGS),
          Pattern.compile(
              "^[ \\t]*\\*\\*Complete Page Visual Analysis[^\\n]*?\\*\\*.*?" + BLOCK_BOUNDARY,
              IMAGE_FLAGS),
          // "> **Figure 2** ..."
          Pattern.compile(
              "^[ \\t]*>[ \\t]*\\*\\*Figure[ \\t]+\\d+.*?" + BLOCK_BOUNDARY, IMAGE_FLAGS));

  private static final String TABLE_ROW = "[ \\t]*\\|[^\\n]*\\|[ \\t]*";

  /** Rest of a caption/summary: stops before a blank line, a header or a sibling marker. */
  private static final String TAIL =
      "(?:[^\\n]|\\n(?![ \\t]*$|[ \\t]*#|[ \\t]*\\*{0,2}(?:Table|Image)[ \\t]+\\d+))*";

  private static final Pattern TABLE_PATTERN =
      Pattern.compile(
          "^"
              + TABLE_ROW
              + "\\n"
              + "[ \\t]*(?=[^\\n]*-)(?=[^\\n]*\\|)[-:| \\t]+"
              + "(?:\\n"
              + TABLE_ROW
              + ")+"
              + "(?:\\n(?:[ \\t]*\\n)?[ \\t]*\\*{0,2}Table[ \\t]+\\d+\\*{0,2}[ \\t]*:"
              + TAIL
              + ")?"
              + "(?:\\n(?:[ \\t]*\\n)?[ \\t]*\\*{0,2}Table[ \\t]+\\d+[ \\t]+Summary\\*{0,2}[ \\t]*:"
              + TAIL
              + ")?",
          Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);

  // reluctant so that two adjacent fences stay two regions
  private static final Pattern CODE_PATTERN = Pattern.compile("```.*?```", Pattern.DOTALL);

  /**
   * Detects all protected regions of a page.
   *
   * @param text raw page markdown
   * @return regions sorted by start offset, non-overlapping
   */
  public List<ProtectedRegion> detect(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }

    List<ProtectedRegion> matches = new ArrayList<>();
    for (Pattern pattern : IMAGE_PATTERNS) {
      collect(pattern, RegionKind.IMAGE, text, matches);
    }
    collect(TABLE_PATTERN, RegionKind.TABLE, text, matches);
    collect(CODE_PATTERN, RegionKind.CODE, text, matches);

    List<ProtectedRegion> merged = mergeOverlapping(matches, text);
    log.debug("Detected {} protected regions ({} raw matches)", merged.size(), matches.size());
    return merged;
  }

  /**
   * Merges overlapping or nested regions into the widest enclosing region.
   *
   * <p>Regions are ordered by start offset (widest first on equal starts). A region starting
   * before the end of the previously kept region is folded into it: the end is extended when it
   * reaches further and the raw content is re-sliced from {@code text}; a fully contained region
   * is dropped. The kept region keeps its own kind. Applying this to its own output is a no-op.
   *
   * @param regions regions in any order
   * @param text the page text the offsets refer to
   * @return sorted, non-overlapping regions
   */
  public List<ProtectedRegion> mergeOverlapping(List<ProtectedRegion> regions, String text) {
    List<ProtectedRegion> sorted = new ArrayList<>(regions);
    sorted.sort(
        Comparator.comparingInt(ProtectedRegion::start)
            .thenComparing(Comparator.comparingInt(ProtectedRegion::end).reversed()));

    List<ProtectedRegion> merged = new ArrayList<>();
    for (ProtectedRegion region : sorted) {
      if (merged.isEmpty()) {
        merged.add(region);
        continue;
      }
      int lastIndex = merged.size() - 1;
      ProtectedRegion previous = merged.get(lastIndex);
      if (region.overlaps(previous)) {
        if (region.end() > previous.end()) {
          merged.set(
              lastIndex,
              new ProtectedRegion(
                  previous.start(),
                  region.end(),
                  previous.kind(),
                  text.substring(previous.start(), region.end())));
        }
      } else {
        merged.add(region);
      }
    }
    return merged;
  }

  private void collect(
      Pattern pattern, RegionKind kind, String text, List<ProtectedRegion> matches) {
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      if (matcher.end() > matcher.start()) {
        matches.add(
            new ProtectedRegion(matcher.start(), matcher.end(), kind, matcher.group()));
      }
    }
  }
}
