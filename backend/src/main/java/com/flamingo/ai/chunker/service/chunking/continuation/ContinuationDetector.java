package com.flamingo.ai.chunker.service.chunking.continuation;

import com.google.common.annotations.VisibleForTesting;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether content runs on from one page into the next by looking at the last
 * {@value #BOUNDARY_WINDOW} characters of a page and the first {@value #BOUNDARY_WINDOW} of the
 * following one.
 *
 * <p>Signals are independent and combined with a logical OR:
 *
 * <ul>
 *   <li>the page ends with a conjunction or preposition ("... processing, and");
 *   <li>the page ends without terminal punctuation ({@code . ! ? :} or a {@code ---} rule);
 *   <li>the next page starts with a numbered item or a bullet;
 *   <li>the page ends in a pipe-table row and the next page starts with one;
 *   <li>the page ends with a header line.
 * </ul>
 */
@Component
@Slf4j
public class ContinuationDetector {

  @VisibleForTesting static final int BOUNDARY_WINDOW = 200;

  private static final List<String> CONTINUATION_WORDS =
      List.of(
          "and", "or", "but", "nor", "yet", "so", "the", "a", "an", "of", "to", "in", "for",
          "with", "on", "at", "by", "from", "as", "into", "that", "which", "including", "such");

  private static final Pattern CONJUNCTION_ENDING =
      Pattern.compile("(?i)\\b(?:" + String.join("|", CONTINUATION_WORDS) + ")$");

  private static final List<String> TERMINAL_PUNCTUATION = List.of(".", "!", "?", ":", "---");

  private static final Pattern NUMBERED_START = Pattern.compile("^\\d+\\.");
  private static final Pattern BULLET_START = Pattern.compile("^[-*+]");
  private static final Pattern TABLE_ROW_ENDING = Pattern.compile("\\|[^\\n]*\\|$");
  private static final Pattern TABLE_ROW_START = Pattern.compile("^\\|");
  private static final Pattern HEADER_ENDING =
      Pattern.compile("(?:^|\\n)[ \\t]*#{1,6}[ \\t]+[^\\n]+$");

  /**
   * Assesses the boundary between two consecutive pages.
   *
   * @param currentPageText full text of page N
   * @param nextPageText full text of page N+1
   * @return fired signals; none if either page is blank
   */
  public ContinuationAssessment assess(String currentPageText, String nextPageText) {
    if (currentPageText == null
        || nextPageText == null
        || currentPageText.isBlank()
        || nextPageText.isBlank()) {
      return ContinuationAssessment.none();
    }

    String tail =
        currentPageText
            .substring(Math.max(0, currentPageText.length() - BOUNDARY_WINDOW))
            .strip();
    String head =
        nextPageText.substring(0, Math.min(BOUNDARY_WINDOW, nextPageText.length())).strip();

    Set<ContinuationSignal> signals = EnumSet.noneOf(ContinuationSignal.class);
    if (CONJUNCTION_ENDING.matcher(tail).find()) {
      signals.add(ContinuationSignal.CONJUNCTION);
    }
    if (TERMINAL_PUNCTUATION.stream().noneMatch(tail::endsWith)) {
      signals.add(ContinuationSignal.NO_TERMINAL_PUNCTUATION);
    }
    if (NUMBERED_START.matcher(head).find()) {
      signals.add(ContinuationSignal.NUMBERED_LIST);
    }
    if (BULLET_START.matcher(head).find()) {
      signals.add(ContinuationSignal.BULLET_LIST);
    }
    if (TABLE_ROW_ENDING.matcher(tail).find() && TABLE_ROW_START.matcher(head).find()) {
      signals.add(ContinuationSignal.TABLE);
    }
    if (HEADER_ENDING.matcher(tail).find()) {
      signals.add(ContinuationSignal.HEADER);
    }

    if (signals.isEmpty()) {
      log.debug("No continuation detected");
    } else {
      log.debug("Continuation detected, signals: {}", signals);
    }
    return new ContinuationAssessment(signals);
  }
}
