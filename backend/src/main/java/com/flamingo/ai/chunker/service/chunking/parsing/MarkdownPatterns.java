package com.flamingo.ai.chunker.service.chunking.parsing;

import java.util.regex.Pattern;

/** Line-level patterns of the markdown dialect produced by the extraction step. */
public final class MarkdownPatterns {

  /** ATX header; group 1 holds the marks, group 2 the title. */
  public static final Pattern HEADER = Pattern.compile("^ {0,3}(#{1,6})[ \\t]+(.+?)[ \\t]*$");

  /** Level-1 header titles that are page-number artifacts of the extractor, e.g. "Page 12". */
  public static final Pattern PAGE_ARTIFACT =
      Pattern.compile("(?i)^page\\s+\\d+(?:\\s+of\\s+\\d+)?$");

  /** Bullet ({@code -}, {@code *}, {@code +}) or numbered ({@code N.}) list item prefix. */
  public static final Pattern LIST_ITEM = Pattern.compile("^[ \\t]*(?:[-*+]|\\d+\\.)[ \\t]+");

  /** A line holding nothing but an HTML comment. */
  public static final Pattern HTML_COMMENT = Pattern.compile("^\\s*<!--.*-->\\s*$");

  private MarkdownPatterns() {}

  public static boolean isListItem(String content) {
    return LIST_ITEM.matcher(content).lookingAt();
  }
}
