package com.flamingo.ai.chunker.service.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits oversized text at sentence boundaries.
 *
 * <p>Sentences (split on whitespace following {@code .}, {@code !} or {@code ?}) are accumulated
 * into pieces; a piece is closed once the next sentence would push it past {@code targetSize} and
 * it already holds at least {@code minSize} characters. Sentences inside a piece are joined with a
 * single space. A single sentence longer than {@code targetSize} stays whole.
 */
final class SentenceSplitter {

  static final String SENTENCE_JOINER = " ";

  private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

  private SentenceSplitter() {}

  static List<String> split(String text, int targetSize, int minSize) {
    List<String> pieces = new ArrayList<>();
    List<String> current = new ArrayList<>();
    int currentLength = 0;

    for (String sentence : SENTENCE_BOUNDARY.split(text)) {
      if (currentLength + sentence.length() > targetSize && currentLength >= minSize) {
        pieces.add(String.join(SENTENCE_JOINER, current));
        current = new ArrayList<>();
        currentLength = 0;
      }
      current.add(sentence);
      currentLength += sentence.length();
    }

    if (!current.isEmpty()) {
      pieces.add(String.join(SENTENCE_JOINER, current));
    }
    return pieces;
  }
}
