package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.chunking.model.QualityMetrics;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Extracts content features from chunk text: quality metrics, figure references and source
 * attributions.
 */
@Component
public class ContentFeatureExtractor {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern SENTENCE = Pattern.compile("[^.!?]+[.!?]+");
  private static final Pattern NUMBER = Pattern.compile("\\b\\d+(?:[.,]\\d+)*%?");
  private static final Pattern DATE =
      Pattern.compile(
          "\\b(?:\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}"
              + "|\\d{4}-\\d{2}-\\d{2}"
              + "|(?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Sept|Oct|Nov|Dec)[a-z]*\\.?\\s+\\d{1,2}"
              + "(?:,\\s*\\d{4})?"
              + "|Q[1-4]\\s+(?:19|20)\\d{2}"
              + "|(?:FY|fiscal year)\\s*(?:19|20)?\\d{2})\\b");
  private static final Pattern NAMED_ENTITY =
      Pattern.compile("\\b[A-Z][a-z]+(?:\\s+(?:of\\s+|&\\s+)?[A-Z][a-z]+)+\\b");
  private static final Pattern EXHIBIT =
      Pattern.compile("(?i)\\b(?:exhibit|figure|fig\\.|table|chart|appendix|schedule)\\s*\\d+");
  private static final Pattern IMAGE_PATH = Pattern.compile("\\((figures/[^)]+\\.png)\\)");
  private static final Pattern SOURCE_ATTRIBUTION =
      Pattern.compile("(?im)^[ \\t>*_]*sources?[*_]*[ \\t]*:[*_]*[ \\t]*(.+)$");

  public QualityMetrics qualityMetrics(String content) {
    String trimmed = content.trim();
    int wordCount = trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;

    int sentenceCount = 0;
    Matcher sentences = SENTENCE.matcher(content);
    while (sentences.find()) {
      sentenceCount++;
    }
    sentenceCount = Math.max(sentenceCount, 1);

    double avgSentenceLength = Math.round(wordCount * 10.0 / sentenceCount) / 10.0;

    return new QualityMetrics(
        wordCount,
        sentenceCount,
        avgSentenceLength,
        NUMBER.matcher(content).find(),
        DATE.matcher(content).find(),
        NAMED_ENTITY.matcher(content).find(),
        EXHIBIT.matcher(content).find());
  }

  /** Returns the first {@code figures/*.png} link target in the content, or {@code null}. */
  public String imagePath(String content) {
    Matcher matcher = IMAGE_PATH.matcher(content);
    return matcher.find() ? matcher.group(1) : null;
  }

  /** Returns the text of the first {@code Source:} line, or {@code null}. */
  public String sourceAttribution(String content) {
    Matcher matcher = SOURCE_ATTRIBUTION.matcher(content);
    if (!matcher.find()) {
      return null;
    }
    String attribution = matcher.group(1).replaceAll("[*_]+$", "").trim();
    return attribution.isEmpty() ? null : attribution;
  }
}
