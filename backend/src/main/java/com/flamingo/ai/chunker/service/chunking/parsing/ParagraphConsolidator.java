package com.flamingo.ai.chunker.service.chunking.parsing;

import com.flamingo.ai.chunker.service.chunking.model.SectionKind;
import com.flamingo.ai.chunker.service.chunking.model.SemanticSection;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Joins runs of consecutive plain-text sections into single paragraph sections.
 *
 * <p>The parser emits every text line on its own; without this pass a one-sentence line could
 * become a chunk by itself. Text sections that look like list items are not paragraph text and
 * end the run, as do headers, list runs and protected blocks, which pass through unchanged.
 */
@Component
public class ParagraphConsolidator {

  static final String PARAGRAPH_SEPARATOR = "\n\n";

  public List<SemanticSection> consolidate(List<SemanticSection> sections) {
    List<SemanticSection> result = new ArrayList<>();
    List<SemanticSection> run = new ArrayList<>();

    for (SemanticSection section : sections) {
      if (isParagraph(section)) {
        run.add(section);
      } else {
        flushRun(run, result);
        result.add(section);
      }
    }
    flushRun(run, result);
    return result;
  }

  private boolean isParagraph(SemanticSection section) {
    return section.kind() == SectionKind.TEXT && !MarkdownPatterns.isListItem(section.content());
  }

  private void flushRun(List<SemanticSection> run, List<SemanticSection> result) {
    if (run.isEmpty()) {
      return;
    }
    if (run.size() == 1) {
      result.add(run.get(0));
    } else {
      SemanticSection first = run.get(0);
      String joined =
          run.stream()
              .map(SemanticSection::content)
              .collect(Collectors.joining(PARAGRAPH_SEPARATOR));
      result.add(
          new SemanticSection(
              SectionKind.TEXT,
              joined,
              first.breadcrumbs(),
              first.start(),
              run.get(run.size() - 1).end()));
    }
    run.clear();
  }
}
