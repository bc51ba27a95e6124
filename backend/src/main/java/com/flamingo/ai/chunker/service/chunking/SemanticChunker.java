package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.chunking.detection.ProtectedRegionDetector;
import com.flamingo.ai.chunker.service.chunking.model.ChunkingOptions;
import com.flamingo.ai.chunker.service.chunking.model.PageDocument;
import com.flamingo.ai.chunker.service.chunking.model.ProtectedRegion;
import com.flamingo.ai.chunker.service.chunking.model.RegionKind;
import com.flamingo.ai.chunker.service.chunking.model.SemanticSection;
import com.flamingo.ai.chunker.service.chunking.parsing.ParagraphConsolidator;
import com.flamingo.ai.chunker.service.chunking.parsing.SemanticSectionParser;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link PageChunker} that keeps structure intact: protected regions are detected first, the page
 * is parsed into semantic sections around them, paragraphs are consolidated, and the sections are
 * packed into chunks between {@code min_size} and {@code max_size}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SemanticChunker implements PageChunker {

  private final ProtectedRegionDetector regionDetector;
  private final SemanticSectionParser sectionParser;
  private final ParagraphConsolidator paragraphConsolidator;
  private final ChunkFactory chunkFactory;
  private final ChunkValidator chunkValidator;

  @Override
  public PageChunkingResult chunkPage(PageDocument page, ChunkingOptions options) {
    String text = page.text() != null ? page.text() : "";

    List<ProtectedRegion> regions = regionDetector.detect(text);
    List<SemanticSection> sections = sectionParser.parse(text, regions);
    List<SemanticSection> consolidated = paragraphConsolidator.consolidate(sections);

    PageChunkCollector collector = new PageChunkCollector(chunkValidator, options);
    ChunkAccumulator accumulator = new ChunkAccumulator(page, options, chunkFactory, collector);
    consolidated.forEach(accumulator::accept);
    accumulator.finish();

    Map<RegionKind, Integer> protectedBlocks = new EnumMap<>(RegionKind.class);
    for (ProtectedRegion region : regions) {
      protectedBlocks.merge(region.kind(), 1, Integer::sum);
    }

    log.debug(
        "Page {}: {} regions, {} sections ({} consolidated), {} chunks",
        page.pageNumber(),
        regions.size(),
        sections.size(),
        consolidated.size(),
        collector.acceptedChunks().size());

    return new PageChunkingResult(
        page,
        collector.acceptedChunks(),
        collector.counters().getDuplicatesPrevented(),
        collector.counters().getValidationFailures(),
        protectedBlocks,
        false);
  }
}
