package com.flamingo.ai.chunker.service.report;

import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import com.flamingo.ai.chunker.service.chunking.model.ChunkMetadata;
import com.flamingo.ai.chunker.service.chunking.model.QualityMetrics;
import com.flamingo.ai.chunker.service.report.DetailedStatistics.ContentAnalysis;
import com.flamingo.ai.chunker.service.report.DetailedStatistics.ProcessingStats;
import com.flamingo.ai.chunker.service.report.DetailedStatistics.SizeDistribution;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Computes the {@code detailed_statistics} section of a chunking report. */
@Component
@Slf4j
public class ChunkStatisticsCalculator {

  /**
   * Calculates statistics over the final chunk list of a document.
   *
   * @param chunks final chunks, after merging
   * @param processingStats counters collected during processing
   * @return the statistics, or {@link DetailedStatistics#empty()} when there are no chunks
   */
  public DetailedStatistics calculate(List<Chunk> chunks, ProcessingStats processingStats) {
    if (chunks.isEmpty()) {
      return DetailedStatistics.empty();
    }

    Map<String, Integer> types = new LinkedHashMap<>();
    Map<Integer, Integer> pages = new TreeMap<>();
    int totalWords = 0;
    int totalSentences = 0;
    int withNumbers = 0;
    int withDates = 0;
    int withEntities = 0;
    int withExhibits = 0;
    int withCitations = 0;

    for (Chunk chunk : chunks) {
      ChunkMetadata metadata = chunk.metadata();
      types.merge(metadata.type().getValue(), 1, Integer::sum);
      pages.merge(metadata.pageNumber(), 1, Integer::sum);

      QualityMetrics quality = metadata.qualityMetrics();
      if (quality != null) {
        totalWords += quality.wordCount();
        totalSentences += quality.sentenceCount();
        withNumbers += quality.hasNumericalData() ? 1 : 0;
        withDates += quality.hasDates() ? 1 : 0;
        withEntities += quality.hasNamedEntities() ? 1 : 0;
        withExhibits += quality.hasExhibits() ? 1 : 0;
      }
      if (metadata.hasCitations()) {
        withCitations++;
      }
    }

    ContentAnalysis contentAnalysis =
        new ContentAnalysis(
            totalWords,
            totalSentences,
            round((double) totalWords / chunks.size(), 1),
            withNumbers,
            withDates,
            withEntities,
            withExhibits,
            withCitations);

    log.debug("Statistics calculated for {} chunks", chunks.size());
    return new DetailedStatistics(
        sizeDistribution(chunks),
        types,
        pages,
        round((double) chunks.size() / pages.size(), 2),
        contentAnalysis,
        processingStats);
  }

  private SizeDistribution sizeDistribution(List<Chunk> chunks) {
    int[] sizes =
        chunks.stream().mapToInt(chunk -> chunk.contentOnly().length()).sorted().toArray();
    int n = sizes.length;

    double mean = 0;
    for (int size : sizes) {
      mean += size;
    }
    mean /= n;

    double variance = 0;
    for (int size : sizes) {
      variance += (size - mean) * (size - mean);
    }
    double stdDev = Math.sqrt(variance / n);

    return new SizeDistribution(
        sizes[0],
        sizes[n - 1],
        round(mean, 1),
        sizes[n / 2],
        round(stdDev, 1),
        sizes[n / 4],
        sizes[3 * n / 4]);
  }

  private static double round(double value, int decimals) {
    double scale = Math.pow(10, decimals);
    return Math.round(value * scale) / scale;
  }
}
