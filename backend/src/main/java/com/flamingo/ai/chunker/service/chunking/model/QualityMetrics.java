package com.flamingo.ai.chunker.service.chunking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Content features of a chunk, used for filtering and for the document statistics. */
public record QualityMetrics(
    @JsonProperty("word_count") int wordCount,
    @JsonProperty("sentence_count") int sentenceCount,
    @JsonProperty("avg_sentence_length") double avgSentenceLength,
    @JsonProperty("has_numerical_data") boolean hasNumericalData,
    @JsonProperty("has_dates") boolean hasDates,
    @JsonProperty("has_named_entities") boolean hasNamedEntities,
    @JsonProperty("has_exhibits") boolean hasExhibits) {}
