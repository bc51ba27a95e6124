package com.flamingo.ai.chunker.config;

import com.flamingo.ai.chunker.service.chunking.model.ChunkingOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Default chunk sizing for every chunking run.
 *
 * <p>Values are defaults only: each run resolves them, together with any per-request overrides,
 * into an immutable {@link ChunkingOptions}.
 */
@ConfigurationProperties(prefix = "chunking")
@Getter
@Setter
public class ChunkingConfig {

  /** Size (characters) at which the accumulation buffer is flushed. */
  private int targetSize = 1500;

  /** Smallest chunk the accumulator prefers to emit at a semantic boundary. */
  private int minSize = 800;

  /** Largest text chunk before sentence-level splitting kicks in. */
  private int maxSize = 2500;

  /** Whether boundary chunks of adjacent pages are merged on continuation signals. */
  private boolean enableMerging = true;

  /** Returns the configured defaults as options. */
  public ChunkingOptions toOptions() {
    return ChunkingOptions.of(targetSize, minSize, maxSize, enableMerging);
  }
}
