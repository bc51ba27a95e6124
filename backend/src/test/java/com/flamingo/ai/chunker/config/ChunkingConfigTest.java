package com.flamingo.ai.chunker.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chunker.service.chunking.model.ChunkingOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkingConfig Tests")
class ChunkingConfigTest {

  @Test
  @DisplayName("should default to 1500/800/2500 with merging enabled")
  void shouldHaveDefaults() {
    assertThat(new ChunkingConfig().toOptions())
        .isEqualTo(ChunkingOptions.of(1500, 800, 2500, true));
  }

  @Test
  @DisplayName("should reflect configured values")
  void shouldReflectConfiguredValues() {
    ChunkingConfig config = new ChunkingConfig();
    config.setTargetSize(1000);
    config.setMinSize(500);
    config.setMaxSize(1200);
    config.setEnableMerging(false);

    assertThat(config.toOptions()).isEqualTo(ChunkingOptions.of(1000, 500, 1200, false));
  }
}
