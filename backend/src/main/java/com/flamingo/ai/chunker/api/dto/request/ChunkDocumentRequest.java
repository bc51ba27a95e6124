package com.flamingo.ai.chunker.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for chunking an extracted document directory. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkDocumentRequest {

  @NotBlank(message = "Input directory is required")
  private String inputDir;

  /** Optional overrides; configured defaults apply when null. */
  @Positive(message = "Target size must be positive")
  private Integer targetSize;

  @Positive(message = "Min size must be positive")
  private Integer minSize;

  @Positive(message = "Max size must be positive")
  private Integer maxSize;

  private Boolean enableMerging;
}
