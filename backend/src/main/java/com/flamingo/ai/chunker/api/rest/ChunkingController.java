package com.flamingo.ai.chunker.api.rest;

import com.flamingo.ai.chunker.api.dto.request.ChunkDocumentRequest;
import com.flamingo.ai.chunker.config.ChunkingConfig;
import com.flamingo.ai.chunker.service.chunking.model.ChunkingOptions;
import com.flamingo.ai.chunker.service.document.DocumentChunkingService;
import com.flamingo.ai.chunker.service.report.ChunkingReport;
import jakarta.validation.Valid;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for chunking extracted documents. */
@RestController
@RequestMapping("/api/chunking")
@RequiredArgsConstructor
public class ChunkingController {

  private final DocumentChunkingService documentChunkingService;
  private final ChunkingConfig chunkingConfig;

  /** Chunks the document in the given directory and returns the full report. */
  @PostMapping
  public ResponseEntity<ChunkingReport> chunkDocument(
      @Valid @RequestBody ChunkDocumentRequest request) {
    ChunkingOptions options =
        chunkingConfig
            .toOptions()
            .withOverrides(
                request.getTargetSize(),
                request.getMinSize(),
                request.getMaxSize(),
                request.getEnableMerging());
    ChunkingReport report =
        documentChunkingService.chunkDocument(Path.of(request.getInputDir()), options);
    return ResponseEntity.ok(report);
  }
}
