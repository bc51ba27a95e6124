package com.flamingo.ai.chunker.service.ingest;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Contents of {@code metadata.json} written by the extraction step. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentManifest(
    @JsonProperty("document") String document, @JsonProperty("pages") List<ManifestPage> pages) {

  /** One page entry; {@code file} is accepted for older extraction output. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ManifestPage(
      @JsonProperty("page_number") Integer pageNumber,
      @JsonProperty("file_name") @JsonAlias("file") String fileName) {}
}
