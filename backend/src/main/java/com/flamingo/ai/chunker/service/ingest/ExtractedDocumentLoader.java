package com.flamingo.ai.chunker.service.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.chunker.exception.DocumentProcessingException;
import com.flamingo.ai.chunker.service.chunking.model.PageDocument;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Loads an extracted document directory: {@code metadata.json} listing the pages and a
 * {@code pages/} directory holding one Markdown file per page.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExtractedDocumentLoader {

  static final String MANIFEST_FILE = "metadata.json";
  static final String PAGES_DIR = "pages";

  private final ObjectMapper objectMapper;

  /**
   * Reads the manifest and every page it lists.
   *
   * @param inputDir extraction output directory
   * @return the document with pages sorted by page number
   * @throws DocumentProcessingException if the directory, manifest or a page file is missing or
   *     malformed
   */
  public ExtractedDocument load(Path inputDir) {
    String fallbackName = inputDir.getFileName() != null ? inputDir.getFileName().toString() : "";
    if (!Files.isDirectory(inputDir)) {
      throw new DocumentProcessingException(
          fallbackName, "Input directory not found: " + inputDir);
    }

    DocumentManifest manifest = readManifest(inputDir, fallbackName);
    String name =
        manifest.document() != null && !manifest.document().isBlank()
            ? manifest.document()
            : fallbackName;

    List<DocumentManifest.ManifestPage> entries = new ArrayList<>(manifest.pages());
    entries.sort(Comparator.comparing(DocumentManifest.ManifestPage::pageNumber));

    Set<Integer> seen = new HashSet<>();
    List<PageDocument> pages = new ArrayList<>(entries.size());
    for (DocumentManifest.ManifestPage entry : entries) {
      if (!seen.add(entry.pageNumber())) {
        throw new DocumentProcessingException(
            name, "Duplicate page number in " + MANIFEST_FILE + ": " + entry.pageNumber());
      }
      pages.add(readPage(inputDir, name, entry));
    }

    log.info("Loaded document '{}' with {} pages from {}", name, pages.size(), inputDir);
    return new ExtractedDocument(name, pages);
  }

  private DocumentManifest readManifest(Path inputDir, String documentName) {
    Path manifestPath = inputDir.resolve(MANIFEST_FILE);
    if (!Files.isRegularFile(manifestPath)) {
      throw new DocumentProcessingException(
          documentName, MANIFEST_FILE + " not found in " + inputDir);
    }

    DocumentManifest manifest;
    try {
      manifest = objectMapper.readValue(manifestPath.toFile(), DocumentManifest.class);
    } catch (IOException e) {
      throw new DocumentProcessingException(documentName, "Malformed " + MANIFEST_FILE, e);
    }

    if (manifest == null || manifest.pages() == null) {
      throw new DocumentProcessingException(
          documentName, MANIFEST_FILE + " does not list any pages");
    }
    for (DocumentManifest.ManifestPage entry : manifest.pages()) {
      if (entry == null || entry.pageNumber() == null || entry.fileName() == null) {
        throw new DocumentProcessingException(
            documentName, "Page entry without page_number or file_name in " + MANIFEST_FILE);
      }
    }
    return manifest;
  }

  private PageDocument readPage(
      Path inputDir, String documentName, DocumentManifest.ManifestPage entry) {
    Path pagePath = inputDir.resolve(PAGES_DIR).resolve(entry.fileName());
    if (!Files.isRegularFile(pagePath)) {
      throw new DocumentProcessingException(
          documentName, "Page file not found: " + PAGES_DIR + "/" + entry.fileName());
    }
    try {
      String text = Files.readString(pagePath, StandardCharsets.UTF_8);
      return new PageDocument(entry.pageNumber(), entry.fileName(), text);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          documentName, "Failed to read page file " + entry.fileName(), e);
    }
  }
}
