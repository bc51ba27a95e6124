package com.flamingo.ai.chunker.service.chunking.model;

/**
 * One page of an extracted document with its markdown already loaded.
 *
 * @param pageNumber page number as declared by the extraction manifest
 * @param fileName name of the page file under {@code pages/}; used as the chunk source
 * @param text raw markdown of the page
 */
public record PageDocument(int pageNumber, String fileName, String text) {}
