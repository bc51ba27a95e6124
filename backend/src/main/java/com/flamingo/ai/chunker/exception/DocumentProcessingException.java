package com.flamingo.ai.chunker.exception;

/**
 * Exception thrown when an extracted document cannot be chunked at all.
 *
 * <p>Raised for input-shape problems (missing {@code metadata.json}, missing page file, unreadable
 * manifest) and when the report cannot be written. It is fatal for the document it names and
 * nothing else; failures inside a single page never surface as this exception.
 */
public class DocumentProcessingException extends RuntimeException {

  private final String document;
  private final String userMessage;

  /** Input-shape problem; the message describes it well enough to show to the caller. */
  public DocumentProcessingException(String document, String message) {
    super(message);
    this.document = document;
    this.userMessage = message;
  }

  public DocumentProcessingException(String document, String message, Throwable cause) {
    super(message, cause);
    this.document = document;
    this.userMessage = message + " for document " + document;
  }

  public String getDocument() {
    return document;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
