package com.flamingo.ai.edigrammar.exception;

/** Exception thrown when a source document cannot be opened or read. */
public class SourceUnreadableException extends RuntimeException {

  private final String documentName;
  private final String userMessage;

  public SourceUnreadableException(String documentName, String message) {
    super(message);
    this.documentName = documentName;
    this.userMessage = "Failed to read document";
  }

  public SourceUnreadableException(String documentName, String message, Throwable cause) {
    super(message, cause);
    this.documentName = documentName;
    this.userMessage = "Failed to read document";
  }

  public String getDocumentName() {
    return documentName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
