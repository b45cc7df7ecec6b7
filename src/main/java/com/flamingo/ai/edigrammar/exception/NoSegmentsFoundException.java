package com.flamingo.ai.edigrammar.exception;

/** Exception thrown when a document was read but no segment could be recognised in it. */
public class NoSegmentsFoundException extends RuntimeException {

  private final String documentName;

  public NoSegmentsFoundException(String documentName) {
    super("No segments found in " + documentName);
    this.documentName = documentName;
  }

  public String getDocumentName() {
    return documentName;
  }

  public String getUserMessage() {
    return "No EDI segments could be extracted from the document";
  }
}
