package com.flamingo.ai.edigrammar.exception;

/** Exception thrown when grammar JSON does not have the expected segment/champ/groupe shape. */
public class GrammarFormatException extends RuntimeException {

  public GrammarFormatException(String message) {
    super(message);
  }

  public GrammarFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
