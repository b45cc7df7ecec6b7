package com.flamingo.ai.edigrammar.service.extraction;

/**
 * Result of a usage lookahead.
 *
 * @param text usage lines joined with {@code '\n'}, empty when the element has no usage
 * @param nextIndex index of the first row not consumed by the element
 */
public record ConsolidatedUsage(String text, int nextIndex) {

  public int consumedRows(int startIndex) {
    return nextIndex - startIndex;
  }
}
