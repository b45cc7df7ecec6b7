package com.flamingo.ai.edigrammar.service.extraction;

/**
 * Counts over an extracted grammar.
 *
 * @param segments number of segments
 * @param simpleElements elements attached directly to a segment
 * @param groups composite groups
 * @param elementsInGroups elements nested in a group
 * @param elementsWithFormat elements (simple or nested) with a format
 * @param elementsWithValue elements (simple or nested) with a value
 * @param elementsWithUsage elements (simple or nested) with usage text
 */
public record ExtractionStatistics(
    int segments,
    int simpleElements,
    int groups,
    int elementsInGroups,
    int elementsWithFormat,
    int elementsWithValue,
    int elementsWithUsage) {

  /** Simple plus nested elements. */
  public int totalElements() {
    return simpleElements + elementsInGroups;
  }
}
