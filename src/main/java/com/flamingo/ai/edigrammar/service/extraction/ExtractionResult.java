package com.flamingo.ai.edigrammar.service.extraction;

import com.flamingo.ai.edigrammar.domain.model.Segment;
import java.util.List;

/**
 * Outcome of extracting one document.
 *
 * @param documentName name of the source document
 * @param convention detected convention
 * @param segments segments in ascending mnemonic order
 * @param statistics counts over {@code segments}
 */
public record ExtractionResult(
    String documentName,
    PdfConvention convention,
    List<Segment> segments,
    ExtractionStatistics statistics) {

  public boolean isEmpty() {
    return segments.isEmpty();
  }
}
