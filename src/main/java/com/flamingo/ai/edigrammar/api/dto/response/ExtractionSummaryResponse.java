package com.flamingo.ai.edigrammar.api.dto.response;

import com.flamingo.ai.edigrammar.service.extraction.ExtractionResult;
import com.flamingo.ai.edigrammar.service.extraction.ExtractionStatistics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO describing what was extracted from an uploaded guideline. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionSummaryResponse {
  private String documentName;
  private String convention;
  private int segments;
  private int simpleElements;
  private int groups;
  private int elementsInGroups;
  private int totalElements;
  private int elementsWithFormat;
  private int elementsWithValue;
  private int elementsWithUsage;

  public static ExtractionSummaryResponse fromResult(ExtractionResult result) {
    ExtractionStatistics stats = result.statistics();
    return ExtractionSummaryResponse.builder()
        .documentName(result.documentName())
        .convention(result.convention().tag())
        .segments(stats.segments())
        .simpleElements(stats.simpleElements())
        .groups(stats.groups())
        .elementsInGroups(stats.elementsInGroups())
        .totalElements(stats.totalElements())
        .elementsWithFormat(stats.elementsWithFormat())
        .elementsWithValue(stats.elementsWithValue())
        .elementsWithUsage(stats.elementsWithUsage())
        .build();
  }
}
