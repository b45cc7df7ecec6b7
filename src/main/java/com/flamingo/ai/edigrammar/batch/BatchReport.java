package com.flamingo.ai.edigrammar.batch;

import java.time.Duration;
import java.util.List;

/**
 * Summary of a batch run.
 *
 * @param outcomes one entry per processed document, in processing order
 * @param totalDuration wall-clock time of the whole batch
 */
public record BatchReport(List<DocumentOutcome> outcomes, Duration totalDuration) {

  public BatchReport {
    outcomes = List.copyOf(outcomes);
  }

  public int processedCount() {
    return outcomes.size();
  }

  public long successCount() {
    return outcomes.stream().filter(DocumentOutcome::isSuccess).count();
  }

  public long failedCount() {
    return processedCount() - successCount();
  }

  public List<DocumentOutcome> failures() {
    return outcomes.stream().filter(o -> !o.isSuccess()).toList();
  }

  /** Average time per document, zero for an empty batch. */
  public Duration averageDuration() {
    return outcomes.isEmpty() ? Duration.ZERO : totalDuration.dividedBy(outcomes.size());
  }
}
