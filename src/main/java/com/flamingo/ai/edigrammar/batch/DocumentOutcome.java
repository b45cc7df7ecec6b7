package com.flamingo.ai.edigrammar.batch;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Result of processing one document in a batch.
 *
 * @param fileName source file name
 * @param status SUCCESS or FAILED
 * @param output written export, null on failure
 * @param error failure reason, null on success
 * @param duration processing time
 */
public record DocumentOutcome(
    String fileName, Status status, Path output, String error, Duration duration) {

  public enum Status {
    SUCCESS,
    FAILED
  }

  public static DocumentOutcome success(String fileName, Path output, Duration duration) {
    return new DocumentOutcome(fileName, Status.SUCCESS, output, null, duration);
  }

  public static DocumentOutcome failure(String fileName, String error, Duration duration) {
    return new DocumentOutcome(fileName, Status.FAILED, null, error, duration);
  }

  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }
}
