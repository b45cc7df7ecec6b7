package com.flamingo.ai.edigrammar.batch;

import com.flamingo.ai.edigrammar.exception.NoSegmentsFoundException;
import com.flamingo.ai.edigrammar.exception.SourceUnreadableException;
import com.flamingo.ai.edigrammar.export.GrammarExportService;
import com.flamingo.ai.edigrammar.source.DocumentSource;
import com.flamingo.ai.edigrammar.source.PdfDocumentSourceLoader;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts every guideline PDF of a directory.
 *
 * <p>Documents are processed one after another, each with its own extraction. A document that
 * cannot be read or yields no segment is recorded as FAILED and the batch moves on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchExtractionService {

  private final PdfDocumentSourceLoader sourceLoader;
  private final GrammarExportService exportService;
  private final MeterRegistry meterRegistry;

  /**
   * Processes every {@code *.pdf} file of {@code inputDir}, in file-name order.
   *
   * @throws UncheckedIOException if the directory cannot be listed
   */
  public BatchReport processDirectory(Path inputDir) {
    List<Path> files = listPdfFiles(inputDir);
    if (files.isEmpty()) {
      log.warn("No PDF found in {}", inputDir);
    } else {
      log.info("Batch extraction of {} PDF files from {}", files.size(), inputDir);
    }
    return process(files);
  }

  /** Processes the given files in order. */
  public BatchReport process(List<Path> files) {
    long start = System.nanoTime();
    List<DocumentOutcome> outcomes = new ArrayList<>();
    for (int i = 0; i < files.size(); i++) {
      Path file = files.get(i);
      log.info("[{}/{}] Processing {}", i + 1, files.size(), file.getFileName());
      outcomes.add(processFile(file));
    }
    BatchReport report = new BatchReport(outcomes, Duration.ofNanos(System.nanoTime() - start));
    logSummary(report);
    return report;
  }

  /** Extracts and exports one file, converting failures into a FAILED outcome. */
  public DocumentOutcome processFile(Path file) {
    String fileName = file.getFileName().toString();
    long start = System.nanoTime();
    DocumentOutcome outcome;
    try {
      DocumentSource source = sourceLoader.load(file);
      Path output = exportService.export(source);
      outcome = DocumentOutcome.success(fileName, output, elapsedSince(start));
    } catch (SourceUnreadableException e) {
      log.error("Unreadable document {}: {}", fileName, e.getMessage());
      outcome = DocumentOutcome.failure(fileName, e.getMessage(), elapsedSince(start));
    } catch (NoSegmentsFoundException e) {
      outcome = DocumentOutcome.failure(fileName, e.getMessage(), elapsedSince(start));
    } catch (RuntimeException e) {
      log.error("Extraction of {} failed: {}", fileName, e.getMessage(), e);
      outcome = DocumentOutcome.failure(fileName, e.getMessage(), elapsedSince(start));
    }
    String status = outcome.status().name().toLowerCase(Locale.ROOT);
    meterRegistry.counter("edi_batch_documents_total", "status", status).increment();
    return outcome;
  }

  // ---- private helpers ----

  private List<Path> listPdfFiles(Path inputDir) {
    try (Stream<Path> entries = Files.list(inputDir)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot list " + inputDir, e);
    }
  }

  private static Duration elapsedSince(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  private void logSummary(BatchReport report) {
    log.info(
        "Batch finished: processed={}, succeeded={}, failed={}, total={} ms, average={} ms/file",
        report.processedCount(),
        report.successCount(),
        report.failedCount(),
        report.totalDuration().toMillis(),
        report.averageDuration().toMillis());
    for (DocumentOutcome failure : report.failures()) {
      log.warn("  FAILED {}: {}", failure.fileName(), failure.error());
    }
    for (DocumentOutcome outcome : report.outcomes()) {
      if (outcome.isSuccess()) {
        log.info("  OK {} ({} ms)", outcome.fileName(), outcome.duration().toMillis());
      }
    }
  }
}
