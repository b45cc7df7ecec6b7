package com.flamingo.ai.edigrammar.batch;

import com.flamingo.ai.edigrammar.config.ExtractionProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the batch extraction on startup when {@code extraction.batch.enabled=true}.
 *
 * <p>With {@code --file=<name>} only that file of the input directory is processed; otherwise every
 * PDF of the directory is.
 */
@Component
@ConditionalOnProperty(prefix = "extraction.batch", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class BatchExtractionRunner implements ApplicationRunner {

  static final String FILE_OPTION = "file";

  private final BatchExtractionService batchService;
  private final ExtractionProperties properties;

  @Override
  public void run(ApplicationArguments args) {
    Path inputDir = Path.of(properties.getInputDir());
    if (!Files.isDirectory(inputDir)) {
      log.error("Input directory {} not found, batch skipped", inputDir.toAbsolutePath());
      return;
    }

    List<String> requested = args.getOptionValues(FILE_OPTION);
    if (requested != null && !requested.isEmpty()) {
      Path file = inputDir.resolve(requested.get(0));
      if (!Files.isRegularFile(file)) {
        log.error("File not found: {}", file);
        return;
      }
      batchService.process(List.of(file));
      return;
    }
    batchService.processDirectory(inputDir);
  }
}
