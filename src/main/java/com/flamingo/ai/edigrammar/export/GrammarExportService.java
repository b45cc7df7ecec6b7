package com.flamingo.ai.edigrammar.export;

import com.flamingo.ai.edigrammar.exception.NoSegmentsFoundException;
import com.flamingo.ai.edigrammar.service.extraction.EdiGrammarExtractor;
import com.flamingo.ai.edigrammar.service.extraction.ExtractionResult;
import com.flamingo.ai.edigrammar.source.DocumentSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Extracts a document and writes its grammar next to the other exports. */
@Service
@RequiredArgsConstructor
@Slf4j
public class GrammarExportService {

  private final EdiGrammarExtractor extractor;
  private final GrammarJsonCodec codec;
  private final OutputPathResolver pathResolver;

  /**
   * Extracts {@code source} and writes the JSON export.
   *
   * @return the path written
   * @throws NoSegmentsFoundException if nothing was extracted; no file is written then
   * @throws UncheckedIOException if the export cannot be written
   */
  public Path export(DocumentSource source) {
    ExtractionResult result = extractor.extract(source);
    if (result.isEmpty()) {
      log.warn("No segments extracted from {}, nothing written", source.name());
      throw new NoSegmentsFoundException(source.name());
    }

    Path output = pathResolver.resolve(source.name());
    try {
      codec.write(result.segments(), output);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + output, e);
    }
    log.info("Export written: {}", output);
    return output;
  }
}
