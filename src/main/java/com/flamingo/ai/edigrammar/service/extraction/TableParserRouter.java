package com.flamingo.ai.edigrammar.service.extraction;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Routes a detected {@link PdfConvention} to the {@link TableParser} that understands it.
 *
 * <p>Parsers are injected by Spring; {@link EdiGrammarExtractor} never references a concrete
 * parser.
 */
@Service
@RequiredArgsConstructor
public class TableParserRouter {

  private final List<TableParser> parsers;

  /**
   * Returns the parser for {@code convention}.
   *
   * @throws IllegalStateException if no parser is registered for it (should not happen)
   */
  public TableParser route(PdfConvention convention) {
    return parsers.stream()
        .filter(p -> p.convention() == convention)
        .findFirst()
        .orElseThrow(
            () -> new IllegalStateException("No TableParser found for convention: " + convention));
  }
}
