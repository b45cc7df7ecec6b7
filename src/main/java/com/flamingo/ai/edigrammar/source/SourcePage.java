package com.flamingo.ai.edigrammar.source;

import java.util.List;

/**
 * One materialized page of a source document.
 *
 * @param text plain text of the page, empty when the page has no text layer
 * @param tables cell grids found on the page, in page order; each table is a list of rows and each
 *     row a list of cells (cells may be null)
 */
public record SourcePage(String text, List<List<List<String>>> tables) {

  public SourcePage {
    text = text == null ? "" : text;
    tables = tables == null ? List.of() : tables;
  }

  public static SourcePage textOnly(String text) {
    return new SourcePage(text, List.of());
  }
}
