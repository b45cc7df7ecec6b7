package com.flamingo.ai.edigrammar.service.extraction;

import com.flamingo.ai.edigrammar.source.DocumentSource;

/**
 * Interprets the pages of a document written in one {@link PdfConvention}.
 *
 * <p>Implementations are stateless; everything that carries over between tables and pages lives in
 * the {@link ParserContext}. Pages must be fed in document order.
 */
public interface TableParser {

  /** The convention this parser understands. */
  PdfConvention convention();

  /**
   * Parses one page into {@code context}.
   *
   * @param source the document
   * @param pageIndex 0-based page index
   * @param context accumulating state of the document
   */
  void parsePage(DocumentSource source, int pageIndex, ParserContext context);
}
