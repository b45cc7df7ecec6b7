package com.flamingo.ai.edigrammar.source;

import java.util.List;

/**
 * Page-level view of a document as produced by a PDF text/table extraction library.
 *
 * <p>Page indexes are 0-based. Parsers only read through this interface, so they work the same on a
 * real PDF and on hand-built grids.
 */
public interface DocumentSource {

  /** Name used in logs and output file naming (usually the file name). */
  String name();

  int pageCount();

  /**
   * Returns the plain text of a page.
   *
   * @param pageIndex 0-based page index
   * @return page text, empty (never null) when the page has none
   */
  String pageText(int pageIndex);

  /**
   * Returns the cell grids of a page.
   *
   * @param pageIndex 0-based page index
   * @return zero or more tables; cells may be null and must be read as empty strings
   */
  List<List<List<String>>> pageTables(int pageIndex);
}
