package com.flamingo.ai.edigrammar.source;

import java.util.List;

/** {@link DocumentSource} over pages that are already fully extracted. */
public class InMemoryDocumentSource implements DocumentSource {

  private final String name;
  private final List<SourcePage> pages;

  public InMemoryDocumentSource(String name, List<SourcePage> pages) {
    this.name = name;
    this.pages = List.copyOf(pages);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public int pageCount() {
    return pages.size();
  }

  @Override
  public String pageText(int pageIndex) {
    return pages.get(pageIndex).text();
  }

  @Override
  public List<List<List<String>>> pageTables(int pageIndex) {
    return pages.get(pageIndex).tables();
  }
}
