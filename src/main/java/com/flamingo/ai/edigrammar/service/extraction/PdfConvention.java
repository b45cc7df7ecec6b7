package com.flamingo.ai.edigrammar.service.extraction;

/** Publisher conventions a guideline PDF can follow. */
public enum PdfConvention {
  /** Linear tables; segment headers are table rows ({@code Segment: NAD ... Pos.: 010}). */
  FAURECIA("faurecia"),
  /** Sectioned layout; segment headers are page text ({@code Segment: NAD Cons. No.: 14}). */
  VDA4932("vda4932");

  private final String tag;

  PdfConvention(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }
}
