package com.flamingo.ai.edigrammar.service.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Cell access helpers shared by the table parsers. */
final class TableRows {

  static final Pattern ELEMENT_CODE = Pattern.compile("^\\d{4}$");
  static final Pattern GROUP_CODE = Pattern.compile("^[SC]\\d{3}$");

  // Unicode white space, so no-break spaces from PDF cells count too
  private static final Pattern EDGE_WHITESPACE =
      Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern WHITESPACE_RUN =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private TableRows() {}

  /** Returns the row with every cell trimmed and null cells replaced by {@code ""}. */
  static List<String> clean(List<String> row) {
    if (row == null) {
      return List.of();
    }
    List<String> cells = new ArrayList<>(row.size());
    for (String cell : row) {
      cells.add(cell == null ? "" : trim(cell));
    }
    return cells;
  }

  /** Returns the trimmed cell at {@code column}, or {@code ""} when the row is shorter. */
  static String cell(List<String> row, int column) {
    if (row == null || column >= row.size()) {
      return "";
    }
    String value = row.get(column);
    return value == null ? "" : trim(value);
  }

  static int width(List<String> row) {
    return row == null ? 0 : row.size();
  }

  static boolean isElementCode(String code) {
    return ELEMENT_CODE.matcher(code).matches();
  }

  static boolean isGroupCode(String code) {
    return GROUP_CODE.matcher(code).matches();
  }

  /** Removes leading and trailing white space, no-break spaces included. */
  static String trim(String text) {
    return EDGE_WHITESPACE.matcher(text).replaceAll("");
  }

  /** Collapses every whitespace run to a single space. */
  static String collapseWhitespace(String text) {
    return WHITESPACE_RUN.matcher(trim(text)).replaceAll(" ");
  }
}
