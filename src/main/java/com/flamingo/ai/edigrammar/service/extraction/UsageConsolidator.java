package com.flamingo.ai.edigrammar.service.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Folds multi-row usage text into a single value.
 *
 * <p>Guidelines often spread the coded values of one element over several table rows that carry
 * nothing but the usage column. Starting at an element row, this scans forward and collects every
 * follow-up row that
 *
 * <ul>
 *   <li>has at least {@code minColumns} cells,
 *   <li>does not start a new element or group, and
 *   <li>has a usage cell accepted by the {@link ContinuationRule}.
 * </ul>
 *
 * <p>The scan stops at the first row that fails any test. It is a pure function of its inputs; the
 * caller resumes its row loop at {@link ConsolidatedUsage#nextIndex()}.
 */
public final class UsageConsolidator {

  private final int usageColumn;
  private final int minColumns;
  private final ContinuationRule rule;
  private final Function<List<String>, String> entryCode;

  /**
   * @param usageColumn index of the usage cell
   * @param minColumns rows narrower than this end the scan
   * @param rule follow-up acceptance rule
   * @param entryCode returns the element/group code a row starts, or {@code ""} if none
   */
  public UsageConsolidator(
      int usageColumn,
      int minColumns,
      ContinuationRule rule,
      Function<List<String>, String> entryCode) {
    this.usageColumn = usageColumn;
    this.minColumns = minColumns;
    this.rule = rule;
    this.entryCode = entryCode;
  }

  /**
   * Consolidates the usage text of the element at {@code startIndex}.
   *
   * @param rows cleaned table rows
   * @param startIndex index of the element row
   * @return joined usage and the index of the next unconsumed row
   */
  public ConsolidatedUsage consolidate(List<List<String>> rows, int startIndex) {
    String first = TableRows.cell(rows.get(startIndex), usageColumn);
    if (first.isEmpty()) {
      return new ConsolidatedUsage("", startIndex + 1);
    }

    List<String> parts = new ArrayList<>();
    parts.add(first);
    int next = startIndex + 1;
    while (next < rows.size()) {
      List<String> row = rows.get(next);
      if (TableRows.width(row) == 0 || TableRows.width(row) < minColumns) {
        break;
      }
      String code = entryCode.apply(row);
      if (TableRows.isElementCode(code) || TableRows.isGroupCode(code)) {
        break;
      }
      String usage = TableRows.cell(row, usageColumn);
      if (!rule.continues(usage)) {
        break;
      }
      parts.add(usage);
      next++;
    }
    return new ConsolidatedUsage(String.join("\n", parts), next);
  }
}
