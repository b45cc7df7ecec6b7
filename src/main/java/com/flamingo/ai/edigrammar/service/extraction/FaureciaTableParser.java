package com.flamingo.ai.edigrammar.service.extraction;

import com.flamingo.ai.edigrammar.config.ExtractionProperties;
import com.flamingo.ai.edigrammar.domain.model.CompositeGroup;
import com.flamingo.ai.edigrammar.domain.model.DataElement;
import com.flamingo.ai.edigrammar.domain.model.Segment;
import com.flamingo.ai.edigrammar.source.DocumentSource;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link TableParser} for Faurecia-style guidelines.
 *
 * <p>Segment headers are rows of the table itself ({@code Segment: NAD ... Pos.: 0100 ... Name and
 * address}). Data rows are positional:
 *
 * <pre>
 *   col 0 code | col 1 description | col 4 format | col 6 value | col 7 usage
 * </pre>
 *
 * <p>The open segment does not carry over between tables: rows of a table that come before its
 * first segment header are dropped.
 */
@Component
@Slf4j
public class FaureciaTableParser implements TableParser {

  static final int CODE_COLUMN = 0;
  static final int DESCRIPTION_COLUMN = 1;
  static final int FORMAT_COLUMN = 4;
  static final int VALUE_COLUMN = 6;
  static final int USAGE_COLUMN = 7;

  private static final Pattern SEGMENT_HEADER = Pattern.compile("Segment:\\s*([A-Z]{3})");
  private static final Pattern HEADER_DESCRIPTION =
      Pattern.compile("Pos\\.:\\s*\\d+.*?([A-Z][\\w\\s/]+)$", Pattern.UNICODE_CHARACTER_CLASS);

  private final int minRows;
  private final UsageConsolidator usageConsolidator =
      new UsageConsolidator(
          USAGE_COLUMN,
          USAGE_COLUMN + 1,
          ContinuationRule.CODED_VALUE,
          row -> TableRows.cell(row, CODE_COLUMN));

  @Autowired
  public FaureciaTableParser(ExtractionProperties properties) {
    this(properties.getFaurecia().getMinRows());
  }

  public FaureciaTableParser(int minRows) {
    this.minRows = minRows;
  }

  @Override
  public PdfConvention convention() {
    return PdfConvention.FAURECIA;
  }

  @Override
  public void parsePage(DocumentSource source, int pageIndex, ParserContext context) {
    List<List<List<String>>> tables = source.pageTables(pageIndex);
    for (int t = 0; t < tables.size(); t++) {
      List<List<String>> table = tables.get(t);
      if (table == null || table.size() < minRows) {
        log.debug(
            "Skipping table {} on page {}: fewer than {} rows", t + 1, pageIndex + 1, minRows);
        continue;
      }
      parseTable(table, context);
    }
  }

  /** Parses a single table. The open segment and group are reset first. */
  void parseTable(List<List<String>> table, ParserContext context) {
    context.reset();
    List<List<String>> rows = cleanRows(table);

    int i = 0;
    while (i < rows.size()) {
      List<String> row = rows.get(i);
      if (row.isEmpty()) {
        i++;
        continue;
      }

      String rowText = String.join(" ", row);
      Matcher header = SEGMENT_HEADER.matcher(rowText);
      if (header.find()) {
        openSegment(header.group(1), rowText, context);
        i++;
        continue;
      }

      if (context.currentSegment().isEmpty()) {
        i++;
        continue;
      }

      String code = TableRows.cell(row, CODE_COLUMN);
      String description =
          DescriptionNormalizer.normalize(TableRows.cell(row, DESCRIPTION_COLUMN));

      if (TableRows.isGroupCode(code)) {
        context.openGroup(new CompositeGroup(code, description));
        i++;
      } else if (TableRows.isElementCode(code)) {
        ConsolidatedUsage usage = usageConsolidator.consolidate(rows, i);
        context.addElement(
            new DataElement(
                code,
                description,
                TableRows.collapseWhitespace(TableRows.cell(row, FORMAT_COLUMN)),
                TableRows.cell(row, VALUE_COLUMN),
                usage.text()));
        i = usage.nextIndex();
      } else {
        i++;
      }
    }
  }

  private void openSegment(String mnemonic, String rowText, ParserContext context) {
    if (!context.catalog().contains(mnemonic)) {
      Matcher description = HEADER_DESCRIPTION.matcher(rowText);
      String text = description.find() ? TableRows.trim(description.group(1)) : "";
      log.debug("New segment {} '{}'", mnemonic, text);
      context.catalog().getOrCreate(mnemonic, DescriptionNormalizer.normalize(text));
    }
    Segment segment = context.catalog().find(mnemonic).orElseThrow();
    context.openSegment(segment);
  }

  private static List<List<String>> cleanRows(List<List<String>> table) {
    return table.stream().map(TableRows::clean).toList();
  }
}
