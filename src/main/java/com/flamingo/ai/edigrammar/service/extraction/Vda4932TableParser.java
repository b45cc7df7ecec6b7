package com.flamingo.ai.edigrammar.service.extraction;

import com.flamingo.ai.edigrammar.config.ExtractionProperties;
import com.flamingo.ai.edigrammar.domain.model.CompositeGroup;
import com.flamingo.ai.edigrammar.domain.model.DataElement;
import com.flamingo.ai.edigrammar.domain.model.Segment;
import com.flamingo.ai.edigrammar.source.DocumentSource;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link TableParser} for VDA 4932 guidelines.
 *
 * <p>Segments are declared in the page text ({@code Segment: NAD Cons. No.: 14 Level: 1 Name and
 * address}); tables only hold elements and groups. Every table is attributed to the segment most
 * recently declared anywhere in the document, which may be on an earlier page. Pages without text
 * contribute nothing, not even their tables.
 *
 * <p>Data rows carry code and description in the first cell:
 *
 * <pre>
 *   col 0 "3035 Party qualifier" | col 1 format | col 2 value | col 3 usage
 * </pre>
 */
@Component
@Slf4j
public class Vda4932TableParser implements TableParser {

  static final int CODE_AND_DESCRIPTION_COLUMN = 0;
  static final int FORMAT_COLUMN = 1;
  static final int VALUE_COLUMN = 2;
  static final int USAGE_COLUMN = 3;

  private static final String NO_USAGE = "--";

  private static final Pattern SEGMENT_HEADER =
      Pattern.compile(
          "Segment:\\s+([A-Z]{3})\\s+Cons\\.\\s*No\\.:\\s*(\\d+)\\s+Level:\\s*(\\d+)\\s+(.*)");
  private static final Pattern CODE_AND_DESCRIPTION =
      Pattern.compile(
          "^([SC]?\\d{3,4})\\s+(.+)$", Pattern.DOTALL | Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern LEADING_CODE =
      Pattern.compile("^([SC]?\\d{3,4})(?:\\s|$)", Pattern.UNICODE_CHARACTER_CLASS);

  private final int minRows;
  private final UsageConsolidator usageConsolidator =
      new UsageConsolidator(
          USAGE_COLUMN,
          USAGE_COLUMN + 1,
          ContinuationRule.CODED_VALUE_OR_PHRASE,
          Vda4932TableParser::leadingCode);

  @Autowired
  public Vda4932TableParser(ExtractionProperties properties) {
    this(properties.getVda().getMinRows());
  }

  public Vda4932TableParser(int minRows) {
    this.minRows = minRows;
  }

  @Override
  public PdfConvention convention() {
    return PdfConvention.VDA4932;
  }

  @Override
  public void parsePage(DocumentSource source, int pageIndex, ParserContext context) {
    String text = source.pageText(pageIndex);
    if (text == null || text.isEmpty()) {
      log.debug("Page {} has no text, its tables are skipped", pageIndex + 1);
      return;
    }
    declareSegments(text, context);

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

  /** Creates a segment for every header found in {@code text} that is not yet known. */
  void declareSegments(String text, ParserContext context) {
    Matcher header = SEGMENT_HEADER.matcher(text);
    while (header.find()) {
      String mnemonic = header.group(1);
      if (!context.catalog().contains(mnemonic)) {
        String description = DescriptionNormalizer.normalize(header.group(4));
        log.debug(
            "New segment {} (cons. no. {}, level {}) '{}'",
            mnemonic,
            header.group(2),
            header.group(3),
            description);
        context.catalog().getOrCreate(mnemonic, description);
      }
    }
  }

  /** Parses a single table into the most recently declared segment. */
  void parseTable(List<List<String>> table, ParserContext context) {
    Optional<Segment> owner = context.catalog().lastCreated();
    if (owner.isEmpty()) {
      log.debug("Table before any segment declaration, skipped");
      return;
    }
    context.openSegment(owner.get());

    List<List<String>> rows = table.stream().map(TableRows::clean).toList();
    int i = 0;
    while (i < rows.size()) {
      List<String> row = rows.get(i);
      if (row.size() < 2) {
        i++;
        continue;
      }

      String first = TableRows.cell(row, CODE_AND_DESCRIPTION_COLUMN);
      if (isHeaderNoise(first)) {
        i++;
        continue;
      }
      Matcher entry = CODE_AND_DESCRIPTION.matcher(first);
      if (!entry.matches()) {
        i++;
        continue;
      }

      String code = entry.group(1);
      String description =
          DescriptionNormalizer.normalize(TableRows.collapseWhitespace(entry.group(2)));

      if (TableRows.isGroupCode(code)) {
        context.openGroup(new CompositeGroup(code, description));
        i++;
      } else if (TableRows.isElementCode(code)) {
        ConsolidatedUsage usage = consolidateUsage(rows, i);
        context.addElement(
            new DataElement(
                code,
                description,
                TableRows.cell(row, FORMAT_COLUMN),
                TableRows.cell(row, VALUE_COLUMN),
                usage.text()));
        i = usage.nextIndex();
      } else {
        i++;
      }
    }
  }

  private ConsolidatedUsage consolidateUsage(List<List<String>> rows, int index) {
    if (NO_USAGE.equals(TableRows.cell(rows.get(index), USAGE_COLUMN))) {
      return new ConsolidatedUsage("", index + 1);
    }
    return usageConsolidator.consolidate(rows, index);
  }

  private static boolean isHeaderNoise(String first) {
    return first.isEmpty() || first.startsWith("S.Format") || first.contains("Segment can/must");
  }

  /** Returns the code that starts the combined code/description cell, or {@code ""}. */
  static String leadingCode(List<String> row) {
    Matcher matcher = LEADING_CODE.matcher(TableRows.cell(row, CODE_AND_DESCRIPTION_COLUMN));
    return matcher.find() ? matcher.group(1) : "";
  }
}
