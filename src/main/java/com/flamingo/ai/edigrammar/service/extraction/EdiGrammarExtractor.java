package com.flamingo.ai.edigrammar.service.extraction;

import com.flamingo.ai.edigrammar.domain.model.SegmentCatalog;
import com.flamingo.ai.edigrammar.source.DocumentSource;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a {@link DocumentSource} into an ordered list of segments.
 *
 * <p>Pipeline: detect the convention, feed every page in order to the matching {@link
 * TableParser}, fill standard descriptions, compute statistics. Each call works on its own {@link
 * SegmentCatalog}, so one instance can serve several documents concurrently.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EdiGrammarExtractor {

  private final FormatDetector formatDetector;
  private final TableParserRouter parserRouter;
  private final StandardDescriptionEnricher enricher;
  private final StatisticsAggregator statisticsAggregator;
  private final MeterRegistry meterRegistry;

  /**
   * Extracts the segment grammar of {@code source}.
   *
   * @param source fully loaded document
   * @return segments sorted by mnemonic, with statistics; empty when nothing was recognised
   */
  @Timed(value = "edi.extraction", description = "Time to extract the grammar of one document")
  public ExtractionResult extract(DocumentSource source) {
    PdfConvention convention = formatDetector.detect(source);
    TableParser parser = parserRouter.route(convention);

    SegmentCatalog catalog = new SegmentCatalog();
    ParserContext context = new ParserContext(catalog);
    for (int page = 0; page < source.pageCount(); page++) {
      parser.parsePage(source, page, context);
    }
    log.info("Found {} segments in {}", catalog.size(), source.name());

    enricher.enrich(catalog);
    ExtractionStatistics statistics = statisticsAggregator.aggregate(catalog.segments());
    logStatistics(source.name(), statistics);

    meterRegistry.counter("edi_extractions_total", "convention", convention.tag()).increment();
    return new ExtractionResult(source.name(), convention, catalog.sortedSegments(), statistics);
  }

  private void logStatistics(String name, ExtractionStatistics stats) {
    log.info(
        "Statistics for {}: segments={}, simpleElements={}, groups={}, elementsInGroups={},"
            + " totalElements={}, withFormat={}, withValue={}, withUsage={}",
        name,
        stats.segments(),
        stats.simpleElements(),
        stats.groups(),
        stats.elementsInGroups(),
        stats.totalElements(),
        stats.elementsWithFormat(),
        stats.elementsWithValue(),
        stats.elementsWithUsage());
  }
}
