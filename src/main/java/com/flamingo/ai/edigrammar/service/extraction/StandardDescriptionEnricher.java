package com.flamingo.ai.edigrammar.service.extraction;

import com.flamingo.ai.edigrammar.domain.model.Segment;
import com.flamingo.ai.edigrammar.domain.model.SegmentCatalog;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fills missing segment descriptions with the standard EDIFACT segment name.
 *
 * <p>Every description is normalized first. A description that is then empty or a stray level
 * digit ({@code "0"}, {@code "1"}) is replaced when the mnemonic is a well-known one; otherwise it
 * is left as is.
 */
@Component
@Slf4j
public class StandardDescriptionEnricher {

  private static final Set<String> PLACEHOLDERS = Set.of("", "0", "1");

  static final Map<String, String> STANDARD_DESCRIPTIONS =
      Map.ofEntries(
          Map.entry("UNB", "Interchange header"),
          Map.entry("UNH", "Message header"),
          Map.entry("BGM", "Beginning of message"),
          Map.entry("DTM", "Date/time/period"),
          Map.entry("RFF", "Reference"),
          Map.entry("NAD", "Name and address"),
          Map.entry("CTA", "Contact information"),
          Map.entry("COM", "Communication contact"),
          Map.entry("TAX", "Duty/tax/fee details"),
          Map.entry("CUX", "Currencies"),
          Map.entry("PAT", "Payment terms basis"),
          Map.entry("PCD", "Percentage details"),
          Map.entry("MOA", "Monetary amount"),
          Map.entry("LIN", "Line item"),
          Map.entry("PIA", "Additional product id"),
          Map.entry("IMD", "Item description"),
          Map.entry("QTY", "Quantity"),
          Map.entry("ALI", "Additional information"),
          Map.entry("GIN", "Goods identity number"),
          Map.entry("GIR", "Related identification numbers"),
          Map.entry("QVR", "Quantity variances"),
          Map.entry("DOC", "Document/message details"),
          Map.entry("PRI", "Price details"),
          Map.entry("APR", "Additional price information"),
          Map.entry("RNG", "Range details"),
          Map.entry("LOC", "Place/location identification"),
          Map.entry("TOD", "Terms of delivery or transport"),
          Map.entry("PAC", "Package"),
          Map.entry("PCI", "Package identification"),
          Map.entry("ALC", "Allowance or charge"),
          Map.entry("RCS", "Requirements and conditions"),
          Map.entry("UNS", "Section control"),
          Map.entry("CNT", "Control total"),
          Map.entry("UNT", "Message trailer"),
          Map.entry("UNZ", "Interchange trailer"),
          Map.entry("FTX", "Free text"),
          Map.entry("FII", "Financial institution information"),
          Map.entry("MEA", "Measurements"),
          Map.entry("PAI", "Payment instructions"));

  /** Normalizes and, where needed, fills the description of every segment in {@code catalog}. */
  public void enrich(SegmentCatalog catalog) {
    int filled = 0;
    for (Segment segment : catalog.segments()) {
      String description = DescriptionNormalizer.normalize(segment.getDescription());
      if (PLACEHOLDERS.contains(description)) {
        Optional<String> standard = standardDescription(segment.getMnemonic());
        if (standard.isPresent()) {
          description = standard.get();
          filled++;
        }
      }
      segment.setDescription(description);
    }
    log.debug("Filled {} segment descriptions from the standard table", filled);
  }

  public static Optional<String> standardDescription(String mnemonic) {
    return Optional.ofNullable(STANDARD_DESCRIPTIONS.get(mnemonic));
  }
}
