package com.flamingo.ai.edigrammar.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.edigrammar.domain.model.SegmentCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StandardDescriptionEnricher Tests")
class StandardDescriptionEnricherTest {

  private StandardDescriptionEnricher enricher;
  private SegmentCatalog catalog;

  @BeforeEach
  void setUp() {
    enricher = new StandardDescriptionEnricher();
    catalog = new SegmentCatalog();
  }

  @Test
  @DisplayName("should fill an empty description of a known mnemonic")
  void shouldFillEmptyDescription() {
    catalog.getOrCreate("MOA", "");

    enricher.enrich(catalog);

    assertThat(catalog.find("MOA").orElseThrow().getDescription()).isEqualTo("Monetary amount");
  }

  @Test
  @DisplayName("should replace placeholder level digits")
  void shouldReplacePlaceholders() {
    catalog.getOrCreate("NAD", "1");
    catalog.getOrCreate("UNH", "0");

    enricher.enrich(catalog);

    assertThat(catalog.find("NAD").orElseThrow().getDescription()).isEqualTo("Name and address");
    assertThat(catalog.find("UNH").orElseThrow().getDescription()).isEqualTo("Message header");
  }

  @Test
  @DisplayName("should fill a description that is empty once normalized")
  void shouldFillDescriptionEmptyAfterNormalization() {
    catalog.getOrCreate("QTY", "   ");

    enricher.enrich(catalog);

    assertThat(catalog.find("QTY").orElseThrow().getDescription()).isEqualTo("Quantity");
  }

  @Test
  @DisplayName("should normalize but keep an existing description")
  void shouldKeepExistingDescription() {
    catalog.getOrCreate("LIN", "Line item details M M");

    enricher.enrich(catalog);

    assertThat(catalog.find("LIN").orElseThrow().getDescription()).isEqualTo("Line item details");
  }

  @Test
  @DisplayName("should leave unknown mnemonics without description")
  void shouldLeaveUnknownMnemonicsEmpty() {
    catalog.getOrCreate("ZZZ", "");
    catalog.getOrCreate("SCC", "1");

    enricher.enrich(catalog);

    assertThat(catalog.find("ZZZ").orElseThrow().getDescription()).isEmpty();
    assertThat(catalog.find("SCC").orElseThrow().getDescription()).isEqualTo("1");
  }

  @Test
  @DisplayName("should expose the standard table")
  void shouldExposeStandardTable() {
    assertThat(StandardDescriptionEnricher.standardDescription("UNZ")).contains("Interchange trailer");
    assertThat(StandardDescriptionEnricher.standardDescription("XYZ")).isEmpty();
  }
}
