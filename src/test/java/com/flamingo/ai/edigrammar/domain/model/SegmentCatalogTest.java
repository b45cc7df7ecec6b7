package com.flamingo.ai.edigrammar.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SegmentCatalog Tests")
class SegmentCatalogTest {

  private SegmentCatalog catalog;

  @BeforeEach
  void setUp() {
    catalog = new SegmentCatalog();
  }

  @Test
  @DisplayName("should return the existing segment for a repeated mnemonic")
  void shouldMergeRepeatedMnemonic() {
    Segment first = catalog.getOrCreate("NAD", "Name and address");
    Segment second = catalog.getOrCreate("NAD", "Something else");

    assertThat(second).isSameAs(first);
    assertThat(second.getDescription()).isEqualTo("Name and address");
    assertThat(catalog.size()).isEqualTo(1);
  }

  @Test
  @DisplayName("should track the most recently created segment")
  void shouldTrackLastCreated() {
    assertThat(catalog.lastCreated()).isEmpty();

    catalog.getOrCreate("UNH", "");
    catalog.getOrCreate("BGM", "");
    catalog.getOrCreate("UNH", "");

    assertThat(catalog.lastCreated()).map(Segment::getMnemonic).contains("BGM");
  }

  @Test
  @DisplayName("should sort segments by mnemonic while keeping insertion order internally")
  void shouldSortByMnemonic() {
    catalog.getOrCreate("UNH", "");
    catalog.getOrCreate("BGM", "");
    catalog.getOrCreate("NAD", "");
    catalog.getOrCreate("DTM", "");

    assertThat(catalog.sortedSegments())
        .extracting(Segment::getMnemonic)
        .containsExactly("BGM", "DTM", "NAD", "UNH");
    assertThat(catalog.segments())
        .extracting(Segment::getMnemonic)
        .containsExactly("UNH", "BGM", "NAD", "DTM");
  }

  @Test
  @DisplayName("should keep element order of a segment")
  void shouldKeepElementOrder() {
    Segment segment = catalog.getOrCreate("NAD", "");
    segment.addElement(new DataElement("3035", "Party qualifier", "an..3", "", ""));
    segment.addElement(new CompositeGroup("C082", "Party identification details"));
    segment.addElement(new DataElement("1131", "Code list", "", "", ""));

    assertThat(segment.getElements())
        .extracting(GrammarNode::code)
        .containsExactly("3035", "C082", "1131");
  }
}
