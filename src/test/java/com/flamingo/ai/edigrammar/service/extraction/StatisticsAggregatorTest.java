package com.flamingo.ai.edigrammar.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.edigrammar.domain.model.CompositeGroup;
import com.flamingo.ai.edigrammar.domain.model.DataElement;
import com.flamingo.ai.edigrammar.domain.model.Segment;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StatisticsAggregator Tests")
class StatisticsAggregatorTest {

  private final StatisticsAggregator aggregator = new StatisticsAggregator();

  @Test
  @DisplayName("should count simple elements, groups and nested elements")
  void shouldCountTree() {
    Segment nad = new Segment("NAD", "Name and address");
    nad.addElement(new DataElement("3035", "Party qualifier", "an..3", "BY", "BY = Buyer"));
    CompositeGroup c082 = new CompositeGroup("C082", "Party identification details");
    c082.addElement(new DataElement("3039", "Party identifier", "an..35", "", ""));
    c082.addElement(new DataElement("3055", "Agency", "an..3", "92", "92 = Assigned by buyer"));
    nad.addElement(c082);
    Segment unt = new Segment("UNT", "Message trailer");
    unt.addElement(new DataElement("0074", "Number of segments", "", "", ""));

    ExtractionStatistics stats = aggregator.aggregate(List.of(nad, unt));

    assertThat(stats.segments()).isEqualTo(2);
    assertThat(stats.simpleElements()).isEqualTo(2);
    assertThat(stats.groups()).isEqualTo(1);
    assertThat(stats.elementsInGroups()).isEqualTo(2);
    assertThat(stats.totalElements()).isEqualTo(4);
    assertThat(stats.elementsWithFormat()).isEqualTo(3);
    assertThat(stats.elementsWithValue()).isEqualTo(2);
    assertThat(stats.elementsWithUsage()).isEqualTo(2);
  }

  @Test
  @DisplayName("should return zeros for no segments")
  void shouldReturnZerosForEmptyInput() {
    assertThat(aggregator.aggregate(List.of()))
        .isEqualTo(new ExtractionStatistics(0, 0, 0, 0, 0, 0, 0));
  }
}
