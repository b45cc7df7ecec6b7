package com.flamingo.ai.edigrammar.service.extraction;

import com.flamingo.ai.edigrammar.domain.model.CompositeGroup;
import com.flamingo.ai.edigrammar.domain.model.DataElement;
import com.flamingo.ai.edigrammar.domain.model.GrammarNode;
import com.flamingo.ai.edigrammar.domain.model.Segment;
import java.util.Collection;
import org.springframework.stereotype.Component;

/** Computes {@link ExtractionStatistics} over a set of segments. Read-only. */
@Component
public class StatisticsAggregator {

  public ExtractionStatistics aggregate(Collection<Segment> segments) {
    int simple = 0;
    int groups = 0;
    int nested = 0;
    int withFormat = 0;
    int withValue = 0;
    int withUsage = 0;

    for (Segment segment : segments) {
      for (GrammarNode node : segment.getElements()) {
        switch (node.kind()) {
          case ELEMENT -> {
            DataElement element = (DataElement) node;
            simple++;
            withFormat += element.hasFormat() ? 1 : 0;
            withValue += element.hasValue() ? 1 : 0;
            withUsage += element.hasUsage() ? 1 : 0;
          }
          case GROUP -> {
            groups++;
            for (DataElement element : ((CompositeGroup) node).elements()) {
              nested++;
              withFormat += element.hasFormat() ? 1 : 0;
              withValue += element.hasValue() ? 1 : 0;
              withUsage += element.hasUsage() ? 1 : 0;
            }
          }
        }
      }
    }
    return new ExtractionStatistics(
        segments.size(), simple, groups, nested, withFormat, withValue, withUsage);
  }
}
