package com.flamingo.ai.edigrammar.service.extraction;

import com.flamingo.ai.edigrammar.domain.model.CompositeGroup;
import com.flamingo.ai.edigrammar.domain.model.DataElement;
import com.flamingo.ai.edigrammar.domain.model.Segment;
import com.flamingo.ai.edigrammar.domain.model.SegmentCatalog;
import java.util.Optional;

/**
 * Parsing state threaded through the table parsers of one document.
 *
 * <p>Holds the accumulating {@link SegmentCatalog} plus the currently open segment and group. Rows
 * are attached to the open group when there is one, otherwise to the open segment.
 */
public class ParserContext {

  private final SegmentCatalog catalog;
  private Segment currentSegment;
  private CompositeGroup currentGroup;

  public ParserContext(SegmentCatalog catalog) {
    this.catalog = catalog;
  }

  public SegmentCatalog catalog() {
    return catalog;
  }

  public Optional<Segment> currentSegment() {
    return Optional.ofNullable(currentSegment);
  }

  public Optional<CompositeGroup> currentGroup() {
    return Optional.ofNullable(currentGroup);
  }

  /** Makes {@code segment} the open segment and closes any open group. */
  public void openSegment(Segment segment) {
    this.currentSegment = segment;
    this.currentGroup = null;
  }

  /**
   * Appends {@code group} to the open segment and makes it the open group.
   *
   * @throws IllegalStateException if no segment is open
   */
  public void openGroup(CompositeGroup group) {
    requireSegment().addElement(group);
    this.currentGroup = group;
  }

  /**
   * Appends {@code element} to the open group, or to the open segment when no group is open.
   *
   * @throws IllegalStateException if no segment is open
   */
  public void addElement(DataElement element) {
    Segment segment = requireSegment();
    if (currentGroup != null) {
      currentGroup.addElement(element);
    } else {
      segment.addElement(element);
    }
  }

  /** Forgets the open segment and group; the catalog is kept. */
  public void reset() {
    this.currentSegment = null;
    this.currentGroup = null;
  }

  private Segment requireSegment() {
    if (currentSegment == null) {
      throw new IllegalStateException("No segment is open");
    }
    return currentSegment;
  }
}
