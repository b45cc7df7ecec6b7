package com.flamingo.ai.edigrammar.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A composite data element ("groupe"). Holds simple elements only; groups do not nest.
 *
 * <p>Mutable while the owning table is being parsed: rows following the group header append their
 * elements here in document order.
 */
@EqualsAndHashCode
@ToString(of = {"code", "description"})
public final class CompositeGroup implements GrammarNode {

  private final String code;
  private final String description;
  private final List<DataElement> elements = new ArrayList<>();

  public CompositeGroup(String code, String description) {
    this.code = Objects.requireNonNull(code, "code");
    this.description = description == null ? "" : description;
  }

  public CompositeGroup(String code, String description, List<DataElement> elements) {
    this(code, description);
    this.elements.addAll(elements);
  }

  @Override
  public String code() {
    return code;
  }

  @Override
  public String description() {
    return description;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.GROUP;
  }

  public void addElement(DataElement element) {
    elements.add(Objects.requireNonNull(element, "element"));
  }

  /** Returns the child elements in document order (read-only view). */
  public List<DataElement> elements() {
    return Collections.unmodifiableList(elements);
  }
}
