package com.flamingo.ai.edigrammar.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An EDI segment identified by its 3-letter mnemonic (e.g. {@code NAD}).
 *
 * <p>Created when its header is first seen and mutated by every following row until the next header
 * or the end of the document. Entries keep document order.
 */
@Getter
@EqualsAndHashCode
@ToString(of = {"mnemonic", "description"})
public final class Segment {

  private final String mnemonic;
  private String description;
  private final List<GrammarNode> elements = new ArrayList<>();

  public Segment(String mnemonic, String description) {
    this.mnemonic = Objects.requireNonNull(mnemonic, "mnemonic");
    this.description = description == null ? "" : description;
  }

  public void setDescription(String description) {
    this.description = description == null ? "" : description;
  }

  public void addElement(GrammarNode node) {
    elements.add(Objects.requireNonNull(node, "node"));
  }

  /** Returns the entries in document order (read-only view). */
  public List<GrammarNode> getElements() {
    return Collections.unmodifiableList(elements);
  }
}
