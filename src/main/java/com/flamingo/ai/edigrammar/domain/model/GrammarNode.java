package com.flamingo.ai.edigrammar.domain.model;

/**
 * An entry in a segment's ordered element list.
 *
 * <p>Either a {@link DataElement} or a {@link CompositeGroup}. Callers branch on {@link #kind()}
 * rather than on the runtime type; the JSON key-shape ({@code champ} vs {@code groupe}) is only
 * produced at the serialization boundary.
 */
public sealed interface GrammarNode permits DataElement, CompositeGroup {

  /** Element or group code as printed in the guideline (e.g. {@code 3035}, {@code C082}). */
  String code();

  /** Normalized description text, never null. */
  String description();

  NodeKind kind();
}
