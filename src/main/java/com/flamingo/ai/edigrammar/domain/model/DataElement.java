package com.flamingo.ai.edigrammar.domain.model;

/**
 * A simple data element ("champ") of a segment or composite group.
 *
 * @param code 4-digit element code
 * @param description normalized description
 * @param format raw format specifier (e.g. {@code an..3}), may be empty
 * @param value example or allowed value, may be empty
 * @param usage consolidated usage text, one coded-value line per row, may be empty
 */
public record DataElement(
    String code, String description, String format, String value, String usage)
    implements GrammarNode {

  public DataElement {
    description = description == null ? "" : description;
    format = format == null ? "" : format;
    value = value == null ? "" : value;
    usage = usage == null ? "" : usage;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ELEMENT;
  }

  public boolean hasFormat() {
    return !format.isEmpty();
  }

  public boolean hasValue() {
    return !value.isEmpty();
  }

  public boolean hasUsage() {
    return !usage.isEmpty();
  }
}
