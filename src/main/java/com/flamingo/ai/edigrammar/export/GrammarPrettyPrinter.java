package com.flamingo.ai.edigrammar.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import java.io.IOException;

/**
 * Pretty printer for grammar exports: 4-space indentation, {@code "key": value} separators, and
 * {@code []} / {@code {}} for empty containers.
 */
class GrammarPrettyPrinter extends DefaultPrettyPrinter {

  private static final long serialVersionUID = 1L;

  GrammarPrettyPrinter() {
    DefaultIndenter indenter = new DefaultIndenter("    ", "\n");
    indentObjectsWith(indenter);
    indentArraysWith(indenter);
  }

  private GrammarPrettyPrinter(GrammarPrettyPrinter base) {
    super(base);
  }

  @Override
  public DefaultPrettyPrinter createInstance() {
    return new GrammarPrettyPrinter(this);
  }

  @Override
  public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
    g.writeRaw(": ");
  }

  @Override
  public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
    if (!_arrayIndenter.isInline()) {
      --_nesting;
    }
    if (nrOfValues > 0) {
      _arrayIndenter.writeIndentation(g, _nesting);
    }
    g.writeRaw(']');
  }

  @Override
  public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
    if (!_objectIndenter.isInline()) {
      --_nesting;
    }
    if (nrOfEntries > 0) {
      _objectIndenter.writeIndentation(g, _nesting);
    }
    g.writeRaw('}');
  }
}
