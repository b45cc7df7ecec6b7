package com.flamingo.ai.edigrammar.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.edigrammar.domain.model.CompositeGroup;
import com.flamingo.ai.edigrammar.domain.model.DataElement;
import com.flamingo.ai.edigrammar.domain.model.GrammarNode;
import com.flamingo.ai.edigrammar.domain.model.Segment;
import com.flamingo.ai.edigrammar.exception.GrammarFormatException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Converts segments to and from the exported JSON layout.
 *
 * <pre>
 * [ { "segment": "NAD", "description": "...", "elements": [
 *     { "champ": "3035", "description": "...", "format": "...", "valeur": "...", "usage": "..." },
 *     { "groupe": "C082", "description": "...", "champs": [ ... ] } ] } ]
 * </pre>
 *
 * <p>Elements and groups are told apart by which key they carry ({@code champ} or {@code groupe});
 * reading checks the key explicitly and rejects entries that carry neither or both.
 */
@Component
public class GrammarJsonCodec {

  static final String SEGMENT = "segment";
  static final String DESCRIPTION = "description";
  static final String ELEMENTS = "elements";
  static final String CHAMP = "champ";
  static final String FORMAT = "format";
  static final String VALEUR = "valeur";
  static final String USAGE = "usage";
  static final String GROUPE = "groupe";
  static final String CHAMPS = "champs";

  private final ObjectMapper objectMapper;
  private final ObjectWriter writer;

  public GrammarJsonCodec() {
    this(new ObjectMapper());
  }

  public GrammarJsonCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.writer = objectMapper.writer(new GrammarPrettyPrinter());
  }

  /** Builds the JSON tree for {@code segments}, keeping their order. */
  public ArrayNode toTree(List<Segment> segments) {
    ArrayNode root = objectMapper.createArrayNode();
    for (Segment segment : segments) {
      ObjectNode node = root.addObject();
      node.put(SEGMENT, segment.getMnemonic());
      node.put(DESCRIPTION, segment.getDescription());
      ArrayNode elements = node.putArray(ELEMENTS);
      for (GrammarNode child : segment.getElements()) {
        switch (child.kind()) {
          case ELEMENT -> writeElement(elements.addObject(), (DataElement) child);
          case GROUP -> writeGroup(elements.addObject(), (CompositeGroup) child);
        }
      }
    }
    return root;
  }

  public String write(List<Segment> segments) {
    try {
      return writer.writeValueAsString(toTree(segments));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize grammar: " + e.getMessage(), e);
    }
  }

  /** Writes {@code segments} to {@code path} as UTF-8, creating parent directories. */
  public void write(List<Segment> segments, Path path) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    writer.writeValue(path.toFile(), toTree(segments));
  }

  public List<Segment> read(String json) {
    try {
      return fromTree(objectMapper.readTree(json));
    } catch (JsonProcessingException e) {
      throw new GrammarFormatException("Invalid grammar JSON: " + e.getOriginalMessage(), e);
    }
  }

  public List<Segment> read(Path path) throws IOException {
    return fromTree(objectMapper.readTree(path.toFile()));
  }

  /**
   * Rebuilds segments from a JSON tree.
   *
   * @throws GrammarFormatException if the tree does not have the export layout
   */
  public List<Segment> fromTree(JsonNode root) {
    if (root == null || !root.isArray()) {
      throw new GrammarFormatException("Grammar JSON must be an array of segments");
    }
    List<Segment> segments = new ArrayList<>();
    for (JsonNode node : root) {
      Segment segment =
          new Segment(requiredText(node, SEGMENT), node.path(DESCRIPTION).asText(""));
      for (JsonNode child : node.path(ELEMENTS)) {
        segment.addElement(readNode(child, segment.getMnemonic()));
      }
      segments.add(segment);
    }
    return segments;
  }

  // ---- private helpers ----

  private void writeElement(ObjectNode node, DataElement element) {
    node.put(CHAMP, element.code());
    node.put(DESCRIPTION, element.description());
    node.put(FORMAT, element.format());
    node.put(VALEUR, element.value());
    node.put(USAGE, element.usage());
  }

  private void writeGroup(ObjectNode node, CompositeGroup group) {
    node.put(GROUPE, group.code());
    node.put(DESCRIPTION, group.description());
    ArrayNode champs = node.putArray(CHAMPS);
    for (DataElement element : group.elements()) {
      writeElement(champs.addObject(), element);
    }
  }

  private GrammarNode readNode(JsonNode node, String segment) {
    boolean isElement = node.has(CHAMP);
    boolean isGroup = node.has(GROUPE);
    if (isElement == isGroup) {
      throw new GrammarFormatException(
          "Entry of segment " + segment + " must have exactly one of 'champ' or 'groupe'");
    }
    if (isElement) {
      return readElement(node);
    }
    CompositeGroup group =
        new CompositeGroup(node.get(GROUPE).asText(), node.path(DESCRIPTION).asText(""));
    for (JsonNode champ : node.path(CHAMPS)) {
      if (!champ.has(CHAMP)) {
        throw new GrammarFormatException(
            "Group " + group.code() + " of segment " + segment + " may only contain 'champ' entries");
      }
      group.addElement(readElement(champ));
    }
    return group;
  }

  private DataElement readElement(JsonNode node) {
    return new DataElement(
        node.get(CHAMP).asText(),
        node.path(DESCRIPTION).asText(""),
        node.path(FORMAT).asText(""),
        node.path(VALEUR).asText(""),
        node.path(USAGE).asText(""));
  }

  private static String requiredText(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual()) {
      throw new GrammarFormatException("Missing '" + field + "' in grammar JSON");
    }
    return value.asText();
  }
}
