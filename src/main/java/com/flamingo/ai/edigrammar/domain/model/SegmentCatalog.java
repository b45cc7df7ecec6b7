package com.flamingo.ai.edigrammar.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Accumulating map of the segments found in one document, keyed by mnemonic.
 *
 * <p>Keeps first-seen order so {@link #lastCreated()} can answer "most recently declared segment";
 * output ordering is by mnemonic via {@link #sortedSegments()}. Not thread-safe: one catalog per
 * extraction.
 */
public class SegmentCatalog {

  private final Map<String, Segment> segments = new LinkedHashMap<>();
  private Segment lastCreated;

  /**
   * Returns the segment for {@code mnemonic}, creating it with {@code description} if absent. An
   * existing segment keeps its description.
   */
  public Segment getOrCreate(String mnemonic, String description) {
    Segment existing = segments.get(mnemonic);
    if (existing != null) {
      return existing;
    }
    Segment created = new Segment(mnemonic, description);
    segments.put(mnemonic, created);
    lastCreated = created;
    return created;
  }

  public Optional<Segment> find(String mnemonic) {
    return Optional.ofNullable(segments.get(mnemonic));
  }

  public boolean contains(String mnemonic) {
    return segments.containsKey(mnemonic);
  }

  /** The segment most recently added to the catalog, if any. */
  public Optional<Segment> lastCreated() {
    return Optional.ofNullable(lastCreated);
  }

  public Collection<Segment> segments() {
    return Collections.unmodifiableCollection(segments.values());
  }

  /** Segments in ascending mnemonic order. */
  public List<Segment> sortedSegments() {
    return segments.values().stream().sorted(Comparator.comparing(Segment::getMnemonic)).toList();
  }

  public int size() {
    return segments.size();
  }

  public boolean isEmpty() {
    return segments.isEmpty();
  }
}
