package com.flamingo.ai.smartretrieval.service.rag.search;

import com.fasterxml.jackson.annotation.JsonValue;
import com.flamingo.ai.smartretrieval.domain.enums.ContentSource;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Which content sources a search may draw from: every source, no source, or an explicit set.
 *
 * <p>Callers branch on {@link #kind()} with a switch so each case is handled explicitly.
 */
public interface SourceSelection {

  /** Discriminator for the three selection shapes. */
  enum Kind {
    ALL,
    NONE,
    EXPLICIT
  }

  String ALL_SENTINEL = "all";
  String NONE_SENTINEL = "none";

  Kind kind();

  static SourceSelection all() {
    return All.INSTANCE;
  }

  static SourceSelection none() {
    return None.INSTANCE;
  }

  static Explicit of(ContentSource... sources) {
    return new Explicit(new LinkedHashSet<>(Arrays.asList(sources)));
  }

  static Explicit of(Collection<ContentSource> sources) {
    return new Explicit(new LinkedHashSet<>(sources));
  }

  /**
   * Parses the wire form used by the UI filter bar: {@code ["all"]}, {@code ["none"]} or a list of
   * source identifiers. A missing or empty list means every source.
   *
   * @param values raw filter values
   * @return the parsed selection
   * @throws IllegalArgumentException when an identifier is not a known source
   */
  static SourceSelection parse(List<String> values) {
    if (values == null || values.isEmpty()) {
      return all();
    }
    if (values.size() == 1) {
      String single = values.get(0) == null ? "" : values.get(0).trim();
      if (ALL_SENTINEL.equalsIgnoreCase(single)) {
        return all();
      }
      if (NONE_SENTINEL.equalsIgnoreCase(single)) {
        return none();
      }
    }
    Set<ContentSource> sources = new LinkedHashSet<>();
    for (String value : values) {
      sources.add(
          ContentSource.fromId(value)
              .orElseThrow(() -> new IllegalArgumentException("Unknown source: " + value)));
    }
    return of(sources);
  }

  /** Every known source. */
  record All() implements SourceSelection {
    static final All INSTANCE = new All();

    @Override
    public Kind kind() {
      return Kind.ALL;
    }

    @JsonValue
    public String wireValue() {
      return ALL_SENTINEL;
    }

    @Override
    public String toString() {
      return ALL_SENTINEL;
    }
  }

  /** Retrieval disabled by the user. */
  record None() implements SourceSelection {
    static final None INSTANCE = new None();

    @Override
    public Kind kind() {
      return Kind.NONE;
    }

    @JsonValue
    public String wireValue() {
      return NONE_SENTINEL;
    }

    @Override
    public String toString() {
      return NONE_SENTINEL;
    }
  }

  /** A non-empty, ordered set of sources. */
  record Explicit(Set<ContentSource> sources) implements SourceSelection {

    public Explicit {
      if (sources == null || sources.isEmpty()) {
        throw new IllegalArgumentException("Explicit source selection must not be empty");
      }
      sources = Collections.unmodifiableSet(new LinkedHashSet<>(sources));
    }

    @Override
    public Kind kind() {
      return Kind.EXPLICIT;
    }

    @JsonValue
    public List<String> ids() {
      return sources.stream().map(ContentSource::getId).toList();
    }

    @Override
    public String toString() {
      return ids().toString();
    }
  }
}
