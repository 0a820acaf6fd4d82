package com.flamingo.ai.smartretrieval.service.rag.search;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A ranked chunk returned by the search collaborator. Scores are comparable within one search call
 * only and are not guaranteed to lie in [0, 1].
 */
public record SearchResult(String content, double score, Map<String, Object> metadata) {

  public static final String SOURCE_KEY = "source";

  public SearchResult {
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(metadata));
  }

  /** Source identifier from metadata, or null when the chunk carries none or a blank one. */
  public String source() {
    Object source = metadata.get(SOURCE_KEY);
    if (source == null || source.toString().isBlank()) {
      return null;
    }
    return source.toString();
  }
}
