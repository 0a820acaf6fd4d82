package com.flamingo.ai.smartretrieval.service.rag.search;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A chunk as stored in the search index. Field names come from configuration, so every stored
 * field is kept by name.
 */
public class ChunkDocument {

  private final Map<String, Object> fields = new LinkedHashMap<>();

  public static ChunkDocument of(Map<String, Object> fields) {
    ChunkDocument document = new ChunkDocument();
    fields.forEach(document::put);
    return document;
  }

  @JsonAnySetter
  public void put(String name, Object value) {
    fields.put(name, value);
  }

  @JsonAnyGetter
  public Map<String, Object> getFields() {
    return fields;
  }

  public Object get(String name) {
    return fields.get(name);
  }
}
