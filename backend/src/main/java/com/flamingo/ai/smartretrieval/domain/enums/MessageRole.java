package com.flamingo.ai.smartretrieval.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Speaker of a prior conversation turn, written as "user" or "assistant" on the wire. */
public enum MessageRole {
  USER,
  ASSISTANT;

  @JsonValue
  public String getId() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static MessageRole fromId(String id) {
    if (id == null) {
      throw new IllegalArgumentException("Message role is required");
    }
    return switch (id.trim().toLowerCase(Locale.ROOT)) {
      case "user" -> USER;
      case "assistant" -> ASSISTANT;
      default -> throw new IllegalArgumentException("Unknown message role: " + id);
    };
  }
}
