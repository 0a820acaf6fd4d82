package com.flamingo.ai.smartretrieval.domain.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Content origins the knowledge base can retrieve from. */
public enum ContentSource {
  /** Files uploaded through the web UI. */
  UPLOADED("uploaded", "Uploaded files"),

  /** Files picked up from a synced folder. */
  SYNCED("synced", "Synced folder"),

  /** Documents mirrored from the external document archive. */
  DOCUMENT_ARCHIVE("document-archive", "Document archive"),

  /** Books, ratings and reviews imported from the reading log. */
  READING_LOG("reading-log", "Reading log");

  private final String id;
  private final String description;

  ContentSource(String id, String description) {
    this.id = id;
    this.description = description;
  }

  public String getId() {
    return id;
  }

  public String getDescription() {
    return description;
  }

  /**
   * Looks up a source by its wire identifier.
   *
   * @param id the identifier stored in chunk metadata (e.g. "document-archive")
   * @return the matching source, or empty when the identifier is unknown
   */
  public static Optional<ContentSource> fromId(String id) {
    if (id == null) {
      return Optional.empty();
    }
    String normalized = id.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(s -> s.id.equals(normalized)).findFirst();
  }
}
