package com.flamingo.ai.smartretrieval.service.rag;

import java.util.Locale;

/** Text helpers shared by the query classifier and router. */
public final class QueryText {

  private QueryText() {}

  /** Lower-cases the query; null becomes the empty string. */
  public static String normalize(String query) {
    return query == null ? "" : query.toLowerCase(Locale.ROOT);
  }

  /** Whitespace-delimited word count. An empty query counts as one (empty) word. */
  public static int wordCount(String query) {
    return normalize(query).trim().split("\\s+").length;
  }
}
