package com.flamingo.ai.smartretrieval.service.rag.search;

/**
 * Call-level metrics for one embedding or index call made on behalf of a search.
 *
 * @param callType "embedding" or "search"
 * @param model embedding model name, or the index name for search calls
 * @param inputTokens tokens consumed (0 when not reported)
 * @param durationMs wall-clock duration
 * @param error error message, null on success
 */
public record SearchCallMetrics(
    String callType, String model, int inputTokens, long durationMs, String error) {

  public static final String EMBEDDING = "embedding";
  public static final String SEARCH = "search";

  public boolean failed() {
    return error != null;
  }
}
