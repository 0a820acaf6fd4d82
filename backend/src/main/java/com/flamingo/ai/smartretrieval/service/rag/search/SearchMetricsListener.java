package com.flamingo.ai.smartretrieval.service.rag.search;

/** Observer notified once per embedding or index call. Must not influence retrieval. */
@FunctionalInterface
public interface SearchMetricsListener {

  void onCall(SearchCallMetrics metrics);
}
