package com.flamingo.ai.smartretrieval.service.rag.iterative;

/** Whether a partial answer warrants another retrieval round, and how many chunks to fetch. */
public record RetrievalNeed(boolean shouldRetrieve, String reason, int suggestedCount) {

  public static RetrievalNeed no(String reason) {
    return new RetrievalNeed(false, reason, 0);
  }
}
