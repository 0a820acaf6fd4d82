package com.flamingo.ai.smartretrieval.agent.dto;

/** Structured output from RetrievalNeedAgent. */
public record RetrievalNeedResult(
    boolean shouldRetrieve,
    String reason,
    int suggestedCount // 0 when the model gives no count
    ) {}
