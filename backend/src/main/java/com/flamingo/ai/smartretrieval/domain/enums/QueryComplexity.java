package com.flamingo.ai.smartretrieval.domain.enums;

/** Query complexity with the base number of chunks to retrieve for each level. */
public enum QueryComplexity {
  SIMPLE(5),
  MODERATE(10),
  COMPLEX(20);

  private final int baseChunkCount;

  QueryComplexity(int baseChunkCount) {
    this.baseChunkCount = baseChunkCount;
  }

  public int getBaseChunkCount() {
    return baseChunkCount;
  }
}
