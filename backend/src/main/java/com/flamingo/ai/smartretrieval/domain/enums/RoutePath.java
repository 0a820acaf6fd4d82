package com.flamingo.ai.smartretrieval.domain.enums;

/**
 * Routing outcome for a query. The downstream skip/use flags are derived from the path only, so
 * they can never disagree with it.
 */
public enum RoutePath {
  /** Cheap path: direct search, no rephrasing, no iterative retrieval, no source analysis. */
  FAST(true, true, true, false),

  /** Expensive path: every downstream step runs and search uses the two-stage probe. */
  SLOW(false, false, false, true);

  private final boolean skipRephrasing;
  private final boolean skipIterativeRetrieval;
  private final boolean skipSourceAnalysis;
  private final boolean useTwoStageSearch;

  RoutePath(
      boolean skipRephrasing,
      boolean skipIterativeRetrieval,
      boolean skipSourceAnalysis,
      boolean useTwoStageSearch) {
    this.skipRephrasing = skipRephrasing;
    this.skipIterativeRetrieval = skipIterativeRetrieval;
    this.skipSourceAnalysis = skipSourceAnalysis;
    this.useTwoStageSearch = useTwoStageSearch;
  }

  public boolean skipsRephrasing() {
    return skipRephrasing;
  }

  public boolean skipsIterativeRetrieval() {
    return skipIterativeRetrieval;
  }

  public boolean skipsSourceAnalysis() {
    return skipSourceAnalysis;
  }

  public boolean usesTwoStageSearch() {
    return useTwoStageSearch;
  }
}
