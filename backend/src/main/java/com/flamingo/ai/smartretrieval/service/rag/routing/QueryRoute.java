package com.flamingo.ai.smartretrieval.service.rag.routing;

import com.flamingo.ai.smartretrieval.domain.enums.RoutePath;

/**
 * Fast/slow routing decision. The skip and two-stage flags are computed from {@link #path()}.
 *
 * @param path chosen path
 * @param fastScore accumulated fast-path points
 * @param slowScore accumulated slow-path points
 * @param reason diagnostic trace, never parsed for control flow
 */
public record QueryRoute(RoutePath path, int fastScore, int slowScore, String reason) {

  public boolean skipRephrasing() {
    return path.skipsRephrasing();
  }

  public boolean skipIterativeRetrieval() {
    return path.skipsIterativeRetrieval();
  }

  public boolean skipSourceAnalysis() {
    return path.skipsSourceAnalysis();
  }

  public boolean useTwoStageSearch() {
    return path.usesTwoStageSearch();
  }

  /** Whether the caller can skip the two-stage probe and search directly. */
  public boolean useSimpleSearch() {
    return path == RoutePath.FAST && !useTwoStageSearch();
  }
}
