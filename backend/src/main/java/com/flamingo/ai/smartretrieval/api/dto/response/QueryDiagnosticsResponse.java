package com.flamingo.ai.smartretrieval.api.dto.response;

import com.flamingo.ai.smartretrieval.service.rag.QueryPlan;
import com.flamingo.ai.smartretrieval.service.rag.classification.QueryAnalysis;
import com.flamingo.ai.smartretrieval.service.rag.routing.QueryRoute;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO exposing the classifier and router decisions for a query. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryDiagnosticsResponse {

  private QueryAnalysis analysis;
  private Route route;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Route {
    private String path;
    private String reason;
    private int fastScore;
    private int slowScore;
    private boolean skipRephrasing;
    private boolean skipIterativeRetrieval;
    private boolean skipSourceAnalysis;
    private boolean useTwoStageSearch;

    static Route fromRoute(QueryRoute route) {
      return Route.builder()
          .path(route.path().name())
          .reason(route.reason())
          .fastScore(route.fastScore())
          .slowScore(route.slowScore())
          .skipRephrasing(route.skipRephrasing())
          .skipIterativeRetrieval(route.skipIterativeRetrieval())
          .skipSourceAnalysis(route.skipSourceAnalysis())
          .useTwoStageSearch(route.useTwoStageSearch())
          .build();
    }
  }

  public static QueryDiagnosticsResponse fromPlan(QueryPlan plan) {
    return QueryDiagnosticsResponse.builder()
        .analysis(plan.analysis())
        .route(Route.fromRoute(plan.route()))
        .build();
  }
}
