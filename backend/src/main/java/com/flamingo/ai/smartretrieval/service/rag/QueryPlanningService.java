package com.flamingo.ai.smartretrieval.service.rag;

import com.flamingo.ai.smartretrieval.service.rag.classification.QueryAnalysis;
import com.flamingo.ai.smartretrieval.service.rag.classification.QueryClassifier;
import com.flamingo.ai.smartretrieval.service.rag.routing.ConversationTurn;
import com.flamingo.ai.smartretrieval.service.rag.routing.QueryRoute;
import com.flamingo.ai.smartretrieval.service.rag.routing.QueryRouter;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Runs the classifier and the router side by side for a query. */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryPlanningService {

  private final QueryClassifier queryClassifier;
  private final QueryRouter queryRouter;

  public QueryPlan plan(String query, boolean isFirstMessage, List<ConversationTurn> history) {
    QueryAnalysis analysis = queryClassifier.classify(query);
    QueryRoute route = queryRouter.route(query, isFirstMessage, history);
    log.info(
        "Query plan: type={}, complexity={}, path={}",
        analysis.queryType(),
        analysis.complexity(),
        route.path());
    return new QueryPlan(analysis, route);
  }
}
