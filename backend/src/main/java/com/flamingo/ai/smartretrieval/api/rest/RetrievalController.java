package com.flamingo.ai.smartretrieval.api.rest;

import com.flamingo.ai.smartretrieval.api.dto.request.AnalyzeRequest;
import com.flamingo.ai.smartretrieval.api.dto.request.RetrievalRequest;
import com.flamingo.ai.smartretrieval.api.dto.response.QueryDiagnosticsResponse;
import com.flamingo.ai.smartretrieval.api.dto.response.RetrievalResponse;
import com.flamingo.ai.smartretrieval.config.RetrievalConfig;
import com.flamingo.ai.smartretrieval.service.rag.QueryPlan;
import com.flamingo.ai.smartretrieval.service.rag.QueryPlanningService;
import com.flamingo.ai.smartretrieval.service.rag.RetrievalResult;
import com.flamingo.ai.smartretrieval.service.rag.SmartRetrievalService;
import com.flamingo.ai.smartretrieval.service.rag.routing.ConversationTurn;
import com.flamingo.ai.smartretrieval.service.rag.search.SourceSearchClient;
import com.flamingo.ai.smartretrieval.service.rag.search.SourceSelection;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller exposing retrieval decisions and adaptive search. */
@RestController
@RequestMapping("/api/retrieval")
@RequiredArgsConstructor
@Slf4j
public class RetrievalController {

  private final QueryPlanningService queryPlanningService;
  private final SmartRetrievalService smartRetrievalService;
  private final SourceSearchClient sourceSearchClient;
  private final RetrievalConfig retrievalConfig;

  /**
   * Classifies and routes a query without searching.
   *
   * @param request the query and conversation context
   * @return classification and routing decisions
   */
  @PostMapping("/analyze")
  public ResponseEntity<QueryDiagnosticsResponse> analyze(
      @Valid @RequestBody AnalyzeRequest request) {
    List<ConversationTurn> history =
        request.getHistory() == null
            ? List.of()
            : request.getHistory().stream()
                .map(turn -> new ConversationTurn(turn.getRole(), turn.getContent()))
                .toList();
    QueryPlan plan =
        queryPlanningService.plan(request.getQuery(), request.isFirstMessage(), history);
    return ResponseEntity.ok(QueryDiagnosticsResponse.fromPlan(plan));
  }

  /**
   * Runs adaptive retrieval for a query.
   *
   * @param request the query, optional source filter and chunk ceiling
   * @return the results and the sources that were searched
   */
  @PostMapping("/search")
  public ResponseEntity<RetrievalResponse> search(@Valid @RequestBody RetrievalRequest request) {
    SourceSelection filter = SourceSelection.parse(request.getSources());
    int maxChunks =
        request.getMaxChunks() != null ? request.getMaxChunks() : retrievalConfig.getMaxChunks();

    log.info("Retrieval request: sources={}, maxChunks={}", filter, maxChunks);
    RetrievalResult result =
        smartRetrievalService.retrieve(request.getQuery(), filter, maxChunks, sourceSearchClient);
    return ResponseEntity.ok(RetrievalResponse.fromResult(result));
  }
}
