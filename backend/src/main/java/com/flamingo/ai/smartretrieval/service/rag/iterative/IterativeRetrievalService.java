package com.flamingo.ai.smartretrieval.service.rag.iterative;

import com.flamingo.ai.smartretrieval.agent.RetrievalNeedAgent;
import com.flamingo.ai.smartretrieval.agent.dto.RetrievalNeedResult;
import com.flamingo.ai.smartretrieval.config.RetrievalConfig;
import com.flamingo.ai.smartretrieval.service.rag.QueryText;
import com.flamingo.ai.smartretrieval.service.rag.RetrievalResult;
import com.flamingo.ai.smartretrieval.service.rag.SmartRetrievalService;
import com.flamingo.ai.smartretrieval.service.rag.search.SearchResult;
import com.flamingo.ai.smartretrieval.service.rag.search.SourceSearchClient;
import com.flamingo.ai.smartretrieval.service.rag.search.SourceSelection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Second retrieval round for slow-path queries. A partial answer that admits missing information
 * is assessed by {@link RetrievalNeedAgent}; if more context is needed it is fetched from the
 * sources already in use.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IterativeRetrievalService {

  static final List<String> UNCERTAINTY_PHRASES =
      List.of(
          "i don't have",
          "i don't see",
          "i cannot find",
          "i'm not sure",
          "i don't know",
          "no information",
          "not enough information",
          "insufficient",
          "unable to find",
          "cannot determine",
          "more context needed",
          "need more details");

  private final RetrievalNeedAgent retrievalNeedAgent;
  private final SmartRetrievalService smartRetrievalService;
  private final RetrievalConfig retrievalConfig;

  /**
   * Decides whether the partial response needs more context.
   *
   * @param query the user query
   * @param partialResponse the answer generated so far
   * @param currentChunkCount chunks already in the prompt
   * @param maxChunks global chunk ceiling
   * @return the decision; suggested count never exceeds the remaining chunk budget
   */
  public RetrievalNeed shouldRetrieveMore(
      String query, String partialResponse, int currentChunkCount, int maxChunks) {
    RetrievalConfig.Iterative config = retrievalConfig.getIterative();
    if (!config.isEnabled()) {
      return RetrievalNeed.no("Iterative retrieval disabled");
    }
    if (currentChunkCount >= maxChunks) {
      return RetrievalNeed.no("Already at max chunks");
    }
    if (!hasUncertainty(partialResponse)) {
      return RetrievalNeed.no("Response appears complete");
    }

    String excerpt = partialResponse;
    if (excerpt.length() > config.getMaxResponseChars()) {
      excerpt = excerpt.substring(0, config.getMaxResponseChars());
    }

    RetrievalNeedResult result;
    try {
      result = retrievalNeedAgent.assess(query, excerpt, currentChunkCount);
    } catch (RuntimeException e) {
      log.error("Retrieval need assessment failed: {}", e.getMessage(), e);
      return RetrievalNeed.no("Assessment failed");
    }
    if (result == null || !result.shouldRetrieve()) {
      String reason = result != null ? result.reason() : "No assessment";
      log.debug("No additional retrieval needed: {}", reason);
      return RetrievalNeed.no(reason);
    }

    int suggested =
        result.suggestedCount() > 0 ? result.suggestedCount() : config.getDefaultSuggestedCount();
    int capped = Math.min(suggested, maxChunks - currentChunkCount);
    log.info("Additional retrieval needed: {} chunks ({})", capped, result.reason());
    return new RetrievalNeed(true, result.reason(), capped);
  }

  /**
   * Fetches more chunks from the sources already in use, skipping content already retrieved.
   *
   * @return only results whose content is not in {@code existing}
   */
  public List<SearchResult> retrieveAdditionalContext(
      String query,
      List<SearchResult> existing,
      SourceSelection currentSources,
      int additionalCount,
      SourceSearchClient searchClient) {
    RetrievalResult result =
        smartRetrievalService.retrieve(query, currentSources, additionalCount, searchClient);

    Set<String> seen = existing.stream().map(SearchResult::content).collect(Collectors.toSet());
    List<SearchResult> fresh =
        result.results().stream().filter(r -> !seen.contains(r.content())).toList();
    log.debug(
        "Iterative retrieval returned {} results, {} new", result.results().size(), fresh.size());
    return fresh;
  }

  boolean hasUncertainty(String response) {
    String normalized = QueryText.normalize(response);
    return UNCERTAINTY_PHRASES.stream().anyMatch(normalized::contains);
  }
}
