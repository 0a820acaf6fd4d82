package com.flamingo.ai.smartretrieval.service.rag.routing;

import com.flamingo.ai.smartretrieval.domain.enums.RoutePath;
import com.flamingo.ai.smartretrieval.service.rag.QueryText;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides whether a query takes the fast path (direct search, no preprocessing) or the slow path
 * (rephrasing, iterative retrieval, source analysis, two-stage search).
 *
 * <p>Two independent sets of signals add points to competing scores. The fast path wins only on a
 * strictly higher score; ties go to the slow path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryRouter {

  private final RoutingPatterns patterns;

  /**
   * Routes a query.
   *
   * @param query raw user query, may be null
   * @param isFirstMessage whether this is the first message of the conversation
   * @param history prior turns, logged but not scored
   * @return the routing decision
   */
  public QueryRoute route(String query, boolean isFirstMessage, List<ConversationTurn> history) {
    String trimmed = query == null ? "" : query.trim();
    String lowerQuery = QueryText.normalize(trimmed);
    int wordCount = QueryText.wordCount(trimmed);

    // Fast path signals
    boolean isShortQuery = wordCount <= patterns.shortQueryMaxWords();
    boolean isDefinitional = patterns.definitional().matcher(trimmed).find();
    boolean isSelfContained = !patterns.anaphora().matcher(trimmed).find();
    boolean isCounting = patterns.counting().matcher(trimmed).find();
    boolean isListRequest = patterns.listRequest().matcher(trimmed).find();

    // Slow path signals
    boolean isComplex = patterns.analytical().matcher(trimmed).find();
    boolean isMultiPart = trimmed.contains("?") && trimmed.split("\\?", -1).length > 2;
    boolean hasMultipleClauses =
        lowerQuery.contains(" and ") || lowerQuery.contains(" or ") || lowerQuery.contains("; ");
    boolean isLongQuery = wordCount > patterns.longQueryMinWords();
    boolean needsContext = !isFirstMessage && !isSelfContained;

    int fastScore = 0;
    if (isShortQuery) fastScore += 3;
    if (isDefinitional) fastScore += 2;
    if (isSelfContained) fastScore += 2;
    if (isCounting) fastScore += 2;
    if (isListRequest) fastScore += 1;
    if (isFirstMessage) fastScore += 1;

    int slowScore = 0;
    if (isComplex) slowScore += 3;
    if (isMultiPart) slowScore += 3;
    if (hasMultipleClauses) slowScore += 2;
    if (isLongQuery) slowScore += 2;
    if (needsContext) slowScore += 2;

    QueryRoute route;
    if (fastScore > slowScore) {
      route =
          new QueryRoute(
              RoutePath.FAST,
              fastScore,
              slowScore,
              String.format(
                  "Fast path: score %d vs %d (short=%s, self-contained=%s, definitional=%s)",
                  fastScore, slowScore, isShortQuery, isSelfContained, isDefinitional));
    } else {
      route =
          new QueryRoute(
              RoutePath.SLOW,
              fastScore,
              slowScore,
              String.format(
                  "Slow path: score %d vs %d (complex=%s, multi-part=%s, needs-context=%s)",
                  fastScore, slowScore, isComplex, isMultiPart, needsContext));
    }

    log.debug(
        "Routed query ({} words, firstMessage={}, history={}): {}",
        wordCount,
        isFirstMessage,
        history == null ? 0 : history.size(),
        route.reason());
    return route;
  }
}
