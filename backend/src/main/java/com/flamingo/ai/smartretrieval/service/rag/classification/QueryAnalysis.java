package com.flamingo.ai.smartretrieval.service.rag.classification;

import com.flamingo.ai.smartretrieval.domain.enums.QueryComplexity;
import com.flamingo.ai.smartretrieval.domain.enums.QueryType;
import com.flamingo.ai.smartretrieval.service.rag.search.SourceSelection;
import java.util.List;

/**
 * Result of classifying a query.
 *
 * @param queryType domain guess
 * @param complexity complexity level
 * @param suggestedSources {@link SourceSelection.All} or a non-empty explicit set, never none
 * @param suggestedChunkCount positive chunk count, not yet clamped to any global maximum
 * @param confidence heuristic vocabulary-match strength in [0, 1]
 * @param keywords matched book terms then matched document terms, in vocabulary order
 */
public record QueryAnalysis(
    QueryType queryType,
    QueryComplexity complexity,
    SourceSelection suggestedSources,
    int suggestedChunkCount,
    double confidence,
    List<String> keywords) {}
