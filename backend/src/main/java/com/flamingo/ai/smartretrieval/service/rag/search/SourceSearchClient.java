package com.flamingo.ai.smartretrieval.service.rag.search;

import java.util.List;

/**
 * Ranked search over the knowledge base. Implementations return at most {@code limit} results in
 * descending score order and treat {@link SourceSelection.All} as every known source.
 */
@FunctionalInterface
public interface SourceSearchClient {

  List<SearchResult> search(String query, int limit, SourceSelection sources);
}
