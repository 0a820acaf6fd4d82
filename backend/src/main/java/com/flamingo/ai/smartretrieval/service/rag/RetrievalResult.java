package com.flamingo.ai.smartretrieval.service.rag;

import com.flamingo.ai.smartretrieval.service.rag.search.SearchResult;
import com.flamingo.ai.smartretrieval.service.rag.search.SourceSelection;
import java.util.List;

/**
 * Final ranked context for prompt assembly.
 *
 * @param results ranked chunks from the last search call
 * @param usedSources sources the last search call was restricted to
 * @param chunkCount chunk limit used for the last search call (0 when nothing was found)
 */
public record RetrievalResult(
    List<SearchResult> results, SourceSelection usedSources, int chunkCount) {

  public static RetrievalResult empty() {
    return new RetrievalResult(List.of(), SourceSelection.all(), 0);
  }
}
