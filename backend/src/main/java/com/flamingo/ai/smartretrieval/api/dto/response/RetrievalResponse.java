package com.flamingo.ai.smartretrieval.api.dto.response;

import com.flamingo.ai.smartretrieval.service.rag.RetrievalResult;
import com.flamingo.ai.smartretrieval.service.rag.search.SearchResult;
import com.flamingo.ai.smartretrieval.service.rag.search.SourceSelection;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an adaptive retrieval. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalResponse {

  private List<SearchResult> results;
  private SourceSelection usedSources;
  private int chunkCount;

  public static RetrievalResponse fromResult(RetrievalResult result) {
    return RetrievalResponse.builder()
        .results(result.results())
        .usedSources(result.usedSources())
        .chunkCount(result.chunkCount())
        .build();
  }
}
