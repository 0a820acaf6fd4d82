package com.flamingo.ai.smartretrieval.service.rag.search;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.smartretrieval.config.RetrievalConfig;
import com.flamingo.ai.smartretrieval.domain.enums.ContentSource;
import com.flamingo.ai.smartretrieval.exception.SearchException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Default search collaborator: embeds the query and runs a kNN search over the chunk index,
 * restricted to the selected sources.
 *
 * <p>Failures reach the caller. The circuit breaker has no fallback, so an open circuit raises
 * like any other backend error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ElasticsearchSourceSearchClient implements SourceSearchClient {

  private final ElasticsearchClient elasticsearchClient;
  private final EmbeddingModel embeddingModel;
  private final RetrievalConfig retrievalConfig;
  private final List<SearchMetricsListener> metricsListeners;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Override
  @Timed(value = "retrieval.search", description = "Time for a source-filtered chunk search")
  @CircuitBreaker(name = "elasticsearch")
  public List<SearchResult> search(String query, int limit, SourceSelection sources) {
    if (sources.kind() == SourceSelection.Kind.NONE) {
      log.debug("Source selection is none, skipping search");
      return List.of();
    }

    List<Float> queryVector = embedQuery(query);
    SearchRequest request = buildSearchRequest(queryVector, limit, sources);

    long start = System.nanoTime();
    try {
      SearchResponse<ChunkDocument> response =
          elasticsearchClient.search(request, ChunkDocument.class);
      List<SearchResult> results = mapHits(response.hits().hits());
      notifyListeners(
          new SearchCallMetrics(
              SearchCallMetrics.SEARCH, indexName(), 0, elapsedMillis(start), null));
      log.debug(
          "Search returned {} results (limit={}, sources={})", results.size(), limit, sources);
      return results;
    } catch (IOException e) {
      notifyListeners(
          new SearchCallMetrics(
              SearchCallMetrics.SEARCH, indexName(), 0, elapsedMillis(start), e.getMessage()));
      log.error("Search failed on index {}: {}", indexName(), e.getMessage(), e);
      throw new SearchException(indexName(), e);
    }
  }

  private List<Float> embedQuery(String query) {
    long start = System.nanoTime();
    try {
      Response<Embedding> response = embeddingModel.embed(query);
      int inputTokens =
          response.tokenUsage() != null && response.tokenUsage().inputTokenCount() != null
              ? response.tokenUsage().inputTokenCount()
              : 0;
      notifyListeners(
          new SearchCallMetrics(
              SearchCallMetrics.EMBEDDING,
              embeddingModelName,
              inputTokens,
              elapsedMillis(start),
              null));
      return response.content().vectorAsList();
    } catch (RuntimeException e) {
      notifyListeners(
          new SearchCallMetrics(
              SearchCallMetrics.EMBEDDING,
              embeddingModelName,
              0,
              elapsedMillis(start),
              e.getMessage()));
      throw e;
    }
  }

  /** Builds a kNN request, adding a terms filter on the source field unless every source. */
  SearchRequest buildSearchRequest(List<Float> queryVector, int limit, SourceSelection sources) {
    RetrievalConfig.Index index = retrievalConfig.getIndex();
    List<FieldValue> sourceValues =
        sources instanceof SourceSelection.Explicit explicit
            ? explicit.sources().stream()
                .map(ContentSource::getId)
                .map(FieldValue::of)
                .toList()
            : List.of();

    return SearchRequest.of(
        s ->
            s.index(index.getName())
                .knn(
                    k -> {
                      k.field(index.getEmbeddingField())
                          .queryVector(queryVector)
                          .k(limit)
                          .numCandidates(limit * index.getNumCandidatesMultiplier());
                      if (!sourceValues.isEmpty()) {
                        k.filter(
                            f ->
                                f.terms(
                                    t ->
                                        t.field(index.getSourceField())
                                            .terms(v -> v.value(sourceValues))));
                      }
                      return k;
                    })
                .source(src -> src.filter(sf -> sf.excludes(index.getEmbeddingField())))
                .size(limit));
  }

  private List<SearchResult> mapHits(List<Hit<ChunkDocument>> hits) {
    RetrievalConfig.Index index = retrievalConfig.getIndex();
    List<SearchResult> results = new ArrayList<>(hits.size());
    for (Hit<ChunkDocument> hit : hits) {
      ChunkDocument source = hit.source();
      if (source == null) {
        continue;
      }
      Map<String, Object> metadata = new HashMap<>(source.getFields());
      metadata.remove(index.getEmbeddingField());
      metadata.put("id", hit.id());
      // Probe ranking reads the source id from the "source" key
      Object sourceId = metadata.get(index.getSourceField());
      if (sourceId != null) {
        metadata.put(SearchResult.SOURCE_KEY, sourceId.toString());
      }
      Object content = source.get(index.getContentField());
      double score = hit.score() != null ? hit.score() : 0.0;
      results.add(new SearchResult(content == null ? "" : content.toString(), score, metadata));
    }
    return results;
  }

  private void notifyListeners(SearchCallMetrics metrics) {
    for (SearchMetricsListener listener : metricsListeners) {
      try {
        listener.onCall(metrics);
      } catch (RuntimeException e) {
        log.warn(
            "Search metrics listener {} failed: {}",
            listener.getClass().getSimpleName(),
            e.getMessage());
      }
    }
  }

  private String indexName() {
    return retrievalConfig.getIndex().getName();
  }

  private static long elapsedMillis(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
