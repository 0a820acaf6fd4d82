package com.flamingo.ai.smartretrieval.service.rag;

import com.flamingo.ai.smartretrieval.config.RetrievalConfig;
import com.flamingo.ai.smartretrieval.domain.enums.ContentSource;
import com.flamingo.ai.smartretrieval.service.rag.classification.QueryAnalysis;
import com.flamingo.ai.smartretrieval.service.rag.classification.QueryClassifier;
import com.flamingo.ai.smartretrieval.service.rag.search.SearchResult;
import com.flamingo.ai.smartretrieval.service.rag.search.SourceSearchClient;
import com.flamingo.ai.smartretrieval.service.rag.search.SourceSelection;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Adaptive retrieval across independently scored content sources.
 *
 * <p>Decision order, each branch returning directly:
 *
 * <ol>
 *   <li>An explicit user source filter is searched as-is; the classifier only sizes the search.
 *   <li>A confident classification with concrete sources is searched directly.
 *   <li>Otherwise a small probe over every source measures per-source match quality, and the
 *       final search focuses on the source (or pair of sources) that clearly stands out.
 * </ol>
 *
 * <p>Search errors propagate unchanged. Nothing is retried or degraded to partial results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SmartRetrievalService {

  private final QueryClassifier queryClassifier;
  private final SourceSearchClient defaultSearchClient;
  private final RetrievalConfig retrievalConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Retrieves context with the configured chunk ceiling and the default search collaborator.
   *
   * @param query the user query
   * @param userSourceFilter the user's source filter, null for none chosen
   * @return ranked results and the sources used
   */
  @Timed(value = "retrieval.retrieve", description = "Time for adaptive retrieval")
  public RetrievalResult retrieve(String query, SourceSelection userSourceFilter) {
    return retrieve(query, userSourceFilter, retrievalConfig.getMaxChunks(), defaultSearchClient);
  }

  /**
   * Retrieves context for a query.
   *
   * @param query the user query
   * @param userSourceFilter the user's source filter; null, all and none defer to the classifier
   * @param maxChunks global ceiling for the final search size; zero or less searches nothing
   * @param searchClient ranked-search collaborator
   * @return ranked results and the sources used
   */
  @Timed(value = "retrieval.retrieve", description = "Time for adaptive retrieval")
  public RetrievalResult retrieve(
      String query,
      SourceSelection userSourceFilter,
      int maxChunks,
      SourceSearchClient searchClient) {
    SourceSelection filter = userSourceFilter == null ? SourceSelection.all() : userSourceFilter;

    QueryAnalysis analysis = queryClassifier.classify(query);
    int chunkCount = Math.max(0, Math.min(analysis.suggestedChunkCount(), maxChunks));
    if (chunkCount == 0) {
      log.info("Chunk ceiling is {}, nothing to retrieve", maxChunks);
      recordBranch("zero_ceiling");
      return new RetrievalResult(List.of(), filter, 0);
    }

    return switch (filter.kind()) {
      case EXPLICIT -> searchUserSelection(query, filter, chunkCount, searchClient);
      case ALL, NONE -> searchByAnalysis(query, analysis, chunkCount, searchClient);
    };
  }

  private RetrievalResult searchUserSelection(
      String query, SourceSelection filter, int chunkCount, SourceSearchClient searchClient) {
    log.info("User selected sources {}, searching {} chunks directly", filter, chunkCount);
    recordBranch("explicit");
    List<SearchResult> results = searchClient.search(query, chunkCount, filter);
    return new RetrievalResult(results, filter, chunkCount);
  }

  private RetrievalResult searchByAnalysis(
      String query, QueryAnalysis analysis, int chunkCount, SourceSearchClient searchClient) {
    RetrievalConfig.Focus focus = retrievalConfig.getFocus();
    if (analysis.confidence() > focus.getHighConfidenceThreshold()
        && analysis.suggestedSources().kind() == SourceSelection.Kind.EXPLICIT) {
      log.info(
          "High confidence ({}), searching suggested sources {}",
          String.format("%.2f", analysis.confidence()),
          analysis.suggestedSources());
      recordBranch("direct");
      List<SearchResult> results =
          searchClient.search(query, chunkCount, analysis.suggestedSources());
      return new RetrievalResult(results, analysis.suggestedSources(), chunkCount);
    }

    log.info(
        "Low confidence ({}) or general query, doing two-stage search",
        String.format("%.2f", analysis.confidence()));
    return twoStageSearch(query, chunkCount, searchClient);
  }

  private RetrievalResult twoStageSearch(
      String query, int chunkCount, SourceSearchClient searchClient) {
    RetrievalConfig.Probe probe = retrievalConfig.getProbe();
    List<SearchResult> probeResults =
        searchClient.search(query, probe.getSize(), SourceSelection.all());

    if (probeResults.isEmpty()) {
      log.info("Probe returned no results, skipping focus search");
      recordBranch("empty_probe");
      return RetrievalResult.empty();
    }
    recordBranch("two_stage");

    List<SourceProbeScore> ranked = rankSources(probeResults, probe.getDefaultSource());
    if (log.isDebugEnabled()) {
      for (SourceProbeScore score : ranked) {
        log.debug(
            "Probe source={} avgScore={} count={}",
            score.source(),
            String.format("%.3f", score.avgScore()),
            score.count());
      }
    }

    SourceSelection focusedSources = chooseFocus(ranked);
    List<SearchResult> finalResults = searchClient.search(query, chunkCount, focusedSources);
    return new RetrievalResult(finalResults, focusedSources, chunkCount);
  }

  /** Groups probe hits by source and orders sources by average score, best first. */
  List<SourceProbeScore> rankSources(List<SearchResult> probeResults, String defaultSource) {
    Map<String, SourceProbeScore> bySource = new LinkedHashMap<>();
    for (SearchResult result : probeResults) {
      String source = result.source() != null ? result.source() : defaultSource;
      bySource.merge(source, SourceProbeScore.of(source, result.score()), SourceProbeScore::plus);
    }
    List<SourceProbeScore> ranked = new ArrayList<>(bySource.values());
    ranked.sort(Comparator.comparingDouble(SourceProbeScore::avgScore).reversed());
    return ranked;
  }

  /**
   * Picks the sources for the final search. A single source needs a clear lead over the runner-up
   * and at least the minimum number of probe hits; a pair needs a clear lead of the top source
   * over the third.
   */
  SourceSelection chooseFocus(List<SourceProbeScore> ranked) {
    RetrievalConfig.Focus focus = retrievalConfig.getFocus();
    SourceProbeScore top = ranked.get(0);
    SourceProbeScore second = ranked.size() > 1 ? ranked.get(1) : null;
    SourceProbeScore third = ranked.size() > 2 ? ranked.get(2) : null;

    if (second != null
        && top.avgScore() > second.avgScore() * focus.getSingleSourceRatio()
        && top.count() >= focus.getSingleSourceMinCount()) {
      log.info("Top source '{}' significantly better, focusing search", top.source());
      return focusOn("single", List.of(top));
    }
    if (third != null && top.avgScore() > third.avgScore() * focus.getPairRatio()) {
      log.info("Top 2 sources better, focusing on '{}' and '{}'", top.source(), second.source());
      return focusOn("pair", List.of(top, second));
    }
    log.info("No clear winner among {} sources, searching all sources", ranked.size());
    recordFocus("all");
    return SourceSelection.all();
  }

  private SourceSelection focusOn(String focusType, List<SourceProbeScore> winners) {
    Set<ContentSource> sources = new LinkedHashSet<>();
    for (SourceProbeScore winner : winners) {
      Optional<ContentSource> source = ContentSource.fromId(winner.source());
      if (source.isEmpty()) {
        log.warn("Probe source '{}' is not a known source, searching all sources", winner.source());
        recordFocus("all");
        return SourceSelection.all();
      }
      sources.add(source.get());
    }
    recordFocus(focusType);
    return SourceSelection.of(sources);
  }

  private void recordBranch(String branch) {
    meterRegistry.counter("retrieval.branch", "branch", branch).increment();
  }

  private void recordFocus(String focus) {
    meterRegistry.counter("retrieval.focus", "focus", focus).increment();
  }
}
