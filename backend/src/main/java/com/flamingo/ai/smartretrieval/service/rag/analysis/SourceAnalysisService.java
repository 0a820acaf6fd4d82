package com.flamingo.ai.smartretrieval.service.rag.analysis;

import com.flamingo.ai.smartretrieval.service.rag.search.SearchResult;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Marks which retrieved chunks the generated answer actually drew on. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SourceAnalysisService {

  static final double MIN_THRESHOLD = 0.4;
  static final double STDDEV_WEIGHT = 0.5;
  static final double TOP_FRACTION = 0.4;

  private final EmbeddingModel embeddingModel;

  /**
   * Scores every source against the response. A source is referenced when its similarity reaches
   * the adaptive threshold and it ranks in the top 40%. At least one source is always referenced.
   *
   * @return sources sorted by relevance, best first
   */
  @Timed(value = "retrieval.source.analysis", description = "Time to analyze referenced sources")
  public List<ReferencedSource> analyzeReferencedSources(
      String response, List<SearchResult> sources) {
    if (response == null || response.isBlank() || sources.isEmpty()) {
      return unreferenced(sources);
    }

    List<Embedding> embeddings;
    try {
      List<TextSegment> segments = new ArrayList<>(sources.size() + 1);
      segments.add(TextSegment.from(response));
      sources.forEach(s -> segments.add(TextSegment.from(s.content())));
      embeddings = embeddingModel.embedAll(segments).content();
    } catch (RuntimeException e) {
      log.error("Source analysis embedding failed: {}", e.getMessage(), e);
      return unreferenced(sources);
    }

    float[] responseVector = embeddings.get(0).vector();
    double[] scores = new double[sources.size()];
    for (int i = 0; i < sources.size(); i++) {
      scores[i] = cosineSimilarity(responseVector, embeddings.get(i + 1).vector());
    }
    double threshold = threshold(scores);
    int topCount = Math.max(1, (int) Math.ceil(sources.size() * TOP_FRACTION));

    List<Integer> order = new ArrayList<>();
    for (int i = 0; i < sources.size(); i++) {
      order.add(i);
    }
    order.sort(Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

    List<ReferencedSource> analyzed = new ArrayList<>(sources.size());
    for (int rank = 0; rank < order.size(); rank++) {
      int i = order.get(rank);
      boolean referenced = scores[i] >= threshold && rank < topCount;
      analyzed.add(new ReferencedSource(sources.get(i), scores[i], referenced));
    }
    if (analyzed.stream().noneMatch(ReferencedSource::referenced)) {
      ReferencedSource best = analyzed.get(0);
      analyzed.set(0, new ReferencedSource(best.source(), best.relevanceScore(), true));
    }

    log.debug(
        "Source analysis: {} of {} referenced (threshold={})",
        analyzed.stream().filter(ReferencedSource::referenced).count(),
        analyzed.size(),
        String.format("%.3f", threshold));
    return analyzed;
  }

  /** max(0.4, mean + 0.5 * population stddev). */
  static double threshold(double[] scores) {
    double mean = 0;
    for (double s : scores) {
      mean += s;
    }
    mean /= scores.length;
    double variance = 0;
    for (double s : scores) {
      variance += (s - mean) * (s - mean);
    }
    double stdDev = Math.sqrt(variance / scores.length);
    return Math.max(MIN_THRESHOLD, mean + STDDEV_WEIGHT * stdDev);
  }

  static double cosineSimilarity(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vector dimensions differ: " + a.length + " vs " + b.length);
    }
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }
    if (normA == 0 || normB == 0) {
      return 0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  private static List<ReferencedSource> unreferenced(List<SearchResult> sources) {
    return sources.stream().map(s -> new ReferencedSource(s, 0.0, false)).toList();
  }
}
