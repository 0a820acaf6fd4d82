package com.flamingo.ai.smartretrieval.service.rag.classification;

import com.flamingo.ai.smartretrieval.domain.enums.QueryComplexity;
import com.flamingo.ai.smartretrieval.domain.enums.QueryType;
import com.flamingo.ai.smartretrieval.service.rag.QueryText;
import com.flamingo.ai.smartretrieval.service.rag.search.SourceSelection;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Classifies a query by domain vocabulary and complexity to suggest which sources to search and
 * how many chunks to retrieve.
 *
 * <p>Pure and total: no I/O, no shared state, and every input (including null or empty) yields an
 * analysis. Queries without vocabulary signal fall back to GENERAL over all sources with 0.5
 * confidence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryClassifier {

  static final double BASE_CONFIDENCE = 0.6;
  static final double CONFIDENCE_PER_MATCH = 0.15;
  static final double MAX_CONFIDENCE = 0.9;
  static final double MIXED_CONFIDENCE = 0.7;
  static final double GENERAL_CONFIDENCE = 0.5;

  static final int SIMPLE_MAX_WORDS = 5;
  static final int COMPLEX_MIN_WORDS = 15;

  /** Simple book queries still need room for ratings and reviews. */
  static final int SIMPLE_BOOK_MIN_CHUNKS = 5;

  private static final List<String> COMPLEX_MARKERS = List.of("?", "how", "why", "explain");

  private final QueryVocabulary vocabulary;

  /**
   * Analyzes a query.
   *
   * @param query raw user query, may be null
   * @return the analysis
   */
  public QueryAnalysis classify(String query) {
    String lowerQuery = QueryText.normalize(query);
    int wordCount = QueryText.wordCount(lowerQuery);

    List<String> bookMatches = matchTerms(vocabulary.bookTerms(), lowerQuery);
    List<String> documentMatches = matchTerms(vocabulary.documentTerms(), lowerQuery);

    QueryType queryType;
    double confidence;
    SourceSelection suggestedSources;

    if (!bookMatches.isEmpty() && documentMatches.isEmpty()) {
      queryType = QueryType.BOOK;
      confidence = singleVocabularyConfidence(bookMatches.size());
      suggestedSources = vocabulary.bookSources();
    } else if (!documentMatches.isEmpty() && bookMatches.isEmpty()) {
      queryType = QueryType.DOCUMENT;
      confidence = singleVocabularyConfidence(documentMatches.size());
      suggestedSources = vocabulary.documentSources();
    } else if (!bookMatches.isEmpty()) {
      queryType = QueryType.MIXED;
      confidence = MIXED_CONFIDENCE;
      suggestedSources = SourceSelection.all();
    } else {
      queryType = QueryType.GENERAL;
      confidence = GENERAL_CONFIDENCE;
      suggestedSources = SourceSelection.all();
    }

    QueryComplexity complexity = complexityOf(lowerQuery, wordCount);

    int suggestedChunkCount = complexity.getBaseChunkCount();
    if (queryType == QueryType.BOOK && complexity == QueryComplexity.SIMPLE) {
      suggestedChunkCount = Math.max(suggestedChunkCount, SIMPLE_BOOK_MIN_CHUNKS);
    }

    List<String> keywords = new ArrayList<>(bookMatches);
    keywords.addAll(documentMatches);

    log.debug(
        "Query analysis: type={}, complexity={}, sources={}, chunks={}, confidence={}, "
            + "bookMatches={}, docMatches={}",
        queryType,
        complexity,
        suggestedSources,
        suggestedChunkCount,
        String.format("%.2f", confidence),
        bookMatches.size(),
        documentMatches.size());

    return new QueryAnalysis(
        queryType,
        complexity,
        suggestedSources,
        suggestedChunkCount,
        confidence,
        List.copyOf(keywords));
  }

  private List<String> matchTerms(List<String> terms, String lowerQuery) {
    return terms.stream().filter(lowerQuery::contains).toList();
  }

  private double singleVocabularyConfidence(int matchCount) {
    return Math.min(MAX_CONFIDENCE, BASE_CONFIDENCE + CONFIDENCE_PER_MATCH * matchCount);
  }

  private QueryComplexity complexityOf(String lowerQuery, int wordCount) {
    if (wordCount <= SIMPLE_MAX_WORDS) {
      return QueryComplexity.SIMPLE;
    }
    if (wordCount > COMPLEX_MIN_WORDS || COMPLEX_MARKERS.stream().anyMatch(lowerQuery::contains)) {
      return QueryComplexity.COMPLEX;
    }
    return QueryComplexity.MODERATE;
  }
}
