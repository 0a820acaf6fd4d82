package com.flamingo.ai.smartretrieval.service.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.smartretrieval.config.RetrievalConfig;
import com.flamingo.ai.smartretrieval.domain.enums.ContentSource;
import com.flamingo.ai.smartretrieval.exception.SearchException;
import com.flamingo.ai.smartretrieval.service.rag.classification.QueryClassifier;
import com.flamingo.ai.smartretrieval.service.rag.classification.QueryVocabulary;
import com.flamingo.ai.smartretrieval.service.rag.search.SearchResult;
import com.flamingo.ai.smartretrieval.service.rag.search.SourceSearchClient;
import com.flamingo.ai.smartretrieval.service.rag.search.SourceSelection;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("SmartRetrievalService Tests")
class SmartRetrievalServiceTest {

  /** General query: confidence 0.5, moderate, 10 chunks. */
  private static final String GENERAL_QUERY = "What is the capital of France";

  /** Document query: confidence 0.9, simple, 5 chunks. */
  private static final String DOCUMENT_QUERY = "Show me my tax documents";

  /** Book query: confidence 0.9, complex, 20 chunks. */
  private static final String BOOK_QUERY =
      "Why did I rate this book five stars and how does it compare to the other novels"
          + " I read this year";

  @Mock private SourceSearchClient searchClient;

  private RetrievalConfig retrievalConfig;
  private SimpleMeterRegistry meterRegistry;
  private SmartRetrievalService service;

  @BeforeEach
  void setUp() {
    retrievalConfig = new RetrievalConfig();
    meterRegistry = new SimpleMeterRegistry();
    service =
        new SmartRetrievalService(
            new QueryClassifier(QueryVocabulary.defaults()),
            searchClient,
            retrievalConfig,
            meterRegistry);
  }

  @Nested
  @DisplayName("explicit user filter")
  class ExplicitFilterTests {

    @Test
    @DisplayName("should search the user's sources once and skip the probe")
    void shouldSearchUserSourcesDirectly() {
      // Given
      SourceSelection filter = SourceSelection.of(ContentSource.DOCUMENT_ARCHIVE);
      List<SearchResult> hits = List.of(hit("document-archive", 0.8));
      when(searchClient.search(GENERAL_QUERY, 10, filter)).thenReturn(hits);

      // When
      RetrievalResult result = service.retrieve(GENERAL_QUERY, filter, 35, searchClient);

      // Then
      assertThat(result.results()).isEqualTo(hits);
      assertThat(result.usedSources()).isEqualTo(filter);
      assertThat(result.chunkCount()).isEqualTo(10);
      verify(searchClient).search(GENERAL_QUERY, 10, filter);
      verifyNoMoreInteractions(searchClient);
      assertThat(branchCount("explicit")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should keep a user filter even when the classifier is confident elsewhere")
    void shouldPreferUserFilterOverClassification() {
      SourceSelection filter = SourceSelection.of(ContentSource.SYNCED);
      when(searchClient.search(BOOK_QUERY, 20, filter)).thenReturn(List.of());

      RetrievalResult result = service.retrieve(BOOK_QUERY, filter, 35, searchClient);

      assertThat(result.usedSources()).isEqualTo(filter);
      verify(searchClient).search(BOOK_QUERY, 20, filter);
      verifyNoMoreInteractions(searchClient);
    }
  }

  @Nested
  @DisplayName("confident classification")
  class DirectSearchTests {

    @Test
    @DisplayName("should search suggested sources directly above the confidence threshold")
    void shouldSearchSuggestedSources() {
      SourceSelection documentSources =
          SourceSelection.of(
              ContentSource.DOCUMENT_ARCHIVE, ContentSource.UPLOADED, ContentSource.SYNCED);
      when(searchClient.search(DOCUMENT_QUERY, 5, documentSources))
          .thenReturn(List.of(hit("uploaded", 0.7)));

      RetrievalResult result =
          service.retrieve(DOCUMENT_QUERY, SourceSelection.all(), 35, searchClient);

      assertThat(result.usedSources()).isEqualTo(documentSources);
      assertThat(result.chunkCount()).isEqualTo(5);
      assertThat(result.results()).hasSize(1);
      verifyNoMoreInteractions(searchClient);
      assertThat(branchCount("direct")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should treat a none filter like no filter")
    void shouldTreatNoneFilterAsNoFilter() {
      SourceSelection readingLog = SourceSelection.of(ContentSource.READING_LOG);
      when(searchClient.search(BOOK_QUERY, 20, readingLog)).thenReturn(List.of());

      RetrievalResult result =
          service.retrieve(BOOK_QUERY, SourceSelection.none(), 35, searchClient);

      assertThat(result.usedSources()).isEqualTo(readingLog);
      verify(searchClient).search(BOOK_QUERY, 20, readingLog);
    }

    @Test
    @DisplayName("should treat a null filter like no filter")
    void shouldTreatNullFilterAsNoFilter() {
      SourceSelection readingLog = SourceSelection.of(ContentSource.READING_LOG);
      when(searchClient.search(BOOK_QUERY, 20, readingLog)).thenReturn(List.of());

      RetrievalResult result = service.retrieve(BOOK_QUERY, null, 35, searchClient);

      assertThat(result.usedSources()).isEqualTo(readingLog);
    }

    @Test
    @DisplayName("should cap the chunk count at maxChunks")
    void shouldCapChunkCount() {
      SourceSelection readingLog = SourceSelection.of(ContentSource.READING_LOG);
      when(searchClient.search(BOOK_QUERY, 8, readingLog)).thenReturn(List.of());

      RetrievalResult result = service.retrieve(BOOK_QUERY, SourceSelection.all(), 8, searchClient);

      assertThat(result.chunkCount()).isEqualTo(8);
      verify(searchClient).search(BOOK_QUERY, 8, readingLog);
    }
  }

  @Nested
  @DisplayName("two-stage search")
  class TwoStageSearchTests {

    @Test
    @DisplayName("should focus on one source with a clear lead and enough hits")
    void shouldFocusOnSingleSource() {
      // Given: reading-log avg 0.9 over 3 hits, synced avg 0.5 over 2 hits
      List<SearchResult> probe =
          List.of(
              hit("reading-log", 0.9),
              hit("synced", 0.5),
              hit("reading-log", 0.9),
              hit("synced", 0.5),
              hit("reading-log", 0.9));
      SourceSelection focus = SourceSelection.of(ContentSource.READING_LOG);
      List<SearchResult> finalHits = List.of(hit("reading-log", 0.95));
      when(searchClient.search(GENERAL_QUERY, 10, SourceSelection.all())).thenReturn(probe);
      when(searchClient.search(GENERAL_QUERY, 10, focus)).thenReturn(finalHits);

      // When
      RetrievalResult result =
          service.retrieve(GENERAL_QUERY, SourceSelection.all(), 35, searchClient);

      // Then
      assertThat(result.results()).isEqualTo(finalHits);
      assertThat(result.usedSources()).isEqualTo(focus);
      assertThat(result.chunkCount()).isEqualTo(10);
      assertThat(branchCount("two_stage")).isEqualTo(1.0);
      assertThat(focusCount("single")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should focus on the top two sources when the top beats the third")
    void shouldFocusOnPairOfSources() {
      List<SearchResult> probe =
          List.of(hit("reading-log", 0.9), hit("synced", 0.85), hit("uploaded", 0.5));
      SourceSelection focus = SourceSelection.of(ContentSource.READING_LOG, ContentSource.SYNCED);
      when(searchClient.search(GENERAL_QUERY, 10, SourceSelection.all())).thenReturn(probe);
      when(searchClient.search(GENERAL_QUERY, 10, focus)).thenReturn(List.of());

      RetrievalResult result =
          service.retrieve(GENERAL_QUERY, SourceSelection.all(), 35, searchClient);

      assertThat(result.usedSources()).isEqualTo(focus);
      assertThat(focusCount("pair")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should search all sources when the leader has too few hits")
    void shouldSearchAllWhenLeaderHasTooFewHits() {
      List<SearchResult> probe = List.of(hit("reading-log", 0.9), hit("synced", 0.5));
      when(searchClient.search(GENERAL_QUERY, 10, SourceSelection.all())).thenReturn(probe);

      RetrievalResult result =
          service.retrieve(GENERAL_QUERY, SourceSelection.all(), 35, searchClient);

      assertThat(result.usedSources()).isEqualTo(SourceSelection.all());
      assertThat(focusCount("all")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should search all sources when every probe hit comes from one source")
    void shouldSearchAllWithSingleProbeSource() {
      List<SearchResult> probe = List.of(hit("uploaded", 0.9), hit("uploaded", 0.8));
      when(searchClient.search(GENERAL_QUERY, 10, SourceSelection.all())).thenReturn(probe);

      RetrievalResult result =
          service.retrieve(GENERAL_QUERY, SourceSelection.all(), 35, searchClient);

      assertThat(result.usedSources()).isEqualTo(SourceSelection.all());
    }

    @Test
    @DisplayName("should bucket hits without a source under the default source")
    void shouldBucketUnlabelledHits() {
      List<SearchResult> probe =
          List.of(
              new SearchResult("a", 0.9, Map.of()),
              new SearchResult("b", 0.9, null),
              hit("reading-log", 0.4));
      SourceSelection focus = SourceSelection.of(ContentSource.SYNCED);
      when(searchClient.search(GENERAL_QUERY, 10, SourceSelection.all())).thenReturn(probe);
      when(searchClient.search(GENERAL_QUERY, 10, focus)).thenReturn(List.of());

      RetrievalResult result =
          service.retrieve(GENERAL_QUERY, SourceSelection.all(), 35, searchClient);

      assertThat(result.usedSources()).isEqualTo(focus);
    }

    @Test
    @DisplayName("should bucket hits with a blank source under the default source")
    void shouldBucketBlankSourceHits() {
      // Given: three blank-source hits at 0.9 against one reading-log hit at 0.4
      List<SearchResult> probe =
          List.of(hit("", 0.9), hit(" ", 0.9), hit("", 0.9), hit("reading-log", 0.4));
      SourceSelection focus = SourceSelection.of(ContentSource.SYNCED);
      when(searchClient.search(GENERAL_QUERY, 10, SourceSelection.all())).thenReturn(probe);
      when(searchClient.search(GENERAL_QUERY, 10, focus)).thenReturn(List.of());

      // When
      RetrievalResult result =
          service.retrieve(GENERAL_QUERY, SourceSelection.all(), 35, searchClient);

      // Then
      assertThat(result.usedSources()).isEqualTo(focus);
      assertThat(service.rankSources(probe, "synced"))
          .extracting(SourceProbeScore::source)
          .containsExactly("synced", "reading-log");
    }

    @Test
    @DisplayName("should never focus on a source it does not know")
    void shouldNotFocusOnUnknownSource() {
      List<SearchResult> probe =
          List.of(hit("notion", 0.9), hit("notion", 0.9), hit("notion", 0.9), hit("synced", 0.3));
      when(searchClient.search(GENERAL_QUERY, 10, SourceSelection.all())).thenReturn(probe);

      RetrievalResult result =
          service.retrieve(GENERAL_QUERY, SourceSelection.all(), 35, searchClient);

      assertThat(result.usedSources()).isEqualTo(SourceSelection.all());
      assertThat(focusCount("all")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should return an empty result without a second search when the probe is empty")
    void shouldStopOnEmptyProbe() {
      when(searchClient.search(GENERAL_QUERY, 10, SourceSelection.all())).thenReturn(List.of());

      RetrievalResult result =
          service.retrieve(GENERAL_QUERY, SourceSelection.all(), 35, searchClient);

      assertThat(result.results()).isEmpty();
      assertThat(result.usedSources()).isEqualTo(SourceSelection.all());
      assertThat(result.chunkCount()).isZero();
      verify(searchClient).search(anyString(), anyInt(), any());
      verifyNoMoreInteractions(searchClient);
      assertThat(branchCount("empty_probe")).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("source ranking")
  class RankSourcesTests {

    @Test
    @DisplayName("should order sources by average score and keep first-seen order on ties")
    void shouldRankByAverageScore() {
      List<SearchResult> probe =
          List.of(
              hit("synced", 0.6),
              hit("uploaded", 0.6),
              hit("reading-log", 0.9),
              hit("reading-log", 0.5));

      List<SourceProbeScore> ranked = service.rankSources(probe, "synced");

      assertThat(ranked)
          .extracting(SourceProbeScore::source)
          .containsExactly("reading-log", "synced", "uploaded");
      assertThat(ranked.get(0).count()).isEqualTo(2);
      assertThat(ranked.get(0).avgScore()).isCloseTo(0.7, offset(1e-9));
    }
  }

  @Nested
  @DisplayName("errors")
  class ErrorTests {

    @Test
    @DisplayName("should propagate search failures unchanged")
    void shouldPropagateSearchFailure() {
      SearchException failure = new SearchException("index unavailable");
      when(searchClient.search(GENERAL_QUERY, 10, SourceSelection.all())).thenThrow(failure);

      assertThatThrownBy(
              () -> service.retrieve(GENERAL_QUERY, SourceSelection.all(), 35, searchClient))
          .isSameAs(failure);
    }

    @Test
    @DisplayName("should return an empty result without searching for a zero chunk ceiling")
    void shouldReturnEmptyForZeroCeiling() {
      RetrievalResult result =
          service.retrieve(DOCUMENT_QUERY, SourceSelection.all(), 0, searchClient);

      assertThat(result.results()).isEmpty();
      assertThat(result.usedSources()).isEqualTo(SourceSelection.all());
      assertThat(result.chunkCount()).isZero();
      verifyNoInteractions(searchClient);
      assertThat(branchCount("zero_ceiling")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should treat a negative chunk ceiling as zero and keep the user filter")
    void shouldClampNegativeCeiling() {
      SourceSelection filter = SourceSelection.of(ContentSource.UPLOADED);

      RetrievalResult result = service.retrieve(GENERAL_QUERY, filter, -3, searchClient);

      assertThat(result.results()).isEmpty();
      assertThat(result.usedSources()).isEqualTo(filter);
      assertThat(result.chunkCount()).isZero();
      verifyNoInteractions(searchClient);
    }
  }

  @Test
  @DisplayName("should use the configured ceiling and default search client")
  void shouldUseConfiguredDefaults() {
    retrievalConfig.setMaxChunks(4);
    SourceSelection readingLog = SourceSelection.of(ContentSource.READING_LOG);
    when(searchClient.search(BOOK_QUERY, 4, readingLog)).thenReturn(List.of());

    RetrievalResult result = service.retrieve(BOOK_QUERY, SourceSelection.all());

    assertThat(result.chunkCount()).isEqualTo(4);
    verify(searchClient).search(BOOK_QUERY, 4, readingLog);
  }

  private double branchCount(String branch) {
    return meterRegistry.counter("retrieval.branch", "branch", branch).count();
  }

  private double focusCount(String focus) {
    return meterRegistry.counter("retrieval.focus", "focus", focus).count();
  }

  private static SearchResult hit(String source, double score) {
    return new SearchResult(source + " chunk", score, Map.of(SearchResult.SOURCE_KEY, source));
  }
}
