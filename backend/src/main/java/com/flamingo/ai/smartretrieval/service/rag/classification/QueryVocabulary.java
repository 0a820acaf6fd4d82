package com.flamingo.ai.smartretrieval.service.rag.classification;

import com.flamingo.ai.smartretrieval.domain.enums.ContentSource;
import com.flamingo.ai.smartretrieval.service.rag.search.SourceSelection;
import java.util.List;

/**
 * Keyword vocabularies used by {@link QueryClassifier}, with the sources each vocabulary points
 * at. Terms are matched as case-insensitive substrings of the whole query, so multi-word terms
 * work.
 */
public record QueryVocabulary(
    List<String> bookTerms,
    List<String> documentTerms,
    SourceSelection.Explicit bookSources,
    SourceSelection.Explicit documentSources) {

  public static final List<String> DEFAULT_BOOK_TERMS =
      List.of(
          "book",
          "books",
          "read",
          "reading",
          "author",
          "novel",
          "story",
          "chapter",
          "goodreads",
          "rated",
          "rating",
          "review",
          "fiction",
          "non-fiction",
          "memoir",
          "biography");

  public static final List<String> DEFAULT_DOCUMENT_TERMS =
      List.of(
          "document",
          "documents",
          "file",
          "files",
          "pdf",
          "paperless",
          "invoice",
          "receipt",
          "tax",
          "contract",
          "report",
          "form",
          "letter",
          "memo",
          "correspondence");

  public QueryVocabulary {
    bookTerms = bookTerms.stream().map(String::toLowerCase).toList();
    documentTerms = documentTerms.stream().map(String::toLowerCase).toList();
  }

  public static QueryVocabulary defaults() {
    return withTerms(DEFAULT_BOOK_TERMS, DEFAULT_DOCUMENT_TERMS);
  }

  /** Built-in source mapping with the given terms. */
  public static QueryVocabulary withTerms(List<String> bookTerms, List<String> documentTerms) {
    return new QueryVocabulary(
        bookTerms,
        documentTerms,
        SourceSelection.of(ContentSource.READING_LOG),
        SourceSelection.of(
            ContentSource.DOCUMENT_ARCHIVE, ContentSource.UPLOADED, ContentSource.SYNCED));
  }
}
