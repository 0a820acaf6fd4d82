package com.flamingo.ai.smartretrieval.config;

import com.flamingo.ai.smartretrieval.service.rag.classification.QueryVocabulary;
import com.flamingo.ai.smartretrieval.service.rag.routing.RoutingPatterns;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Keyword vocabularies and routing patterns used by the classifier and router. */
@Configuration
@Slf4j
public class RetrievalEngineConfig {

  @Bean
  public QueryVocabulary queryVocabulary(RetrievalConfig retrievalConfig) {
    RetrievalConfig.Vocabulary vocabulary = retrievalConfig.getVocabulary();
    boolean customBook = !vocabulary.getBookTerms().isEmpty();
    boolean customDocument = !vocabulary.getDocumentTerms().isEmpty();
    if (!customBook && !customDocument) {
      return QueryVocabulary.defaults();
    }
    log.info(
        "Using configured query vocabulary (book terms: {}, document terms: {})",
        customBook ? "custom" : "default",
        customDocument ? "custom" : "default");
    return QueryVocabulary.withTerms(
        customBook ? vocabulary.getBookTerms() : QueryVocabulary.DEFAULT_BOOK_TERMS,
        customDocument ? vocabulary.getDocumentTerms() : QueryVocabulary.DEFAULT_DOCUMENT_TERMS);
  }

  @Bean
  public RoutingPatterns routingPatterns() {
    return RoutingPatterns.defaults();
  }
}
