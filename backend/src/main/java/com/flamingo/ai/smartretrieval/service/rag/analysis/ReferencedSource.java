package com.flamingo.ai.smartretrieval.service.rag.analysis;

import com.flamingo.ai.smartretrieval.service.rag.search.SearchResult;

/** A retrieved chunk with its similarity to the generated answer. */
public record ReferencedSource(SearchResult source, double relevanceScore, boolean referenced) {}
