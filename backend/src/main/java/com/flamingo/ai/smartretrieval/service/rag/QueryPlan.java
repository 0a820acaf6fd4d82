package com.flamingo.ai.smartretrieval.service.rag;

import com.flamingo.ai.smartretrieval.service.rag.classification.QueryAnalysis;
import com.flamingo.ai.smartretrieval.service.rag.routing.QueryRoute;

/** Classification and routing decisions for one query, computed independently. */
public record QueryPlan(QueryAnalysis analysis, QueryRoute route) {}
