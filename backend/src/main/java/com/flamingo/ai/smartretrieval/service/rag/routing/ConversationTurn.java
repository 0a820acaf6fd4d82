package com.flamingo.ai.smartretrieval.service.rag.routing;

import com.flamingo.ai.smartretrieval.domain.enums.MessageRole;

/** One prior message in the conversation. */
public record ConversationTurn(MessageRole role, String content) {}
