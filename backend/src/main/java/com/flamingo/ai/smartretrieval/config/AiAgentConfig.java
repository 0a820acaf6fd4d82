package com.flamingo.ai.smartretrieval.config;

import com.flamingo.ai.smartretrieval.agent.RetrievalNeedAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for AI agents built with LangChain4j AI Services. */
@Configuration
public class AiAgentConfig {

  /** Retrieval need agent for iterative retrieval. Uses the JSON-mode chat model. */
  @Bean
  public RetrievalNeedAgent retrievalNeedAgent(ChatModel chatModel) {
    return AiServices.builder(RetrievalNeedAgent.class).chatModel(chatModel).build();
  }
}
