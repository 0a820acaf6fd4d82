package com.flamingo.ai.smartretrieval.agent;

import com.flamingo.ai.smartretrieval.agent.dto.RetrievalNeedResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Judges whether a partial answer needs more retrieved context. */
public interface RetrievalNeedAgent {

  @SystemMessage(
      """
        You assess whether an assistant's partial answer needs more retrieved context.

        Return shouldRetrieve=true only when the answer is missing information that is likely
        to exist in the user's knowledge base. Return false when the answer is complete, or
        when the question cannot be answered from personal notes and documents at all.

        Respond with JSON:
        - shouldRetrieve (boolean)
        - reason (string) - one short sentence
        - suggestedCount (integer) - how many additional chunks to fetch, between 1 and 10
        """)
  @UserMessage(
      """
        Query: {{query}}

        Partial response: {{partialResponse}}

        Chunks already retrieved: {{currentChunkCount}}
        """)
  RetrievalNeedResult assess(
      @V("query") String query,
      @V("partialResponse") String partialResponse,
      @V("currentChunkCount") int currentChunkCount);
}
