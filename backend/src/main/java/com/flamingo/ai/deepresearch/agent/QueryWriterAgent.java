package com.flamingo.ai.deepresearch.agent;

import com.flamingo.ai.deepresearch.agent.dto.GeneratedQuery;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that turns a research topic into the first web search query. Backed by the JSON-mode
 * chat model.
 */
public interface QueryWriterAgent {

  @SystemMessage(
      """
        You write targeted web search queries for an automated research assistant.
        The query must gather information about the following topic.

        <TOPIC>
        {{topic}}
        </TOPIC>

        Respond with a JSON object containing exactly these keys:
        - "query": the search query string
        - "aspect": the aspect of the topic this query covers
        - "rationale": one sentence on why the query is relevant

        Example:
        {"query": "solid-state battery electrolyte materials 2024",
         "aspect": "materials",
         "rationale": "Electrolyte chemistry determines safety and energy density"}
        """)
  @UserMessage("Generate a query for web search:")
  GeneratedQuery writeQuery(@V("topic") String topic);
}
