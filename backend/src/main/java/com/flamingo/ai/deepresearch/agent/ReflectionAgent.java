package com.flamingo.ai.deepresearch.agent;

import com.flamingo.ai.deepresearch.agent.dto.ReflectionResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that finds a knowledge gap in the running summary and proposes a follow-up query. */
public interface ReflectionAgent {

  @SystemMessage(
      """
        You are an expert research assistant analyzing a summary about {{topic}}.

        <GOAL>
        1. Identify a knowledge gap or an area that needs deeper exploration.
        2. Write a follow-up question that would close that gap.
        3. Prefer technical details, implementation specifics or emerging trends the summary
           does not cover yet.
        </GOAL>

        <REQUIREMENTS>
        The follow-up question must be self-contained and usable as a web search query.
        </REQUIREMENTS>

        Respond with a JSON object containing exactly these keys:
        - "knowledgeGap": what information is missing or unclear
        - "followUpQuery": a specific question addressing the gap
        """)
  @UserMessage(
      """
        Identify a knowledge gap and generate a follow-up web search query based on our
        existing knowledge:
        {{summary}}
        """)
  ReflectionResult reflect(@V("topic") String topic, @V("summary") String summary);
}
