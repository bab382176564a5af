package com.flamingo.ai.deepresearch.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that folds web and video evidence into the running research summary. Backed by the
 * free-text chat model; output may contain {@code <think>} reasoning spans that the caller strips.
 */
public interface SummarizerAgent {

  String INSTRUCTIONS =
      """
        <GOAL>
        Write a concise, high-quality summary of the search results that stays on the user's topic.
        Results come from web pages and from YouTube video transcripts.
        </GOAL>

        <REQUIREMENTS>
        When writing a NEW summary:
        1. Lead with the information most relevant to the topic.
        2. Keep a coherent flow between paragraphs.

        When EXTENDING an existing summary:
        1. Read the existing summary and the new results carefully.
        2. Merge new facts that relate to existing points into the matching paragraph.
        3. Add a new paragraph, with a smooth transition, for relevant facts not covered yet.
        4. Skip anything unrelated to the topic.
        5. Make sure the result differs from the existing summary.
        </REQUIREMENTS>

        <FORMATTING>
        Start directly with the summary text. No preamble, no titles, no XML tags.
        </FORMATTING>
        """;

  @SystemMessage(INSTRUCTIONS)
  @UserMessage(
      """
        <User Input>
        {{topic}}
        </User Input>

        <Web Search Results>
        {{webResults}}
        </Web Search Results>

        <YouTube Search Results>
        {{videoResults}}
        </YouTube Search Results>
        """)
  String summarize(
      @V("topic") String topic,
      @V("webResults") String webResults,
      @V("videoResults") String videoResults);

  @SystemMessage(INSTRUCTIONS)
  @UserMessage(
      """
        <User Input>
        {{topic}}
        </User Input>

        <Existing Summary>
        {{existingSummary}}
        </Existing Summary>

        <New Web Search Results>
        {{webResults}}
        </New Web Search Results>

        <YouTube Search Results>
        {{videoResults}}
        </YouTube Search Results>
        """)
  String extendSummary(
      @V("topic") String topic,
      @V("existingSummary") String existingSummary,
      @V("webResults") String webResults,
      @V("videoResults") String videoResults);
}
