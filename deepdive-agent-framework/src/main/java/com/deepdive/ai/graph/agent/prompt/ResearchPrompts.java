/*
 * Copyright 2024-2025 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.deepdive.ai.graph.agent.prompt;

import org.springframework.ai.chat.prompt.PromptTemplate;

import java.util.Map;

/**
 * Prompt templates of the research pipeline, rendered with Spring AI's
 * {@link PromptTemplate}. Templates use {@code {name}} placeholders and contain no other
 * braces.
 */
public final class ResearchPrompts {

	public static final String CLARIFY = """
			You screen research requests before any work starts. Today is {date}.
			Decide whether the request below is too ambiguous to research as stated.
			Reply with a single JSON object with two keys: need_clarification, a boolean, and question, \
			the one question you would ask the user. Ask only when essential information is missing.
			""";

	public static final String WRITE_BRIEF = """
			You are the lead researcher planning an investigation. Today is {date}.
			Request: {query}
			Focus area: {focus}

			Write a research brief in Markdown. It must contain these sections: {sections}.
			Include between {minQuestions} and {maxQuestions} specific investigative questions, \
			each on its own line and ending with a question mark.
			""";

	public static final String BRIEF_REVISION = """
			The previous brief was rejected. Revise it to fix these issues:
			{issues}
			""";

	public static final String SUPERVISE = """
			You lead a research team working from the brief below. This is round {round} of at most {maxRounds}.
			Delegate research with conduct_research, one call per topic, at most {maxConcurrent} per round.
			Use think_tool to reflect on gaps. Call research_complete when the findings cover the brief.

			Brief:
			{brief}

			Findings so far:
			{findings}
			""";

	public static final String RESEARCH = """
			You research a single topic with the tools available to you.
			Topic: {topic}

			Context from the research brief:
			{brief}

			Stop calling tools as soon as you can answer. Answer with your findings and cite every source.
			""";

	public static final String COMPRESS = """
			Rewrite the research findings below into a clean, deduplicated set of notes about: {topic}
			Keep every fact, figure and source reference. Do not add information.

			Findings:
			{findings}
			""";

	public static final String REPORT = """
			Write the final research report for this request: {query}
			Focus area: {focus}

			Use the research brief and the notes below. Cite sources inline as [1], [2] and so on, \
			and end the report with a "## Sources" section listing each cited source as a numbered entry.

			Brief:
			{brief}

			Notes:
			{notes}
			""";

	public static final String REPORT_REVISION = """
			The previous report failed the quality check. Fix these issues:
			{issues}
			""";

	public static final String SUMMARY = """
			Write a short executive summary, one paragraph, of the report below.

			{report}
			""";

	private ResearchPrompts() {
	}

	public static String render(String template, Map<String, Object> variables) {
		return new PromptTemplate(template).render(variables);
	}

}
