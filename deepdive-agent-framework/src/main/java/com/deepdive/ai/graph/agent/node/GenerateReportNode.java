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
package com.deepdive.ai.graph.agent.node;

import com.deepdive.ai.graph.RunnableConfig;
import com.deepdive.ai.graph.agent.model.InferencePurpose;
import com.deepdive.ai.graph.agent.model.ModelInference;
import com.deepdive.ai.graph.agent.prompt.ResearchPrompts;
import com.deepdive.ai.graph.agent.state.Note;
import com.deepdive.ai.graph.agent.state.ResearchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Writes the report from the research notes, then its executive summary.
 */
public class GenerateReportNode extends AbstractModelNode {

	private static final Logger log = LoggerFactory.getLogger(GenerateReportNode.class);

	public static final String NO_FINDINGS_REPORT = "No research findings available.";

	public GenerateReportNode(ModelInference modelInference) {
		super(modelInference);
	}

	@Override
	public ResearchState apply(ResearchState state, RunnableConfig config) {
		String threadId = threadIdOf(config);
		state.setReportValid(false);
		if (state.getCompressedNotes().isEmpty() && state.getRawNotes().isEmpty()) {
			log.warn("[ThreadId {}] no research notes, writing empty report", threadId);
			state.setReport(NO_FINDINGS_REPORT);
			state.setExecutiveSummary(NO_FINDINGS_REPORT);
			return state;
		}

		List<Message> messages = new ArrayList<>();
		messages.add(new SystemMessage(ResearchPrompts.render(ResearchPrompts.REPORT,
				Map.of("query", state.getQuery(), "focus", state.getFocus().orElse("none"), "brief",
						Objects.toString(state.getBrief(), ""), "notes", formatNotes(state)))));
		messages.addAll(userMessages(state));
		boolean revising = state.getReportRevisionHint() != null && state.getReportRevisions() > 0;
		if (revising) {
			messages.add(new UserMessage(ResearchPrompts.render(ResearchPrompts.REPORT_REVISION,
					Map.of("issues", state.getReportRevisionHint()))));
		}
		String report = complete(InferencePurpose.REPORT, messages);
		state.setReport(report);
		state.setExecutiveSummary(summarize(threadId, report));
		log.info("[ThreadId {}] report {}", threadId,
				revising ? "revised (revision " + state.getReportRevisions() + ")" : "written");
		return state;
	}

	private String summarize(String threadId, String report) {
		try {
			return complete(InferencePurpose.SUMMARY, List.of(
					new UserMessage(ResearchPrompts.render(ResearchPrompts.SUMMARY, Map.of("report", report)))));
		}
		catch (RuntimeException ex) {
			log.warn("[ThreadId {}] executive summary failed, using first paragraph of the report: {}", threadId,
					ex.getMessage());
			return firstParagraph(report);
		}
	}

	static String formatNotes(ResearchState state) {
		List<Note> notes = state.getCompressedNotes().isEmpty() ? state.getRawNotes() : state.getCompressedNotes();
		return notes.stream()
			.map(note -> "### " + note.topic() + (note.truncated() ? " (partial)" : "") + "\n" + note.content())
			.collect(Collectors.joining("\n\n"));
	}

	/**
	 * @return the first paragraph that is not a heading, or the first paragraph
	 */
	static String firstParagraph(String report) {
		String[] paragraphs = report.strip().split("\\R\\s*\\R");
		for (String paragraph : paragraphs) {
			String stripped = paragraph.strip();
			if (!stripped.isEmpty() && !stripped.startsWith("#")) {
				return stripped;
			}
		}
		return paragraphs[0].strip();
	}

}
