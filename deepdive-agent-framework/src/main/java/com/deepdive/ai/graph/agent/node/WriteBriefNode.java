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
import com.deepdive.ai.graph.agent.state.ResearchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes the research brief, taking the revision hint of a failed validation into
 * account.
 */
public class WriteBriefNode extends AbstractModelNode {

	private static final Logger log = LoggerFactory.getLogger(WriteBriefNode.class);

	private final int minQuestions;

	private final int maxQuestions;

	private final List<String> requiredSections;

	public WriteBriefNode(ModelInference modelInference, int minQuestions, int maxQuestions,
			List<String> requiredSections) {
		super(modelInference);
		this.minQuestions = minQuestions;
		this.maxQuestions = maxQuestions;
		this.requiredSections = List.copyOf(requiredSections);
	}

	@Override
	public ResearchState apply(ResearchState state, RunnableConfig config) {
		String system = ResearchPrompts.render(ResearchPrompts.WRITE_BRIEF,
				Map.of("date", today(), "query", state.getQuery(), "focus", state.getFocus().orElse("none"),
						"sections", String.join(", ", requiredSections), "minQuestions", minQuestions, "maxQuestions",
						maxQuestions));
		List<Message> messages = new ArrayList<>();
		messages.add(new SystemMessage(system));
		messages.addAll(userMessages(state));
		boolean revising = state.getBriefRevisionHint() != null && state.getBriefRevisions() > 0;
		if (revising) {
			messages.add(new UserMessage(ResearchPrompts.render(ResearchPrompts.BRIEF_REVISION,
					Map.of("issues", state.getBriefRevisionHint()))));
		}

		state.setBrief(complete(InferencePurpose.WRITE_BRIEF, messages));
		state.setBriefValid(false);
		log.info("[ThreadId {}] brief {}", threadIdOf(config),
				revising ? "revised (revision " + state.getBriefRevisions() + ")" : "written");
		return state;
	}

}
