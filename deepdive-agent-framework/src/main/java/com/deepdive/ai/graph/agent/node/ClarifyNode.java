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
import com.deepdive.ai.graph.agent.state.ConversationMessage;
import com.deepdive.ai.graph.agent.state.ResearchState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Asks the model whether the request needs clarification. When it does, the question
 * is stored in the state and the run ends waiting for the user's answer.
 */
public class ClarifyNode extends AbstractModelNode {

	private static final Logger log = LoggerFactory.getLogger(ClarifyNode.class);

	private final boolean allowClarification;

	private final int maxClarifications;

	private final ObjectMapper objectMapper = new ObjectMapper();

	public ClarifyNode(ModelInference modelInference, boolean allowClarification, int maxClarifications) {
		super(modelInference);
		this.allowClarification = allowClarification;
		this.maxClarifications = maxClarifications;
	}

	@Override
	public ResearchState apply(ResearchState state, RunnableConfig config) {
		state.setAwaitingClarification(false);
		if (!allowClarification || state.getClarificationRounds() >= maxClarifications) {
			return state;
		}

		List<Message> messages = new ArrayList<>();
		messages.add(new SystemMessage(ResearchPrompts.render(ResearchPrompts.CLARIFY, Map.of("date", today()))));
		state.getMessages().stream().map(ConversationMessage::toMessage).forEach(messages::add);
		String answer = complete(InferencePurpose.CLARIFY, messages);

		Optional<String> question = parseQuestion(answer);
		if (question.isEmpty()) {
			log.debug("[ThreadId {}] no clarification needed", threadIdOf(config));
			return state;
		}
		log.info("[ThreadId {}] asking for clarification", threadIdOf(config));
		state.setAwaitingClarification(true);
		state.setClarificationQuestion(question.get());
		state.setClarificationRounds(state.getClarificationRounds() + 1);
		state.addMessage(ConversationMessage.assistant(question.get()));
		return state;
	}

	/**
	 * Reads the {@code need_clarification} answer. Anything unparseable means proceed.
	 */
	Optional<String> parseQuestion(String answer) {
		int start = answer.indexOf('{');
		int end = answer.lastIndexOf('}');
		if (start < 0 || end <= start) {
			log.warn("Clarification answer is not a JSON object, proceeding without clarification");
			return Optional.empty();
		}
		try {
			JsonNode json = objectMapper.readTree(answer.substring(start, end + 1));
			if (!json.path("need_clarification").asBoolean(false)) {
				return Optional.empty();
			}
			String question = json.path("question").asText("").strip();
			return question.isEmpty() ? Optional.empty() : Optional.of(question);
		}
		catch (JsonProcessingException ex) {
			log.warn("Cannot parse clarification answer, proceeding without clarification: {}", ex.getMessage());
			return Optional.empty();
		}
	}

}
