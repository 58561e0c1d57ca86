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
import com.deepdive.ai.graph.action.NodeAction;
import com.deepdive.ai.graph.agent.model.InferencePurpose;
import com.deepdive.ai.graph.agent.model.InferenceRequest;
import com.deepdive.ai.graph.agent.model.ModelInference;
import com.deepdive.ai.graph.agent.model.ModelInferenceException;
import com.deepdive.ai.graph.agent.state.ConversationMessage;
import com.deepdive.ai.graph.agent.state.ResearchState;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

import static com.deepdive.ai.graph.checkpoint.BaseCheckpointSaver.THREAD_ID_DEFAULT;

/**
 * Base of the pipeline nodes that call the model.
 */
public abstract class AbstractModelNode implements NodeAction<ResearchState> {

	protected final ModelInference modelInference;

	protected AbstractModelNode(ModelInference modelInference) {
		this.modelInference = Objects.requireNonNull(modelInference, "modelInference cannot be null");
	}

	/**
	 * Calls the model and returns the text of its answer.
	 * @throws ModelInferenceException if the answer has no text
	 */
	protected String complete(InferencePurpose purpose, List<Message> messages) {
		AssistantMessage reply = modelInference.infer(InferenceRequest.of(purpose, messages));
		if (reply == null || reply.getText() == null || reply.getText().isBlank()) {
			throw new ModelInferenceException("model returned an empty answer for " + purpose);
		}
		return reply.getText().strip();
	}

	/**
	 * @return what the user said so far, as model messages
	 */
	protected static List<Message> userMessages(ResearchState state) {
		return state.getMessages()
			.stream()
			.filter(message -> message.role() == ConversationMessage.Role.USER)
			.map(ConversationMessage::toMessage)
			.toList();
	}

	protected static String threadIdOf(RunnableConfig config) {
		return config.threadId().orElse(THREAD_ID_DEFAULT);
	}

	protected static String today() {
		return LocalDate.now().toString();
	}

}
