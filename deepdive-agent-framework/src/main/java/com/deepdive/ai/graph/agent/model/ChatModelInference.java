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
package com.deepdive.ai.graph.agent.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;

import java.util.Objects;

/**
 * {@link ModelInference} backed by a Spring AI {@link ChatModel}. Tool calls are
 * returned to the caller instead of being executed by the model layer.
 */
public class ChatModelInference implements ModelInference {

	private static final Logger log = LoggerFactory.getLogger(ChatModelInference.class);

	private final ChatModel chatModel;

	public ChatModelInference(ChatModel chatModel) {
		this.chatModel = Objects.requireNonNull(chatModel, "chatModel cannot be null");
	}

	@Override
	public AssistantMessage infer(InferenceRequest request) {
		ToolCallingChatOptions options = ToolCallingChatOptions.builder()
			.toolCallbacks(request.tools())
			.internalToolExecutionEnabled(false)
			.build();
		log.debug("Calling model for {} with {} message(s) and {} tool(s)", request.purpose(),
				request.messages().size(), request.tools().size());

		ChatResponse response = chatModel.call(new Prompt(request.messages(), options));
		if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
			throw new ModelInferenceException("model returned no generation for " + request.purpose());
		}
		return response.getResult().getOutput();
	}

}
