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

import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.tool.ToolCallback;

import java.util.List;
import java.util.Objects;

/**
 * A single model call.
 *
 * @param purpose the pipeline step issuing the call
 * @param messages the conversation sent to the model
 * @param tools the tools the model may request, only their definitions are used
 */
public record InferenceRequest(InferencePurpose purpose, List<Message> messages, List<ToolCallback> tools) {

	public InferenceRequest {
		Objects.requireNonNull(purpose, "purpose cannot be null");
		messages = List.copyOf(messages);
		tools = tools != null ? List.copyOf(tools) : List.of();
	}

	public static InferenceRequest of(InferencePurpose purpose, List<Message> messages) {
		return new InferenceRequest(purpose, messages, List.of());
	}

	public boolean hasTools() {
		return !tools.isEmpty();
	}

}
