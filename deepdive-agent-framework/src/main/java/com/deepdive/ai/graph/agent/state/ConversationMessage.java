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
package com.deepdive.ai.graph.agent.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.Objects;

/**
 * An entry of the append-only conversation log kept in {@link ResearchState}.
 */
public record ConversationMessage(Role role, String content) {

	public enum Role {

		USER, ASSISTANT, SYSTEM

	}

	@JsonCreator
	public ConversationMessage(@JsonProperty("role") Role role, @JsonProperty("content") String content) {
		this.role = Objects.requireNonNull(role, "role cannot be null");
		this.content = content != null ? content : "";
	}

	public static ConversationMessage user(String content) {
		return new ConversationMessage(Role.USER, content);
	}

	public static ConversationMessage assistant(String content) {
		return new ConversationMessage(Role.ASSISTANT, content);
	}

	public static ConversationMessage system(String content) {
		return new ConversationMessage(Role.SYSTEM, content);
	}

	/**
	 * Converts the entry to the Spring AI message sent to the model.
	 */
	public Message toMessage() {
		return switch (role) {
			case USER -> new UserMessage(content);
			case ASSISTANT -> new AssistantMessage(content);
			case SYSTEM -> new SystemMessage(content);
		};
	}

}
