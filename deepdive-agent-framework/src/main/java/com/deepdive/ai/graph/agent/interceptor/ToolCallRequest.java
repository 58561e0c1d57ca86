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
package com.deepdive.ai.graph.agent.interceptor;

import org.springframework.ai.chat.messages.AssistantMessage;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A tool call requested by the model on behalf of a research task.
 */
public class ToolCallRequest {

	private final String toolName;

	private final String arguments;

	private final String toolCallId;

	private final String threadId;

	private final String taskId;

	private final String topic;

	private final Map<String, Object> context;

	private ToolCallRequest(Builder builder) {
		this.toolName = builder.toolName;
		this.arguments = builder.arguments != null ? builder.arguments : "";
		this.toolCallId = builder.toolCallId;
		this.threadId = builder.threadId;
		this.taskId = builder.taskId;
		this.topic = builder.topic;
		this.context = builder.context != null ? Collections.unmodifiableMap(new HashMap<>(builder.context))
				: Collections.emptyMap();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static Builder builder(ToolCallRequest request) {
		return new Builder().toolName(request.toolName)
			.arguments(request.arguments)
			.toolCallId(request.toolCallId)
			.threadId(request.threadId)
			.taskId(request.taskId)
			.topic(request.topic)
			.context(request.context);
	}

	public String getToolName() {
		return toolName;
	}

	public String getArguments() {
		return arguments;
	}

	public String getToolCallId() {
		return toolCallId;
	}

	public String getThreadId() {
		return threadId;
	}

	public String getTaskId() {
		return taskId;
	}

	public String getTopic() {
		return topic;
	}

	public Map<String, Object> getContext() {
		return context;
	}

	@Override
	public String toString() {
		return "ToolCallRequest{tool=" + toolName + ", taskId=" + taskId + ", toolCallId=" + toolCallId + '}';
	}

	public static class Builder {

		private String toolName;

		private String arguments;

		private String toolCallId;

		private String threadId;

		private String taskId;

		private String topic;

		private Map<String, Object> context;

		public Builder toolCall(AssistantMessage.ToolCall toolCall) {
			this.toolName = toolCall.name();
			this.arguments = toolCall.arguments();
			this.toolCallId = toolCall.id();
			return this;
		}

		public Builder toolName(String toolName) {
			this.toolName = toolName;
			return this;
		}

		public Builder arguments(String arguments) {
			this.arguments = arguments;
			return this;
		}

		public Builder toolCallId(String toolCallId) {
			this.toolCallId = toolCallId;
			return this;
		}

		public Builder threadId(String threadId) {
			this.threadId = threadId;
			return this;
		}

		public Builder taskId(String taskId) {
			this.taskId = taskId;
			return this;
		}

		public Builder topic(String topic) {
			this.topic = topic;
			return this;
		}

		public Builder context(Map<String, Object> context) {
			this.context = context;
			return this;
		}

		public ToolCallRequest build() {
			return new ToolCallRequest(this);
		}

	}

}
