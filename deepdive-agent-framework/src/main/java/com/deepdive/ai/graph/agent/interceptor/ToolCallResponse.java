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

import org.springframework.ai.chat.messages.ToolResponseMessage;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a tool call. Failures are observations too, flagged with
 * {@link Status#ERROR}.
 */
public class ToolCallResponse {

	public enum Status {

		SUCCESS, ERROR, REPLAYED

	}

	private final String result;

	private final String toolName;

	private final String toolCallId;

	private final Status status;

	private final Map<String, Object> metadata;

	public ToolCallResponse(String result, String toolName, String toolCallId, Status status,
			Map<String, Object> metadata) {
		this.result = result != null ? result : "";
		this.toolName = toolName;
		this.toolCallId = toolCallId;
		this.status = Objects.requireNonNull(status, "status cannot be null");
		this.metadata = metadata != null ? new HashMap<>(metadata) : Collections.emptyMap();
	}

	public static ToolCallResponse of(String toolCallId, String toolName, String result) {
		return new ToolCallResponse(result, toolName, toolCallId, Status.SUCCESS, null);
	}

	public static ToolCallResponse error(String toolCallId, String toolName, String message) {
		return new ToolCallResponse(message, toolName, toolCallId, Status.ERROR, null);
	}

	/**
	 * @return a copy of this response answering another call with the same result
	 */
	public ToolCallResponse replayedFor(String toolCallId) {
		return new ToolCallResponse(result, toolName, toolCallId, Status.REPLAYED, metadata);
	}

	public String getResult() {
		return result;
	}

	public String getToolName() {
		return toolName;
	}

	public String getToolCallId() {
		return toolCallId;
	}

	public Status getStatus() {
		return status;
	}

	public boolean isError() {
		return status == Status.ERROR;
	}

	public Map<String, Object> getMetadata() {
		return Collections.unmodifiableMap(metadata);
	}

	public ToolResponseMessage.ToolResponse toToolResponse() {
		return new ToolResponseMessage.ToolResponse(toolCallId, toolName, result);
	}

	@Override
	public String toString() {
		return "ToolCallResponse{tool=" + toolName + ", toolCallId=" + toolCallId + ", status=" + status + '}';
	}

}
