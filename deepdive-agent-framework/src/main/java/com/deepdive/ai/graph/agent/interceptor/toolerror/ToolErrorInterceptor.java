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
package com.deepdive.ai.graph.agent.interceptor.toolerror;

import com.deepdive.ai.graph.agent.interceptor.ToolCallHandler;
import com.deepdive.ai.graph.agent.interceptor.ToolCallRequest;
import com.deepdive.ai.graph.agent.interceptor.ToolCallResponse;
import com.deepdive.ai.graph.agent.interceptor.ToolInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a failing tool call into an observation the model can react to.
 */
public class ToolErrorInterceptor extends ToolInterceptor {

	private static final Logger log = LoggerFactory.getLogger(ToolErrorInterceptor.class);

	public static final String ERROR_PREFIX = "Tool failed: ";

	@Override
	public ToolCallResponse interceptToolCall(ToolCallRequest request, ToolCallHandler handler) {
		try {
			return handler.call(request);
		}
		catch (Exception e) {
			log.warn("[TaskId {}] tool '{}' failed: {}", request.getTaskId(), request.getToolName(), e.getMessage());
			String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
			return ToolCallResponse.error(request.getToolCallId(), request.getToolName(), ERROR_PREFIX + message);
		}
	}

	@Override
	public String getName() {
		return "ToolError";
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		public ToolErrorInterceptor build() {
			return new ToolErrorInterceptor();
		}

	}

}
