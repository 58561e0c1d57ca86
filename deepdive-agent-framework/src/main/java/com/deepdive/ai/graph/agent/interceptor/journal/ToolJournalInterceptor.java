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
package com.deepdive.ai.graph.agent.interceptor.journal;

import com.deepdive.ai.graph.agent.interceptor.ToolCallHandler;
import com.deepdive.ai.graph.agent.interceptor.ToolCallRequest;
import com.deepdive.ai.graph.agent.interceptor.ToolCallResponse;
import com.deepdive.ai.graph.agent.interceptor.ToolInterceptor;

/**
 * Answers a tool call from the {@link ToolInvocationJournal} of its thread when the
 * same call was already made or is still in flight, and records the outcome of new
 * calls. The journal is taken from the request context, calls without one pass through.
 */
public class ToolJournalInterceptor extends ToolInterceptor {

	@Override
	public ToolCallResponse interceptToolCall(ToolCallRequest request, ToolCallHandler handler) {
		Object value = request.getContext().get(ToolInvocationJournal.METADATA_KEY);
		if (!(value instanceof ToolInvocationJournal journal)) {
			return handler.call(request);
		}
		return journal.invoke(request, handler);
	}

	@Override
	public String getName() {
		return "ToolJournal";
	}

}
