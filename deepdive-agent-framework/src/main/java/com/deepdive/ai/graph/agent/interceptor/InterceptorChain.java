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

import java.util.List;

/**
 * Chains tool interceptors around a base handler. The first interceptor in the list
 * becomes the outermost layer.
 */
public final class InterceptorChain {

	private InterceptorChain() {
	}

	/**
	 * Chain multiple ToolInterceptors into a single handler.
	 *
	 * <pre>
	 * [journal, error, retry] + provider
	 * request  -> journal -> error -> retry -> provider
	 * response <- journal <- error <- retry <- provider
	 * </pre>
	 * @param interceptors interceptors, outermost first
	 * @param baseHandler the handler that invokes the tool
	 * @return a composed handler, or the base handler if there are no interceptors
	 */
	public static ToolCallHandler chainToolInterceptors(List<ToolInterceptor> interceptors,
			ToolCallHandler baseHandler) {
		if (interceptors == null || interceptors.isEmpty()) {
			return baseHandler;
		}
		ToolCallHandler current = baseHandler;
		for (int i = interceptors.size() - 1; i >= 0; i--) {
			ToolInterceptor interceptor = interceptors.get(i);
			ToolCallHandler nextHandler = current;
			current = request -> interceptor.interceptToolCall(request, nextHandler);
		}
		return current;
	}

}
