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
package com.deepdive.ai.graph.agent.tool;

import org.springframework.ai.tool.ToolCallback;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Source of the tools research tasks may call.
 */
public interface ToolProvider {

	/**
	 * Invokes a tool.
	 * @param toolName the tool to call
	 * @param arguments the JSON arguments produced by the model
	 * @return the tool output
	 * @throws RuntimeException when the tool fails
	 */
	String invoke(String toolName, String arguments);

	boolean hasTool(String toolName);

	Set<String> toolNames();

	/**
	 * @return the callbacks advertised to the model for the given tool names, unknown
	 * names are skipped
	 */
	List<ToolCallback> toolCallbacks(Collection<String> toolNames);

}
