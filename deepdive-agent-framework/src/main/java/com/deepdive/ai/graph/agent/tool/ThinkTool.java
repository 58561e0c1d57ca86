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

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.function.FunctionToolCallback;

import java.util.function.Function;

/**
 * Scratchpad tool: records a reflection and returns it to the model.
 */
public final class ThinkTool {

	public static final String NAME = "think_tool";

	public static final String DESCRIPTION = "Record a short reflection on progress, gaps and next steps "
			+ "before deciding what to do next.";

	public record Input(@JsonPropertyDescription("The reflection to record") String reflection) {
	}

	private ThinkTool() {
	}

	public static String reflect(String reflection) {
		return "Reflection recorded: " + (reflection != null ? reflection : "");
	}

	public static ToolCallback create() {
		Function<Input, String> function = input -> reflect(input != null ? input.reflection() : null);
		return FunctionToolCallback.builder(NAME, function)
			.description(DESCRIPTION)
			.inputType(Input.class)
			.toolCallResultConverter(new PlainTextToolCallResultConverter())
			.build();
	}

}
