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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static java.lang.String.format;

/**
 * {@link ToolProvider} over Spring AI {@link ToolCallback}s. The {@code think_tool} is
 * always registered.
 */
public class ToolCallbackRegistry implements ToolProvider {

	private static final Logger log = LoggerFactory.getLogger(ToolCallbackRegistry.class);

	private final Map<String, ToolCallback> callbacks = new LinkedHashMap<>();

	public ToolCallbackRegistry(List<ToolCallback> toolCallbacks) {
		register(ThinkTool.create());
		for (ToolCallback callback : toolCallbacks) {
			register(callback);
		}
	}

	private void register(ToolCallback callback) {
		String name = Objects.requireNonNull(callback, "toolCallback cannot be null").getToolDefinition().name();
		if (callbacks.putIfAbsent(name, callback) != null && !ThinkTool.NAME.equals(name)) {
			throw new IllegalArgumentException(format("tool '%s' is registered twice", name));
		}
	}

	@Override
	public String invoke(String toolName, String arguments) {
		ToolCallback callback = callbacks.get(toolName);
		if (callback == null) {
			throw new IllegalArgumentException(format("tool '%s' is not registered", toolName));
		}
		log.debug("Invoking tool {}", toolName);
		return callback.call(arguments != null && !arguments.isBlank() ? arguments : "{}");
	}

	@Override
	public boolean hasTool(String toolName) {
		return callbacks.containsKey(toolName);
	}

	@Override
	public Set<String> toolNames() {
		return Collections.unmodifiableSet(callbacks.keySet());
	}

	@Override
	public List<ToolCallback> toolCallbacks(Collection<String> toolNames) {
		List<ToolCallback> result = new ArrayList<>();
		for (String name : toolNames) {
			ToolCallback callback = callbacks.get(name);
			if (callback != null) {
				result.add(callback);
			}
		}
		return result;
	}

}
