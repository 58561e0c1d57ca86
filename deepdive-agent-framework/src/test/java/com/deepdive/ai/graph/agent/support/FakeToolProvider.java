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
package com.deepdive.ai.graph.agent.support;

import com.deepdive.ai.graph.agent.tool.ToolProvider;
import org.springframework.ai.tool.ToolCallback;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * In-memory tools counting their invocations.
 */
public class FakeToolProvider implements ToolProvider {

	private final Map<String, Function<String, String>> tools = new LinkedHashMap<>();

	private final Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();

	public FakeToolProvider tool(String name, Function<String, String> tool) {
		tools.put(name, tool);
		return this;
	}

	@Override
	public String invoke(String toolName, String arguments) {
		invocations.computeIfAbsent(toolName, name -> new AtomicInteger()).incrementAndGet();
		Function<String, String> tool = tools.get(toolName);
		if (tool == null) {
			throw new IllegalArgumentException("unknown tool " + toolName);
		}
		return tool.apply(arguments);
	}

	@Override
	public boolean hasTool(String toolName) {
		return tools.containsKey(toolName);
	}

	@Override
	public Set<String> toolNames() {
		return tools.keySet();
	}

	@Override
	public List<ToolCallback> toolCallbacks(Collection<String> toolNames) {
		return List.of();
	}

	public int invocations(String toolName) {
		AtomicInteger count = invocations.get(toolName);
		return count != null ? count.get() : 0;
	}

	public int totalInvocations() {
		return invocations.values().stream().mapToInt(AtomicInteger::get).sum();
	}

}
