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
package com.deepdive.ai.graph.agent.coordinator;

import java.util.List;

/**
 * What the supervisor wants to happen in a research round.
 *
 * @param topics the topics to research, in the order proposed
 * @param complete whether the research phase should end
 * @param reflections reflections recorded by the supervisor during the decision
 */
public record SupervisorDecision(List<String> topics, boolean complete, List<String> reflections) {

	public SupervisorDecision {
		topics = List.copyOf(topics);
		reflections = List.copyOf(reflections);
	}

	public static SupervisorDecision research(List<String> topics) {
		return new SupervisorDecision(topics, topics.isEmpty(), List.of());
	}

	public static SupervisorDecision done() {
		return new SupervisorDecision(List.of(), true, List.of());
	}

}
