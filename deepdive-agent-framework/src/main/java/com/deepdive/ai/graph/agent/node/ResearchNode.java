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
package com.deepdive.ai.graph.agent.node;

import com.deepdive.ai.graph.RunnableConfig;
import com.deepdive.ai.graph.action.NodeAction;
import com.deepdive.ai.graph.agent.coordinator.SubWorkflowCoordinator;
import com.deepdive.ai.graph.agent.state.ResearchState;

import java.util.Objects;

/**
 * Hands the research stage to the {@link SubWorkflowCoordinator} and waits for it to
 * gather.
 */
public class ResearchNode implements NodeAction<ResearchState> {

	private final SubWorkflowCoordinator coordinator;

	public ResearchNode(SubWorkflowCoordinator coordinator) {
		this.coordinator = Objects.requireNonNull(coordinator, "coordinator cannot be null");
	}

	@Override
	public ResearchState apply(ResearchState state, RunnableConfig config) {
		return coordinator.coordinate(state, config);
	}

}
