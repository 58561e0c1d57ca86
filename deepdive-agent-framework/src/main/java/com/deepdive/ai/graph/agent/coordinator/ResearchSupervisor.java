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

import com.deepdive.ai.graph.agent.state.ResearchState;

/**
 * The decision step of the research sub-workflow: proposes the topics of the next
 * round, or declares the research complete.
 */
@FunctionalInterface
public interface ResearchSupervisor {

	/**
	 * @param state the state of the thread, not to be modified
	 * @param round the 1-based number of the round about to start
	 * @param maxConcurrent how many topics the round can take
	 */
	SupervisorDecision decide(ResearchState state, int round, int maxConcurrent);

}
