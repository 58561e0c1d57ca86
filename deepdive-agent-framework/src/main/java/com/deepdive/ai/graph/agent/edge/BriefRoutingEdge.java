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
package com.deepdive.ai.graph.agent.edge;

import com.deepdive.ai.graph.action.EdgeAction;
import com.deepdive.ai.graph.agent.state.ResearchState;

/**
 * Loops back to the brief writer until the brief is valid or its revisions are spent.
 */
public class BriefRoutingEdge implements EdgeAction<ResearchState> {

	public static final String REVISE = "revise";

	public static final String PROCEED = "proceed";

	@Override
	public String apply(ResearchState state) {
		return state.isBriefValid() || state.isBriefCapHit() ? PROCEED : REVISE;
	}

}
