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

/**
 * Ids of the nodes of the research graph, in pipeline order.
 */
public final class ResearchNodes {

	public static final String CLARIFY = "clarify";

	public static final String WRITE_BRIEF = "write_brief";

	public static final String VALIDATE_BRIEF = "validate_brief";

	public static final String RESEARCH = "research";

	public static final String GENERATE_REPORT = "generate_report";

	public static final String QUALITY_CONTROL = "quality_control";

	private ResearchNodes() {
	}

}
