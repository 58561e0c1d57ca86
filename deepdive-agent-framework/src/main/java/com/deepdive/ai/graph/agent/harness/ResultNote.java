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
package com.deepdive.ai.graph.agent.harness;

import java.util.List;

/**
 * Outcome of the tool loop of a research task.
 *
 * @param taskId the task id
 * @param topic the research topic
 * @param content the final answer, or the best partial answer when truncated
 * @param observations the tool results, in the order they were fed back to the model
 * @param toolInvocations how many tool calls were performed
 * @param truncated whether tool calls were dropped because the budget was spent
 */
public record ResultNote(String taskId, String topic, String content, List<String> observations,
		int toolInvocations, boolean truncated) {

	public ResultNote {
		observations = List.copyOf(observations);
	}

}
