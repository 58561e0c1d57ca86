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

import com.deepdive.ai.graph.agent.interceptor.journal.ToolInvocationJournal;

import java.util.List;
import java.util.Objects;

/**
 * Everything a research task needs to run its tool loop.
 *
 * @param threadId the thread the task belongs to
 * @param taskId the task id
 * @param topic the research topic
 * @param round the research round
 * @param brief the research brief, may be {@code null}
 * @param assignedTools the names of the tools the task may call
 * @param journal the journal of the thread, {@code null} disables replay
 */
public record TaskContext(String threadId, String taskId, String topic, int round, String brief,
		List<String> assignedTools, ToolInvocationJournal journal) {

	public TaskContext {
		Objects.requireNonNull(taskId, "taskId cannot be null");
		Objects.requireNonNull(topic, "topic cannot be null");
		assignedTools = List.copyOf(assignedTools);
	}

}
