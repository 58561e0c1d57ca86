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
package com.deepdive.ai.graph.agent.state;

import java.util.List;
import java.util.Objects;

import static java.lang.String.format;

/**
 * A unit of research launched by the coordinator. Lives only for the round that
 * launched it.
 */
public final class ResearchTask {

	private final String id;

	private final String topic;

	private final int round;

	private final List<String> assignedTools;

	private volatile TaskStatus status = TaskStatus.PENDING;

	public ResearchTask(String id, String topic, int round, List<String> assignedTools) {
		this.id = Objects.requireNonNull(id, "id cannot be null");
		this.topic = Objects.requireNonNull(topic, "topic cannot be null");
		this.round = round;
		this.assignedTools = List.copyOf(assignedTools);
	}

	/**
	 * Builds the id of the {@code index}-th task (1-based) of {@code round}. Ids sort in
	 * launch order.
	 */
	public static String taskId(int round, int index) {
		return format("round-%02d-task-%02d", round, index);
	}

	public String getId() {
		return id;
	}

	public String getTopic() {
		return topic;
	}

	public int getRound() {
		return round;
	}

	public List<String> getAssignedTools() {
		return assignedTools;
	}

	public TaskStatus getStatus() {
		return status;
	}

	public void setStatus(TaskStatus status) {
		this.status = status;
	}

	@Override
	public String toString() {
		return format("ResearchTask{id=%s, topic=%s, status=%s}", id, topic, status);
	}

}
