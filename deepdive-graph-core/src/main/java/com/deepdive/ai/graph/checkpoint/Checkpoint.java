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
package com.deepdive.ai.graph.checkpoint;

import com.deepdive.ai.graph.RunStatus;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.Optional.ofNullable;

/**
 * The durable snapshot of one thread: its state as of the last completed node, the id
 * of that node and the status of the run. There is a single checkpoint per thread,
 * overwritten on every write.
 */
public class Checkpoint {

	private final String id;

	private final String threadId;

	private final Map<String, Object> state;

	private final String nodeId;

	private final RunStatus status;

	private final String error;

	private final Instant updatedAt;

	@JsonCreator
	private Checkpoint(@JsonProperty("id") String id, @JsonProperty("threadId") String threadId,
			@JsonProperty("state") Map<String, Object> state, @JsonProperty("nodeId") String nodeId,
			@JsonProperty("status") RunStatus status, @JsonProperty("error") String error,
			@JsonProperty("updatedAt") Instant updatedAt) {
		this.id = requireNonNull(id, "id cannot be null");
		this.threadId = requireNonNull(threadId, "threadId cannot be null");
		this.state = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(state, "state cannot be null")));
		this.nodeId = requireNonNull(nodeId, "nodeId cannot be null");
		this.status = requireNonNull(status, "status cannot be null");
		this.error = error;
		this.updatedAt = requireNonNull(updatedAt, "updatedAt cannot be null");
	}

	public static Builder builder() {
		return new Builder();
	}

	public String getId() {
		return id;
	}

	public String getThreadId() {
		return threadId;
	}

	public Map<String, Object> getState() {
		return state;
	}

	/**
	 * @return the id of the last node that completed, or {@code __START__} when none has
	 */
	public String getNodeId() {
		return nodeId;
	}

	public RunStatus getStatus() {
		return status;
	}

	public Optional<String> getError() {
		return ofNullable(error);
	}

	public Instant getUpdatedAt() {
		return updatedAt;
	}

	@Override
	public String toString() {
		return format("Checkpoint{id=%s, threadId=%s, nodeId=%s, status=%s, updatedAt=%s}", id, threadId, nodeId,
				status, updatedAt);
	}

	public static class Builder {

		private String threadId;

		private Map<String, Object> state;

		private String nodeId;

		private RunStatus status = RunStatus.RUNNING;

		private String error;

		private Instant updatedAt;

		public Builder threadId(String threadId) {
			this.threadId = threadId;
			return this;
		}

		public Builder state(Map<String, Object> state) {
			this.state = state;
			return this;
		}

		public Builder nodeId(String nodeId) {
			this.nodeId = nodeId;
			return this;
		}

		public Builder status(RunStatus status) {
			this.status = status;
			return this;
		}

		public Builder error(String error) {
			this.error = error;
			return this;
		}

		public Builder updatedAt(Instant updatedAt) {
			this.updatedAt = updatedAt;
			return this;
		}

		public Checkpoint build() {
			return new Checkpoint(UUID.randomUUID().toString(), threadId, state, nodeId, status, error,
					updatedAt != null ? updatedAt : Instant.now());
		}

	}

}
