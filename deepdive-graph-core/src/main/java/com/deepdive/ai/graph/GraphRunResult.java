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
package com.deepdive.ai.graph;

import com.deepdive.ai.graph.exception.GraphRunnerException;

import java.util.Objects;
import java.util.Optional;

import static java.util.Optional.ofNullable;

/**
 * Outcome of a graph invocation: the state as last persisted, the status of the thread
 * and, for failed runs, the error that aborted it.
 *
 * @param <S> the graph state type
 */
public final class GraphRunResult<S> {

	private final String threadId;

	private final S state;

	private final RunStatus status;

	private final String lastNodeId;

	private final GraphRunnerException error;

	private GraphRunResult(String threadId, S state, RunStatus status, String lastNodeId,
			GraphRunnerException error) {
		this.threadId = Objects.requireNonNull(threadId, "threadId cannot be null");
		this.state = state;
		this.status = Objects.requireNonNull(status, "status cannot be null");
		this.lastNodeId = lastNodeId;
		this.error = error;
	}

	public static <S> GraphRunResult<S> of(String threadId, S state, RunStatus status, String lastNodeId) {
		return new GraphRunResult<>(threadId, state, status, lastNodeId, null);
	}

	public static <S> GraphRunResult<S> failed(String threadId, S state, String lastNodeId,
			GraphRunnerException error) {
		return new GraphRunResult<>(threadId, state, RunStatus.FAILED, lastNodeId,
				Objects.requireNonNull(error, "error cannot be null"));
	}

	public String threadId() {
		return threadId;
	}

	public S state() {
		return state;
	}

	public RunStatus status() {
		return status;
	}

	public String lastNodeId() {
		return lastNodeId;
	}

	public Optional<GraphRunnerException> error() {
		return ofNullable(error);
	}

	public boolean isCompleted() {
		return status == RunStatus.COMPLETED;
	}

	@Override
	public String toString() {
		return "GraphRunResult{threadId=" + threadId + ", status=" + status + ", lastNodeId=" + lastNodeId
				+ (error != null ? ", error=" + error.getMessage() : "") + '}';
	}

}
