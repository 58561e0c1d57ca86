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

import com.deepdive.ai.graph.checkpoint.BaseCheckpointSaver;
import com.deepdive.ai.graph.checkpoint.savers.MemorySaver;
import io.micrometer.observation.ObservationRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Settings applied when a {@link StateGraph} is compiled.
 */
public final class CompileConfig {

	public static final int DEFAULT_MAX_ITERATIONS = 50;

	private final BaseCheckpointSaver checkpointSaver;

	private final NodePolicy defaultNodePolicy;

	private final int maxIterations;

	private final List<GraphLifecycleListener> lifecycleListeners;

	private final ObservationRegistry observationRegistry;

	private final ExecutorService nodeExecutorService;

	private CompileConfig(Builder builder) {
		this.checkpointSaver = builder.checkpointSaver != null ? builder.checkpointSaver : new MemorySaver();
		this.defaultNodePolicy = builder.defaultNodePolicy != null ? builder.defaultNodePolicy : NodePolicy.defaults();
		this.maxIterations = builder.maxIterations;
		this.lifecycleListeners = List.copyOf(builder.lifecycleListeners);
		this.observationRegistry = builder.observationRegistry != null ? builder.observationRegistry
				: ObservationRegistry.NOOP;
		this.nodeExecutorService = builder.nodeExecutorService != null ? builder.nodeExecutorService
				: Executors.newCachedThreadPool(daemonThreadFactory("graph-node-"));
	}

	public static Builder builder() {
		return new Builder();
	}

	public BaseCheckpointSaver checkpointSaver() {
		return checkpointSaver;
	}

	public NodePolicy defaultNodePolicy() {
		return defaultNodePolicy;
	}

	/**
	 * @return the maximum number of node executions in a single invocation
	 */
	public int maxIterations() {
		return maxIterations;
	}

	public List<GraphLifecycleListener> lifecycleListeners() {
		return lifecycleListeners;
	}

	public ObservationRegistry observationRegistry() {
		return observationRegistry;
	}

	public ExecutorService nodeExecutorService() {
		return nodeExecutorService;
	}

	public static ThreadFactory daemonThreadFactory(String prefix) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	public static class Builder {

		private BaseCheckpointSaver checkpointSaver;

		private NodePolicy defaultNodePolicy;

		private int maxIterations = DEFAULT_MAX_ITERATIONS;

		private final List<GraphLifecycleListener> lifecycleListeners = new ArrayList<>();

		private ObservationRegistry observationRegistry;

		private ExecutorService nodeExecutorService;

		public Builder checkpointSaver(BaseCheckpointSaver checkpointSaver) {
			this.checkpointSaver = checkpointSaver;
			return this;
		}

		public Builder defaultNodePolicy(NodePolicy defaultNodePolicy) {
			this.defaultNodePolicy = defaultNodePolicy;
			return this;
		}

		public Builder maxIterations(int maxIterations) {
			if (maxIterations < 1) {
				throw new IllegalArgumentException("maxIterations must be >= 1");
			}
			this.maxIterations = maxIterations;
			return this;
		}

		public Builder withLifecycleListener(GraphLifecycleListener listener) {
			this.lifecycleListeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
			return this;
		}

		public Builder observationRegistry(ObservationRegistry observationRegistry) {
			this.observationRegistry = observationRegistry;
			return this;
		}

		public Builder nodeExecutorService(ExecutorService nodeExecutorService) {
			this.nodeExecutorService = nodeExecutorService;
			return this;
		}

		public CompileConfig build() {
			return new CompileConfig(this);
		}

	}

}
