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

/**
 * Callbacks fired by the graph engine around node executions. Listeners run on the
 * thread driving the graph and must not mutate the state they receive.
 */
public interface GraphLifecycleListener {

	default void onStart(String threadId, Object state, RunnableConfig config) {
	}

	default void before(String nodeId, Object state, RunnableConfig config) {
	}

	default void after(String nodeId, Object state, RunnableConfig config) {
	}

	default void onError(String nodeId, Object state, Throwable ex, RunnableConfig config) {
	}

	default void onComplete(String nodeId, Object state, RunnableConfig config) {
	}

}
