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
package com.deepdive.ai.graph.action;

import com.deepdive.ai.graph.RunnableConfig;

import java.util.concurrent.CompletableFuture;

/**
 * Represents an asynchronous node action that operates on a working copy of the graph
 * state and completes with the resulting state.
 *
 * @param <S> the graph state type
 */
@FunctionalInterface
public interface AsyncNodeAction<S> {

	CompletableFuture<S> apply(S state, RunnableConfig config);

	/**
	 * Creates an asynchronous node action from a synchronous node action.
	 * @param syncAction the synchronous node action
	 * @param <S> the graph state type
	 * @return an asynchronous node action
	 */
	static <S> AsyncNodeAction<S> node_async(NodeAction<S> syncAction) {
		return (state, config) -> {
			CompletableFuture<S> result = new CompletableFuture<>();
			try {
				result.complete(syncAction.apply(state, config));
			}
			catch (Exception e) {
				result.completeExceptionally(e);
			}
			return result;
		};
	}

}
