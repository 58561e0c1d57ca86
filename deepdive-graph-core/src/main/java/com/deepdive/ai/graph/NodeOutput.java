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
 * Progress event emitted once the checkpoint of a completed node has been persisted.
 *
 * @param node the node that completed
 * @param state a snapshot of the state as persisted
 * @param <S> the graph state type
 */
public record NodeOutput<S>(String node, S state) {

	@Override
	public String toString() {
		return "NodeOutput{node=" + node + '}';
	}

}
