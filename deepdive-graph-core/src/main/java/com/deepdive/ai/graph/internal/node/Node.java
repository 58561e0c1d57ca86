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
package com.deepdive.ai.graph.internal.node;

import com.deepdive.ai.graph.NodePolicy;
import com.deepdive.ai.graph.action.AsyncNodeAction;

import java.util.Objects;

/**
 * A named node of the graph with its action and, optionally, its own execution policy.
 *
 * @param id the node identifier
 * @param action the node body
 * @param policy timeout and retry settings, {@code null} to use the graph default
 * @param <S> the graph state type
 */
public record Node<S>(String id, AsyncNodeAction<S> action, NodePolicy policy) {

	public Node {
		Objects.requireNonNull(id, "id cannot be null");
		Objects.requireNonNull(action, "action cannot be null");
	}

	public Node<S> withDefaultPolicy(NodePolicy defaultPolicy) {
		return policy != null ? this : new Node<>(id, action, defaultPolicy);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		Node<?> node = (Node<?>) o;
		return Objects.equals(id, node.id);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id);
	}

}
