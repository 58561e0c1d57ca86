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
package com.deepdive.ai.graph.internal.edge;

import com.deepdive.ai.graph.StateGraph;
import com.deepdive.ai.graph.exception.Errors;
import com.deepdive.ai.graph.exception.GraphStateException;

import java.util.Objects;
import java.util.Set;

import static com.deepdive.ai.graph.StateGraph.START;

/**
 * Represents an edge in a graph with a source ID and a target value.
 *
 * @param sourceId The ID of the source node.
 * @param target The target value associated with the edge.
 * @param <S> the graph state type
 */
public record Edge<S>(String sourceId, EdgeValue<S> target) {

	public boolean anyMatchByTargetId(String targetId) {
		return target.id() != null ? Objects.equals(target.id(), targetId)
				: target.value().mappings().containsValue(targetId);
	}

	public void validate(Set<String> nodeIds) throws GraphStateException {
		if (!Objects.equals(sourceId, START) && !nodeIds.contains(sourceId)) {
			throw Errors.missingNodeReferencedByEdge.exception(sourceId);
		}
		if (target.id() != null) {
			if (!Objects.equals(target.id(), StateGraph.END) && !nodeIds.contains(target.id())) {
				throw Errors.missingNodeReferencedByEdge.exception(target.id());
			}
			return;
		}
		if (target.value().mappings().isEmpty()) {
			throw Errors.edgeMappingIsEmpty.exception(sourceId);
		}
		for (String nodeId : target.value().mappings().values()) {
			if (!Objects.equals(nodeId, StateGraph.END) && !nodeIds.contains(nodeId)) {
				throw Errors.missingNodeInEdgeMapping.exception(sourceId, nodeId);
			}
		}
	}

}
