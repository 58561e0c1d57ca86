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

import com.deepdive.ai.graph.action.AsyncNodeAction;
import com.deepdive.ai.graph.action.EdgeAction;
import com.deepdive.ai.graph.diagram.MermaidGenerator;
import com.deepdive.ai.graph.exception.Errors;
import com.deepdive.ai.graph.exception.GraphStateException;
import com.deepdive.ai.graph.internal.edge.Edge;
import com.deepdive.ai.graph.internal.edge.EdgeCondition;
import com.deepdive.ai.graph.internal.edge.EdgeValue;
import com.deepdive.ai.graph.internal.node.Node;
import com.deepdive.ai.graph.serializer.StateSerializer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builder of a directed graph of nodes. Each node has exactly one outgoing edge, either
 * static or conditional; conditional edges may point backwards to express bounded
 * loops.
 *
 * @param <S> the graph state type
 */
public class StateGraph<S> {

	public static final String START = "__START__";

	public static final String END = "__END__";

	private final String name;

	private final StateSerializer<S> stateSerializer;

	private final Map<String, Node<S>> nodes = new LinkedHashMap<>();

	private final Map<String, Edge<S>> edges = new LinkedHashMap<>();

	public StateGraph(String name, StateSerializer<S> stateSerializer) {
		this.name = Objects.requireNonNull(name, "name cannot be null");
		this.stateSerializer = Objects.requireNonNull(stateSerializer, "stateSerializer cannot be null");
	}

	public String getName() {
		return name;
	}

	public StateSerializer<S> getStateSerializer() {
		return stateSerializer;
	}

	public Map<String, Node<S>> nodes() {
		return Collections.unmodifiableMap(nodes);
	}

	public Map<String, Edge<S>> edges() {
		return Collections.unmodifiableMap(edges);
	}

	public StateGraph<S> addNode(String id, AsyncNodeAction<S> action) throws GraphStateException {
		return addNode(id, action, null);
	}

	/**
	 * @param policy timeout and retry settings of this node, {@code null} to inherit the
	 * default of the compiled graph
	 */
	public StateGraph<S> addNode(String id, AsyncNodeAction<S> action, NodePolicy policy)
			throws GraphStateException {
		if (Objects.equals(id, START) || Objects.equals(id, END)) {
			throw Errors.invalidNodeIdentifier.exception(id);
		}
		if (nodes.containsKey(id)) {
			throw Errors.duplicateNodeError.exception(id);
		}
		nodes.put(id, new Node<>(id, action, policy));
		return this;
	}

	public StateGraph<S> addEdge(String sourceId, String targetId) throws GraphStateException {
		if (Objects.equals(sourceId, END)) {
			throw Errors.invalidNodeIdentifier.exception(END);
		}
		if (edges.containsKey(sourceId)) {
			throw Errors.duplicateEdgeError.exception(sourceId);
		}
		edges.put(sourceId, new Edge<>(sourceId, new EdgeValue<>(targetId)));
		return this;
	}

	/**
	 * @param condition evaluated after {@code sourceId} completes
	 * @param mappings route label returned by the condition to target node id
	 */
	public StateGraph<S> addConditionalEdges(String sourceId, EdgeAction<S> condition, Map<String, String> mappings)
			throws GraphStateException {
		if (Objects.equals(sourceId, END)) {
			throw Errors.invalidNodeIdentifier.exception(END);
		}
		if (mappings == null || mappings.isEmpty()) {
			throw Errors.edgeMappingIsEmpty.exception(sourceId);
		}
		if (edges.containsKey(sourceId)) {
			throw Errors.duplicateEdgeError.exception(sourceId);
		}
		edges.put(sourceId, new Edge<>(sourceId, new EdgeValue<>(new EdgeCondition<>(condition, mappings))));
		return this;
	}

	void validateGraph() throws GraphStateException {
		if (!edges.containsKey(START)) {
			throw Errors.missingEntryPoint.exception();
		}
		for (Edge<S> edge : edges.values()) {
			edge.validate(nodes.keySet());
		}
		for (String nodeId : nodes.keySet()) {
			if (!edges.containsKey(nodeId)) {
				throw Errors.missingOutgoingEdge.exception(nodeId);
			}
		}
	}

	public CompiledGraph<S> compile() throws GraphStateException {
		return compile(CompileConfig.builder().build());
	}

	public CompiledGraph<S> compile(CompileConfig config) throws GraphStateException {
		Objects.requireNonNull(config, "config cannot be null");
		validateGraph();
		return new CompiledGraph<>(this, config);
	}

	/**
	 * Renders the graph as a Mermaid flowchart.
	 * @param title diagram title, may be {@code null}
	 */
	public String getGraph(String title) {
		return new MermaidGenerator().generate(this, title);
	}

}
