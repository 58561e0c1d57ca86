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

import com.deepdive.ai.graph.exception.GraphStateException;
import com.deepdive.ai.graph.serializer.plain_text.jackson.JacksonStateSerializer;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.deepdive.ai.graph.StateGraph.END;
import static com.deepdive.ai.graph.StateGraph.START;
import static com.deepdive.ai.graph.action.AsyncNodeAction.node_async;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateGraphTest {

	private StateGraph<SimpleState> newGraph() {
		return new StateGraph<>("test", new JacksonStateSerializer<>(SimpleState.class));
	}

	@Test
	void compileRequiresAnEntryPoint() throws GraphStateException {
		StateGraph<SimpleState> graph = newGraph().addNode("a", node_async((s, c) -> s)).addEdge("a", END);

		assertThatThrownBy(graph::compile).isInstanceOf(GraphStateException.class).hasMessageContaining("entry point");
	}

	@Test
	void compileRejectsEdgesToUnknownNodes() throws GraphStateException {
		StateGraph<SimpleState> graph = newGraph().addNode("a", node_async((s, c) -> s))
			.addEdge(START, "a")
			.addConditionalEdges("a", s -> "x", Map.of("x", "missing", "y", END));

		assertThatThrownBy(graph::compile).isInstanceOf(GraphStateException.class).hasMessageContaining("missing");
	}

	@Test
	void everyNodeNeedsAnOutgoingEdge() throws GraphStateException {
		StateGraph<SimpleState> graph = newGraph().addNode("a", node_async((s, c) -> s))
			.addNode("b", node_async((s, c) -> s))
			.addEdge(START, "a")
			.addEdge("a", "b");

		assertThatThrownBy(graph::compile).isInstanceOf(GraphStateException.class)
			.hasMessageContaining("'b' has no outgoing edge");
	}

	@Test
	void nodeIdentifiersMustBeUniqueAndNotReserved() throws GraphStateException {
		StateGraph<SimpleState> graph = newGraph().addNode("a", node_async((s, c) -> s));

		assertThatThrownBy(() -> graph.addNode("a", node_async((s, c) -> s))).isInstanceOf(GraphStateException.class);
		assertThatThrownBy(() -> graph.addNode(END, node_async((s, c) -> s))).isInstanceOf(GraphStateException.class);
		graph.addEdge("a", END);
		assertThatThrownBy(() -> graph.addEdge("a", END)).isInstanceOf(GraphStateException.class);
	}

	@Test
	void rendersMermaidFlowchart() throws GraphStateException {
		StateGraph<SimpleState> graph = newGraph().addNode("write", node_async((s, c) -> s))
			.addNode("check", node_async((s, c) -> s))
			.addEdge(START, "write")
			.addEdge("write", "check")
			.addConditionalEdges("check", s -> "done", Map.of("revise", "write", "done", END));

		String mermaid = graph.getGraph("pipeline");

		assertThat(mermaid).startsWith("---\ntitle: pipeline\n---\nflowchart TD\n")
			.contains("\twrite(\"write\")\n")
			.contains("\t__START__ --> write\n")
			.contains("\tcheck -.-> condition1\n")
			.contains("\tcondition1 -.->|revise| write\n")
			.contains("\tcondition1 -.->|done| __END__\n");
	}

}
