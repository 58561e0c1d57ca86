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
package com.deepdive.ai.graph.diagram;

import com.deepdive.ai.graph.StateGraph;
import com.deepdive.ai.graph.internal.edge.Edge;
import com.deepdive.ai.graph.internal.edge.EdgeValue;

import java.util.Map;
import java.util.TreeMap;

import static com.deepdive.ai.graph.StateGraph.END;
import static com.deepdive.ai.graph.StateGraph.START;
import static java.lang.String.format;
import static java.util.Optional.ofNullable;

/**
 * Generates a flowchart of a {@link StateGraph} using Mermaid syntax. Conditional edges
 * are drawn through a "check state" decision node whose outgoing arrows carry the route
 * labels.
 */
public class MermaidGenerator {

	public String generate(StateGraph<?> graph, String title) {
		StringBuilder sb = new StringBuilder();
		appendHeader(sb, title);
		graph.nodes().keySet().forEach(id -> sb.append(format("\t%s(\"%s\")\n", id, id)));

		int ordinal = 0;
		for (Edge<?> edge : graph.edges().values()) {
			EdgeValue<?> target = edge.target();
			if (!target.isConditional()) {
				sb.append(format("\t%s --> %s\n", edge.sourceId(), target.id()));
				continue;
			}
			String condition = format("condition%d", ++ordinal);
			sb.append(format("\t%s{\"check state\"}\n", condition));
			sb.append(format("\t%s -.-> %s\n", edge.sourceId(), condition));
			Map<String, String> sorted = new TreeMap<>(target.value().mappings());
			sorted.forEach((label, nodeId) -> sb.append(format("\t%s -.->|%s| %s\n", condition, label, nodeId)));
		}
		appendFooter(sb);
		return sb.toString();
	}

	private void appendHeader(StringBuilder sb, String title) {
		ofNullable(title).ifPresent(t -> sb.append(format("---\ntitle: %s\n---\n", t)));
		sb.append("flowchart TD\n")
			.append(format("\t%s((start))\n", START))
			.append(format("\t%s((stop))\n", END));
	}

	private void appendFooter(StringBuilder sb) {
		sb.append('\n')
			.append(format("\tclassDef %s fill:black,stroke-width:1px,font-size:xx-small;\n", START))
			.append(format("\tclassDef %s fill:black,stroke-width:1px,font-size:xx-small;\n", END));
	}

}
