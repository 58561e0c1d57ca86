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
package com.deepdive.ai.graph.exception;

import static java.lang.String.format;

/**
 * Message templates for errors raised while a compiled graph is running.
 */
public enum RunnableErrors {

	missingNode("node '%s' is not declared in the graph"),
	missingEdge("no outgoing edge declared for node '%s'"),
	missingNodeInEdgeMapping("edge condition of '%s' returned '%s' which has no mapping"),
	edgeEvaluationFailed("edge condition of '%s' failed: %s"),
	maxIterationsReached("maximum number of node executions (%d) reached on thread '%s'");

	private final String errorMessage;

	RunnableErrors(String errorMessage) {
		this.errorMessage = errorMessage;
	}

	public GraphRunnerException exception(Object... args) {
		return new GraphRunnerException(format(errorMessage, args));
	}

}
