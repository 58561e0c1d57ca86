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
 * Message templates for graph construction errors.
 */
public enum Errors {

	invalidNodeIdentifier("'%s' is a reserved node identifier!"),
	duplicateNodeError("node with id: %s already exist!"),
	duplicateEdgeError("edge from '%s' already exist!"),
	missingEntryPoint("missing entry point, add an edge from START!"),
	missingNodeReferencedByEdge("edge refers to an undefined node '%s'!"),
	missingNodeInEdgeMapping("edge mapping for source '%s' refers to an undefined node '%s'!"),
	edgeMappingIsEmpty("edge mapping for source '%s' is empty!"),
	missingOutgoingEdge("node '%s' has no outgoing edge!");

	private final String errorMessage;

	Errors(String errorMessage) {
		this.errorMessage = errorMessage;
	}

	public GraphStateException exception(Object... args) {
		return new GraphStateException(format(errorMessage, args));
	}

}
