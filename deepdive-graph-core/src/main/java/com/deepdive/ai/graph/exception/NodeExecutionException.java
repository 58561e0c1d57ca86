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
 * Raised by the node executor when a unit of work fails permanently, either because
 * the error is not transient or because every attempt has been used.
 */
public class NodeExecutionException extends GraphRunnerException {

	private final String nodeId;

	private final int attempts;

	public NodeExecutionException(String nodeId, int attempts, Throwable cause) {
		super(format("node '%s' failed after %d attempt(s): %s", nodeId, attempts, describe(cause)), cause);
		this.nodeId = nodeId;
		this.attempts = attempts;
	}

	public String nodeId() {
		return nodeId;
	}

	public int attempts() {
		return attempts;
	}

	private static String describe(Throwable cause) {
		if (cause == null) {
			return "unknown error";
		}
		return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
	}

}
