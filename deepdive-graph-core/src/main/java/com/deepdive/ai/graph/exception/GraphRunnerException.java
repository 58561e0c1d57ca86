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

/**
 * A fatal error that aborts a graph run. The thread keeps the state of the last
 * completed node in its checkpoint.
 */
public class GraphRunnerException extends RuntimeException {

	public GraphRunnerException(String errorMessage) {
		super(errorMessage);
	}

	public GraphRunnerException(String errorMessage, Throwable cause) {
		super(errorMessage, cause);
	}

}
