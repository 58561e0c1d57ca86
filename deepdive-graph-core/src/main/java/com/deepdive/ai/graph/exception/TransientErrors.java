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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies errors as transient by walking the cause chain.
 */
public final class TransientErrors {

	private static final int MAX_CAUSE_DEPTH = 16;

	private TransientErrors() {
	}

	public static boolean isTransient(Throwable throwable) {
		Throwable current = throwable;
		int depth = 0;
		while (current != null && depth++ < MAX_CAUSE_DEPTH) {
			if (current instanceof TransientException || current instanceof TimeoutException
					|| current instanceof IOException || current instanceof UncheckedIOException) {
				return true;
			}
			if (current instanceof NodeExecutionException) {
				// already classified by an inner executor
				return false;
			}
			current = current.getCause();
		}
		return false;
	}

}
