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

import com.deepdive.ai.graph.executor.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Execution policy of a node: its wall-clock timeout and its retry policy.
 *
 * @param timeout maximum duration of one attempt, {@code null} for no limit
 * @param retryPolicy policy deciding whether and when to retry a failed attempt
 */
public record NodePolicy(Duration timeout, RetryPolicy retryPolicy) {

	public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

	public NodePolicy {
		Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
		if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
			throw new IllegalArgumentException("timeout must be positive");
		}
	}

	public static NodePolicy defaults() {
		return new NodePolicy(DEFAULT_TIMEOUT, RetryPolicy.builder().build());
	}

	public static NodePolicy of(Duration timeout, RetryPolicy retryPolicy) {
		return new NodePolicy(timeout, retryPolicy);
	}

	public NodePolicy withTimeout(Duration timeout) {
		return new NodePolicy(timeout, retryPolicy);
	}

}
