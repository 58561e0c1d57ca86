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
package com.deepdive.ai.graph.executor;

import com.deepdive.ai.graph.exception.TransientErrors;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Retry settings with exponential backoff.
 *
 * Example:
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxRetries(3)
 *     .backoffFactor(2.0)
 *     .initialDelay(500)
 *     .build();
 */
public final class RetryPolicy {

	private final int maxRetries;

	private final Predicate<Throwable> retryOn;

	private final double backoffFactor;

	private final long initialDelayMs;

	private final long maxDelayMs;

	private final boolean jitter;

	private RetryPolicy(Builder builder) {
		this.maxRetries = builder.maxRetries;
		this.retryOn = builder.retryOn;
		this.backoffFactor = builder.backoffFactor;
		this.initialDelayMs = builder.initialDelayMs;
		this.maxDelayMs = builder.maxDelayMs;
		this.jitter = builder.jitter;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static RetryPolicy noRetry() {
		return builder().maxRetries(0).build();
	}

	public int maxRetries() {
		return maxRetries;
	}

	public int maxAttempts() {
		return maxRetries + 1;
	}

	/**
	 * @param error the failure of the attempt that just ended
	 * @param attempt the 1-based number of that attempt
	 * @return whether another attempt should be made
	 */
	public boolean shouldRetry(Throwable error, int attempt) {
		return attempt <= maxRetries && retryOn.test(error);
	}

	/**
	 * @param attempt the 1-based number of the attempt that just failed
	 * @return the delay before the next attempt, in milliseconds
	 */
	public long delayMillis(int attempt) {
		long delay = (long) (initialDelayMs * Math.pow(backoffFactor, Math.max(0, attempt - 1)));
		delay = Math.min(delay, maxDelayMs);
		if (jitter && delay > 0) {
			// +/- 25%
			double jitterFactor = 0.75 + ThreadLocalRandom.current().nextDouble() * 0.5;
			delay = (long) (delay * jitterFactor);
		}
		return delay;
	}

	@Override
	public String toString() {
		return "RetryPolicy{maxRetries=" + maxRetries + ", initialDelayMs=" + initialDelayMs + ", backoffFactor="
				+ backoffFactor + ", maxDelayMs=" + maxDelayMs + ", jitter=" + jitter + '}';
	}

	public static class Builder {

		private int maxRetries = 3;

		private Predicate<Throwable> retryOn = TransientErrors::isTransient;

		private double backoffFactor = 2.0;

		private long initialDelayMs = 500;

		private long maxDelayMs = 30_000;

		private boolean jitter = true;

		public Builder maxRetries(int maxRetries) {
			if (maxRetries < 0) {
				throw new IllegalArgumentException("maxRetries must be >= 0");
			}
			this.maxRetries = maxRetries;
			return this;
		}

		@SafeVarargs
		public final Builder retryOn(Class<? extends Throwable>... errorTypes) {
			Set<Class<? extends Throwable>> types = new HashSet<>(Arrays.asList(errorTypes));
			this.retryOn = e -> types.stream().anyMatch(type -> type.isInstance(e));
			return this;
		}

		public Builder retryOn(Predicate<Throwable> predicate) {
			this.retryOn = predicate;
			return this;
		}

		public Builder backoffFactor(double backoffFactor) {
			if (backoffFactor < 1.0) {
				throw new IllegalArgumentException("backoffFactor must be >= 1.0");
			}
			this.backoffFactor = backoffFactor;
			return this;
		}

		public Builder initialDelay(long initialDelayMs) {
			this.initialDelayMs = initialDelayMs;
			return this;
		}

		public Builder maxDelay(long maxDelayMs) {
			this.maxDelayMs = maxDelayMs;
			return this;
		}

		public Builder jitter(boolean jitter) {
			this.jitter = jitter;
			return this;
		}

		public RetryPolicy build() {
			return new RetryPolicy(this);
		}

	}

}
