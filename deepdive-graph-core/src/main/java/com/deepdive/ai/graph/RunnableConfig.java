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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.util.Optional.ofNullable;

/**
 * Per-invocation configuration: the thread the run belongs to, free-form metadata made
 * available to node actions, and the cancellation token of the run.
 */
public final class RunnableConfig {

	private final String threadId;

	private final Map<String, Object> metadata;

	private final CancellationToken cancellationToken;

	private RunnableConfig(Builder builder) {
		this.threadId = builder.threadId;
		this.metadata = Collections.unmodifiableMap(new HashMap<>(builder.metadata));
		this.cancellationToken = builder.cancellationToken != null ? builder.cancellationToken
				: new CancellationToken();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static Builder builder(RunnableConfig config) {
		Objects.requireNonNull(config, "config cannot be null");
		return new Builder().threadId(config.threadId)
			.addMetadata(config.metadata)
			.cancellationToken(config.cancellationToken);
	}

	public Optional<String> threadId() {
		return ofNullable(threadId);
	}

	public Map<String, Object> metadata() {
		return metadata;
	}

	public Optional<Object> metadata(String key) {
		return ofNullable(metadata.get(key));
	}

	public <T> Optional<T> metadata(String key, Class<T> type) {
		return metadata(key).filter(type::isInstance).map(type::cast);
	}

	public CancellationToken cancellationToken() {
		return cancellationToken;
	}

	public boolean isCancellationRequested() {
		return cancellationToken.isCancellationRequested();
	}

	@Override
	public String toString() {
		return "RunnableConfig{threadId=" + threadId + ", metadata=" + metadata.keySet() + '}';
	}

	public static class Builder {

		private String threadId;

		private final Map<String, Object> metadata = new HashMap<>();

		private CancellationToken cancellationToken;

		public Builder threadId(String threadId) {
			this.threadId = threadId;
			return this;
		}

		public Builder addMetadata(String key, Object value) {
			this.metadata.put(key, value);
			return this;
		}

		public Builder addMetadata(Map<String, Object> metadata) {
			this.metadata.putAll(metadata);
			return this;
		}

		public Builder cancellationToken(CancellationToken cancellationToken) {
			this.cancellationToken = cancellationToken;
			return this;
		}

		public RunnableConfig build() {
			return new RunnableConfig(this);
		}

	}

}
