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
package com.deepdive.ai.graph.checkpoint.config;

import com.deepdive.ai.graph.checkpoint.BaseCheckpointSaver;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;

/**
 * Registry of named checkpoint savers.
 */
public class SaverConfig {

	public static final String MEMORY = "memory";

	public static final String FILE_SYSTEM = "filesystem";

	private final Map<String, BaseCheckpointSaver> savers = new LinkedHashMap<>();

	public static Builder builder() {
		return new Builder();
	}

	public SaverConfig register(String name, BaseCheckpointSaver saver) {
		savers.put(Objects.requireNonNull(name, "name cannot be null"),
				Objects.requireNonNull(saver, "saver cannot be null"));
		return this;
	}

	/**
	 * @return the only registered saver
	 * @throws IllegalStateException if none or several are registered
	 */
	public BaseCheckpointSaver get() {
		if (savers.size() == 1) {
			return savers.values().iterator().next();
		}
		if (savers.isEmpty()) {
			throw new IllegalStateException("No saver configured.");
		}
		throw new IllegalStateException("Multiple savers configured, but no specific one requested.");
	}

	public Optional<BaseCheckpointSaver> get(String name) {
		return Optional.ofNullable(savers.get(name));
	}

	public BaseCheckpointSaver require(String name) {
		return get(name).orElseThrow(() -> new IllegalStateException(
				format("No saver registered under '%s', available: %s", name, savers.keySet())));
	}

	public Map<String, BaseCheckpointSaver> getAll() {
		return Map.copyOf(savers);
	}

	public static class Builder {

		private final SaverConfig config = new SaverConfig();

		Builder() {
		}

		public Builder register(String name, BaseCheckpointSaver saver) {
			this.config.register(name, saver);
			return this;
		}

		public SaverConfig build() {
			return config;
		}

	}

}
