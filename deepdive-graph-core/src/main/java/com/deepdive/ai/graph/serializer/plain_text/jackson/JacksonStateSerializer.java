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
package com.deepdive.ai.graph.serializer.plain_text.jackson;

import com.deepdive.ai.graph.checkpoint.BaseCheckpointSaver;
import com.deepdive.ai.graph.serializer.StateSerializer;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Objects;

/**
 * {@link StateSerializer} backed by Jackson data binding. The state type must be a bean
 * or record that Jackson can round-trip.
 *
 * @param <S> the graph state type
 */
public class JacksonStateSerializer<S> implements StateSerializer<S> {

	private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
	};

	private final Class<S> stateType;

	private final ObjectMapper objectMapper;

	public JacksonStateSerializer(Class<S> stateType) {
		this(stateType, BaseCheckpointSaver.configureObjectMapper(new ObjectMapper()));
	}

	public JacksonStateSerializer(Class<S> stateType, ObjectMapper objectMapper) {
		this.stateType = Objects.requireNonNull(stateType, "stateType cannot be null");
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
	}

	@Override
	public Class<S> stateType() {
		return stateType;
	}

	@Override
	public Map<String, Object> toMap(S state) {
		Objects.requireNonNull(state, "state cannot be null");
		return objectMapper.convertValue(state, MAP_TYPE);
	}

	@Override
	public S fromMap(Map<String, Object> data) {
		Objects.requireNonNull(data, "data cannot be null");
		return objectMapper.convertValue(data, stateType);
	}

	public ObjectMapper objectMapper() {
		return objectMapper;
	}

}
