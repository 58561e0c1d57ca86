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
package com.deepdive.ai.graph.checkpoint;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Objects;
import java.util.Optional;

/**
 * Durable store of one {@link Checkpoint} per thread.
 * <p>
 * Implementations must let {@link #get(String)} run concurrently with other reads and
 * writes, serialize {@link #put(Checkpoint)} calls for the same thread, and never expose
 * a partially written checkpoint.
 * </p>
 */
public interface BaseCheckpointSaver {

	String THREAD_ID_DEFAULT = "$default";

	/**
	 * Configures an ObjectMapper for checkpoint and state serialization. Public so that
	 * savers and state serializers share the same settings.
	 * @param objectMapper the ObjectMapper to configure
	 * @return the configured ObjectMapper
	 */
	static ObjectMapper configureObjectMapper(ObjectMapper objectMapper) {
		ObjectMapper mapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
		mapper.registerModule(new Jdk8Module());
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		return mapper;
	}

	/**
	 * The checkpoint removed by {@link #release(String)}.
	 *
	 * @param threadId the released thread
	 * @param checkpoint the checkpoint it held, {@code null} if there was none
	 */
	record Tag(String threadId, Checkpoint checkpoint) {
	}

	Optional<Checkpoint> get(String threadId);

	/**
	 * Stores {@code checkpoint}, replacing the previous checkpoint of its thread.
	 */
	void put(Checkpoint checkpoint);

	boolean clear(String threadId);

	/**
	 * Removes the checkpoint of a thread that is no longer going to be resumed. Savers
	 * with durable storage may archive it.
	 */
	default Tag release(String threadId) {
		Optional<Checkpoint> current = get(threadId);
		clear(threadId);
		return new Tag(threadId, current.orElse(null));
	}

}
