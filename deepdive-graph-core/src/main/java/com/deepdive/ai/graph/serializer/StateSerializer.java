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
package com.deepdive.ai.graph.serializer;

import java.util.Map;

/**
 * Converts graph state to and from the plain map representation stored in checkpoints.
 *
 * @param <S> the graph state type
 */
public interface StateSerializer<S> {

	Class<S> stateType();

	Map<String, Object> toMap(S state);

	S fromMap(Map<String, Object> data);

	/**
	 * Deep copy of {@code state}; the copy shares no mutable structure with the original.
	 */
	default S cloneObject(S state) {
		return fromMap(toMap(state));
	}

}
