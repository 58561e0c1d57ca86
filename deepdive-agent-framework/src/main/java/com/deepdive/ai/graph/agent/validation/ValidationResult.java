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
package com.deepdive.ai.graph.agent.validation;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Outcome of a structural check. An invalid result lists the issues that a revision
 * has to fix.
 */
public record ValidationResult(boolean valid, List<String> issues) {

	public ValidationResult {
		issues = List.copyOf(issues);
	}

	public static ValidationResult ok() {
		return new ValidationResult(true, List.of());
	}

	public static ValidationResult of(List<String> issues) {
		return new ValidationResult(issues.isEmpty(), issues);
	}

	/**
	 * @return the issues as a numbered list
	 */
	public String hint() {
		return IntStream.range(0, issues.size())
			.mapToObj(i -> (i + 1) + ". " + issues.get(i))
			.collect(Collectors.joining("\n"));
	}

}
