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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import static java.lang.String.format;

/**
 * Structural check of a research brief: the number of investigative questions and the
 * presence of the required section headings. Says nothing about content quality.
 */
public class BriefValidator {

	public static final List<String> DEFAULT_REQUIRED_SECTIONS = List.of("Investigation Strategy",
			"Research Priorities");

	private final int minQuestions;

	private final int maxQuestions;

	private final List<String> requiredSections;

	public BriefValidator(int minQuestions, int maxQuestions, List<String> requiredSections) {
		if (minQuestions < 0 || maxQuestions < minQuestions) {
			throw new IllegalArgumentException(
					format("invalid question range [%d, %d]", minQuestions, maxQuestions));
		}
		this.minQuestions = minQuestions;
		this.maxQuestions = maxQuestions;
		this.requiredSections = List.copyOf(Objects.requireNonNull(requiredSections, "requiredSections cannot be null"));
	}

	public ValidationResult validate(String brief) {
		if (brief == null || brief.isBlank()) {
			return ValidationResult.of(List.of("The brief is empty"));
		}
		List<String> issues = new ArrayList<>();
		int questions = countQuestions(brief);
		if (questions < minQuestions) {
			issues.add(format("The brief has %d investigative questions, at least %d are required", questions,
					minQuestions));
		}
		else if (questions > maxQuestions) {
			issues.add(format("The brief has %d investigative questions, at most %d are allowed", questions,
					maxQuestions));
		}
		for (String section : requiredSections) {
			if (!hasHeading(brief, section)) {
				issues.add(format("The brief is missing the \"%s\" section", section));
			}
		}
		return ValidationResult.of(issues);
	}

	/**
	 * Counts the lines ending with a question mark.
	 */
	static int countQuestions(String text) {
		return (int) text.lines().map(String::strip).filter(line -> line.endsWith("?")).count();
	}

	static boolean hasHeading(String text, String section) {
		String wanted = section.toLowerCase(Locale.ROOT);
		return text.lines()
			.map(String::strip)
			.filter(line -> line.startsWith("#"))
			.map(line -> line.replaceFirst("^#+", "").strip().toLowerCase(Locale.ROOT))
			.anyMatch(heading -> heading.startsWith(wanted));
	}

}
