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
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;

/**
 * Structural quality check of a report: a {@code ## Sources} section with enough
 * numbered entries, enough distinct {@code [n]} citations, and a mention of the focus
 * area when there is one.
 */
public class ReportQualityChecker {

	private static final Pattern SOURCES_SECTION = Pattern.compile("^##\\s+Sources\\s*$",
			Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);

	private static final Pattern NEXT_SECTION = Pattern.compile("^#{1,2}\\s+\\S", Pattern.MULTILINE);

	private static final Pattern SOURCE_ENTRY = Pattern.compile("^\\s*\\d+\\.\\s+\\S", Pattern.MULTILINE);

	private static final Pattern CITATION = Pattern.compile("\\[(\\d+)]");

	private final int minSources;

	private final int minCitations;

	public ReportQualityChecker(int minSources, int minCitations) {
		this.minSources = minSources;
		this.minCitations = minCitations;
	}

	public ValidationResult check(String report, String focus) {
		if (report == null || report.isBlank()) {
			return ValidationResult.of(List.of("The report is empty"));
		}
		List<String> issues = new ArrayList<>();
		int sources = countSources(report);
		if (sources == 0) {
			issues.add(format("The report is missing a \"## Sources\" section with at least %d numbered entries",
					minSources));
		}
		else if (sources < minSources) {
			issues.add(format("The \"## Sources\" section lists %d entries, at least %d are required", sources,
					minSources));
		}
		int citations = countCitations(report);
		if (citations < minCitations) {
			issues.add(format("The report cites %d distinct sources inline, at least %d are required", citations,
					minCitations));
		}
		if (focus != null && !focus.isBlank()
				&& !report.toLowerCase(Locale.ROOT).contains(focus.strip().toLowerCase(Locale.ROOT))) {
			issues.add(format("The report does not address the requested focus area \"%s\"", focus.strip()));
		}
		return ValidationResult.of(issues);
	}

	/**
	 * Counts the numbered entries of the {@code ## Sources} section, 0 when it is missing.
	 */
	static int countSources(String report) {
		Matcher section = SOURCES_SECTION.matcher(report);
		if (!section.find()) {
			return 0;
		}
		String body = report.substring(section.end());
		Matcher next = NEXT_SECTION.matcher(body);
		if (next.find()) {
			body = body.substring(0, next.start());
		}
		Matcher entries = SOURCE_ENTRY.matcher(body);
		int count = 0;
		while (entries.find()) {
			count++;
		}
		return count;
	}

	/**
	 * Counts distinct citation numbers in the body of the report.
	 */
	static int countCitations(String report) {
		Matcher section = SOURCES_SECTION.matcher(report);
		String body = section.find() ? report.substring(0, section.start()) : report;
		Set<Integer> cited = new HashSet<>();
		Matcher matcher = CITATION.matcher(body);
		while (matcher.find()) {
			cited.add(Integer.parseInt(matcher.group(1)));
		}
		return cited.size();
	}

}
