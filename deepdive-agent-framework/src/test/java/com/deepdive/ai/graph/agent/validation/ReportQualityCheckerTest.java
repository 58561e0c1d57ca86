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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReportQualityCheckerTest {

	private final ReportQualityChecker checker = new ReportQualityChecker(5, 3);

	static final String GOOD_REPORT = """
			# Acme Corp

			Acme grew revenue by 12% [1] while margins held [2]. Its supply chain risks
			are concentrated in two suppliers [3][4].

			## Sources
			1. Annual report 2024
			2. Q4 earnings call
			3. Supplier filing
			4. Industry survey
			5. Press release
			""";

	@Test
	void acceptsReportWithSourcesAndCitations() {
		assertThat(checker.check(GOOD_REPORT, "supply chain risks").valid()).isTrue();
	}

	@Test
	void reportsMissingSourcesSection() {
		ValidationResult result = checker.check("# Acme\n\nGrowth [1] [2] [3].", null);

		assertThat(result.issues())
			.containsExactly("The report is missing a \"## Sources\" section with at least 5 numbered entries");
	}

	@Test
	void reportsTooFewSourcesAndCitations() {
		String report = "# Acme\n\nGrowth [1].\n\n## Sources\n1. Annual report\n2. Blog post\n";

		ValidationResult result = checker.check(report, null);

		assertThat(result.issues()).containsExactly(
				"The \"## Sources\" section lists 2 entries, at least 5 are required",
				"The report cites 1 distinct sources inline, at least 3 are required");
	}

	@Test
	void reportsMissingFocusArea() {
		ValidationResult result = checker.check(GOOD_REPORT, "pricing strategy");

		assertThat(result.issues()).containsExactly("The report does not address the requested focus area \"pricing strategy\"");
	}

	@Test
	void countsOnlyEntriesOfSourcesSection() {
		String report = GOOD_REPORT + "\n## Appendix\n1. Not a source\n2. Neither\n";

		assertThat(ReportQualityChecker.countSources(report)).isEqualTo(5);
	}

	@Test
	void countsDistinctCitationsBeforeSources() {
		String report = "Claim [1], again [1], another [2].\n\n## Sources\n1. a [7]\n2. b\n";

		assertThat(ReportQualityChecker.countCitations(report)).isEqualTo(2);
	}

}
