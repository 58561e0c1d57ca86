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
package com.deepdive.ai.graph.agent.metadata;

import com.deepdive.ai.graph.agent.state.ResearchState;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QueryClassifierTest {

	private final QueryClassifier classifier = new QueryClassifier();

	@Test
	void classifiesAsCompanyResearch() {
		Map<String, String> metadata = classifier.classify("Research Acme Corp");

		assertThat(metadata).containsExactly(Map.entry(ResearchState.METADATA_CATEGORY, QueryClassifier.COMPANY_CATEGORY));
	}

	@Test
	void extractsFocusArea() {
		assertThat(QueryClassifier.extractFocus("Research Acme Corp, focusing on supply chain risks."))
			.isEqualTo("supply chain risks");
		assertThat(QueryClassifier.extractFocus("Analyze Globex with a focus on pricing; keep it short"))
			.isEqualTo("pricing");
		assertThat(classifier.classify("Look into Initech. Focus area: cloud revenue"))
			.containsEntry(ResearchState.METADATA_FOCUS, "cloud revenue");
	}

	@Test
	void noFocusWithoutMarker() {
		assertThat(QueryClassifier.extractFocus("Who are Acme's competitors?")).isNull();
		assertThat(QueryClassifier.extractFocus(null)).isNull();
	}

}
