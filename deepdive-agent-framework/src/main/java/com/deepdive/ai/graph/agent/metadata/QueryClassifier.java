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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the read-only metadata of a thread from its initial query.
 */
public class QueryClassifier {

	public static final String COMPANY_CATEGORY = "company";

	private static final Pattern FOCUS = Pattern.compile(
			"\\b(?:focus(?:ing|ed)?\\s+(?:on|area:?)|with\\s+(?:a\\s+)?focus\\s+on|emphasis\\s+on)\\s+(.+?)(?:[.;!?]|$)",
			Pattern.CASE_INSENSITIVE);

	public Map<String, String> classify(String query) {
		Map<String, String> metadata = new LinkedHashMap<>();
		metadata.put(ResearchState.METADATA_CATEGORY, COMPANY_CATEGORY);
		String focus = extractFocus(query);
		if (focus != null) {
			metadata.put(ResearchState.METADATA_FOCUS, focus);
		}
		return metadata;
	}

	static String extractFocus(String query) {
		if (query == null) {
			return null;
		}
		Matcher matcher = FOCUS.matcher(query);
		if (!matcher.find()) {
			return null;
		}
		String focus = matcher.group(1).strip();
		return focus.isEmpty() ? null : focus;
	}

}
