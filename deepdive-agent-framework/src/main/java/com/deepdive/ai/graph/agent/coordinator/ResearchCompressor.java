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
package com.deepdive.ai.graph.agent.coordinator;

import com.deepdive.ai.graph.agent.harness.ResultNote;
import com.deepdive.ai.graph.agent.model.InferencePurpose;
import com.deepdive.ai.graph.agent.model.InferenceRequest;
import com.deepdive.ai.graph.agent.model.ModelInference;
import com.deepdive.ai.graph.agent.prompt.ResearchPrompts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Condenses the raw output of a research task into a clean note. Falls back to the
 * first raw observations when every attempt fails.
 */
public class ResearchCompressor {

	private static final Logger log = LoggerFactory.getLogger(ResearchCompressor.class);

	public static final int DEFAULT_MAX_ATTEMPTS = 3;

	public static final String FALLBACK_PREFIX = "Compression failed. Raw notes:";

	private static final int FALLBACK_OBSERVATIONS = 3;

	private final ModelInference modelInference;

	private final int maxAttempts;

	public ResearchCompressor(ModelInference modelInference) {
		this(modelInference, DEFAULT_MAX_ATTEMPTS);
	}

	public ResearchCompressor(ModelInference modelInference, int maxAttempts) {
		this.modelInference = Objects.requireNonNull(modelInference, "modelInference cannot be null");
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be >= 1");
		}
		this.maxAttempts = maxAttempts;
	}

	public String compress(ResultNote result) {
		String prompt = ResearchPrompts.render(ResearchPrompts.COMPRESS,
				Map.of("topic", result.topic(), "findings", rawFindings(result)));
		InferenceRequest request = InferenceRequest.of(InferencePurpose.COMPRESS, List.of(new UserMessage(prompt)));
		for (int attempt = 1; attempt <= maxAttempts; attempt++) {
			try {
				AssistantMessage reply = modelInference.infer(request);
				if (reply != null && reply.getText() != null && !reply.getText().isBlank()) {
					return reply.getText().strip();
				}
				log.warn("[TaskId {}] compression attempt {}/{} returned no text", result.taskId(), attempt,
						maxAttempts);
			}
			catch (RuntimeException ex) {
				log.warn("[TaskId {}] compression attempt {}/{} failed: {}", result.taskId(), attempt, maxAttempts,
						ex.getMessage());
			}
		}
		log.error("[TaskId {}] compression failed after {} attempts, keeping raw notes", result.taskId(),
				maxAttempts);
		return fallback(result);
	}

	/**
	 * The raw material of a task: its observations followed by its answer.
	 */
	static String rawFindings(ResultNote result) {
		StringBuilder findings = new StringBuilder();
		for (String observation : result.observations()) {
			findings.append(observation).append("\n\n");
		}
		return findings.append(result.content()).toString().strip();
	}

	static String fallback(ResultNote result) {
		List<String> raw = result.observations().isEmpty() ? List.of(result.content()) : result.observations();
		return FALLBACK_PREFIX + "\n" + String.join("\n", raw.subList(0, Math.min(FALLBACK_OBSERVATIONS, raw.size())));
	}

}
