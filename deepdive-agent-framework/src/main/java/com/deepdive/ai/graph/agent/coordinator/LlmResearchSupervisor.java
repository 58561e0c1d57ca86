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

import com.deepdive.ai.graph.agent.model.InferencePurpose;
import com.deepdive.ai.graph.agent.model.InferenceRequest;
import com.deepdive.ai.graph.agent.model.ModelInference;
import com.deepdive.ai.graph.agent.prompt.ResearchPrompts;
import com.deepdive.ai.graph.agent.state.ResearchState;
import com.deepdive.ai.graph.agent.tool.PlainTextToolCallResultConverter;
import com.deepdive.ai.graph.agent.tool.ThinkTool;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.function.FunctionToolCallback;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Supervisor that lets the model steer the research through three tools:
 * {@code conduct_research}, {@code research_complete} and {@code think_tool}.
 *
 * <p>
 * A reply without any {@code conduct_research} call, or with a
 * {@code research_complete} call, ends the research phase.
 */
public class LlmResearchSupervisor implements ResearchSupervisor {

	private static final Logger log = LoggerFactory.getLogger(LlmResearchSupervisor.class);

	public static final String CONDUCT_RESEARCH = "conduct_research";

	public static final String RESEARCH_COMPLETE = "research_complete";

	public record ConductResearchInput(
			@JsonPropertyDescription("The topic to research, described in enough detail to work on it alone") String research_topic) {
	}

	public record ResearchCompleteInput() {
	}

	private final ModelInference modelInference;

	private final int maxRounds;

	private final List<ToolCallback> tools;

	private final ObjectMapper objectMapper = new ObjectMapper();

	public LlmResearchSupervisor(ModelInference modelInference, int maxRounds) {
		this.modelInference = Objects.requireNonNull(modelInference, "modelInference cannot be null");
		this.maxRounds = maxRounds;
		this.tools = List.of(conductResearchTool(), researchCompleteTool(), ThinkTool.create());
	}

	@Override
	public SupervisorDecision decide(ResearchState state, int round, int maxConcurrent) {
		String prompt = ResearchPrompts.render(ResearchPrompts.SUPERVISE,
				Map.of("round", round, "maxRounds", maxRounds, "maxConcurrent", maxConcurrent, "brief",
						Objects.toString(state.getBrief(), ""), "findings", findings(state)));
		List<Message> messages = List.of(new SystemMessage(prompt), new UserMessage(state.getQuery()));
		AssistantMessage reply = modelInference.infer(new InferenceRequest(InferencePurpose.SUPERVISE, messages, tools));

		List<String> topics = new ArrayList<>();
		List<String> reflections = new ArrayList<>();
		boolean complete = false;
		for (AssistantMessage.ToolCall toolCall : reply.getToolCalls()) {
			switch (toolCall.name()) {
				case CONDUCT_RESEARCH -> {
					String topic = argument(toolCall, "research_topic");
					if (topic != null && !topic.isBlank()) {
						topics.add(topic.strip());
					}
				}
				case RESEARCH_COMPLETE -> complete = true;
				case ThinkTool.NAME -> reflections.add(ThinkTool.reflect(argument(toolCall, "reflection")));
				default -> log.warn("Supervisor requested unknown tool '{}', ignored", toolCall.name());
			}
		}
		if (topics.isEmpty()) {
			complete = true;
		}
		log.debug("Supervisor round {}: topics={}, complete={}", round, topics, complete);
		return new SupervisorDecision(complete ? List.of() : topics, complete, reflections);
	}

	private String argument(AssistantMessage.ToolCall toolCall, String name) {
		try {
			JsonNode arguments = objectMapper.readTree(toolCall.arguments() != null ? toolCall.arguments() : "{}");
			JsonNode value = arguments.get(name);
			return value != null && !value.isNull() ? value.asText() : null;
		}
		catch (JsonProcessingException ex) {
			log.warn("Cannot parse arguments of supervisor tool call '{}': {}", toolCall.name(), ex.getMessage());
			return null;
		}
	}

	private static String findings(ResearchState state) {
		if (state.getCompressedNotes().isEmpty()) {
			return "None yet.";
		}
		return state.getCompressedNotes()
			.stream()
			.map(note -> "- " + note.topic() + ": " + abbreviate(note.content()))
			.collect(Collectors.joining("\n"));
	}

	private static String abbreviate(String text) {
		return text.length() <= 300 ? text : text.substring(0, 300) + "...";
	}

	private static ToolCallback conductResearchTool() {
		Function<ConductResearchInput, String> function = input -> "Research delegated";
		return FunctionToolCallback.builder(CONDUCT_RESEARCH, function)
			.description("Delegate research on one topic to a research assistant")
			.inputType(ConductResearchInput.class)
			.toolCallResultConverter(new PlainTextToolCallResultConverter())
			.build();
	}

	private static ToolCallback researchCompleteTool() {
		Function<ResearchCompleteInput, String> function = input -> "Research complete";
		return FunctionToolCallback.builder(RESEARCH_COMPLETE, function)
			.description("Declare that the findings cover the research brief")
			.inputType(ResearchCompleteInput.class)
			.toolCallResultConverter(new PlainTextToolCallResultConverter())
			.build();
	}

}
