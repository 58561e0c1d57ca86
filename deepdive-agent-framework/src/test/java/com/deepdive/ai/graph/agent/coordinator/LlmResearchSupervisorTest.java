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
import com.deepdive.ai.graph.agent.state.ResearchState;
import com.deepdive.ai.graph.agent.support.ScriptedModelInference;
import com.deepdive.ai.graph.agent.tool.ThinkTool;
import org.junit.jupiter.api.Test;

import static com.deepdive.ai.graph.agent.support.ScriptedModelInference.call;
import static com.deepdive.ai.graph.agent.support.ScriptedModelInference.text;
import static com.deepdive.ai.graph.agent.support.ScriptedModelInference.toolCalls;
import static org.assertj.core.api.Assertions.assertThat;

class LlmResearchSupervisorTest {

	private final ScriptedModelInference model = new ScriptedModelInference();

	private final LlmResearchSupervisor supervisor = new LlmResearchSupervisor(model, 4);

	private ResearchState state() {
		ResearchState state = new ResearchState("Research Acme");
		state.setBrief("# Research Brief");
		return state;
	}

	@Test
	void delegatesTopicsFromConductResearchCalls() {
		model.on(InferencePurpose.SUPERVISE,
				request -> toolCalls("",
						call("1", ThinkTool.NAME, "{\"reflection\":\"start with financials\"}"),
						call("2", LlmResearchSupervisor.CONDUCT_RESEARCH, "{\"research_topic\":\"Acme revenue\"}"),
						call("3", LlmResearchSupervisor.CONDUCT_RESEARCH, "{\"research_topic\":\" Acme debt \"}")));

		SupervisorDecision decision = supervisor.decide(state(), 1, 3);

		assertThat(decision.complete()).isFalse();
		assertThat(decision.topics()).containsExactly("Acme revenue", "Acme debt");
		assertThat(decision.reflections()).containsExactly("Reflection recorded: start with financials");
		assertThat(model.requests(InferencePurpose.SUPERVISE)
			.get(0)
			.tools()
			.stream()
			.map(tool -> tool.getToolDefinition().name())
			.toList()).containsExactly(LlmResearchSupervisor.CONDUCT_RESEARCH, LlmResearchSupervisor.RESEARCH_COMPLETE,
					ThinkTool.NAME);
	}

	@Test
	void researchCompleteEndsResearch() {
		model.on(InferencePurpose.SUPERVISE,
				request -> toolCalls("",
						call("1", LlmResearchSupervisor.CONDUCT_RESEARCH, "{\"research_topic\":\"Acme revenue\"}"),
						call("2", LlmResearchSupervisor.RESEARCH_COMPLETE, "{}")));

		SupervisorDecision decision = supervisor.decide(state(), 2, 3);

		assertThat(decision.complete()).isTrue();
		assertThat(decision.topics()).isEmpty();
	}

	@Test
	void replyWithoutToolCallsEndsResearch() {
		model.on(InferencePurpose.SUPERVISE, request -> text("The findings are sufficient."));

		assertThat(supervisor.decide(state(), 1, 3).complete()).isTrue();
	}

	@Test
	void ignoresMalformedArguments() {
		model.on(InferencePurpose.SUPERVISE,
				request -> toolCalls("", call("1", LlmResearchSupervisor.CONDUCT_RESEARCH, "not json"),
						call("2", LlmResearchSupervisor.CONDUCT_RESEARCH, "{\"research_topic\":\"Acme debt\"}")));

		assertThat(supervisor.decide(state(), 1, 3).topics()).containsExactly("Acme debt");
	}

}
