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
package com.deepdive.ai.graph.agent.node;

import com.deepdive.ai.graph.RunnableConfig;
import com.deepdive.ai.graph.agent.model.InferencePurpose;
import com.deepdive.ai.graph.agent.state.ConversationMessage;
import com.deepdive.ai.graph.agent.state.ResearchState;
import com.deepdive.ai.graph.agent.support.ScriptedModelInference;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClarifyNodeTest {

	private final ScriptedModelInference model = new ScriptedModelInference();

	private final RunnableConfig config = RunnableConfig.builder().threadId("thread-1").build();

	@Test
	void asksQuestionAndWaits() {
		model.reply(InferencePurpose.CLARIFY,
				"```json\n{\"need_clarification\": true, \"question\": \"Which Acme do you mean?\"}\n```");

		ResearchState state = new ClarifyNode(model, true, 1).apply(new ResearchState("Research Acme"), config);

		assertThat(state.isAwaitingClarification()).isTrue();
		assertThat(state.getClarificationQuestion()).isEqualTo("Which Acme do you mean?");
		assertThat(state.getClarificationRounds()).isEqualTo(1);
		assertThat(state.getMessages()).endsWith(ConversationMessage.assistant("Which Acme do you mean?"));
	}

	@Test
	void proceedsWhenNoClarificationNeeded() {
		model.reply(InferencePurpose.CLARIFY, "{\"need_clarification\": false, \"question\": \"\"}");

		ResearchState state = new ClarifyNode(model, true, 1).apply(new ResearchState("Research Acme Corp"), config);

		assertThat(state.isAwaitingClarification()).isFalse();
		assertThat(state.getClarificationRounds()).isZero();
	}

	@Test
	void skipsModelOnceQuestionsAreSpent() {
		ResearchState state = new ResearchState("Research Acme");
		state.setClarificationRounds(1);
		state.setAwaitingClarification(true);

		new ClarifyNode(model, true, 1).apply(state, config);
		new ClarifyNode(model, false, 1).apply(new ResearchState("Research Acme"), config);

		assertThat(state.isAwaitingClarification()).isFalse();
		assertThat(model.count(InferencePurpose.CLARIFY)).isZero();
	}

	@Test
	void unparseableAnswerMeansProceed() {
		ClarifyNode node = new ClarifyNode(model, true, 1);

		assertThat(node.parseQuestion("Sure, let me research that.")).isEmpty();
		assertThat(node.parseQuestion("{need_clarification: yes}")).isEmpty();
		assertThat(node.parseQuestion("{\"need_clarification\": true}")).isEmpty();
	}

}
