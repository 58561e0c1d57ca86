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
import com.deepdive.ai.graph.agent.edge.BriefRoutingEdge;
import com.deepdive.ai.graph.agent.edge.QualityRoutingEdge;
import com.deepdive.ai.graph.agent.state.ConversationMessage;
import com.deepdive.ai.graph.agent.state.ResearchState;
import com.deepdive.ai.graph.agent.validation.BriefValidator;
import com.deepdive.ai.graph.agent.validation.ReportQualityChecker;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RevisionLoopNodesTest {

	private final RunnableConfig config = RunnableConfig.builder().threadId("thread-1").build();

	private final ValidateBriefNode validateBrief = new ValidateBriefNode(
			new BriefValidator(15, 30, BriefValidator.DEFAULT_REQUIRED_SECTIONS), 1);

	private final QualityControlNode qualityControl = new QualityControlNode(new ReportQualityChecker(5, 3), 1);

	@Test
	void invalidBriefIsRevisedOnceThenPassesWithWarning() {
		ResearchState state = new ResearchState("Research Acme");
		state.setBrief("# Brief\nWhat does Acme sell?");

		validateBrief.apply(state, config);

		assertThat(state.getBriefRevisions()).isEqualTo(1);
		assertThat(state.getBriefRevisionHint()).startsWith("1. The brief has 1 investigative questions");
		assertThat(state.getMessages()).last()
			.satisfies(message -> assertThat(message.content()).startsWith("Brief revision requested:\n1. "));
		assertThat(new BriefRoutingEdge().apply(state)).isEqualTo(BriefRoutingEdge.REVISE);

		validateBrief.apply(state, config);

		assertThat(state.isBriefCapHit()).isTrue();
		assertThat(state.isRevisionCapHit()).isTrue();
		assertThat(state.getWarnings()).singleElement()
			.satisfies(warning -> assertThat(warning).startsWith("Warning: the research brief did not pass"));
		assertThat(state.getBrief()).contains("\n\n> Warning: the research brief");
		assertThat(new BriefRoutingEdge().apply(state)).isEqualTo(BriefRoutingEdge.PROCEED);
	}

	@Test
	void failingReportIsRegeneratedOnceThenFinishesWithWarning() {
		ResearchState state = new ResearchState("Research Acme");
		state.setReport("# Acme\n\nNo citations here.");

		qualityControl.apply(state, config);

		assertThat(state.getReportRevisions()).isEqualTo(1);
		assertThat(state.getMessages()).last()
			.isEqualTo(ConversationMessage.system("Report revision requested:\n" + state.getReportRevisionHint()));
		assertThat(new QualityRoutingEdge().apply(state)).isEqualTo(QualityRoutingEdge.REVISE);

		qualityControl.apply(state, config);

		assertThat(state.isReportCapHit()).isTrue();
		assertThat(state.getReport()).contains("> Warning: the report did not pass quality control after 1 revision(s)");
		assertThat(new QualityRoutingEdge().apply(state)).isEqualTo(QualityRoutingEdge.FINISH);
	}

	@Test
	void passingReportFinishesImmediately() {
		ResearchState state = new ResearchState("Research Acme");
		state.setReport("Growth [1] [2] [3].\n\n## Sources\n1. a\n2. b\n3. c\n4. d\n5. e\n");

		qualityControl.apply(state, config);

		assertThat(state.isReportValid()).isTrue();
		assertThat(state.getWarnings()).isEmpty();
		assertThat(new QualityRoutingEdge().apply(state)).isEqualTo(QualityRoutingEdge.FINISH);
	}

}
