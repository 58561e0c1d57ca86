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
import com.deepdive.ai.graph.action.NodeAction;
import com.deepdive.ai.graph.agent.state.ConversationMessage;
import com.deepdive.ai.graph.agent.state.ResearchState;
import com.deepdive.ai.graph.agent.validation.ReportQualityChecker;
import com.deepdive.ai.graph.agent.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

import static com.deepdive.ai.graph.checkpoint.BaseCheckpointSaver.THREAD_ID_DEFAULT;

/**
 * Checks the structure of the report. A failing report is regenerated while revisions
 * remain, otherwise the run ends with a visible warning.
 */
public class QualityControlNode implements NodeAction<ResearchState> {

	private static final Logger log = LoggerFactory.getLogger(QualityControlNode.class);

	private final ReportQualityChecker checker;

	private final int maxRevisions;

	public QualityControlNode(ReportQualityChecker checker, int maxRevisions) {
		this.checker = Objects.requireNonNull(checker, "checker cannot be null");
		this.maxRevisions = maxRevisions;
	}

	@Override
	public ResearchState apply(ResearchState state, RunnableConfig config) {
		String threadId = config.threadId().orElse(THREAD_ID_DEFAULT);
		ValidationResult result = checker.check(state.getReport(), state.getFocus().orElse(null));
		if (result.valid()) {
			state.setReportValid(true);
			log.info("[ThreadId {}] report passed quality control", threadId);
			return state;
		}

		state.setReportValid(false);
		if (state.getReportRevisions() < maxRevisions) {
			state.setReportRevisions(state.getReportRevisions() + 1);
			state.setReportRevisionHint(result.hint());
			state.addMessage(ConversationMessage.system("Report revision requested:\n" + result.hint()));
			log.info("[ThreadId {}] report failed quality control, requesting revision {}/{}: {}", threadId,
					state.getReportRevisions(), maxRevisions, result.issues());
			return state;
		}

		String warning = "Warning: the report did not pass quality control after " + state.getReportRevisions()
				+ " revision(s): " + String.join("; ", result.issues());
		state.markReportCapHit();
		state.addWarning(warning);
		state.setReport(state.getReport() + "\n\n> " + warning);
		log.warn("[ThreadId {}] report revision cap reached, finishing with warning: {}", threadId, result.issues());
		return state;
	}

}
