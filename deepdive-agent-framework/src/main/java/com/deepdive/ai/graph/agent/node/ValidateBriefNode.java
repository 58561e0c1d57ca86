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
import com.deepdive.ai.graph.agent.validation.BriefValidator;
import com.deepdive.ai.graph.agent.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

import static com.deepdive.ai.graph.checkpoint.BaseCheckpointSaver.THREAD_ID_DEFAULT;

/**
 * Checks the structure of the brief. A failing brief is sent back for revision while
 * revisions remain, otherwise it goes forward with a visible warning.
 */
public class ValidateBriefNode implements NodeAction<ResearchState> {

	private static final Logger log = LoggerFactory.getLogger(ValidateBriefNode.class);

	private final BriefValidator validator;

	private final int maxRevisions;

	public ValidateBriefNode(BriefValidator validator, int maxRevisions) {
		this.validator = Objects.requireNonNull(validator, "validator cannot be null");
		this.maxRevisions = maxRevisions;
	}

	@Override
	public ResearchState apply(ResearchState state, RunnableConfig config) {
		String threadId = config.threadId().orElse(THREAD_ID_DEFAULT);
		ValidationResult result = validator.validate(state.getBrief());
		if (result.valid()) {
			state.setBriefValid(true);
			log.info("[ThreadId {}] brief is valid", threadId);
			return state;
		}

		state.setBriefValid(false);
		if (state.getBriefRevisions() < maxRevisions) {
			state.setBriefRevisions(state.getBriefRevisions() + 1);
			state.setBriefRevisionHint(result.hint());
			state.addMessage(ConversationMessage.system("Brief revision requested:\n" + result.hint()));
			log.info("[ThreadId {}] brief rejected, requesting revision {}/{}: {}", threadId,
					state.getBriefRevisions(), maxRevisions, result.issues());
			return state;
		}

		String warning = "Warning: the research brief did not pass structural validation after "
				+ state.getBriefRevisions() + " revision(s): " + String.join("; ", result.issues());
		state.markBriefCapHit();
		state.addWarning(warning);
		state.setBrief(state.getBrief() + "\n\n> " + warning);
		log.warn("[ThreadId {}] brief revision cap reached, proceeding: {}", threadId, result.issues());
		return state;
	}

}
