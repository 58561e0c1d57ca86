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

import com.deepdive.ai.graph.agent.state.Note;
import com.deepdive.ai.graph.agent.state.ResearchTask;

/**
 * Result of one research task: its raw and compressed notes, or the error that
 * stopped it.
 */
public record TaskOutcome(ResearchTask task, Note rawNote, Note compressedNote, Throwable error) {

	public static TaskOutcome success(ResearchTask task, Note rawNote, Note compressedNote) {
		return new TaskOutcome(task, rawNote, compressedNote, null);
	}

	public static TaskOutcome failure(ResearchTask task, Throwable error) {
		return new TaskOutcome(task, null, null, error);
	}

	public boolean failed() {
		return error != null;
	}

}
