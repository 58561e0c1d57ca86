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

import com.deepdive.ai.graph.NodePolicy;
import com.deepdive.ai.graph.RunnableConfig;
import com.deepdive.ai.graph.agent.harness.ResultNote;
import com.deepdive.ai.graph.agent.harness.TaskContext;
import com.deepdive.ai.graph.agent.harness.ToolCallHarness;
import com.deepdive.ai.graph.agent.state.Note;
import com.deepdive.ai.graph.agent.state.ResearchTask;
import com.deepdive.ai.graph.agent.state.TaskStatus;
import com.deepdive.ai.graph.executor.NodeExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs one research task: the tool loop under the timeout and retry policy of the
 * node executor, then compression. Never throws, failures are returned as a
 * {@link TaskOutcome}.
 */
public class ResearchTaskRunner {

	private static final Logger log = LoggerFactory.getLogger(ResearchTaskRunner.class);

	private final ToolCallHarness harness;

	private final ResearchCompressor compressor;

	private final NodeExecutor nodeExecutor;

	private final NodePolicy taskPolicy;

	public ResearchTaskRunner(ToolCallHarness harness, ResearchCompressor compressor, NodeExecutor nodeExecutor,
			NodePolicy taskPolicy) {
		this.harness = Objects.requireNonNull(harness, "harness cannot be null");
		this.compressor = Objects.requireNonNull(compressor, "compressor cannot be null");
		this.nodeExecutor = Objects.requireNonNull(nodeExecutor, "nodeExecutor cannot be null");
		this.taskPolicy = Objects.requireNonNull(taskPolicy, "taskPolicy cannot be null");
	}

	public TaskOutcome run(ResearchTask task, TaskContext context, RunnableConfig config) {
		task.setStatus(TaskStatus.RUNNING);
		try {
			ResultNote result = nodeExecutor.call(task.getId(), taskPolicy, config, () -> harness.runToolLoop(context));
			String compressed = compressor.compress(result);
			Note rawNote = new Note(task.getId(), task.getTopic(), ResearchCompressor.rawFindings(result),
					task.getRound(), result.truncated());
			Note compressedNote = new Note(task.getId(), task.getTopic(), compressed, task.getRound(),
					result.truncated());
			task.setStatus(TaskStatus.DONE);
			log.info("[TaskId {}] done with {} tool call(s){}", task.getId(), result.toolInvocations(),
					result.truncated() ? ", truncated" : "");
			return TaskOutcome.success(task, rawNote, compressedNote);
		}
		catch (RuntimeException ex) {
			task.setStatus(TaskStatus.FAILED);
			log.error("[TaskId {}] failed: {}", task.getId(), ex.getMessage());
			return TaskOutcome.failure(task, ex);
		}
	}

}
