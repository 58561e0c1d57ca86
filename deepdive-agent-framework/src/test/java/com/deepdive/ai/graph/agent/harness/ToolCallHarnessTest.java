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
package com.deepdive.ai.graph.agent.harness;

import com.deepdive.ai.graph.agent.interceptor.journal.ToolInvocationJournal;
import com.deepdive.ai.graph.agent.model.InferencePurpose;
import com.deepdive.ai.graph.agent.model.InferenceRequest;
import com.deepdive.ai.graph.agent.model.ModelInferenceException;
import com.deepdive.ai.graph.agent.support.FakeToolProvider;
import com.deepdive.ai.graph.agent.support.ScriptedModelInference;
import com.deepdive.ai.graph.executor.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static com.deepdive.ai.graph.agent.support.ScriptedModelInference.call;
import static com.deepdive.ai.graph.agent.support.ScriptedModelInference.text;
import static com.deepdive.ai.graph.agent.support.ScriptedModelInference.toolCalls;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolCallHarnessTest {

	private ScriptedModelInference model;

	private FakeToolProvider tools;

	private ExecutorService toolExecutor;

	@BeforeEach
	void setUp() {
		model = new ScriptedModelInference();
		tools = new FakeToolProvider().tool("web_search", args -> "results for " + args);
		toolExecutor = Executors.newCachedThreadPool();
	}

	@AfterEach
	void tearDown() {
		toolExecutor.shutdownNow();
	}

	private ToolCallHarness harness() {
		return ToolCallHarness.builder()
			.modelInference(model)
			.toolProvider(tools)
			.toolExecutor(toolExecutor)
			.modelRetryPolicy(RetryPolicy.builder().initialDelay(1).maxDelay(5).jitter(false).build())
			.build();
	}

	private static TaskContext context(ToolInvocationJournal journal) {
		return new TaskContext("thread-1", "round-01-task-01", "Acme revenue", 1, "brief", List.of("web_search"),
				journal);
	}

	private static boolean answersToolResults(InferenceRequest request) {
		List<Message> messages = request.messages();
		return messages.get(messages.size() - 1) instanceof ToolResponseMessage;
	}

	@Test
	void stopsAtToolBudgetAndReturnsPartialAnswer() {
		AtomicInteger turn = new AtomicInteger();
		AtomicInteger callId = new AtomicInteger();
		model.on(InferencePurpose.RESEARCH, request -> {
			int n = turn.incrementAndGet();
			return toolCalls("searching round " + n,
					call("c" + callId.incrementAndGet(), "web_search", "{\"q\":\"" + callId.get() + "\"}"),
					call("c" + callId.incrementAndGet(), "web_search", "{\"q\":\"" + callId.get() + "\"}"),
					call("c" + callId.incrementAndGet(), "web_search", "{\"q\":\"" + callId.get() + "\"}"));
		});

		ResultNote note = harness().runToolLoop(context(null));

		assertThat(note.truncated()).isTrue();
		assertThat(note.toolInvocations()).isEqualTo(ToolCallHarness.DEFAULT_MAX_TOOL_CALLS);
		assertThat(note.observations()).hasSize(8);
		assertThat(note.content()).isEqualTo("searching round 3");
		assertThat(tools.invocations("web_search")).isEqualTo(8);
		assertThat(model.count(InferencePurpose.RESEARCH)).isEqualTo(3);
	}

	@Test
	void answersWithoutToolsWhenModelIsDone() {
		model.on(InferencePurpose.RESEARCH, request -> text("Acme earned 10M in 2024."));

		ResultNote note = harness().runToolLoop(context(null));

		assertThat(note.truncated()).isFalse();
		assertThat(note.toolInvocations()).isZero();
		assertThat(note.content()).isEqualTo("Acme earned 10M in 2024.");
	}

	@Test
	void toolFailureBecomesObservation() {
		tools.tool("web_search", args -> {
			throw new IllegalStateException("rate limited");
		});
		model.on(InferencePurpose.RESEARCH, request -> answersToolResults(request) ? text("No data found.")
				: toolCalls("", call("c1", "web_search", "{\"q\":\"acme\"}")));

		ResultNote note = harness().runToolLoop(context(null));

		assertThat(note.truncated()).isFalse();
		assertThat(note.content()).isEqualTo("No data found.");
		assertThat(note.observations()).containsExactly("Tool failed: rate limited");
		ToolResponseMessage fedBack = (ToolResponseMessage) model.requests(InferencePurpose.RESEARCH)
			.get(1)
			.messages()
			.get(3);
		assertThat(fedBack.getResponses()).singleElement()
			.satisfies(response -> assertThat(response.responseData()).isEqualTo("Tool failed: rate limited"));
	}

	@Test
	void unassignedToolIsReportedAsUnavailable() {
		tools.tool("delete_records", args -> "deleted");
		model.on(InferencePurpose.RESEARCH, request -> answersToolResults(request) ? text("done")
				: toolCalls("", call("c1", "delete_records", "{}")));

		ResultNote note = harness().runToolLoop(context(null));

		assertThat(note.observations()).containsExactly("Tool delete_records not available");
		assertThat(tools.invocations("delete_records")).isZero();
	}

	@Test
	void retriesModelFailuresWithinLimit() {
		AtomicInteger calls = new AtomicInteger();
		model.on(InferencePurpose.RESEARCH, request -> {
			if (calls.incrementAndGet() < 3) {
				throw new IllegalStateException("model overloaded");
			}
			return text("recovered");
		});

		ResultNote note = harness().runToolLoop(context(null));

		assertThat(note.content()).isEqualTo("recovered");
		assertThat(calls).hasValue(3);
	}

	@Test
	void failsAfterConsecutiveModelFailures() {
		model.on(InferencePurpose.RESEARCH, request -> {
			throw new IllegalStateException("model down");
		});

		assertThatThrownBy(() -> harness().runToolLoop(context(null))).isInstanceOf(ModelInferenceException.class)
			.hasMessageContaining("failed 3 consecutive time(s)")
			.hasRootCauseMessage("model down");
		assertThat(model.count(InferencePurpose.RESEARCH)).isEqualTo(ToolCallHarness.DEFAULT_MAX_MODEL_FAILURES);
	}

	@Test
	void replaysJournaledToolCallsOnRerun() {
		ToolInvocationJournal journal = new ToolInvocationJournal();
		model.on(InferencePurpose.RESEARCH, request -> answersToolResults(request) ? text("Acme is profitable.")
				: toolCalls("", call("c1", "web_search", "{\"q\":\"acme profit\"}")));
		ToolCallHarness harness = harness();

		ResultNote first = harness.runToolLoop(context(journal));
		ResultNote second = harness.runToolLoop(context(journal));

		assertThat(tools.invocations("web_search")).isEqualTo(1);
		assertThat(journal.size()).isEqualTo(1);
		assertThat(journal.replayCount()).isEqualTo(1);
		assertThat(second.observations()).isEqualTo(first.observations());
	}

	@Test
	void rejectsInvalidBudget() {
		assertThatThrownBy(() -> ToolCallHarness.builder().maxToolCalls(0))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
