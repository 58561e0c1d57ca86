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
package com.deepdive.ai.graph.agent;

import com.deepdive.ai.graph.GraphRunResult;
import com.deepdive.ai.graph.NodeOutput;
import com.deepdive.ai.graph.RunStatus;
import com.deepdive.ai.graph.RunnableConfig;
import com.deepdive.ai.graph.agent.config.ResearchProperties;
import com.deepdive.ai.graph.agent.coordinator.LlmResearchSupervisor;
import com.deepdive.ai.graph.agent.model.InferencePurpose;
import com.deepdive.ai.graph.agent.model.InferenceRequest;
import com.deepdive.ai.graph.agent.state.ConversationMessage;
import com.deepdive.ai.graph.agent.state.Note;
import com.deepdive.ai.graph.agent.state.ResearchState;
import com.deepdive.ai.graph.agent.support.FakeToolProvider;
import com.deepdive.ai.graph.agent.support.ScriptedModelInference;
import com.deepdive.ai.graph.checkpoint.Checkpoint;
import com.deepdive.ai.graph.checkpoint.savers.MemorySaver;
import com.deepdive.ai.graph.exception.GraphStateException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.deepdive.ai.graph.agent.node.ResearchNodes.CLARIFY;
import static com.deepdive.ai.graph.agent.node.ResearchNodes.GENERATE_REPORT;
import static com.deepdive.ai.graph.agent.node.ResearchNodes.QUALITY_CONTROL;
import static com.deepdive.ai.graph.agent.node.ResearchNodes.RESEARCH;
import static com.deepdive.ai.graph.agent.node.ResearchNodes.VALIDATE_BRIEF;
import static com.deepdive.ai.graph.agent.node.ResearchNodes.WRITE_BRIEF;
import static com.deepdive.ai.graph.agent.support.ScriptedModelInference.call;
import static com.deepdive.ai.graph.agent.support.ScriptedModelInference.text;
import static com.deepdive.ai.graph.agent.support.ScriptedModelInference.toolCalls;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResearchAgentTest {

	private static final String QUERY = "Research Acme Corp";

	private static final String NO_CLARIFICATION = "{\"need_clarification\": false, \"question\": \"\"}";

	private static final String SHORT_BRIEF = "# Research Brief\nWhat does Acme sell?";

	private static final String REPORT_WITHOUT_SOURCES = "# Acme Corp\n\nAcme is a manufacturer.";

	private ScriptedModelInference model;

	private FakeToolProvider tools;

	private ResearchAgent agent;

	@BeforeEach
	void setUp() throws GraphStateException {
		model = new ScriptedModelInference();
		tools = new FakeToolProvider().tool("web_search", args -> "search results for " + args);
		model.reply(InferencePurpose.CLARIFY, NO_CLARIFICATION);
		model.reply(InferencePurpose.WRITE_BRIEF, SHORT_BRIEF, validBrief());
		AtomicInteger supervision = new AtomicInteger();
		model.on(InferencePurpose.SUPERVISE, request -> supervision.incrementAndGet() == 1
				? toolCalls("",
						call("s1", LlmResearchSupervisor.CONDUCT_RESEARCH, "{\"research_topic\":\"Acme revenue\"}"),
						call("s2", LlmResearchSupervisor.CONDUCT_RESEARCH, "{\"research_topic\":\"Acme debt\"}"))
				: text("Research is sufficient."));
		model.on(InferencePurpose.RESEARCH, request -> answersToolResults(request)
				? text("Findings on " + request.messages().get(1).getText())
				: toolCalls("", call("r1", "web_search", "{\"q\":\"" + request.messages().get(1).getText() + "\"}")));
		model.on(InferencePurpose.COMPRESS, request -> text("Compressed findings."));
		model.reply(InferencePurpose.REPORT, REPORT_WITHOUT_SOURCES);
		model.reply(InferencePurpose.SUMMARY, "Acme is a manufacturer.");

		ResearchProperties properties = new ResearchProperties();
		properties.getNode().setInitialDelay(Duration.ofMillis(1));
		properties.getNode().setJitter(false);
		agent = ResearchAgent.builder()
			.modelInference(model)
			.toolProvider(tools)
			.properties(properties)
			.checkpointSaver(new MemorySaver())
			.build();
	}

	@AfterEach
	void tearDown() {
		agent.close();
	}

	static String validBrief() {
		String questions = IntStream.rangeClosed(1, 15)
			.mapToObj(i -> i + ". What is factor " + i + " of Acme's performance?")
			.collect(Collectors.joining("\n"));
		return "# Research Brief\n\n## Key Questions\n" + questions
				+ "\n\n## Investigation Strategy\nFilings first.\n\n## Research Priorities\n1. Revenue";
	}

	private static boolean answersToolResults(InferenceRequest request) {
		List<Message> messages = request.messages();
		return messages.get(messages.size() - 1) instanceof ToolResponseMessage;
	}

	@Test
	void runsPipelineWithBoundedRevisions() {
		GraphRunResult<ResearchState> result = agent.startOrResume("acme", QUERY);

		assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
		assertThat(result.lastNodeId()).isEqualTo(QUALITY_CONTROL);
		ResearchState state = result.state();
		assertThat(state.getBriefRevisions()).isEqualTo(1);
		assertThat(state.isBriefValid()).isTrue();
		assertThat(state.getBrief()).isEqualTo(validBrief());
		assertThat(state.getRawNotes()).extracting(Note::topic).containsExactly("Acme revenue", "Acme debt");
		assertThat(state.getCompressedNotes()).hasSize(2);
		assertThat(state.getResearchIterations()).isEqualTo(1);
		assertThat(state.getReportRevisions()).isEqualTo(1);
		assertThat(state.isRevisionCapHit()).isTrue();
		assertThat(state.getWarnings()).singleElement()
			.satisfies(warning -> assertThat(warning).startsWith("Warning: the report did not pass quality control"));
		assertThat(state.getReport()).startsWith(REPORT_WITHOUT_SOURCES).contains("\n\n> Warning:");
		assertThat(state.getExecutiveSummary()).isEqualTo("Acme is a manufacturer.");
		assertThat(model.count(InferencePurpose.WRITE_BRIEF)).isEqualTo(2);
		assertThat(model.count(InferencePurpose.REPORT)).isEqualTo(2);
		assertThat(tools.invocations("web_search")).isEqualTo(2);
		assertThat(agent.getState("acme")).hasValue(state);
	}

	@Test
	void completedThreadIsReturnedAsIs() {
		GraphRunResult<ResearchState> first = agent.startOrResume("acme", QUERY);
		int calls = model.count(InferencePurpose.REPORT) + model.count(InferencePurpose.RESEARCH);

		GraphRunResult<ResearchState> second = agent.startOrResume("acme", QUERY);

		assertThat(second.status()).isEqualTo(RunStatus.COMPLETED);
		assertThat(second.state()).isEqualTo(first.state());
		assertThat(model.count(InferencePurpose.REPORT) + model.count(InferencePurpose.RESEARCH)).isEqualTo(calls);
	}

	@Test
	void clarificationAnswerRestartsPipeline() {
		model.reply(InferencePurpose.CLARIFY,
				"{\"need_clarification\": true, \"question\": \"Which Acme: the US manufacturer or the UK retailer?\"}");

		GraphRunResult<ResearchState> waiting = agent.startOrResume("acme", QUERY);

		assertThat(waiting.status()).isEqualTo(RunStatus.COMPLETED);
		assertThat(waiting.lastNodeId()).isEqualTo(CLARIFY);
		assertThat(waiting.state().isAwaitingClarification()).isTrue();
		assertThat(waiting.state().getClarificationQuestion()).startsWith("Which Acme");
		assertThat(model.count(InferencePurpose.WRITE_BRIEF)).isZero();

		GraphRunResult<ResearchState> answered = agent.startOrResume("acme", "The US manufacturer");

		assertThat(answered.status()).isEqualTo(RunStatus.COMPLETED);
		assertThat(answered.lastNodeId()).isEqualTo(QUALITY_CONTROL);
		assertThat(answered.state().getQuery()).isEqualTo(QUERY);
		assertThat(answered.state().getMessages()).contains(ConversationMessage.user("The US manufacturer"));
		assertThat(answered.state().isAwaitingClarification()).isFalse();
		assertThat(model.count(InferencePurpose.CLARIFY)).isEqualTo(1);
		assertThat(model.requests(InferencePurpose.WRITE_BRIEF).get(0).messages())
			.anySatisfy(message -> assertThat(message.getText()).isEqualTo("The US manufacturer"));
	}

	@Test
	void failedRunResumesWithoutRepeatingResearch() {
		AtomicInteger reports = new AtomicInteger();
		model.on(InferencePurpose.REPORT, request -> {
			if (reports.incrementAndGet() == 1) {
				throw new IllegalStateException("report model crashed");
			}
			return text(REPORT_WITHOUT_SOURCES);
		});

		GraphRunResult<ResearchState> failed = agent.startOrResume("acme", QUERY);

		assertThat(failed.status()).isEqualTo(RunStatus.FAILED);
		assertThat(failed.lastNodeId()).isEqualTo(RESEARCH);
		assertThat(failed.error()).hasValueSatisfying(
				error -> assertThat(error).hasMessageContaining("report model crashed"));
		int researchCalls = model.count(InferencePurpose.RESEARCH);

		GraphRunResult<ResearchState> resumed = agent.startOrResume("acme", null);

		assertThat(resumed.status()).isEqualTo(RunStatus.COMPLETED);
		assertThat(resumed.state().getRawNotes()).hasSize(2);
		assertThat(model.count(InferencePurpose.RESEARCH)).isEqualTo(researchCalls);
		assertThat(tools.invocations("web_search")).isEqualTo(2);
	}

	@Test
	void timedOutResearchRetryReusesToolCallInFlight() throws GraphStateException {
		FakeToolProvider orders = new FakeToolProvider().tool("place_order", args -> {
			try {
				Thread.sleep(700);
			}
			catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
			}
			return "order accepted for " + args;
		});
		AtomicInteger supervision = new AtomicInteger();
		model.on(InferencePurpose.SUPERVISE, request -> supervision.incrementAndGet() <= 2
				? toolCalls("",
						call("s1", LlmResearchSupervisor.CONDUCT_RESEARCH, "{\"research_topic\":\"Acme order\"}"))
				: text("Research is sufficient."));
		model.on(InferencePurpose.RESEARCH, request -> answersToolResults(request) ? text("Order placed.")
				: toolCalls("", call("r1", "place_order", "{\"sku\":\"A-1\"}")));
		ResearchProperties properties = new ResearchProperties();
		properties.getNode().setInitialDelay(Duration.ofMillis(1));
		properties.getNode().setJitter(false);
		properties.getResearch().setTimeout(Duration.ofMillis(500));

		try (ResearchAgent ordering = ResearchAgent.builder()
			.modelInference(model)
			.toolProvider(orders)
			.properties(properties)
			.build()) {
			GraphRunResult<ResearchState> result = ordering.startOrResume("orders", QUERY);

			assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
			assertThat(supervision.get()).isEqualTo(3);
			assertThat(result.state().getRawNotes()).extracting(Note::topic).containsExactly("Acme order");
			assertThat(orders.invocations("place_order")).isEqualTo(1);
		}
	}

	@Test
	void cancelledRunStopsAtNodeBoundaryAndResumes() throws Exception {
		CountDownLatch entered = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		model.on(InferencePurpose.CLARIFY, request -> {
			entered.countDown();
			try {
				release.await(10, TimeUnit.SECONDS);
			}
			catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
			}
			return text(NO_CLARIFICATION);
		});

		CompletableFuture<GraphRunResult<ResearchState>> running = CompletableFuture
			.supplyAsync(() -> agent.startOrResume("acme", QUERY));
		assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

		assertThatThrownBy(() -> agent.startOrResume("acme", QUERY)).isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("already running");
		assertThat(agent.cancel("acme")).isTrue();
		release.countDown();
		GraphRunResult<ResearchState> cancelled = running.get(10, TimeUnit.SECONDS);

		assertThat(cancelled.status()).isEqualTo(RunStatus.CANCELLED);
		assertThat(cancelled.lastNodeId()).isEqualTo(CLARIFY);
		assertThat(model.count(InferencePurpose.WRITE_BRIEF)).isZero();
		assertThat(agent.cancel("acme")).isFalse();

		GraphRunResult<ResearchState> resumed = agent.startOrResume("acme", null);

		assertThat(resumed.status()).isEqualTo(RunStatus.COMPLETED);
		assertThat(model.count(InferencePurpose.CLARIFY)).isEqualTo(1);
	}

	@Test
	void streamEmitsEveryCompletedNode() {
		StepVerifier.create(agent.stream("acme", QUERY))
			.recordWith(ArrayList::new)
			.thenConsumeWhile(output -> true)
			.consumeRecordedWith(outputs -> assertThat(outputs).extracting(NodeOutput::node)
				.containsExactly(CLARIFY, WRITE_BRIEF, VALIDATE_BRIEF, WRITE_BRIEF, VALIDATE_BRIEF, RESEARCH,
						GENERATE_REPORT, QUALITY_CONTROL, GENERATE_REPORT, QUALITY_CONTROL))
			.expectComplete()
			.verify(Duration.ofSeconds(30));

		assertThat(agent.getState("acme")).hasValueSatisfying(state -> assertThat(state.getReport()).isNotBlank());
	}

	@Test
	void abandonedStreamKeepsThreadBusyUntilRunStops() throws Exception {
		CountDownLatch entered = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		AtomicInteger active = new AtomicInteger();
		AtomicInteger peak = new AtomicInteger();
		model.on(InferencePurpose.WRITE_BRIEF, request -> {
			peak.accumulateAndGet(active.incrementAndGet(), Math::max);
			entered.countDown();
			try {
				release.await(10, TimeUnit.SECONDS);
			}
			catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
			}
			finally {
				active.decrementAndGet();
			}
			return text(validBrief());
		});

		NodeOutput<ResearchState> first = agent.stream("acme", QUERY).take(1).blockLast(Duration.ofSeconds(10));
		assertThat(first.node()).isEqualTo(CLARIFY);
		assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

		assertThatThrownBy(() -> agent.startOrResume("acme", QUERY)).isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("already running");
		assertThat(agent.cancel("acme")).isTrue();
		release.countDown();
		awaitIdle("acme");

		Checkpoint checkpoint = agent.getCompiledGraph()
			.getCheckpoint(RunnableConfig.builder().threadId("acme").build())
			.orElseThrow();
		assertThat(checkpoint.getStatus()).isEqualTo(RunStatus.CANCELLED);
		assertThat(checkpoint.getNodeId()).isEqualTo(WRITE_BRIEF);
		assertThat(model.count(InferencePurpose.SUPERVISE)).isZero();

		GraphRunResult<ResearchState> resumed = agent.startOrResume("acme", null);

		assertThat(resumed.status()).isEqualTo(RunStatus.COMPLETED);
		assertThat(model.count(InferencePurpose.WRITE_BRIEF)).isEqualTo(1);
		assertThat(peak.get()).isEqualTo(1);
	}

	private void awaitIdle(String threadId) throws InterruptedException {
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
		while (agent.cancel(threadId)) {
			assertThat(System.nanoTime()).as("thread %s still running", threadId).isLessThan(deadline);
			Thread.sleep(10);
		}
	}

	@Test
	void newThreadNeedsQuery() {
		assertThatThrownBy(() -> agent.startOrResume("empty", " ")).isInstanceOf(IllegalArgumentException.class);
		assertThat(agent.getState("empty")).isEmpty();
	}

	@Test
	void queryMetadataIsDerivedOnce() {
		ResearchState state = agent.startOrResume("focus", "Research Acme Corp, focusing on supply chain risks.")
			.state();

		assertThat(state.getMetadata()).containsEntry(ResearchState.METADATA_CATEGORY, "company")
			.containsEntry(ResearchState.METADATA_FOCUS, "supply chain risks");
		assertThat(state.getWarnings().get(0)).contains("supply chain risks");
	}

	@Test
	void describesGraph() {
		assertThat(agent.getGraph()).contains(CLARIFY, WRITE_BRIEF, VALIDATE_BRIEF, RESEARCH, GENERATE_REPORT,
				QUALITY_CONTROL);
	}

}
