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
package com.deepdive.ai.graph;

import com.deepdive.ai.graph.checkpoint.Checkpoint;
import com.deepdive.ai.graph.checkpoint.savers.MemorySaver;
import com.deepdive.ai.graph.exception.GraphStateException;
import com.deepdive.ai.graph.exception.NodeExecutionException;
import com.deepdive.ai.graph.executor.RetryPolicy;
import com.deepdive.ai.graph.serializer.plain_text.jackson.JacksonStateSerializer;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.deepdive.ai.graph.StateGraph.END;
import static com.deepdive.ai.graph.StateGraph.START;
import static com.deepdive.ai.graph.action.AsyncNodeAction.node_async;
import static org.assertj.core.api.Assertions.assertThat;

class CompiledGraphTest {

	private final RecordingSaver saver = new RecordingSaver();

	private final List<String> executed = Collections.synchronizedList(new ArrayList<>());

	private static final NodePolicy FAST_POLICY = NodePolicy.of(Duration.ofSeconds(5),
			RetryPolicy.builder().maxRetries(2).initialDelay(1).jitter(false).build());

	private final GraphLifecycleListener recorder = new GraphLifecycleListener() {
		@Override
		public void before(String nodeId, Object state, RunnableConfig config) {
			executed.add(nodeId);
		}
	};

	private StateGraph<SimpleState> newGraph() {
		return new StateGraph<>("test", new JacksonStateSerializer<>(SimpleState.class));
	}

	private CompiledGraph<SimpleState> compile(StateGraph<SimpleState> graph) throws GraphStateException {
		return compile(graph, CompileConfig.DEFAULT_MAX_ITERATIONS);
	}

	private CompiledGraph<SimpleState> compile(StateGraph<SimpleState> graph, int maxIterations)
			throws GraphStateException {
		return graph.compile(CompileConfig.builder()
			.checkpointSaver(saver)
			.defaultNodePolicy(FAST_POLICY)
			.maxIterations(maxIterations)
			.withLifecycleListener(recorder)
			.build());
	}

	private static RunnableConfig thread(String threadId) {
		return RunnableConfig.builder().threadId(threadId).build();
	}

	private StateGraph<SimpleState> linearGraph() throws GraphStateException {
		return newGraph().addNode("a", node_async((s, c) -> s.step("a")))
			.addNode("b", node_async((s, c) -> s.step("b")))
			.addNode("c", node_async((s, c) -> s.step("c")))
			.addEdge(START, "a")
			.addEdge("a", "b")
			.addEdge("b", "c")
			.addEdge("c", END);
	}

	@Test
	void checkpointIsWrittenAfterEveryNodeBeforeTheEdgeIsEvaluated() throws GraphStateException {
		List<String> nodeIdSeenByEdge = new ArrayList<>();
		StateGraph<SimpleState> graph = newGraph().addNode("a", node_async((s, c) -> s.step("a")))
			.addNode("b", node_async((s, c) -> s.step("b")))
			.addEdge(START, "a")
			.addConditionalEdges("a", s -> {
				nodeIdSeenByEdge.add(saver.get("linear").orElseThrow().getNodeId());
				return "next";
			}, Map.of("next", "b"))
			.addEdge("b", END);

		GraphRunResult<SimpleState> result = compile(graph).invoke(new SimpleState("q"), thread("linear"));

		assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
		assertThat(result.state().getSteps()).containsExactly("a", "b");
		assertThat(nodeIdSeenByEdge).containsExactly("a");
		assertThat(saver.writes).containsExactly(START + ":RUNNING", "a:RUNNING", "b:RUNNING", "b:COMPLETED");
	}

	@Test
	void conditionalBackEdgeLoopsUntilTheConditionChanges() throws GraphStateException {
		StateGraph<SimpleState> graph = newGraph().addNode("write", node_async((s, c) -> {
			s.setCounter(s.getCounter() + 1);
			return s.step("write");
		}))
			.addNode("check", node_async((s, c) -> s.step("check")))
			.addEdge(START, "write")
			.addEdge("write", "check")
			.addConditionalEdges("check", s -> s.getCounter() < 2 ? "revise" : "done",
					Map.of("revise", "write", "done", END));

		GraphRunResult<SimpleState> result = compile(graph).invoke(new SimpleState("q"), thread("loop"));

		assertThat(result.isCompleted()).isTrue();
		assertThat(executed).containsExactly("write", "check", "write", "check");
		assertThat(result.lastNodeId()).isEqualTo("check");
	}

	@Test
	void resumingACompletedThreadExecutesNothing() throws GraphStateException {
		CompiledGraph<SimpleState> compiled = compile(linearGraph());
		GraphRunResult<SimpleState> first = compiled.invoke(new SimpleState("q"), thread("done"));
		executed.clear();
		int writes = saver.writes.size();

		GraphRunResult<SimpleState> second = compiled.invoke(new SimpleState("ignored"), thread("done"));

		assertThat(executed).isEmpty();
		assertThat(saver.writes).hasSize(writes);
		assertThat(second.status()).isEqualTo(RunStatus.COMPLETED);
		assertThat(second.state()).isEqualTo(first.state());
	}

	@Test
	void failedRunKeepsLastCompletedNodeAndResumesFromThere() throws GraphStateException {
		AtomicBoolean broken = new AtomicBoolean(true);
		StateGraph<SimpleState> graph = newGraph().addNode("a", node_async((s, c) -> s.step("a")))
			.addNode("b", node_async((s, c) -> {
				s.step("b-partial");
				if (broken.get()) {
					throw new IllegalStateException("provider rejected request");
				}
				return s.step("b");
			}))
			.addNode("c", node_async((s, c) -> s.step("c")))
			.addEdge(START, "a")
			.addEdge("a", "b")
			.addEdge("b", "c")
			.addEdge("c", END);
		CompiledGraph<SimpleState> compiled = compile(graph);

		GraphRunResult<SimpleState> failed = compiled.invoke(new SimpleState("q"), thread("crash"));

		assertThat(failed.status()).isEqualTo(RunStatus.FAILED);
		assertThat(failed.error()).get().isInstanceOf(NodeExecutionException.class);
		assertThat(failed.state().getSteps()).containsExactly("a");
		Checkpoint checkpoint = saver.get("crash").orElseThrow();
		assertThat(checkpoint.getNodeId()).isEqualTo("a");
		assertThat(checkpoint.getStatus()).isEqualTo(RunStatus.FAILED);
		assertThat(checkpoint.getError()).get().asString().contains("provider rejected request");

		broken.set(false);
		executed.clear();
		GraphRunResult<SimpleState> resumed = compiled.invoke(null, thread("crash"));

		assertThat(resumed.isCompleted()).isTrue();
		assertThat(executed).containsExactly("b", "c");
		assertThat(resumed.state().getSteps()).containsExactly("a", "b-partial", "b", "c");
	}

	@Test
	void cancellationIsHonouredAtTheNextCheckpointBoundary() throws GraphStateException {
		StateGraph<SimpleState> graph = newGraph().addNode("a", node_async((s, c) -> {
			c.cancellationToken().cancel();
			return s.step("a");
		}))
			.addNode("b", node_async((s, c) -> s.step("b")))
			.addEdge(START, "a")
			.addEdge("a", "b")
			.addEdge("b", END);
		CompiledGraph<SimpleState> compiled = compile(graph);

		GraphRunResult<SimpleState> cancelled = compiled.invoke(new SimpleState("q"), thread("cancel"));

		assertThat(cancelled.status()).isEqualTo(RunStatus.CANCELLED);
		assertThat(cancelled.state().getSteps()).containsExactly("a");
		assertThat(executed).containsExactly("a");
		assertThat(saver.get("cancel").orElseThrow().getStatus()).isEqualTo(RunStatus.CANCELLED);

		executed.clear();
		GraphRunResult<SimpleState> resumed = compiled.invoke(null, thread("cancel"));
		assertThat(executed).containsExactly("b");
		assertThat(resumed.state().getSteps()).containsExactly("a", "b");
	}

	@Test
	void runawayLoopsHitTheIterationGuard() throws GraphStateException {
		StateGraph<SimpleState> graph = newGraph().addNode("spin", node_async((s, c) -> s.step("spin")))
			.addEdge(START, "spin")
			.addConditionalEdges("spin", s -> "again", Map.of("again", "spin", "stop", END));

		GraphRunResult<SimpleState> result = compile(graph, 5).invoke(new SimpleState("q"), thread("spin"));

		assertThat(result.status()).isEqualTo(RunStatus.FAILED);
		assertThat(result.error()).get().extracting(Throwable::getMessage).asString().contains("(5)");
		assertThat(result.state().getSteps()).hasSize(5);
	}

	@Test
	void unmappedEdgeLabelFailsTheRun() throws GraphStateException {
		StateGraph<SimpleState> graph = newGraph().addNode("a", node_async((s, c) -> s.step("a")))
			.addEdge(START, "a")
			.addConditionalEdges("a", s -> "unknown", Map.of("known", END));

		GraphRunResult<SimpleState> result = compile(graph).invoke(new SimpleState("q"), thread("unmapped"));

		assertThat(result.status()).isEqualTo(RunStatus.FAILED);
		assertThat(result.lastNodeId()).isEqualTo("a");
	}

	@Test
	void streamEmitsOneEventPerPersistedNode() throws GraphStateException {
		CompiledGraph<SimpleState> compiled = compile(linearGraph());

		StepVerifier.create(compiled.stream(new SimpleState("q"), thread("stream")))
			.assertNext(output -> {
				assertThat(output.node()).isEqualTo("a");
				assertThat(output.state().getSteps()).containsExactly("a");
			})
			.assertNext(output -> assertThat(output.node()).isEqualTo("b"))
			.assertNext(output -> assertThat(output.state().getSteps()).containsExactly("a", "b", "c"))
			.expectComplete()
			.verify(Duration.ofSeconds(10));
	}

	@Test
	void disposingTheStreamCancelsTheRunAndReportsItsExit() throws Exception {
		CountDownLatch entered = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		CountDownLatch exited = new CountDownLatch(1);
		StateGraph<SimpleState> graph = newGraph().addNode("a", node_async((s, c) -> s.step("a")))
			.addNode("b", node_async((s, c) -> {
				entered.countDown();
				release.await(10, TimeUnit.SECONDS);
				return s.step("b");
			}))
			.addNode("c", node_async((s, c) -> s.step("c")))
			.addEdge(START, "a")
			.addEdge("a", "b")
			.addEdge("b", "c")
			.addEdge("c", END);
		CompiledGraph<SimpleState> compiled = compile(graph);
		RunnableConfig config = thread("dispose");

		Disposable subscription = compiled.stream(new SimpleState("q"), config, exited::countDown).subscribe();
		assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();
		subscription.dispose();

		assertThat(config.isCancellationRequested()).isTrue();
		assertThat(exited.getCount()).isEqualTo(1);
		release.countDown();
		assertThat(exited.await(10, TimeUnit.SECONDS)).isTrue();
		assertThat(executed).containsExactly("a", "b");
		assertThat(saver.get("dispose").orElseThrow().getStatus()).isEqualTo(RunStatus.CANCELLED);
		assertThat(saver.get("dispose").orElseThrow().getNodeId()).isEqualTo("b");
	}

	@Test
	void updateStateRestartsACompletedThread() throws GraphStateException {
		CompiledGraph<SimpleState> compiled = compile(linearGraph());
		compiled.invoke(new SimpleState("q"), thread("update"));
		executed.clear();

		compiled.updateState(thread("update"), state -> {
			state.getAttributes().put("answer", "yes");
			return state;
		}, START);
		GraphRunResult<SimpleState> rerun = compiled.invoke(null, thread("update"));

		assertThat(executed).containsExactly("a", "b", "c");
		assertThat(rerun.state().getAttributes()).containsEntry("answer", "yes");
		assertThat(rerun.state().getSteps()).containsExactly("a", "b", "c", "a", "b", "c");
		assertThat(compiled.getState(thread("update"))).contains(rerun.state());
	}

	static class RecordingSaver extends MemorySaver {

		final List<String> writes = Collections.synchronizedList(new ArrayList<>());

		@Override
		public void put(Checkpoint checkpoint) {
			super.put(checkpoint);
			writes.add(checkpoint.getNodeId() + ":" + checkpoint.getStatus());
		}

	}

}
