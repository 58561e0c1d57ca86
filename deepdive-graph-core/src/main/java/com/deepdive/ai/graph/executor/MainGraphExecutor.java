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
package com.deepdive.ai.graph.executor;

import com.deepdive.ai.graph.CompiledGraph;
import com.deepdive.ai.graph.GraphLifecycleListener;
import com.deepdive.ai.graph.GraphRunResult;
import com.deepdive.ai.graph.NodeOutput;
import com.deepdive.ai.graph.RunStatus;
import com.deepdive.ai.graph.RunnableConfig;
import com.deepdive.ai.graph.checkpoint.BaseCheckpointSaver;
import com.deepdive.ai.graph.checkpoint.Checkpoint;
import com.deepdive.ai.graph.exception.CheckpointException;
import com.deepdive.ai.graph.exception.GraphRunnerException;
import com.deepdive.ai.graph.exception.RunnableErrors;
import com.deepdive.ai.graph.internal.node.Node;
import com.deepdive.ai.graph.serializer.StateSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

import static com.deepdive.ai.graph.StateGraph.START;
import static com.deepdive.ai.graph.checkpoint.BaseCheckpointSaver.THREAD_ID_DEFAULT;

/**
 * Drives one invocation of a compiled graph: loads or creates the checkpoint of the
 * thread, runs nodes one at a time through the {@link NodeExecutor}, persists a
 * checkpoint after each of them and follows the edges until the graph ends, the run is
 * cancelled or a node fails permanently.
 *
 * @param <S> the graph state type
 */
public class MainGraphExecutor<S> {

	private static final Logger log = LoggerFactory.getLogger(MainGraphExecutor.class);

	private final CompiledGraph<S> graph;

	private final NodeExecutor nodeExecutor;

	public MainGraphExecutor(CompiledGraph<S> graph, NodeExecutor nodeExecutor) {
		this.graph = Objects.requireNonNull(graph, "graph cannot be null");
		this.nodeExecutor = Objects.requireNonNull(nodeExecutor, "nodeExecutor cannot be null");
	}

	public GraphRunResult<S> run(S input, RunnableConfig config, Consumer<NodeOutput<S>> emitter) {
		Objects.requireNonNull(config, "config cannot be null");
		String threadId = config.threadId().orElse(THREAD_ID_DEFAULT);
		StateSerializer<S> serializer = graph.getStateSerializer();
		List<GraphLifecycleListener> listeners = graph.getCompileConfig().lifecycleListeners();

		S persisted;
		String current;
		try {
			Optional<Checkpoint> existing = saver().get(threadId);
			if (existing.isPresent()) {
				Checkpoint checkpoint = existing.get();
				persisted = serializer.fromMap(checkpoint.getState());
				if (checkpoint.getStatus().isTerminal()) {
					log.info("[ThreadId {}] already completed at node '{}', nothing to execute", threadId,
							checkpoint.getNodeId());
					return GraphRunResult.of(threadId, persisted, checkpoint.getStatus(), checkpoint.getNodeId());
				}
				current = checkpoint.getNodeId();
				log.info("[ThreadId {}] resuming after node '{}' (status {})", threadId, current,
						checkpoint.getStatus());
			}
			else {
				Objects.requireNonNull(input, "input state cannot be null for a new thread");
				persisted = serializer.cloneObject(input);
				current = START;
				persist(threadId, persisted, current, RunStatus.RUNNING, null);
				log.info("[ThreadId {}] starting graph '{}'", threadId, graph.getStateGraph().getName());
			}
		}
		catch (GraphRunnerException ex) {
			log.error("[ThreadId {}] cannot load or create checkpoint", threadId, ex);
			return GraphRunResult.failed(threadId, null, null, ex);
		}
		catch (RuntimeException ex) {
			log.error("[ThreadId {}] cannot read checkpoint state", threadId, ex);
			return GraphRunResult.failed(threadId, null, null,
					new CheckpointException("checkpoint state of thread '" + threadId + "' is unreadable", ex));
		}

		final S initial = persisted;
		listeners.forEach(l -> l.onStart(threadId, initial, config));

		int iterations = 0;
		int maxIterations = graph.getCompileConfig().maxIterations();
		String running = null;
		try {
			while (true) {
				String next = graph.nextNodeId(current, persisted);
				if (graph.isEnd(next)) {
					persist(threadId, persisted, current, RunStatus.COMPLETED, null);
					final String last = current;
					final S finalState = persisted;
					listeners.forEach(l -> l.onComplete(last, finalState, config));
					log.info("[ThreadId {}] completed after node '{}'", threadId, current);
					return GraphRunResult.of(threadId, persisted, RunStatus.COMPLETED, current);
				}
				if (config.isCancellationRequested()) {
					persist(threadId, persisted, current, RunStatus.CANCELLED, null);
					log.info("[ThreadId {}] cancelled after node '{}', '{}' not started", threadId, current, next);
					return GraphRunResult.of(threadId, persisted, RunStatus.CANCELLED, current);
				}
				if (++iterations > maxIterations) {
					throw RunnableErrors.maxIterationsReached.exception(maxIterations, threadId);
				}

				Node<S> node = graph.getNode(next).orElseThrow(() -> RunnableErrors.missingNode.exception(next));
				running = next;
				final S before = persisted;
				listeners.forEach(l -> l.before(next, before, config));
				log.debug("[ThreadId {}] executing node '{}'", threadId, next);

				S updated = nodeExecutor.execute(node, persisted, serializer, config);

				persist(threadId, updated, next, RunStatus.RUNNING, null);
				persisted = updated;
				current = next;
				running = null;

				final S after = persisted;
				listeners.forEach(l -> l.after(next, after, config));
				emitter.accept(new NodeOutput<>(next, serializer.cloneObject(persisted)));
			}
		}
		catch (RuntimeException ex) {
			GraphRunnerException error = ex instanceof GraphRunnerException graphError ? graphError
					: new GraphRunnerException("unexpected error: " + ex.getMessage(), ex);
			String failedAt = running != null ? running : current;
			log.error("[ThreadId {}] run failed at node '{}': {}", threadId, failedAt, error.getMessage());
			final S lastState = persisted;
			listeners.forEach(l -> l.onError(failedAt, lastState, error, config));
			markFailed(threadId, persisted, current, error);
			return GraphRunResult.failed(threadId, persisted, current, error);
		}
	}

	private void markFailed(String threadId, S state, String lastCompleted, GraphRunnerException ex) {
		try {
			persist(threadId, state, lastCompleted, RunStatus.FAILED, ex.getMessage());
		}
		catch (GraphRunnerException persistError) {
			ex.addSuppressed(persistError);
			log.error("[ThreadId {}] cannot record failure in checkpoint", threadId, persistError);
		}
	}

	private void persist(String threadId, S state, String nodeId, RunStatus status, String error) {
		Checkpoint checkpoint = Checkpoint.builder()
			.threadId(threadId)
			.state(graph.getStateSerializer().toMap(state))
			.nodeId(nodeId)
			.status(status)
			.error(error)
			.build();
		saver().put(checkpoint);
	}

	private BaseCheckpointSaver saver() {
		return graph.getCompileConfig().checkpointSaver();
	}

}
