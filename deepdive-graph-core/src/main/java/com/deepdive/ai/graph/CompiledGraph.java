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

import com.deepdive.ai.graph.checkpoint.BaseCheckpointSaver;
import com.deepdive.ai.graph.checkpoint.Checkpoint;
import com.deepdive.ai.graph.exception.GraphRunnerException;
import com.deepdive.ai.graph.exception.RunnableErrors;
import com.deepdive.ai.graph.executor.MainGraphExecutor;
import com.deepdive.ai.graph.executor.NodeExecutor;
import com.deepdive.ai.graph.internal.edge.Edge;
import com.deepdive.ai.graph.internal.edge.EdgeValue;
import com.deepdive.ai.graph.internal.node.Node;
import com.deepdive.ai.graph.serializer.StateSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

import static com.deepdive.ai.graph.StateGraph.END;
import static com.deepdive.ai.graph.StateGraph.START;
import static com.deepdive.ai.graph.checkpoint.BaseCheckpointSaver.THREAD_ID_DEFAULT;

/**
 * Executable form of a {@link StateGraph}.
 * <p>
 * A run walks the graph one node at a time. After every node the state is written to
 * the checkpoint saver under the thread id of the {@link RunnableConfig}, and only then
 * is the outgoing edge evaluated. Invoking a thread that already has a checkpoint
 * resumes it after its last completed node; a thread whose checkpoint is
 * {@link RunStatus#COMPLETED} is returned as is.
 * </p>
 *
 * @param <S> the graph state type
 */
public class CompiledGraph<S> {

	private static final Logger log = LoggerFactory.getLogger(CompiledGraph.class);

	private final StateGraph<S> stateGraph;

	private final CompileConfig compileConfig;

	private final Map<String, Node<S>> nodes = new LinkedHashMap<>();

	private final Map<String, Edge<S>> edges;

	private final MainGraphExecutor<S> mainGraphExecutor;

	CompiledGraph(StateGraph<S> stateGraph, CompileConfig compileConfig) {
		this.stateGraph = stateGraph;
		this.compileConfig = compileConfig;
		for (Node<S> node : stateGraph.nodes().values()) {
			nodes.put(node.id(), node.withDefaultPolicy(compileConfig.defaultNodePolicy()));
		}
		this.edges = Map.copyOf(stateGraph.edges());
		NodeExecutor nodeExecutor = new NodeExecutor(compileConfig.nodeExecutorService(),
				compileConfig.observationRegistry());
		this.mainGraphExecutor = new MainGraphExecutor<>(this, nodeExecutor);
	}

	public StateGraph<S> getStateGraph() {
		return stateGraph;
	}

	public CompileConfig getCompileConfig() {
		return compileConfig;
	}

	public StateSerializer<S> getStateSerializer() {
		return stateGraph.getStateSerializer();
	}

	public BaseCheckpointSaver getCheckpointSaver() {
		return compileConfig.checkpointSaver();
	}

	public Optional<Node<S>> getNode(String nodeId) {
		return Optional.ofNullable(nodes.get(nodeId));
	}

	/**
	 * Runs the graph to completion, cancellation or failure.
	 * @param input the initial state, ignored when the thread already has a checkpoint
	 * @param config the run configuration
	 * @return the outcome of the run
	 */
	public GraphRunResult<S> invoke(S input, RunnableConfig config) {
		return mainGraphExecutor.run(input, config, output -> {
		});
	}

	/**
	 * Runs the graph on a worker thread, emitting one {@link NodeOutput} per persisted
	 * checkpoint. The flux completes when the run completes or is cancelled and errors
	 * when it fails.
	 */
	public Flux<NodeOutput<S>> stream(S input, RunnableConfig config) {
		return stream(input, config, () -> {
		});
	}

	/**
	 * Same as {@link #stream(Object, RunnableConfig)}. Cancelling the subscription
	 * cancels the run through the token of {@code config}; the run then stops at the
	 * next checkpoint boundary.
	 * @param onRunExit called exactly once per subscription: on the worker thread after
	 * the run has returned, or on termination when the subscription ended before the run
	 * started, in which case the run never starts
	 */
	public Flux<NodeOutput<S>> stream(S input, RunnableConfig config, Runnable onRunExit) {
		Objects.requireNonNull(onRunExit, "onRunExit cannot be null");
		return Flux.defer(() -> {
			AtomicBoolean claimed = new AtomicBoolean();
			return Flux.<NodeOutput<S>>create(sink -> {
				if (!claimed.compareAndSet(false, true)) {
					sink.complete();
					return;
				}
				sink.onCancel(() -> {
					log.info("[ThreadId {}] stream subscriber cancelled, cancelling run", threadIdOf(config));
					config.cancellationToken().cancel();
				});
				try {
					GraphRunResult<S> result = mainGraphExecutor.run(input, config, sink::next);
					if (result.error().isPresent()) {
						sink.error(result.error().get());
					}
					else {
						sink.complete();
					}
				}
				finally {
					onRunExit.run();
				}
			}).subscribeOn(Schedulers.boundedElastic()).doFinally(signal -> {
				if (claimed.compareAndSet(false, true)) {
					onRunExit.run();
				}
			});
		});
	}

	public Optional<Checkpoint> getCheckpoint(RunnableConfig config) {
		return getCheckpointSaver().get(threadIdOf(config));
	}

	/**
	 * @return the state of the thread as last persisted
	 */
	public Optional<S> getState(RunnableConfig config) {
		return getCheckpoint(config).map(checkpoint -> getStateSerializer().fromMap(checkpoint.getState()));
	}

	/**
	 * Rewrites the checkpoint of a thread so that the next invocation resumes after
	 * {@code asNode} with the updated state.
	 * @param config identifies the thread
	 * @param update applied to the persisted state, or to {@code null} when the thread
	 * has no checkpoint yet
	 * @param asNode the node the updated state is attributed to; {@code START} restarts
	 * the thread from the entry node
	 */
	public Checkpoint updateState(RunnableConfig config, UnaryOperator<S> update, String asNode) {
		Objects.requireNonNull(update, "update cannot be null");
		if (!START.equals(asNode) && !nodes.containsKey(asNode)) {
			throw RunnableErrors.missingNode.exception(asNode);
		}
		String threadId = threadIdOf(config);
		S current = getState(config).orElse(null);
		S updated = Objects.requireNonNull(update.apply(current), "updated state cannot be null");
		Checkpoint checkpoint = Checkpoint.builder()
			.threadId(threadId)
			.state(getStateSerializer().toMap(updated))
			.nodeId(asNode)
			.status(RunStatus.RUNNING)
			.build();
		getCheckpointSaver().put(checkpoint);
		log.info("[ThreadId {}] state updated as node '{}'", threadId, asNode);
		return checkpoint;
	}

	/**
	 * Resolves the node that follows {@code nodeId}. Edge conditions see the state but
	 * must not change it.
	 * @return the next node id, or {@link StateGraph#END}
	 */
	public String nextNodeId(String nodeId, S state) {
		Edge<S> edge = edges.get(nodeId);
		if (edge == null) {
			throw RunnableErrors.missingEdge.exception(nodeId);
		}
		EdgeValue<S> target = edge.target();
		if (!target.isConditional()) {
			return target.id();
		}
		String label;
		try {
			label = target.value().action().apply(state);
		}
		catch (Exception ex) {
			throw new GraphRunnerException(
					RunnableErrors.edgeEvaluationFailed.exception(nodeId, ex.getMessage()).getMessage(), ex);
		}
		String result = target.value().mappings().get(label);
		if (result == null) {
			throw RunnableErrors.missingNodeInEdgeMapping.exception(nodeId, label);
		}
		return result;
	}

	public boolean isEnd(String nodeId) {
		return END.equals(nodeId);
	}

	static String threadIdOf(RunnableConfig config) {
		return config.threadId().orElse(THREAD_ID_DEFAULT);
	}

}
