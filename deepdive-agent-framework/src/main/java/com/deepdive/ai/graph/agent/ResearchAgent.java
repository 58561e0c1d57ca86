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

import com.deepdive.ai.graph.CancellationToken;
import com.deepdive.ai.graph.CompileConfig;
import com.deepdive.ai.graph.CompiledGraph;
import com.deepdive.ai.graph.GraphLifecycleListener;
import com.deepdive.ai.graph.GraphRunResult;
import com.deepdive.ai.graph.NodeOutput;
import com.deepdive.ai.graph.NodePolicy;
import com.deepdive.ai.graph.RunStatus;
import com.deepdive.ai.graph.RunnableConfig;
import com.deepdive.ai.graph.StateGraph;
import com.deepdive.ai.graph.agent.config.ResearchProperties;
import com.deepdive.ai.graph.agent.coordinator.LlmResearchSupervisor;
import com.deepdive.ai.graph.agent.coordinator.ResearchCompressor;
import com.deepdive.ai.graph.agent.coordinator.ResearchSupervisor;
import com.deepdive.ai.graph.agent.coordinator.ResearchTaskRunner;
import com.deepdive.ai.graph.agent.coordinator.SubWorkflowCoordinator;
import com.deepdive.ai.graph.agent.edge.BriefRoutingEdge;
import com.deepdive.ai.graph.agent.edge.ClarifyRoutingEdge;
import com.deepdive.ai.graph.agent.edge.QualityRoutingEdge;
import com.deepdive.ai.graph.agent.harness.ToolCallHarness;
import com.deepdive.ai.graph.agent.interceptor.ToolInterceptor;
import com.deepdive.ai.graph.agent.interceptor.journal.ToolInvocationJournal;
import com.deepdive.ai.graph.agent.metadata.QueryClassifier;
import com.deepdive.ai.graph.agent.model.ModelInference;
import com.deepdive.ai.graph.agent.node.ClarifyNode;
import com.deepdive.ai.graph.agent.node.GenerateReportNode;
import com.deepdive.ai.graph.agent.node.QualityControlNode;
import com.deepdive.ai.graph.agent.node.ResearchNode;
import com.deepdive.ai.graph.agent.node.ValidateBriefNode;
import com.deepdive.ai.graph.agent.node.WriteBriefNode;
import com.deepdive.ai.graph.agent.state.ConversationMessage;
import com.deepdive.ai.graph.agent.state.ResearchState;
import com.deepdive.ai.graph.agent.tool.ToolProvider;
import com.deepdive.ai.graph.agent.validation.BriefValidator;
import com.deepdive.ai.graph.agent.validation.ReportQualityChecker;
import com.deepdive.ai.graph.checkpoint.BaseCheckpointSaver;
import com.deepdive.ai.graph.checkpoint.Checkpoint;
import com.deepdive.ai.graph.checkpoint.savers.MemorySaver;
import com.deepdive.ai.graph.exception.GraphStateException;
import com.deepdive.ai.graph.executor.NodeExecutor;
import com.deepdive.ai.graph.serializer.plain_text.jackson.JacksonStateSerializer;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.deepdive.ai.graph.StateGraph.END;
import static com.deepdive.ai.graph.StateGraph.START;
import static com.deepdive.ai.graph.action.AsyncNodeAction.node_async;
import static com.deepdive.ai.graph.agent.node.ResearchNodes.CLARIFY;
import static com.deepdive.ai.graph.agent.node.ResearchNodes.GENERATE_REPORT;
import static com.deepdive.ai.graph.agent.node.ResearchNodes.QUALITY_CONTROL;
import static com.deepdive.ai.graph.agent.node.ResearchNodes.RESEARCH;
import static com.deepdive.ai.graph.agent.node.ResearchNodes.VALIDATE_BRIEF;
import static com.deepdive.ai.graph.agent.node.ResearchNodes.WRITE_BRIEF;
import static java.lang.String.format;

/**
 * Entry point of the research pipeline. Starts, resumes, streams and cancels research
 * threads, each identified by a caller-chosen thread id.
 *
 * <pre>
 * clarify -> write_brief -> validate_brief -> research -> generate_report -> quality_control
 *               ^                 |                           ^                  |
 *               +---- revise -----+                           +----- revise -----+
 * </pre>
 */
public class ResearchAgent implements AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(ResearchAgent.class);

	public static final String GRAPH_NAME = "deepdive-research";

	private final CompiledGraph<ResearchState> graph;

	private final SubWorkflowCoordinator coordinator;

	private final QueryClassifier queryClassifier = new QueryClassifier();

	private final List<ExecutorService> executors = new ArrayList<>();

	private final Map<String, CancellationToken> running = new ConcurrentHashMap<>();

	private final Map<String, ToolInvocationJournal> journals = new ConcurrentHashMap<>();

	private ResearchAgent(Builder builder) throws GraphStateException {
		ModelInference model = Objects.requireNonNull(builder.modelInference, "modelInference cannot be null");
		ToolProvider toolProvider = Objects.requireNonNull(builder.toolProvider, "toolProvider cannot be null");
		ResearchProperties properties = builder.properties != null ? builder.properties : new ResearchProperties();
		ObservationRegistry observationRegistry = builder.observationRegistry != null ? builder.observationRegistry
				: ObservationRegistry.NOOP;
		ResearchProperties.Research research = properties.getResearch();
		NodePolicy defaultPolicy = properties.getNode().toNodePolicy();

		ToolCallHarness.Builder harness = ToolCallHarness.builder()
			.modelInference(model)
			.toolProvider(toolProvider)
			.toolExecutor(executor("research-tool-"))
			.maxToolCalls(research.getMaxToolCalls())
			.maxModelFailures(research.getMaxModelFailures())
			.modelRetryPolicy(properties.getNode().toRetryPolicy());
		if (builder.toolInterceptors != null) {
			harness.interceptors(builder.toolInterceptors);
		}
		ResearchSupervisor supervisor = builder.supervisor != null ? builder.supervisor
				: new LlmResearchSupervisor(model, research.getMaxIterations());
		ResearchTaskRunner taskRunner = new ResearchTaskRunner(harness.build(),
				new ResearchCompressor(model, research.getCompressionAttempts()),
				new NodeExecutor(executor("research-unit-"), observationRegistry),
				defaultPolicy.withTimeout(research.getTaskTimeout()));
		this.coordinator = new SubWorkflowCoordinator(supervisor, taskRunner, toolProvider, research.getMaxConcurrent(),
				research.getMaxIterations());

		ResearchProperties.Brief brief = properties.getBrief();
		ResearchProperties.Report report = properties.getReport();
		StateGraph<ResearchState> stateGraph = new StateGraph<>(GRAPH_NAME,
				new JacksonStateSerializer<>(ResearchState.class))
			.addNode(CLARIFY,
					node_async(new ClarifyNode(model, properties.isAllowClarification(),
							properties.getMaxClarifications())))
			.addNode(WRITE_BRIEF,
					node_async(new WriteBriefNode(model, brief.getMinQuestions(), brief.getMaxQuestions(),
							brief.getRequiredSections())))
			.addNode(VALIDATE_BRIEF,
					node_async(new ValidateBriefNode(new BriefValidator(brief.getMinQuestions(),
							brief.getMaxQuestions(), brief.getRequiredSections()), brief.getMaxRevisions())))
			.addNode(RESEARCH, node_async(new ResearchNode(coordinator)), defaultPolicy.withTimeout(research.getTimeout()))
			.addNode(GENERATE_REPORT, node_async(new GenerateReportNode(model)))
			.addNode(QUALITY_CONTROL,
					node_async(new QualityControlNode(
							new ReportQualityChecker(report.getMinSources(), report.getMinCitations()),
							report.getMaxRevisions())))
			.addEdge(START, CLARIFY)
			.addConditionalEdges(CLARIFY, new ClarifyRoutingEdge(),
					Map.of(ClarifyRoutingEdge.AWAIT_USER, END, ClarifyRoutingEdge.PROCEED, WRITE_BRIEF))
			.addEdge(WRITE_BRIEF, VALIDATE_BRIEF)
			.addConditionalEdges(VALIDATE_BRIEF, new BriefRoutingEdge(),
					Map.of(BriefRoutingEdge.REVISE, WRITE_BRIEF, BriefRoutingEdge.PROCEED, RESEARCH))
			.addEdge(RESEARCH, GENERATE_REPORT)
			.addEdge(GENERATE_REPORT, QUALITY_CONTROL)
			.addConditionalEdges(QUALITY_CONTROL, new QualityRoutingEdge(),
					Map.of(QualityRoutingEdge.REVISE, GENERATE_REPORT, QualityRoutingEdge.FINISH, END));

		CompileConfig.Builder compileConfig = CompileConfig.builder()
			.checkpointSaver(builder.checkpointSaver != null ? builder.checkpointSaver : new MemorySaver())
			.defaultNodePolicy(defaultPolicy)
			.maxIterations(properties.getMaxGraphIterations())
			.observationRegistry(observationRegistry)
			.nodeExecutorService(executor("research-node-"));
		builder.lifecycleListeners.forEach(compileConfig::withLifecycleListener);
		this.graph = stateGraph.compile(compileConfig.build());
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Starts a new thread or resumes an existing one.
	 *
	 * <p>
	 * A new thread starts from {@code query}. An interrupted, failed or cancelled thread
	 * resumes after its last completed node and {@code query} is ignored. A completed
	 * thread is returned as is, unless it is waiting for a clarification, in which case
	 * {@code query} is taken as the user's answer and the pipeline restarts.
	 * @param threadId identifies the thread
	 * @param query the research request, or the answer to a clarification question
	 * @return the outcome of the run
	 */
	public GraphRunResult<ResearchState> startOrResume(String threadId, String query) {
		CancellationToken token = register(threadId);
		try {
			RunnableConfig config = configFor(threadId, token);
			return graph.invoke(prepareThread(config, query), config);
		}
		finally {
			release(threadId, token);
		}
	}

	/**
	 * Same as {@link #startOrResume(String, String)}, emitting the state after every
	 * completed node. The run starts on subscription. Cancelling the subscription
	 * cancels the run; the thread stays busy until the run has stopped at its next node
	 * boundary.
	 */
	public Flux<NodeOutput<ResearchState>> stream(String threadId, String query) {
		return Flux.defer(() -> {
			CancellationToken token = register(threadId);
			try {
				RunnableConfig config = configFor(threadId, token);
				return graph.stream(prepareThread(config, query), config, () -> release(threadId, token));
			}
			catch (RuntimeException ex) {
				release(threadId, token);
				throw ex;
			}
		});
	}

	/**
	 * Requests cancellation of the running invocation of a thread. The run stops at the
	 * next node or round boundary and can be resumed later.
	 * @return whether an invocation was running
	 */
	public boolean cancel(String threadId) {
		CancellationToken token = running.get(threadId);
		if (token == null) {
			return false;
		}
		log.info("[ThreadId {}] cancellation requested", threadId);
		token.cancel();
		return true;
	}

	public Optional<ResearchState> getState(String threadId) {
		return graph.getState(RunnableConfig.builder().threadId(threadId).build());
	}

	/**
	 * @return the Mermaid flowchart of the pipeline
	 */
	public String getGraph() {
		return graph.getStateGraph().getGraph("DeepDive research pipeline");
	}

	CompiledGraph<ResearchState> getCompiledGraph() {
		return graph;
	}

	private ResearchState prepareThread(RunnableConfig config, String query) {
		String threadId = config.threadId().orElseThrow();
		Optional<Checkpoint> checkpoint = graph.getCheckpoint(config);
		if (checkpoint.isEmpty()) {
			if (query == null || query.isBlank()) {
				throw new IllegalArgumentException(format("a query is required to start thread '%s'", threadId));
			}
			ResearchState state = new ResearchState(query.strip());
			state.setMetadata(queryClassifier.classify(query));
			return state;
		}
		if (checkpoint.get().getStatus() == RunStatus.COMPLETED && query != null && !query.isBlank()) {
			ResearchState persisted = graph.getStateSerializer().fromMap(checkpoint.get().getState());
			if (persisted.isAwaitingClarification()) {
				log.info("[ThreadId {}] clarification answered, restarting pipeline", threadId);
				graph.updateState(config, state -> {
					state.addMessage(ConversationMessage.user(query.strip()));
					state.setAwaitingClarification(false);
					return state;
				}, START);
			}
		}
		return null;
	}

	private RunnableConfig configFor(String threadId, CancellationToken token) {
		return RunnableConfig.builder()
			.threadId(threadId)
			.cancellationToken(token)
			.addMetadata(ToolInvocationJournal.METADATA_KEY,
					journals.computeIfAbsent(threadId, id -> new ToolInvocationJournal()))
			.build();
	}

	private CancellationToken register(String threadId) {
		Objects.requireNonNull(threadId, "threadId cannot be null");
		CancellationToken token = new CancellationToken();
		if (running.putIfAbsent(threadId, token) != null) {
			throw new IllegalStateException(format("thread '%s' is already running", threadId));
		}
		return token;
	}

	private void release(String threadId, CancellationToken token) {
		running.remove(threadId, token);
		boolean completed = graph.getCheckpoint(RunnableConfig.builder().threadId(threadId).build())
			.map(checkpoint -> checkpoint.getStatus() == RunStatus.COMPLETED)
			.orElse(false);
		if (completed) {
			journals.remove(threadId);
		}
	}

	private ExecutorService executor(String prefix) {
		ExecutorService executor = Executors.newCachedThreadPool(CompileConfig.daemonThreadFactory(prefix));
		executors.add(executor);
		return executor;
	}

	@Override
	public void close() {
		executors.forEach(ExecutorService::shutdownNow);
	}

	public static class Builder {

		private ModelInference modelInference;

		private ToolProvider toolProvider;

		private ResearchProperties properties;

		private BaseCheckpointSaver checkpointSaver;

		private ObservationRegistry observationRegistry;

		private ResearchSupervisor supervisor;

		private List<ToolInterceptor> toolInterceptors;

		private final List<GraphLifecycleListener> lifecycleListeners = new ArrayList<>();

		private Builder() {
		}

		public Builder modelInference(ModelInference modelInference) {
			this.modelInference = modelInference;
			return this;
		}

		public Builder toolProvider(ToolProvider toolProvider) {
			this.toolProvider = toolProvider;
			return this;
		}

		public Builder properties(ResearchProperties properties) {
			this.properties = properties;
			return this;
		}

		public Builder checkpointSaver(BaseCheckpointSaver checkpointSaver) {
			this.checkpointSaver = checkpointSaver;
			return this;
		}

		public Builder observationRegistry(ObservationRegistry observationRegistry) {
			this.observationRegistry = observationRegistry;
			return this;
		}

		/**
		 * Replaces the model-driven supervisor of the research stage.
		 */
		public Builder supervisor(ResearchSupervisor supervisor) {
			this.supervisor = supervisor;
			return this;
		}

		/**
		 * Replaces the default tool interceptor chain.
		 */
		public Builder toolInterceptors(List<ToolInterceptor> toolInterceptors) {
			this.toolInterceptors = toolInterceptors;
			return this;
		}

		public Builder lifecycleListener(GraphLifecycleListener listener) {
			this.lifecycleListeners.add(listener);
			return this;
		}

		public ResearchAgent build() throws GraphStateException {
			return new ResearchAgent(this);
		}

	}

}
