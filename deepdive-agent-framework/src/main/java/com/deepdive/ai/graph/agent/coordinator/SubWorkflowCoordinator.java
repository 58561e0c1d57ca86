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

import com.deepdive.ai.graph.CompileConfig;
import com.deepdive.ai.graph.RunnableConfig;
import com.deepdive.ai.graph.agent.harness.TaskContext;
import com.deepdive.ai.graph.agent.interceptor.journal.ToolInvocationJournal;
import com.deepdive.ai.graph.agent.state.ConversationMessage;
import com.deepdive.ai.graph.agent.state.Note;
import com.deepdive.ai.graph.agent.state.ResearchState;
import com.deepdive.ai.graph.agent.state.ResearchTask;
import com.deepdive.ai.graph.agent.tool.ToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.deepdive.ai.graph.checkpoint.BaseCheckpointSaver.THREAD_ID_DEFAULT;
import static java.lang.String.format;

/**
 * Runs the research sub-workflow: rounds of concurrent research tasks proposed by a
 * {@link ResearchSupervisor}, gathered and merged into the state in task-id order.
 *
 * <p>
 * A round launches at most {@code maxConcurrent} tasks and at most
 * {@code maxIterations} rounds run per thread, whatever the supervisor says. A failed
 * task is recorded as an unresolved topic without affecting its siblings. Cancellation
 * is checked before each round; tasks already running finish.
 *
 * <p>
 * Every {@link #coordinate} call gets its own pool of {@code maxConcurrent} threads, so
 * concurrent threads of one agent do not queue behind each other. When the calling
 * thread is interrupted, as on a node timeout, the tasks of the current round are
 * interrupted too.
 */
public class SubWorkflowCoordinator {

	private static final Logger log = LoggerFactory.getLogger(SubWorkflowCoordinator.class);

	public static final int DEFAULT_MAX_CONCURRENT = 3;

	public static final int DEFAULT_MAX_ITERATIONS = 4;

	private final ResearchSupervisor supervisor;

	private final ResearchTaskRunner taskRunner;

	private final ToolProvider toolProvider;

	private final int maxConcurrent;

	private final int maxIterations;

	public SubWorkflowCoordinator(ResearchSupervisor supervisor, ResearchTaskRunner taskRunner,
			ToolProvider toolProvider, int maxConcurrent, int maxIterations) {
		if (maxConcurrent < 1 || maxIterations < 1) {
			throw new IllegalArgumentException("maxConcurrent and maxIterations must be >= 1");
		}
		this.supervisor = Objects.requireNonNull(supervisor, "supervisor cannot be null");
		this.taskRunner = Objects.requireNonNull(taskRunner, "taskRunner cannot be null");
		this.toolProvider = Objects.requireNonNull(toolProvider, "toolProvider cannot be null");
		this.maxConcurrent = maxConcurrent;
		this.maxIterations = maxIterations;
	}

	public int getMaxConcurrent() {
		return maxConcurrent;
	}

	public int getMaxIterations() {
		return maxIterations;
	}

	/**
	 * Runs rounds until the supervisor declares completion, the round cap is reached, or
	 * cancellation is requested.
	 * @param state the state to merge results into, modified in place
	 * @param config the run configuration
	 * @return {@code state}
	 */
	public ResearchState coordinate(ResearchState state, RunnableConfig config) {
		String threadId = config.threadId().orElse(THREAD_ID_DEFAULT);
		ToolInvocationJournal journal = config.metadata(ToolInvocationJournal.METADATA_KEY, ToolInvocationJournal.class)
			.orElse(null);
		Set<String> researched = new HashSet<>();
		state.getRawNotes().forEach(note -> researched.add(normalize(note.topic())));
		state.getUnresolvedTopics().forEach(topic -> researched.add(normalize(topic)));

		ExecutorService taskPool = Executors.newFixedThreadPool(maxConcurrent,
				CompileConfig.daemonThreadFactory("research-task-" + threadId + "-"));
		try {
			runRounds(threadId, state, researched, journal, config, taskPool);
		}
		finally {
			taskPool.shutdownNow();
		}
		if (state.getResearchIterations() >= maxIterations) {
			log.info("[ThreadId {}] research stopped at the round cap ({})", threadId, maxIterations);
		}
		return state;
	}

	private void runRounds(String threadId, ResearchState state, Set<String> researched,
			ToolInvocationJournal journal, RunnableConfig config, ExecutorService taskPool) {
		while (state.getResearchIterations() < maxIterations) {
			if (config.isCancellationRequested()) {
				log.info("[ThreadId {}] cancellation requested, no further research round", threadId);
				break;
			}
			int round = state.getResearchIterations() + 1;
			SupervisorDecision decision = supervisor.decide(state, round, maxConcurrent);
			decision.reflections().forEach(reflection -> state.addMessage(ConversationMessage.assistant(reflection)));
			if (decision.complete()) {
				log.info("[ThreadId {}] supervisor completed research before round {}", threadId, round);
				break;
			}
			List<String> topics = selectTopics(decision.topics(), researched);
			if (topics.isEmpty()) {
				log.info("[ThreadId {}] supervisor proposed no new topic for round {}", threadId, round);
				break;
			}

			List<ResearchTask> tasks = new ArrayList<>();
			for (int i = 0; i < topics.size(); i++) {
				tasks.add(new ResearchTask(ResearchTask.taskId(round, i + 1), topics.get(i), round,
						List.copyOf(toolProvider.toolNames())));
			}
			log.info("[ThreadId {}] research round {}/{} with {} task(s)", threadId, round, maxIterations,
					tasks.size());

			List<TaskOutcome> outcomes = runRound(threadId, state, tasks, journal, config, taskPool);
			merge(state, outcomes);
			state.setResearchIterations(round);
		}
	}

	private List<String> selectTopics(List<String> proposed, Set<String> researched) {
		Set<String> seen = new LinkedHashSet<>();
		List<String> selected = new ArrayList<>();
		for (String topic : proposed) {
			String key = normalize(topic);
			if (key.isEmpty() || researched.contains(key) || !seen.add(key)) {
				continue;
			}
			selected.add(topic.strip());
			if (selected.size() == maxConcurrent) {
				break;
			}
		}
		selected.forEach(topic -> researched.add(normalize(topic)));
		return selected;
	}

	private List<TaskOutcome> runRound(String threadId, ResearchState state, List<ResearchTask> tasks,
			ToolInvocationJournal journal, RunnableConfig config, ExecutorService taskPool) {
		List<Future<TaskOutcome>> futures = new ArrayList<>();
		for (ResearchTask task : tasks) {
			TaskContext context = new TaskContext(threadId, task.getId(), task.getTopic(), task.getRound(),
					state.getBrief(), task.getAssignedTools(), journal);
			futures.add(taskPool.submit(() -> taskRunner.run(task, context, config)));
		}
		List<TaskOutcome> outcomes = new ArrayList<>();
		for (int i = 0; i < futures.size(); i++) {
			try {
				outcomes.add(futures.get(i).get());
			}
			catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				futures.forEach(future -> future.cancel(true));
				log.warn("[ThreadId {}] research round interrupted, {} task(s) cancelled", threadId, futures.size());
				throw new CancellationException(format("research round of thread '%s' interrupted", threadId));
			}
			catch (ExecutionException ex) {
				outcomes.add(TaskOutcome.failure(tasks.get(i), ex.getCause()));
			}
		}
		return outcomes;
	}

	private void merge(ResearchState state, List<TaskOutcome> outcomes) {
		List<TaskOutcome> ordered = outcomes.stream()
			.sorted(Comparator.comparing(outcome -> outcome.task().getId()))
			.toList();
		for (TaskOutcome outcome : ordered) {
			if (outcome.failed()) {
				state.addUnresolvedTopic(outcome.task().getTopic());
				state.addMessage(ConversationMessage.assistant(failureMessage(outcome)));
			}
			else {
				state.addRawNote(outcome.rawNote());
			}
		}
		for (TaskOutcome outcome : ordered) {
			Note compressed = outcome.compressedNote();
			if (compressed != null) {
				state.addCompressedNote(compressed);
			}
		}
	}

	static String failureMessage(TaskOutcome outcome) {
		Throwable error = outcome.error();
		String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
		return format("Tool failed: conduct_research(\"%s\") [%s]: %s", outcome.task().getTopic(),
				outcome.task().getId(), reason);
	}

	private static String normalize(String topic) {
		return topic == null ? "" : topic.strip().toLowerCase(Locale.ROOT);
	}

}
