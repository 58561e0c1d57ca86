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

import com.deepdive.ai.graph.agent.interceptor.InterceptorChain;
import com.deepdive.ai.graph.agent.interceptor.ToolCallHandler;
import com.deepdive.ai.graph.agent.interceptor.ToolCallRequest;
import com.deepdive.ai.graph.agent.interceptor.ToolCallResponse;
import com.deepdive.ai.graph.agent.interceptor.ToolInterceptor;
import com.deepdive.ai.graph.agent.interceptor.journal.ToolInvocationJournal;
import com.deepdive.ai.graph.agent.interceptor.journal.ToolJournalInterceptor;
import com.deepdive.ai.graph.agent.interceptor.toolerror.ToolErrorInterceptor;
import com.deepdive.ai.graph.agent.interceptor.toolretry.ToolRetryInterceptor;
import com.deepdive.ai.graph.agent.model.InferencePurpose;
import com.deepdive.ai.graph.agent.model.InferenceRequest;
import com.deepdive.ai.graph.agent.model.ModelInference;
import com.deepdive.ai.graph.agent.model.ModelInferenceException;
import com.deepdive.ai.graph.agent.prompt.ResearchPrompts;
import com.deepdive.ai.graph.agent.tool.ToolProvider;
import com.deepdive.ai.graph.executor.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

import static java.lang.String.format;

/**
 * Runs the bounded tool loop of a research task: call the model, execute the tool
 * calls it requests, feed the results back, and repeat until the model answers.
 *
 * <p>
 * At most {@code maxToolCalls} tools are invoked per task. Tool calls requested beyond
 * that budget are not invoked; the loop stops and returns a truncated result holding
 * the best partial answer. Tool failures become observations. Model failures are
 * retried and fail the task once {@code maxModelFailures} happen in a row.
 */
public class ToolCallHarness {

	private static final Logger log = LoggerFactory.getLogger(ToolCallHarness.class);

	public static final int DEFAULT_MAX_TOOL_CALLS = 8;

	public static final int DEFAULT_MAX_MODEL_FAILURES = 3;

	private final ModelInference modelInference;

	private final ToolProvider toolProvider;

	private final List<ToolInterceptor> interceptors;

	private final ExecutorService toolExecutor;

	private final int maxToolCalls;

	private final int maxModelFailures;

	private final RetryPolicy modelRetryPolicy;

	private ToolCallHarness(Builder builder) {
		this.modelInference = Objects.requireNonNull(builder.modelInference, "modelInference cannot be null");
		this.toolProvider = Objects.requireNonNull(builder.toolProvider, "toolProvider cannot be null");
		this.toolExecutor = Objects.requireNonNull(builder.toolExecutor, "toolExecutor cannot be null");
		this.interceptors = builder.interceptors != null ? List.copyOf(builder.interceptors)
				: defaultInterceptors();
		this.maxToolCalls = builder.maxToolCalls;
		this.maxModelFailures = builder.maxModelFailures;
		this.modelRetryPolicy = builder.modelRetryPolicy;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * The default chain: journal, then error conversion, then retry of transient
	 * failures.
	 */
	public static List<ToolInterceptor> defaultInterceptors() {
		return List.of(new ToolJournalInterceptor(), ToolErrorInterceptor.builder().build(),
				new ToolRetryInterceptor());
	}

	public int getMaxToolCalls() {
		return maxToolCalls;
	}

	public ResultNote runToolLoop(TaskContext context) {
		List<Message> messages = new ArrayList<>();
		messages.add(new SystemMessage(ResearchPrompts.render(ResearchPrompts.RESEARCH,
				Map.of("topic", context.topic(), "brief", context.brief() != null ? context.brief() : ""))));
		messages.add(new UserMessage(context.topic()));

		List<String> observations = new ArrayList<>();
		String lastText = null;
		int invoked = 0;

		while (true) {
			checkInterrupted(context);
			AssistantMessage reply = inferWithRetry(context, messages);
			if (hasText(reply)) {
				lastText = reply.getText();
			}
			if (!reply.hasToolCalls()) {
				log.debug("[TaskId {}] answered after {} tool call(s)", context.taskId(), invoked);
				return new ResultNote(context.taskId(), context.topic(), reply.getText() != null ? reply.getText() : "",
						observations, invoked, false);
			}

			List<AssistantMessage.ToolCall> requested = reply.getToolCalls();
			int admitted = Math.min(requested.size(), maxToolCalls - invoked);
			List<ToolCallResponse> responses = executeAll(context, requested.subList(0, admitted));
			invoked += admitted;
			responses.forEach(response -> observations.add(response.getResult()));

			if (admitted < requested.size()) {
				log.warn("[TaskId {}] tool budget of {} spent, {} requested call(s) dropped", context.taskId(),
						maxToolCalls, requested.size() - admitted);
				String partial = lastText != null ? lastText : String.join("\n\n", observations);
				return new ResultNote(context.taskId(), context.topic(), partial, observations, invoked, true);
			}

			messages.add(reply);
			messages.add(new ToolResponseMessage(responses.stream().map(ToolCallResponse::toToolResponse).toList(),
					Map.of()));
		}
	}

	private AssistantMessage inferWithRetry(TaskContext context, List<Message> messages) {
		InferenceRequest request = new InferenceRequest(InferencePurpose.RESEARCH, messages,
				toolProvider.toolCallbacks(context.assignedTools()));
		int failures = 0;
		while (true) {
			try {
				AssistantMessage reply = modelInference.infer(request);
				if (reply == null) {
					throw new ModelInferenceException("model returned no message");
				}
				return reply;
			}
			catch (RuntimeException ex) {
				failures++;
				if (failures >= maxModelFailures) {
					throw new ModelInferenceException(format("model call of task '%s' failed %d consecutive time(s)",
							context.taskId(), failures), ex);
				}
				long delay = modelRetryPolicy.delayMillis(failures);
				log.warn("[TaskId {}] model call failed ({}/{}), retrying in {}ms: {}", context.taskId(), failures,
						maxModelFailures, delay, ex.getMessage());
				sleep(context, delay);
			}
		}
	}

	private List<ToolCallResponse> executeAll(TaskContext context, List<AssistantMessage.ToolCall> toolCalls) {
		ToolCallHandler handler = InterceptorChain.chainToolInterceptors(interceptors, request -> invokeTool(context, request));
		List<CompletableFuture<ToolCallResponse>> futures = new ArrayList<>();
		for (AssistantMessage.ToolCall toolCall : toolCalls) {
			ToolCallRequest request = ToolCallRequest.builder()
				.toolCall(toolCall)
				.threadId(context.threadId())
				.taskId(context.taskId())
				.topic(context.topic())
				.context(journalContext(context.journal()))
				.build();
			futures.add(CompletableFuture.supplyAsync(() -> handler.call(request), toolExecutor));
		}
		List<ToolCallResponse> responses = new ArrayList<>();
		try {
			for (CompletableFuture<ToolCallResponse> future : futures) {
				responses.add(future.join());
			}
		}
		catch (CompletionException ex) {
			futures.forEach(future -> future.cancel(true));
			if (ex.getCause() instanceof RuntimeException runtime) {
				throw runtime;
			}
			throw ex;
		}
		return responses;
	}

	private ToolCallResponse invokeTool(TaskContext context, ToolCallRequest request) {
		String toolName = request.getToolName();
		if (!context.assignedTools().contains(toolName) || !toolProvider.hasTool(toolName)) {
			log.warn("[TaskId {}] model requested unavailable tool '{}'", context.taskId(), toolName);
			return ToolCallResponse.error(request.getToolCallId(), toolName, format("Tool %s not available", toolName));
		}
		log.debug("[TaskId {}] executing tool {}", context.taskId(), toolName);
		String result = toolProvider.invoke(toolName, request.getArguments());
		return ToolCallResponse.of(request.getToolCallId(), toolName, result);
	}

	private static Map<String, Object> journalContext(ToolInvocationJournal journal) {
		Map<String, Object> context = new HashMap<>();
		if (journal != null) {
			context.put(ToolInvocationJournal.METADATA_KEY, journal);
		}
		return context;
	}

	private static boolean hasText(AssistantMessage message) {
		return message.getText() != null && !message.getText().isBlank();
	}

	private static void checkInterrupted(TaskContext context) {
		if (Thread.currentThread().isInterrupted()) {
			throw new CancellationException(format("tool loop of task '%s' interrupted", context.taskId()));
		}
	}

	private static void sleep(TaskContext context, long delay) {
		try {
			Thread.sleep(delay);
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new CancellationException(format("tool loop of task '%s' interrupted", context.taskId()));
		}
	}

	public static class Builder {

		private ModelInference modelInference;

		private ToolProvider toolProvider;

		private List<ToolInterceptor> interceptors;

		private ExecutorService toolExecutor;

		private int maxToolCalls = DEFAULT_MAX_TOOL_CALLS;

		private int maxModelFailures = DEFAULT_MAX_MODEL_FAILURES;

		private RetryPolicy modelRetryPolicy = RetryPolicy.builder().initialDelay(500).build();

		public Builder modelInference(ModelInference modelInference) {
			this.modelInference = modelInference;
			return this;
		}

		public Builder toolProvider(ToolProvider toolProvider) {
			this.toolProvider = toolProvider;
			return this;
		}

		/**
		 * Replaces the default interceptor chain. The first interceptor is the outermost.
		 */
		public Builder interceptors(List<ToolInterceptor> interceptors) {
			this.interceptors = interceptors;
			return this;
		}

		public Builder toolExecutor(ExecutorService toolExecutor) {
			this.toolExecutor = toolExecutor;
			return this;
		}

		public Builder maxToolCalls(int maxToolCalls) {
			if (maxToolCalls < 1) {
				throw new IllegalArgumentException("maxToolCalls must be >= 1");
			}
			this.maxToolCalls = maxToolCalls;
			return this;
		}

		public Builder maxModelFailures(int maxModelFailures) {
			if (maxModelFailures < 1) {
				throw new IllegalArgumentException("maxModelFailures must be >= 1");
			}
			this.maxModelFailures = maxModelFailures;
			return this;
		}

		/**
		 * Backoff between failed model calls. Only the delays of the policy are used.
		 */
		public Builder modelRetryPolicy(RetryPolicy modelRetryPolicy) {
			this.modelRetryPolicy = Objects.requireNonNull(modelRetryPolicy, "modelRetryPolicy cannot be null");
			return this;
		}

		public ToolCallHarness build() {
			return new ToolCallHarness(this);
		}

	}

}
