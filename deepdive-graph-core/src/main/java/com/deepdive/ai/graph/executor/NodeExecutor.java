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

import com.deepdive.ai.graph.NodePolicy;
import com.deepdive.ai.graph.RunnableConfig;
import com.deepdive.ai.graph.exception.NodeExecutionException;
import com.deepdive.ai.graph.exception.NodeTimeoutException;
import com.deepdive.ai.graph.internal.node.Node;
import com.deepdive.ai.graph.serializer.StateSerializer;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.deepdive.ai.graph.checkpoint.BaseCheckpointSaver.THREAD_ID_DEFAULT;

/**
 * Runs a single unit of work under a {@link NodePolicy}.
 * <p>
 * Every attempt is submitted to the node pool and awaited for at most the policy
 * timeout. Failures accepted by the retry policy are retried after a backoff delay;
 * anything else, or the failure of the last attempt, is reported as a
 * {@link NodeExecutionException}. For graph nodes each attempt starts from a fresh copy
 * of the pre-execution snapshot, so a failed attempt never leaks partial mutations into
 * the next one.
 * </p>
 */
public class NodeExecutor {

	private static final Logger log = LoggerFactory.getLogger(NodeExecutor.class);

	public static final String OBSERVATION_NAME = "deepdive.graph.node";

	private final ExecutorService executorService;

	private final ObservationRegistry observationRegistry;

	public NodeExecutor(ExecutorService executorService, ObservationRegistry observationRegistry) {
		this.executorService = Objects.requireNonNull(executorService, "executorService cannot be null");
		this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
	}

	/**
	 * Executes a graph node against a snapshot of {@code state}.
	 * @param node the node to run, with its resolved policy
	 * @param state the state as of the last completed node, left untouched
	 * @param serializer used to take the snapshot and the per-attempt working copies
	 * @param config the run configuration
	 * @return the state produced by the successful attempt
	 * @throws NodeExecutionException if the node fails permanently
	 */
	public <S> S execute(Node<S> node, S state, StateSerializer<S> serializer, RunnableConfig config) {
		S snapshot = serializer.cloneObject(state);
		return call(node.id(), node.policy(), config, () -> {
			S working = serializer.cloneObject(snapshot);
			S result = awaitAction(node.action().apply(working, config));
			return result != null ? result : working;
		});
	}

	/**
	 * Runs an arbitrary unit of work with the timeout and retry semantics of a node.
	 * @param unitId name used in logs, observations and errors
	 * @param policy timeout and retry settings
	 * @param config the run configuration
	 * @param body the work; it is invoked once per attempt
	 * @return the value of the successful attempt
	 * @throws NodeExecutionException if the unit fails permanently
	 */
	public <T> T call(String unitId, NodePolicy policy, RunnableConfig config, Callable<T> body) {
		Objects.requireNonNull(policy, "policy cannot be null");
		String threadId = config.threadId().orElse(THREAD_ID_DEFAULT);
		RetryPolicy retryPolicy = policy.retryPolicy();
		int attempt = 0;
		while (true) {
			attempt++;
			final int currentAttempt = attempt;
			try {
				return Observation.createNotStarted(OBSERVATION_NAME, observationRegistry)
					.lowCardinalityKeyValue("graph.node.id", unitId)
					.highCardinalityKeyValue("graph.node.attempt", String.valueOf(currentAttempt))
					.observeChecked(() -> runWithTimeout(unitId, policy.timeout(), body));
			}
			catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				throw new NodeExecutionException(unitId, attempt, ex);
			}
			catch (Exception ex) {
				if (!retryPolicy.shouldRetry(ex, attempt)) {
					log.error("[ThreadId {}] Node '{}' failed permanently after {} attempt(s): {}", threadId, unitId,
							attempt, ex.toString());
					throw new NodeExecutionException(unitId, attempt, ex);
				}
				long delay = retryPolicy.delayMillis(attempt);
				log.warn("[ThreadId {}] Node '{}' failed (attempt {}/{}), retrying in {}ms: {}", threadId, unitId,
						attempt, retryPolicy.maxAttempts(), delay, ex.getMessage());
				sleep(unitId, attempt, delay);
			}
		}
	}

	private <T> T runWithTimeout(String unitId, Duration timeout, Callable<T> body) throws Exception {
		Future<T> future = executorService.submit(body);
		try {
			return timeout == null ? future.get() : future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (TimeoutException ex) {
			future.cancel(true);
			throw new NodeTimeoutException(unitId, timeout);
		}
		catch (InterruptedException ex) {
			future.cancel(true);
			throw ex;
		}
		catch (ExecutionException ex) {
			throw rethrowable(ex.getCause());
		}
	}

	private static <S> S awaitAction(CompletableFuture<S> future) throws Exception {
		try {
			return future.get();
		}
		catch (ExecutionException ex) {
			throw rethrowable(ex.getCause());
		}
	}

	private static Exception rethrowable(Throwable cause) {
		if (cause instanceof Error error) {
			throw error;
		}
		if (cause instanceof CompletionException && cause.getCause() != null) {
			return rethrowable(cause.getCause());
		}
		return (Exception) cause;
	}

	private static void sleep(String unitId, int attempt, long delay) {
		if (delay <= 0) {
			return;
		}
		try {
			Thread.sleep(delay);
		}
		catch (InterruptedException ie) {
			Thread.currentThread().interrupt();
			throw new NodeExecutionException(unitId, attempt, ie);
		}
	}

}
