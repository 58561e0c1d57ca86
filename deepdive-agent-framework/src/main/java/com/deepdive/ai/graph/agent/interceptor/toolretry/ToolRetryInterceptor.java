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
package com.deepdive.ai.graph.agent.interceptor.toolretry;

import com.deepdive.ai.graph.agent.interceptor.ToolCallHandler;
import com.deepdive.ai.graph.agent.interceptor.ToolCallRequest;
import com.deepdive.ai.graph.agent.interceptor.ToolCallResponse;
import com.deepdive.ai.graph.agent.interceptor.ToolInterceptor;
import com.deepdive.ai.graph.executor.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CancellationException;

import static java.lang.String.format;

/**
 * Re-invokes a tool whose call failed with an error the {@link RetryPolicy} accepts,
 * waiting the policy's backoff between attempts. The last error is re-raised once the
 * policy gives up; turning it into an observation is left to an outer interceptor.
 */
public class ToolRetryInterceptor extends ToolInterceptor {

	private static final Logger log = LoggerFactory.getLogger(ToolRetryInterceptor.class);

	/**
	 * Two retries of transient errors, 500ms apart and doubling, capped at 10s.
	 */
	public static final RetryPolicy DEFAULT_POLICY = RetryPolicy.builder().maxRetries(2).maxDelay(10_000).build();

	private final RetryPolicy policy;

	public ToolRetryInterceptor() {
		this(DEFAULT_POLICY);
	}

	public ToolRetryInterceptor(RetryPolicy policy) {
		this.policy = Objects.requireNonNull(policy, "policy cannot be null");
	}

	@Override
	public ToolCallResponse interceptToolCall(ToolCallRequest request, ToolCallHandler handler) {
		int attempt = 0;
		while (true) {
			attempt++;
			try {
				return handler.call(request);
			}
			catch (RuntimeException ex) {
				if (!policy.shouldRetry(ex, attempt)) {
					if (attempt > 1) {
						log.error("[TaskId {}] tool '{}' failed after {} attempt(s): {}", request.getTaskId(),
								request.getToolName(), attempt, ex.getMessage());
					}
					throw ex;
				}
				long delay = policy.delayMillis(attempt);
				log.warn("[TaskId {}] tool '{}' failed (attempt {}/{}), retrying in {}ms: {}", request.getTaskId(),
						request.getToolName(), attempt, policy.maxAttempts(), delay, ex.getMessage());
				pause(request, delay);
			}
		}
	}

	private static void pause(ToolCallRequest request, long delay) {
		try {
			Thread.sleep(delay);
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			CancellationException cancelled = new CancellationException(
					format("retry of tool '%s' interrupted", request.getToolName()));
			cancelled.initCause(ex);
			throw cancelled;
		}
	}

	public RetryPolicy getPolicy() {
		return policy;
	}

	@Override
	public String getName() {
		return "ToolRetry";
	}

}
