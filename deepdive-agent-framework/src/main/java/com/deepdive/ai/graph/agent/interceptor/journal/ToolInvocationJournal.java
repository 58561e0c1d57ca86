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
package com.deepdive.ai.graph.agent.interceptor.journal;

import com.deepdive.ai.graph.agent.interceptor.ToolCallHandler;
import com.deepdive.ai.graph.agent.interceptor.ToolCallRequest;
import com.deepdive.ai.graph.agent.interceptor.ToolCallResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.String.format;

/**
 * Results of the tool calls already performed for a thread. Lives outside the graph
 * state, so a node or task that is rolled back and retried finds the calls it made
 * before and does not repeat their side effects.
 *
 * <p>
 * A call is reserved before the tool runs. A second caller with the same key, such as
 * the retry of a task whose previous attempt is still waiting on the tool, blocks until
 * the first call finishes and receives its result. A reservation whose call throws is
 * dropped, so the next caller invokes the tool again.
 */
public class ToolInvocationJournal {

	private static final Logger log = LoggerFactory.getLogger(ToolInvocationJournal.class);

	/**
	 * Key of the journal in the metadata of a run configuration.
	 */
	public static final String METADATA_KEY = "deepdive.toolJournal";

	private final Map<String, CompletableFuture<ToolCallResponse>> entries = new ConcurrentHashMap<>();

	private final AtomicInteger replays = new AtomicInteger();

	public static String keyOf(ToolCallRequest request) {
		return String.join("\u0000", Objects.toString(request.getTaskId(), ""),
				Objects.toString(request.getTopic(), ""), request.getToolName(), request.getArguments());
	}

	/**
	 * Performs {@code request} through {@code handler} unless the same call was made or
	 * is in flight, in which case its result is replayed.
	 * @throws CancellationException if interrupted while waiting for a call in flight
	 */
	public ToolCallResponse invoke(ToolCallRequest request, ToolCallHandler handler) {
		String key = keyOf(request);
		while (true) {
			CompletableFuture<ToolCallResponse> reservation = new CompletableFuture<>();
			CompletableFuture<ToolCallResponse> existing = entries.putIfAbsent(key, reservation);
			if (existing == null) {
				return perform(key, reservation, request, handler);
			}
			Optional<ToolCallResponse> recorded = await(existing, request);
			if (recorded.isPresent()) {
				replays.incrementAndGet();
				log.info("[TaskId {}] replaying recorded result of tool '{}'", request.getTaskId(),
						request.getToolName());
				return recorded.get().replayedFor(request.getToolCallId());
			}
		}
	}

	private ToolCallResponse perform(String key, CompletableFuture<ToolCallResponse> reservation,
			ToolCallRequest request, ToolCallHandler handler) {
		try {
			ToolCallResponse response = handler.call(request);
			reservation.complete(response);
			return response;
		}
		catch (RuntimeException | Error ex) {
			entries.remove(key, reservation);
			reservation.completeExceptionally(ex);
			throw ex;
		}
	}

	private static Optional<ToolCallResponse> await(CompletableFuture<ToolCallResponse> inFlight,
			ToolCallRequest request) {
		try {
			return Optional.of(inFlight.get());
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new CancellationException(format("task '%s' interrupted while waiting for tool '%s'",
					request.getTaskId(), request.getToolName()));
		}
		catch (ExecutionException ex) {
			return Optional.empty();
		}
	}

	/**
	 * @return the recorded result of a finished call, without waiting for one in flight
	 */
	public Optional<ToolCallResponse> lookup(ToolCallRequest request) {
		CompletableFuture<ToolCallResponse> entry = entries.get(keyOf(request));
		if (entry == null || !entry.isDone() || entry.isCompletedExceptionally()) {
			return Optional.empty();
		}
		return Optional.of(entry.join().replayedFor(request.getToolCallId()));
	}

	public void record(ToolCallRequest request, ToolCallResponse response) {
		entries.putIfAbsent(keyOf(request), CompletableFuture.completedFuture(response));
	}

	/**
	 * @return how many calls are recorded or in flight
	 */
	public int size() {
		return entries.size();
	}

	/**
	 * @return how many calls were answered from the journal
	 */
	public int replayCount() {
		return replays.get();
	}

}
