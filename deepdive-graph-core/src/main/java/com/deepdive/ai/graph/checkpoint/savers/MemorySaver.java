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
package com.deepdive.ai.graph.checkpoint.savers;

import com.deepdive.ai.graph.checkpoint.BaseCheckpointSaver;
import com.deepdive.ai.graph.checkpoint.Checkpoint;
import com.deepdive.ai.graph.exception.CheckpointException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;

/**
 * In-process checkpoint saver.
 * <p>
 * Checkpoints are kept in their serialized form, so a reader always gets a fresh copy
 * that shares nothing with the writer or with other readers. Writes to the same thread
 * are serialized by a per-thread lock while reads never block. Subclasses hook into the
 * load, insert, clear and release steps to add durable storage.
 * </p>
 */
public class MemorySaver implements BaseCheckpointSaver {

	private final Map<String, byte[]> checkpointsByThread = new ConcurrentHashMap<>();

	private final Map<String, ReentrantLock> locksByThread = new ConcurrentHashMap<>();

	protected final ObjectMapper objectMapper;

	public MemorySaver() {
		this(BaseCheckpointSaver.configureObjectMapper(new ObjectMapper()));
	}

	public MemorySaver(ObjectMapper objectMapper) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
	}

	/**
	 * Called on a cache miss. Returns the serialized checkpoint of the thread from durable
	 * storage, or {@code null} if there is none.
	 */
	protected byte[] loadedCheckpoint(String threadId) throws IOException {
		return null;
	}

	/**
	 * Called with the thread lock held, before the new checkpoint becomes visible to
	 * readers.
	 */
	protected void insertedCheckpoint(String threadId, byte[] serialized) throws IOException {
	}

	protected void clearedCheckpoint(String threadId) throws IOException {
	}

	protected void releasedCheckpoint(String threadId, Tag releaseTag) throws IOException {
	}

	@Override
	public Optional<Checkpoint> get(String threadId) {
		Objects.requireNonNull(threadId, "threadId cannot be null");
		byte[] serialized = checkpointsByThread.get(threadId);
		if (serialized == null) {
			try {
				serialized = loadedCheckpoint(threadId);
			}
			catch (IOException ex) {
				throw new CheckpointException(format("cannot load checkpoint of thread '%s'", threadId), ex);
			}
			if (serialized == null) {
				return Optional.empty();
			}
			byte[] racing = checkpointsByThread.putIfAbsent(threadId, serialized);
			if (racing != null) {
				serialized = racing;
			}
		}
		return Optional.of(deserialize(threadId, serialized));
	}

	@Override
	public void put(Checkpoint checkpoint) {
		Objects.requireNonNull(checkpoint, "checkpoint cannot be null");
		String threadId = checkpoint.getThreadId();
		withThreadLock(threadId, () -> {
			byte[] serialized = serialize(checkpoint);
			insertedCheckpoint(threadId, serialized);
			checkpointsByThread.put(threadId, serialized);
			return null;
		});
	}

	@Override
	public boolean clear(String threadId) {
		Objects.requireNonNull(threadId, "threadId cannot be null");
		return withThreadLock(threadId, () -> {
			boolean existed = checkpointsByThread.remove(threadId) != null;
			clearedCheckpoint(threadId);
			return existed;
		});
	}

	@Override
	public Tag release(String threadId) {
		Objects.requireNonNull(threadId, "threadId cannot be null");
		return withThreadLock(threadId, () -> {
			Checkpoint current = get(threadId).orElse(null);
			Tag tag = new Tag(threadId, current);
			releasedCheckpoint(threadId, tag);
			checkpointsByThread.remove(threadId);
			return tag;
		});
	}

	private <T> T withThreadLock(String threadId, IOCallable<T> action) {
		ReentrantLock lock = locksByThread.computeIfAbsent(threadId, k -> new ReentrantLock());
		lock.lock();
		try {
			return action.call();
		}
		catch (IOException ex) {
			throw new CheckpointException(format("cannot store checkpoint of thread '%s'", threadId), ex);
		}
		finally {
			lock.unlock();
		}
	}

	private byte[] serialize(Checkpoint checkpoint) throws IOException {
		return objectMapper.writeValueAsBytes(checkpoint);
	}

	private Checkpoint deserialize(String threadId, byte[] serialized) {
		try {
			return objectMapper.readValue(serialized, Checkpoint.class);
		}
		catch (IOException ex) {
			throw new CheckpointException(format("checkpoint of thread '%s' is corrupted", threadId), ex);
		}
	}

	@FunctionalInterface
	private interface IOCallable<T> {

		T call() throws IOException;

	}

}
