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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;

/**
 * A CheckpointSaver that stores checkpoints in the filesystem.
 * <p>
 * Each thread is associated with a JSON file in the provided targetFolder named
 * "thread-<i>threadId</i>.saver". Files are replaced atomically: the new content is
 * written to a temporary file in the same folder and then moved over the old one.
 * </p>
 */
public class FileSystemSaver extends MemorySaver {

	private static final Logger log = LoggerFactory.getLogger(FileSystemSaver.class);

	public static final String EXTENSION = ".saver";

	private final Path targetFolder;

	public FileSystemSaver(Path targetFolder) {
		this(targetFolder, BaseCheckpointSaver.configureObjectMapper(new ObjectMapper()));
	}

	public FileSystemSaver(Path targetFolder, ObjectMapper objectMapper) {
		super(objectMapper);
		this.targetFolder = Objects.requireNonNull(targetFolder, "targetFolder cannot be null");
		try {
			if (Files.exists(targetFolder) && !Files.isDirectory(targetFolder)) {
				throw new IllegalArgumentException(format("targetFolder '%s' must be a directory", targetFolder));
			}
			Files.createDirectories(targetFolder);
		}
		catch (IOException ex) {
			throw new IllegalArgumentException(format("targetFolder '%s' cannot be created", targetFolder), ex);
		}
	}

	public Path getTargetFolder() {
		return targetFolder;
	}

	private String getBaseName(String threadId) {
		return format("thread-%s", URLEncoder.encode(threadId, StandardCharsets.UTF_8));
	}

	Path getPath(String threadId) {
		return targetFolder.resolve(getBaseName(threadId).concat(EXTENSION));
	}

	@Override
	protected byte[] loadedCheckpoint(String threadId) throws IOException {
		Path path = getPath(threadId);
		if (!Files.exists(path)) {
			return null;
		}
		return Files.readAllBytes(path);
	}

	@Override
	protected void insertedCheckpoint(String threadId, byte[] serialized) throws IOException {
		Path target = getPath(threadId);
		Path temp = Files.createTempFile(targetFolder, getBaseName(threadId), ".tmp");
		try {
			Files.write(temp, serialized);
			try {
				Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			}
			catch (AtomicMoveNotSupportedException ex) {
				log.debug("atomic move not supported in {}, falling back to replace", targetFolder);
				Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
			}
		}
		finally {
			Files.deleteIfExists(temp);
		}
	}

	@Override
	protected void clearedCheckpoint(String threadId) throws IOException {
		Files.deleteIfExists(getPath(threadId));
	}

	/**
	 * Moves the checkpoint file of the thread (e.g., "thread-123.saver") to a versioned
	 * backup file (e.g., "thread-123-v1.saver", "thread-123-v2.saver", etc.) numbered
	 * after the existing backups.
	 */
	@Override
	protected void releasedCheckpoint(String threadId, Tag releaseTag) throws IOException {
		Path currentPath = getPath(threadId);
		if (!Files.exists(currentPath)) {
			log.warn("file {} doesn't exist. Skipping file operations.", currentPath);
			return;
		}

		String baseName = getBaseName(threadId);
		Pattern versionPattern = Pattern.compile(Pattern.quote(baseName) + "-v(\\d+)" + Pattern.quote(EXTENSION) + "$");

		int maxVersion;
		try (var stream = Files.list(targetFolder)) {
			maxVersion = stream.map(path -> path.getFileName().toString())
				.map(versionPattern::matcher)
				.filter(Matcher::matches)
				.mapToInt(matcher -> Integer.parseInt(matcher.group(1)))
				.max()
				.orElse(0);
		}

		Path backupPath = targetFolder.resolve(format("%s-v%d%s", baseName, maxVersion + 1, EXTENSION));
		Files.move(currentPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
		log.info("released thread '{}' to {}", threadId, backupPath.getFileName());
	}

}
