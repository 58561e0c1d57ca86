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
package com.deepdive.ai.graph.agent.config;

import com.deepdive.ai.graph.NodePolicy;
import com.deepdive.ai.graph.executor.RetryPolicy;
import com.deepdive.ai.graph.agent.validation.BriefValidator;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Caps, thresholds and timeouts of the research pipeline.
 */
@ConfigurationProperties(prefix = ResearchProperties.PREFIX)
public class ResearchProperties {

	public static final String PREFIX = "deepdive.research";

	/**
	 * Whether the pipeline may stop to ask the user a clarification question.
	 */
	private boolean allowClarification = true;

	/**
	 * Maximum number of clarification questions per thread.
	 */
	private int maxClarifications = 1;

	/**
	 * Maximum number of node executions in a single invocation.
	 */
	private int maxGraphIterations = 50;

	private final Brief brief = new Brief();

	private final Report report = new Report();

	private final Research research = new Research();

	private final Node node = new Node();

	private final Checkpoint checkpoint = new Checkpoint();

	public boolean isAllowClarification() {
		return allowClarification;
	}

	public void setAllowClarification(boolean allowClarification) {
		this.allowClarification = allowClarification;
	}

	public int getMaxClarifications() {
		return maxClarifications;
	}

	public void setMaxClarifications(int maxClarifications) {
		this.maxClarifications = maxClarifications;
	}

	public int getMaxGraphIterations() {
		return maxGraphIterations;
	}

	public void setMaxGraphIterations(int maxGraphIterations) {
		this.maxGraphIterations = maxGraphIterations;
	}

	public Brief getBrief() {
		return brief;
	}

	public Report getReport() {
		return report;
	}

	public Research getResearch() {
		return research;
	}

	public Node getNode() {
		return node;
	}

	public Checkpoint getCheckpoint() {
		return checkpoint;
	}

	public static class Brief {

		private int minQuestions = 15;

		private int maxQuestions = 30;

		private List<String> requiredSections = new ArrayList<>(BriefValidator.DEFAULT_REQUIRED_SECTIONS);

		/**
		 * How many times a failing brief is sent back before the pipeline proceeds with a
		 * warning.
		 */
		private int maxRevisions = 1;

		public int getMinQuestions() {
			return minQuestions;
		}

		public void setMinQuestions(int minQuestions) {
			this.minQuestions = minQuestions;
		}

		public int getMaxQuestions() {
			return maxQuestions;
		}

		public void setMaxQuestions(int maxQuestions) {
			this.maxQuestions = maxQuestions;
		}

		public List<String> getRequiredSections() {
			return requiredSections;
		}

		public void setRequiredSections(List<String> requiredSections) {
			this.requiredSections = requiredSections;
		}

		public int getMaxRevisions() {
			return maxRevisions;
		}

		public void setMaxRevisions(int maxRevisions) {
			this.maxRevisions = maxRevisions;
		}

	}

	public static class Report {

		private int minSources = 5;

		private int minCitations = 3;

		private int maxRevisions = 1;

		public int getMinSources() {
			return minSources;
		}

		public void setMinSources(int minSources) {
			this.minSources = minSources;
		}

		public int getMinCitations() {
			return minCitations;
		}

		public void setMinCitations(int minCitations) {
			this.minCitations = minCitations;
		}

		public int getMaxRevisions() {
			return maxRevisions;
		}

		public void setMaxRevisions(int maxRevisions) {
			this.maxRevisions = maxRevisions;
		}

	}

	public static class Research {

		private int maxConcurrent = 3;

		/**
		 * Maximum number of research rounds per thread.
		 */
		private int maxIterations = 4;

		/**
		 * Maximum number of tool invocations per research task.
		 */
		private int maxToolCalls = 8;

		/**
		 * Consecutive model failures after which a research task fails.
		 */
		private int maxModelFailures = 3;

		private int compressionAttempts = 3;

		private Duration taskTimeout = Duration.ofMinutes(10);

		/**
		 * Timeout of the whole research stage.
		 */
		private Duration timeout = Duration.ofMinutes(30);

		public int getMaxConcurrent() {
			return maxConcurrent;
		}

		public void setMaxConcurrent(int maxConcurrent) {
			this.maxConcurrent = maxConcurrent;
		}

		public int getMaxIterations() {
			return maxIterations;
		}

		public void setMaxIterations(int maxIterations) {
			this.maxIterations = maxIterations;
		}

		public int getMaxToolCalls() {
			return maxToolCalls;
		}

		public void setMaxToolCalls(int maxToolCalls) {
			this.maxToolCalls = maxToolCalls;
		}

		public int getMaxModelFailures() {
			return maxModelFailures;
		}

		public void setMaxModelFailures(int maxModelFailures) {
			this.maxModelFailures = maxModelFailures;
		}

		public int getCompressionAttempts() {
			return compressionAttempts;
		}

		public void setCompressionAttempts(int compressionAttempts) {
			this.compressionAttempts = compressionAttempts;
		}

		public Duration getTaskTimeout() {
			return taskTimeout;
		}

		public void setTaskTimeout(Duration taskTimeout) {
			this.taskTimeout = taskTimeout;
		}

		public Duration getTimeout() {
			return timeout;
		}

		public void setTimeout(Duration timeout) {
			this.timeout = timeout;
		}

	}

	/**
	 * Timeout and retry settings applied to every node unless overridden.
	 */
	public static class Node {

		private Duration timeout = NodePolicy.DEFAULT_TIMEOUT;

		private int maxRetries = 3;

		private Duration initialDelay = Duration.ofMillis(500);

		private double backoffFactor = 2.0;

		private Duration maxDelay = Duration.ofSeconds(30);

		private boolean jitter = true;

		public Duration getTimeout() {
			return timeout;
		}

		public void setTimeout(Duration timeout) {
			this.timeout = timeout;
		}

		public int getMaxRetries() {
			return maxRetries;
		}

		public void setMaxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
		}

		public Duration getInitialDelay() {
			return initialDelay;
		}

		public void setInitialDelay(Duration initialDelay) {
			this.initialDelay = initialDelay;
		}

		public double getBackoffFactor() {
			return backoffFactor;
		}

		public void setBackoffFactor(double backoffFactor) {
			this.backoffFactor = backoffFactor;
		}

		public Duration getMaxDelay() {
			return maxDelay;
		}

		public void setMaxDelay(Duration maxDelay) {
			this.maxDelay = maxDelay;
		}

		public boolean isJitter() {
			return jitter;
		}

		public void setJitter(boolean jitter) {
			this.jitter = jitter;
		}

		public RetryPolicy toRetryPolicy() {
			return RetryPolicy.builder()
				.maxRetries(maxRetries)
				.initialDelay(initialDelay.toMillis())
				.backoffFactor(backoffFactor)
				.maxDelay(maxDelay.toMillis())
				.jitter(jitter)
				.build();
		}

		public NodePolicy toNodePolicy() {
			return NodePolicy.of(timeout, toRetryPolicy());
		}

	}

	public static class Checkpoint {

		/**
		 * Name of the checkpoint saver, "memory" or "filesystem".
		 */
		private String saver = "memory";

		/**
		 * Directory of the "filesystem" saver.
		 */
		private Path directory = Path.of(System.getProperty("java.io.tmpdir"), "deepdive-checkpoints");

		public String getSaver() {
			return saver;
		}

		public void setSaver(String saver) {
			this.saver = saver;
		}

		public Path getDirectory() {
			return directory;
		}

		public void setDirectory(Path directory) {
			this.directory = directory;
		}

	}

}
