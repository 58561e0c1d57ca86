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
package com.deepdive.ai.graph.agent.state;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.util.Optional.ofNullable;

/**
 * State of a research thread. Serialized with Jackson into every checkpoint.
 *
 * <p>
 * Only the executing node mutates an instance. Message, note, warning and topic lists
 * only grow; {@code query} and {@code metadata} are fixed once set.
 */
public class ResearchState {

	public static final String METADATA_CATEGORY = "category";

	public static final String METADATA_FOCUS = "focus";

	private String query;

	private List<ConversationMessage> messages = new ArrayList<>();

	private String brief;

	private boolean briefValid;

	private int briefRevisions;

	private String briefRevisionHint;

	private boolean briefCapHit;

	private List<Note> rawNotes = new ArrayList<>();

	private List<Note> compressedNotes = new ArrayList<>();

	private int researchIterations;

	private List<String> unresolvedTopics = new ArrayList<>();

	private String report;

	private String executiveSummary;

	private boolean reportValid;

	private int reportRevisions;

	private String reportRevisionHint;

	private boolean reportCapHit;

	private boolean revisionCapHit;

	private boolean awaitingClarification;

	private String clarificationQuestion;

	private int clarificationRounds;

	private List<String> warnings = new ArrayList<>();

	private Map<String, String> metadata = new LinkedHashMap<>();

	public ResearchState() {
	}

	public ResearchState(String query) {
		this.query = Objects.requireNonNull(query, "query cannot be null");
		this.messages.add(ConversationMessage.user(query));
	}

	public String getQuery() {
		return query;
	}

	public void setQuery(String query) {
		if (this.query != null && !this.query.equals(query)) {
			throw new IllegalStateException("query cannot change once set");
		}
		this.query = query;
	}

	public List<ConversationMessage> getMessages() {
		return Collections.unmodifiableList(messages);
	}

	public void setMessages(List<ConversationMessage> messages) {
		this.messages = new ArrayList<>(messages);
	}

	public void addMessage(ConversationMessage message) {
		this.messages.add(Objects.requireNonNull(message, "message cannot be null"));
	}

	public String getBrief() {
		return brief;
	}

	public void setBrief(String brief) {
		this.brief = brief;
	}

	public boolean isBriefValid() {
		return briefValid;
	}

	public void setBriefValid(boolean briefValid) {
		this.briefValid = briefValid;
	}

	public int getBriefRevisions() {
		return briefRevisions;
	}

	public void setBriefRevisions(int briefRevisions) {
		this.briefRevisions = briefRevisions;
	}

	public String getBriefRevisionHint() {
		return briefRevisionHint;
	}

	public void setBriefRevisionHint(String briefRevisionHint) {
		this.briefRevisionHint = briefRevisionHint;
	}

	public boolean isBriefCapHit() {
		return briefCapHit;
	}

	public void setBriefCapHit(boolean briefCapHit) {
		this.briefCapHit = briefCapHit;
	}

	public List<Note> getRawNotes() {
		return Collections.unmodifiableList(rawNotes);
	}

	public void setRawNotes(List<Note> rawNotes) {
		this.rawNotes = new ArrayList<>(rawNotes);
	}

	public void addRawNote(Note note) {
		this.rawNotes.add(Objects.requireNonNull(note, "note cannot be null"));
	}

	public List<Note> getCompressedNotes() {
		return Collections.unmodifiableList(compressedNotes);
	}

	public void setCompressedNotes(List<Note> compressedNotes) {
		this.compressedNotes = new ArrayList<>(compressedNotes);
	}

	public void addCompressedNote(Note note) {
		this.compressedNotes.add(Objects.requireNonNull(note, "note cannot be null"));
	}

	public int getResearchIterations() {
		return researchIterations;
	}

	public void setResearchIterations(int researchIterations) {
		this.researchIterations = researchIterations;
	}

	public List<String> getUnresolvedTopics() {
		return Collections.unmodifiableList(unresolvedTopics);
	}

	public void setUnresolvedTopics(List<String> unresolvedTopics) {
		this.unresolvedTopics = new ArrayList<>(unresolvedTopics);
	}

	public void addUnresolvedTopic(String topic) {
		this.unresolvedTopics.add(topic);
	}

	public String getReport() {
		return report;
	}

	public void setReport(String report) {
		this.report = report;
	}

	public String getExecutiveSummary() {
		return executiveSummary;
	}

	public void setExecutiveSummary(String executiveSummary) {
		this.executiveSummary = executiveSummary;
	}

	public boolean isReportValid() {
		return reportValid;
	}

	public void setReportValid(boolean reportValid) {
		this.reportValid = reportValid;
	}

	public int getReportRevisions() {
		return reportRevisions;
	}

	public void setReportRevisions(int reportRevisions) {
		this.reportRevisions = reportRevisions;
	}

	public String getReportRevisionHint() {
		return reportRevisionHint;
	}

	public void setReportRevisionHint(String reportRevisionHint) {
		this.reportRevisionHint = reportRevisionHint;
	}

	public boolean isReportCapHit() {
		return reportCapHit;
	}

	public void setReportCapHit(boolean reportCapHit) {
		this.reportCapHit = reportCapHit;
	}

	/**
	 * @return whether any revision loop ran out of revisions
	 */
	public boolean isRevisionCapHit() {
		return revisionCapHit;
	}

	public void setRevisionCapHit(boolean revisionCapHit) {
		this.revisionCapHit = revisionCapHit;
	}

	public boolean isAwaitingClarification() {
		return awaitingClarification;
	}

	public void setAwaitingClarification(boolean awaitingClarification) {
		this.awaitingClarification = awaitingClarification;
	}

	public String getClarificationQuestion() {
		return clarificationQuestion;
	}

	public void setClarificationQuestion(String clarificationQuestion) {
		this.clarificationQuestion = clarificationQuestion;
	}

	public int getClarificationRounds() {
		return clarificationRounds;
	}

	public void setClarificationRounds(int clarificationRounds) {
		this.clarificationRounds = clarificationRounds;
	}

	public List<String> getWarnings() {
		return Collections.unmodifiableList(warnings);
	}

	public void setWarnings(List<String> warnings) {
		this.warnings = new ArrayList<>(warnings);
	}

	public void addWarning(String warning) {
		this.warnings.add(warning);
	}

	public Map<String, String> getMetadata() {
		return Collections.unmodifiableMap(metadata);
	}

	public void setMetadata(Map<String, String> metadata) {
		if (!this.metadata.isEmpty() && !this.metadata.equals(metadata)) {
			throw new IllegalStateException("metadata is read-only once set");
		}
		this.metadata = new LinkedHashMap<>(metadata);
	}

	@JsonIgnore
	public Optional<String> getFocus() {
		return ofNullable(metadata.get(METADATA_FOCUS)).filter(focus -> !focus.isBlank());
	}

	/**
	 * Marks a revision loop as exhausted.
	 */
	public void markBriefCapHit() {
		this.briefCapHit = true;
		this.revisionCapHit = true;
	}

	public void markReportCapHit() {
		this.reportCapHit = true;
		this.revisionCapHit = true;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ResearchState that)) {
			return false;
		}
		return briefValid == that.briefValid && briefRevisions == that.briefRevisions
				&& briefCapHit == that.briefCapHit && researchIterations == that.researchIterations
				&& reportValid == that.reportValid && reportRevisions == that.reportRevisions
				&& reportCapHit == that.reportCapHit && revisionCapHit == that.revisionCapHit
				&& awaitingClarification == that.awaitingClarification
				&& clarificationRounds == that.clarificationRounds && Objects.equals(query, that.query)
				&& Objects.equals(messages, that.messages) && Objects.equals(brief, that.brief)
				&& Objects.equals(briefRevisionHint, that.briefRevisionHint) && Objects.equals(rawNotes, that.rawNotes)
				&& Objects.equals(compressedNotes, that.compressedNotes)
				&& Objects.equals(unresolvedTopics, that.unresolvedTopics) && Objects.equals(report, that.report)
				&& Objects.equals(executiveSummary, that.executiveSummary)
				&& Objects.equals(reportRevisionHint, that.reportRevisionHint)
				&& Objects.equals(clarificationQuestion, that.clarificationQuestion)
				&& Objects.equals(warnings, that.warnings) && Objects.equals(metadata, that.metadata);
	}

	@Override
	public int hashCode() {
		return Objects.hash(query, messages, brief, briefRevisions, rawNotes, compressedNotes, researchIterations,
				report, reportRevisions, warnings, metadata);
	}

	@Override
	public String toString() {
		return "ResearchState{query=" + query + ", briefRevisions=" + briefRevisions + ", researchIterations="
				+ researchIterations + ", rawNotes=" + rawNotes.size() + ", reportRevisions=" + reportRevisions
				+ ", revisionCapHit=" + revisionCapHit + ", awaitingClarification=" + awaitingClarification + '}';
	}

}
