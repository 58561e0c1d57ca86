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

/**
 * A research finding produced by a task of the research stage.
 *
 * @param taskId the id of the task that produced it, {@code round-NN-task-NN}
 * @param topic the researched topic
 * @param content the finding itself
 * @param round the research round, starting from 1
 * @param truncated whether the task ran out of tool calls before answering
 */
public record Note(String taskId, String topic, String content, int round, boolean truncated) {

}
