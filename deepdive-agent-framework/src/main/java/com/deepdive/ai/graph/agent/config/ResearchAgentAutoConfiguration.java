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

import com.deepdive.ai.graph.agent.ResearchAgent;
import com.deepdive.ai.graph.agent.model.ChatModelInference;
import com.deepdive.ai.graph.agent.model.ModelInference;
import com.deepdive.ai.graph.agent.tool.ToolCallbackRegistry;
import com.deepdive.ai.graph.agent.tool.ToolProvider;
import com.deepdive.ai.graph.checkpoint.BaseCheckpointSaver;
import com.deepdive.ai.graph.checkpoint.config.SaverConfig;
import com.deepdive.ai.graph.checkpoint.savers.FileSystemSaver;
import com.deepdive.ai.graph.checkpoint.savers.MemorySaver;
import com.deepdive.ai.graph.exception.GraphStateException;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

/**
 * Wires a {@link ResearchAgent} from the application's {@link ChatModel} and tool
 * callbacks.
 */
@AutoConfiguration
@ConditionalOnClass(ChatModel.class)
@EnableConfigurationProperties(ResearchProperties.class)
public class ResearchAgentAutoConfiguration {

	private static final Logger log = LoggerFactory.getLogger(ResearchAgentAutoConfiguration.class);

	@Bean
	@ConditionalOnMissingBean
	@ConditionalOnBean(ChatModel.class)
	public ModelInference researchModelInference(ChatModel chatModel) {
		return new ChatModelInference(chatModel);
	}

	@Bean
	@ConditionalOnMissingBean
	public ToolProvider researchToolProvider(ObjectProvider<ToolCallback> toolCallbacks) {
		return new ToolCallbackRegistry(toolCallbacks.orderedStream().collect(Collectors.toList()));
	}

	@Bean
	@ConditionalOnMissingBean
	public BaseCheckpointSaver researchCheckpointSaver(ResearchProperties properties) {
		ResearchProperties.Checkpoint checkpoint = properties.getCheckpoint();
		SaverConfig.Builder saverConfig = SaverConfig.builder();
		if (SaverConfig.FILE_SYSTEM.equals(checkpoint.getSaver())) {
			saverConfig.register(SaverConfig.FILE_SYSTEM, new FileSystemSaver(checkpoint.getDirectory()));
		}
		else {
			saverConfig.register(SaverConfig.MEMORY, new MemorySaver());
		}
		log.info("Using '{}' checkpoint saver for research threads", checkpoint.getSaver());
		return saverConfig.build().require(checkpoint.getSaver());
	}

	@Bean(destroyMethod = "close")
	@ConditionalOnMissingBean
	@ConditionalOnBean(ModelInference.class)
	public ResearchAgent researchAgent(ModelInference modelInference, ToolProvider toolProvider,
			BaseCheckpointSaver checkpointSaver, ResearchProperties properties,
			ObjectProvider<ObservationRegistry> observationRegistry) throws GraphStateException {
		return ResearchAgent.builder()
			.modelInference(modelInference)
			.toolProvider(toolProvider)
			.checkpointSaver(checkpointSaver)
			.properties(properties)
			.observationRegistry(observationRegistry.getIfUnique(() -> ObservationRegistry.NOOP))
			.build();
	}

}
