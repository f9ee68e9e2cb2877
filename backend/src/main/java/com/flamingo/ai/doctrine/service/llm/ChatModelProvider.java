package com.flamingo.ai.doctrine.service.llm;

import dev.langchain4j.model.chat.ChatModel;
import java.time.Duration;

/** Creates chat models for a model name and call timeout. */
@FunctionalInterface
public interface ChatModelProvider {

  ChatModel create(String modelName, Duration timeout);
}
