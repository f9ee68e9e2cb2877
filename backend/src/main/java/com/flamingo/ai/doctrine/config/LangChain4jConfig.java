package com.flamingo.ai.doctrine.config;

import com.flamingo.ai.doctrine.service.llm.ChatModelProvider;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models.
 *
 * <p>The extraction pipeline picks the model and timeout per call, so instead of a single {@link
 * ChatModel} bean this exposes a {@link ChatModelProvider} that builds one model per (name,
 * timeout) pair against an OpenAI-compatible endpoint. A local Ollama server works through its
 * {@code /v1} API.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:http://localhost:11434/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:2048}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.chat-model.temperature:0.2}")
  private double temperature;

  @Bean
  public ChatModelProvider chatModelProvider() {
    validateApiKey();

    return (modelName, timeout) -> buildChatModel(modelName, timeout);
  }

  private ChatModel buildChatModel(String modelName, Duration timeout) {
    return OpenAiChatModel.builder()
        .baseUrl(baseUrl)
        .apiKey(openAiApiKey)
        .modelName(modelName)
        .maxCompletionTokens(maxCompletionTokens)
        .temperature(temperature)
        .timeout(timeout)
        .maxRetries(0)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "An API key is required for the generation endpoint. Set LLM_API_KEY (any non-empty"
              + " value works for a local Ollama server).");
    }
  }
}
