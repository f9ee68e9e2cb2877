package com.flamingo.ai.doctrine.service.llm;

import com.flamingo.ai.doctrine.exception.LlmServiceException;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link GenerationClient} backed by a LangChain4j chat model. One model instance is cached per
 * (model name, timeout) pair.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LangChain4jGenerationClient implements GenerationClient {

  private final ChatModelProvider chatModelProvider;
  private final MeterRegistry meterRegistry;

  // 429 only as a status code, not as digits inside a number such as "4290 ms"
  private static final Pattern STATUS_429 =
      Pattern.compile(
          "(status|http|code|error)\\W{0,12}429(?!\\d)|(?<!\\d)429\\W+too many requests");

  private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

  @Override
  @CircuitBreaker(name = "llm", fallbackMethod = "generateFallback")
  public String generate(String prompt, String model, Duration timeout) {
    return call(model, timeout, List.of(UserMessage.from(prompt)));
  }

  @Override
  @CircuitBreaker(name = "llm", fallbackMethod = "generateWithSystemFallback")
  public String generate(String systemPrompt, String prompt, String model, Duration timeout) {
    return call(
        model, timeout, List.of(SystemMessage.from(systemPrompt), UserMessage.from(prompt)));
  }

  private String call(String model, Duration timeout, List<ChatMessage> messages) {
    ChatModel chatModel =
        models.computeIfAbsent(
            model + "|" + timeout.toMillis(), key -> chatModelProvider.create(model, timeout));
    try {
      ChatResponse response = chatModel.chat(messages);
      String text = response.aiMessage() == null ? null : response.aiMessage().text();
      if (text == null) {
        throw new LlmServiceException("Model " + model + " returned no text");
      }
      meterRegistry.counter("llm.requests.success").increment();
      return text;
    } catch (LlmServiceException e) {
      throw e;
    } catch (RuntimeException e) {
      boolean rateLimited = isRateLimit(e);
      meterRegistry
          .counter("llm.requests.failure", "rate_limited", String.valueOf(rateLimited))
          .increment();
      throw new LlmServiceException(
          "Generation failed for model " + model + ": " + e.getMessage(), rateLimited, e);
    }
  }

  /** Walks the cause chain looking for a rate-limit exception type or an HTTP 429 message. */
  static boolean isRateLimit(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current.getClass().getSimpleName().contains("RateLimit")) {
        return true;
      }
      String message = current.getMessage();
      if (message != null) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("rate limit") || STATUS_429.matcher(lower).find()) {
          return true;
        }
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return false;
  }

  @SuppressWarnings("unused")
  private String generateFallback(String prompt, String model, Duration timeout, Throwable t) {
    throw toLlmException(model, t);
  }

  @SuppressWarnings("unused")
  private String generateWithSystemFallback(
      String systemPrompt, String prompt, String model, Duration timeout, Throwable t) {
    throw toLlmException(model, t);
  }

  private LlmServiceException toLlmException(String model, Throwable t) {
    if (t instanceof LlmServiceException llmException) {
      return llmException;
    }
    if (t instanceof CallNotPermittedException) {
      log.error("Generation circuit breaker open, rejecting call to {}", model);
      meterRegistry.counter("llm.requests.rejected").increment();
      return new LlmServiceException("Generation circuit breaker is open", t);
    }
    return new LlmServiceException("Generation failed for model " + model, t);
  }
}
