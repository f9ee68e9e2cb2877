package com.flamingo.ai.doctrine;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.doctrine.service.ingest.ExtractionPipeline;
import com.flamingo.ai.doctrine.service.ingest.checkpoint.CheckpointStore;
import com.flamingo.ai.doctrine.service.ingest.checkpoint.InMemoryCheckpointStore;
import com.flamingo.ai.doctrine.service.ingestion.IngestionService;
import com.flamingo.ai.doctrine.service.llm.ChatModelProvider;
import com.flamingo.ai.doctrine.service.llm.GenerationClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. The chat model provider is mocked so no
 * generation endpoint is needed.
 */
@SpringBootTest(
    properties = {"ingest.checkpoint.store=memory", "ingest.progress.enabled=false"})
class ApplicationContextTest {

  @MockitoBean private ChatModelProvider chatModelProvider;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Pipeline beans should be wired")
  void pipelineBeansShouldBeWired() {
    assertThat(applicationContext.getBean(ExtractionPipeline.class)).isNotNull();
    assertThat(applicationContext.getBean(IngestionService.class)).isNotNull();
    assertThat(applicationContext.getBean(GenerationClient.class)).isNotNull();
    assertThat(applicationContext.getBean(CheckpointStore.class))
        .isInstanceOf(InMemoryCheckpointStore.class);
  }
}
