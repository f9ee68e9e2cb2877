package com.flamingo.ai.doctrine.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.doctrine.api.rest.HealthController;
import com.flamingo.ai.doctrine.api.rest.IngestionController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.multipart.MultipartFile;

/**
 * Contract tests for the REST mappings:
 *
 * <ul>
 *   <li>POST /api/ingestions - Start a run from text or pages
 *   <li>POST /api/ingestions/pdf - Start a run from an uploaded PDF
 *   <li>GET /api/ingestions - List runs
 *   <li>GET /api/ingestions/{runId} - Get a run with chapter results
 *   <li>DELETE /api/ingestions/{runId} - Stop a run
 *   <li>GET /api/health - Health check
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("IngestionController API contract")
  class IngestionControllerContract {

    @Test
    @DisplayName("should be mapped to /api/ingestions")
    void shouldBeMappedToApiIngestions() {
      RequestMapping mapping = IngestionController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/ingestions");
    }

    @Test
    @DisplayName("should upload PDFs under /pdf")
    void shouldMapPdfUpload() throws Exception {
      PostMapping mapping =
          IngestionController.class
              .getMethod("startPdfIngestion", MultipartFile.class, Integer.class)
              .getAnnotation(PostMapping.class);
      assertThat(mapping.value()).containsExactly("/pdf");
    }

    @Test
    @DisplayName("should stop runs with DELETE /{runId}")
    void shouldMapStop() throws Exception {
      DeleteMapping mapping =
          IngestionController.class
              .getMethod("stopIngestion", String.class)
              .getAnnotation(DeleteMapping.class);
      assertThat(mapping.value()).containsExactly("/{runId}");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /api/health")
    void shouldBeMappedToApiHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/health");
    }
  }
}
