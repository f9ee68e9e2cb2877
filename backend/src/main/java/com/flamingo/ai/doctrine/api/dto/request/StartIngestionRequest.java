package com.flamingo.ai.doctrine.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for starting an ingestion run from text. Either text or pages must be given. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartIngestionRequest {

  @NotBlank(message = "Name is required")
  @Size(min = 1, max = 255, message = "Name must be between 1 and 255 characters")
  private String name;

  private String text;

  private List<String> pages;

  @Min(value = 1, message = "numWorkers must be at least 1")
  @Max(value = 32, message = "numWorkers must be at most 32")
  private Integer numWorkers;
}
