package com.flamingo.ai.smartretrieval.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for an adaptive retrieval. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 10000, message = "Query must not exceed 10000 characters")
  private String query;

  /** Source ids, or a single "all"/"none". Omitted means all. */
  private List<String> sources;

  /** Chunk ceiling; the configured default applies when omitted. */
  @Min(value = 1, message = "maxChunks must be at least 1")
  @Max(value = 100, message = "maxChunks must be at most 100")
  private Integer maxChunks;
}
