package com.flamingo.ai.smartretrieval.api.dto.request;

import com.flamingo.ai.smartretrieval.domain.enums.MessageRole;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for query analysis diagnostics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 10000, message = "Query must not exceed 10000 characters")
  private String query;

  @Builder.Default private boolean firstMessage = true;

  @Valid
  @Size(max = 50, message = "History must not exceed 50 turns")
  @Builder.Default
  private List<Turn> history = new ArrayList<>();

  /** A prior conversation turn. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Turn {

    @NotNull(message = "Role is required")
    private MessageRole role;

    private String content;
  }
}
