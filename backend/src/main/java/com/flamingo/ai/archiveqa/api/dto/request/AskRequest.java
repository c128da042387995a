package com.flamingo.ai.archiveqa.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking a question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskRequest {

  @NotBlank(message = "Question is required")
  @Size(max = 4000, message = "Question must not exceed 4000 characters")
  private String question;

  /** Channel name to search. If null, detected from the question. */
  private String channelFilter;

  /** Only search the last N days. If null, detected from the question. */
  @Positive(message = "daysBack must be positive")
  private Integer daysBack;

  /** Number of messages to answer from. Defaults to 10. */
  @Min(value = 1, message = "maxSources must be at least 1")
  @Max(value = 50, message = "maxSources must not exceed 50")
  private Integer maxSources;
}
