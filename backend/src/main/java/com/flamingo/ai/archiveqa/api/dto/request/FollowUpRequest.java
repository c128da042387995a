package com.flamingo.ai.archiveqa.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a question asked inside a conversation thread. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FollowUpRequest {

  @NotBlank(message = "Question is required")
  @Size(max = 4000, message = "Question must not exceed 4000 characters")
  private String question;

  @NotBlank(message = "Channel ID is required")
  private String channelId;
}
