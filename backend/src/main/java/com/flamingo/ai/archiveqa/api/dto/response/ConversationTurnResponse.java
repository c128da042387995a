package com.flamingo.ai.archiveqa.api.dto.response;

import com.flamingo.ai.archiveqa.domain.entity.ConversationTurn;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one conversation turn. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationTurnResponse {

  /** {@code user} or {@code assistant}. */
  private String role;

  private String content;
  private LocalDateTime createdAt;

  /** Creates a ConversationTurnResponse from a ConversationTurn entity. */
  public static ConversationTurnResponse fromEntity(ConversationTurn turn) {
    return ConversationTurnResponse.builder()
        .role(turn.getRole().wireValue())
        .content(turn.getContent())
        .createdAt(turn.getCreatedAt())
        .build();
  }
}
