package com.flamingo.ai.archiveqa.domain.entity;

import com.flamingo.ai.archiveqa.domain.enums.MessageRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One question or answer inside a threaded conversation. Rows are only ever appended. */
@Entity
@Table(
    name = "conversation_history",
    indexes = @Index(name = "idx_conversation_thread", columnList = "workspace_id, thread_ts"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationTurn {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "workspace_id", nullable = false)
  private String workspaceId;

  /** Conversation id: the timestamp of the thread's root message. */
  @Column(name = "thread_ts", nullable = false)
  private String threadTs;

  @Column(name = "channel_id", nullable = false)
  private String channelId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private MessageRole role;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String content;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }
}
