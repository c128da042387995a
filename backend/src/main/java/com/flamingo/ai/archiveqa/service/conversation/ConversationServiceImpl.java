package com.flamingo.ai.archiveqa.service.conversation;

import com.flamingo.ai.archiveqa.config.RagConfig;
import com.flamingo.ai.archiveqa.domain.entity.ConversationTurn;
import com.flamingo.ai.archiveqa.domain.enums.MessageRole;
import com.flamingo.ai.archiveqa.domain.repository.ConversationTurnRepository;
import com.flamingo.ai.archiveqa.service.rag.model.WorkspaceScope;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/** JPA-backed implementation of ConversationService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationServiceImpl implements ConversationService {

  private final ConversationTurnRepository turnRepository;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public boolean append(
      WorkspaceScope scope, String threadTs, String channelId, String role, String content) {
    Optional<MessageRole> messageRole = MessageRole.fromWireValue(role);
    if (messageRole.isEmpty()) {
      log.error("Invalid role: {}. Must be 'user' or 'assistant'", role);
      return false;
    }
    try {
      turnRepository.save(
          ConversationTurn.builder()
              .workspaceId(scope.workspaceId())
              .threadTs(threadTs)
              .channelId(channelId)
              .role(messageRole.get())
              .content(content)
              .build());
      meterRegistry.counter("conversation.turns.appended", "role", role).increment();
      log.debug("Stored {} turn in thread {}", role, threadTs);
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to store conversation turn in thread {}: {}", threadTs, e.getMessage(), e);
      return false;
    }
  }

  @Override
  public List<ConversationTurn> history(WorkspaceScope scope, String threadTs, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    try {
      List<ConversationTurn> turns =
          turnRepository.findThread(scope.workspaceId(), threadTs, PageRequest.of(0, limit));
      log.debug("Retrieved {} turns from thread {}", turns.size(), threadTs);
      return turns;
    } catch (RuntimeException e) {
      log.error("Failed to read conversation thread {}: {}", threadTs, e.getMessage(), e);
      return List.of();
    }
  }

  @Override
  public String buildPrompt(WorkspaceScope scope, String threadTs, String question) {
    int limit = ragConfig.getConversation().getMaxHistoryTurns() * 2;
    List<ConversationTurn> turns = history(scope, threadTs, limit);
    if (turns.isEmpty()) {
      return question;
    }
    List<String> parts = new ArrayList<>(turns.size() + 2);
    parts.add("Previous conversation:");
    for (ConversationTurn turn : turns) {
      String label = turn.getRole() == MessageRole.USER ? "User" : "Assistant";
      parts.add(label + ": " + turn.getContent());
    }
    parts.add("\nNew question: " + question);
    return String.join("\n", parts);
  }

  @Override
  public boolean clear(WorkspaceScope scope, String threadTs) {
    try {
      int deleted = turnRepository.deleteThread(scope.workspaceId(), threadTs);
      log.info("Cleared {} turns from thread {}", deleted, threadTs);
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to clear conversation thread {}: {}", threadTs, e.getMessage(), e);
      return false;
    }
  }

  @Override
  public List<ConversationSummary> recentConversations(
      WorkspaceScope scope, String channelId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    PageRequest page = PageRequest.of(0, limit);
    try {
      if (channelId != null && !channelId.isBlank()) {
        return turnRepository.findRecentConversationsInChannel(
            scope.workspaceId(), channelId, page);
      }
      return turnRepository.findRecentConversations(scope.workspaceId(), page);
    } catch (RuntimeException e) {
      log.error("Failed to list recent conversations: {}", e.getMessage(), e);
      return List.of();
    }
  }
}
