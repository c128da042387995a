package com.flamingo.ai.archiveqa.domain.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.archiveqa.domain.entity.ConversationTurn;
import com.flamingo.ai.archiveqa.domain.enums.MessageRole;
import com.flamingo.ai.archiveqa.service.conversation.ConversationSummary;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;

@DataJpaTest
@DisplayName("ConversationTurnRepository Tests")
class ConversationTurnRepositoryTest {

  private static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 10, 9, 0);

  @Autowired private ConversationTurnRepository repository;

  @Test
  @DisplayName("Should return a thread oldest first, breaking ties by insertion order")
  void shouldOrderThread() {
    save("T1", "100.1", "C1", MessageRole.USER, "first", T0);
    save("T1", "100.1", "C1", MessageRole.ASSISTANT, "second", T0);
    save("T1", "100.1", "C1", MessageRole.USER, "third", T0.plusMinutes(1));

    List<ConversationTurn> turns = repository.findThread("T1", "100.1", PageRequest.of(0, 20));

    assertThat(turns)
        .extracting(ConversationTurn::getContent)
        .containsExactly("first", "second", "third");
  }

  @Test
  @DisplayName("Should keep threads of different workspaces apart")
  void shouldScopeByWorkspace() {
    save("T1", "100.1", "C1", MessageRole.USER, "mine", T0);
    save("T2", "100.1", "C1", MessageRole.USER, "theirs", T0);

    assertThat(repository.findThread("T1", "100.1", PageRequest.of(0, 20)))
        .extracting(ConversationTurn::getContent)
        .containsExactly("mine");
    assertThat(contents("T2", "100.1")).containsExactly("theirs");
  }

  @Test
  @DisplayName("Should delete only the requested thread")
  void shouldDeleteThread() {
    save("T1", "100.1", "C1", MessageRole.USER, "question", T0);
    save("T1", "100.1", "C1", MessageRole.ASSISTANT, "answer", T0.plusSeconds(5));
    save("T1", "200.2", "C1", MessageRole.USER, "other thread", T0);
    save("T2", "100.1", "C1", MessageRole.USER, "other workspace", T0);

    int deleted = repository.deleteThread("T1", "100.1");

    assertThat(deleted).isEqualTo(2);
    assertThat(contents("T1", "100.1")).isEmpty();
    assertThat(contents("T1", "200.2")).containsExactly("other thread");
    assertThat(contents("T2", "100.1")).containsExactly("other workspace");
    assertThat(repository.deleteThread("T1", "100.1")).isZero();
  }

  @Test
  @DisplayName("Should list conversations by last activity, newest first")
  void shouldListRecentConversations() {
    save("T1", "100.1", "C1", MessageRole.USER, "older thread", T0);
    save("T1", "100.1", "C1", MessageRole.ASSISTANT, "older reply", T0.plusMinutes(5));
    save("T1", "200.2", "C2", MessageRole.USER, "newer thread", T0.plusMinutes(10));
    save("T2", "300.3", "C1", MessageRole.USER, "other workspace", T0.plusMinutes(20));

    List<ConversationSummary> recent =
        repository.findRecentConversations("T1", PageRequest.of(0, 10));

    assertThat(recent)
        .containsExactly(
            new ConversationSummary("200.2", "C2", T0.plusMinutes(10)),
            new ConversationSummary("100.1", "C1", T0.plusMinutes(5)));
    assertThat(repository.findRecentConversations("T1", PageRequest.of(0, 1))).hasSize(1);
  }

  @Test
  @DisplayName("Should restrict recent conversations to one channel")
  void shouldListRecentConversationsInChannel() {
    save("T1", "100.1", "C1", MessageRole.USER, "in channel", T0);
    save("T1", "200.2", "C2", MessageRole.USER, "elsewhere", T0.plusMinutes(10));

    assertThat(repository.findRecentConversationsInChannel("T1", "C1", PageRequest.of(0, 10)))
        .extracting(ConversationSummary::threadTs)
        .containsExactly("100.1");
  }

  @Test
  @DisplayName("Should stamp the creation time when none is set")
  void shouldStampCreatedAt() {
    ConversationTurn saved = save("T1", "100.1", "C1", MessageRole.USER, "hello", null);

    assertThat(saved.getCreatedAt()).isNotNull();
  }

  private List<String> contents(String workspaceId, String threadTs) {
    return repository.findThread(workspaceId, threadTs, PageRequest.of(0, 20)).stream()
        .map(ConversationTurn::getContent)
        .toList();
  }

  private ConversationTurn save(
      String workspaceId,
      String threadTs,
      String channelId,
      MessageRole role,
      String content,
      LocalDateTime createdAt) {
    return repository.saveAndFlush(
        ConversationTurn.builder()
            .workspaceId(workspaceId)
            .threadTs(threadTs)
            .channelId(channelId)
            .role(role)
            .content(content)
            .createdAt(createdAt)
            .build());
  }
}
