package com.flamingo.ai.archiveqa.domain.repository;

import com.flamingo.ai.archiveqa.domain.entity.ConversationTurn;
import com.flamingo.ai.archiveqa.service.conversation.ConversationSummary;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for ConversationTurn entities. */
@Repository
public interface ConversationTurnRepository extends JpaRepository<ConversationTurn, Long> {

  /** Finds the turns of one conversation in creation order, oldest first. */
  @Query(
      "SELECT t FROM ConversationTurn t WHERE t.workspaceId = :workspaceId "
          + "AND t.threadTs = :threadTs ORDER BY t.createdAt ASC, t.id ASC")
  List<ConversationTurn> findThread(
      @Param("workspaceId") String workspaceId,
      @Param("threadTs") String threadTs,
      Pageable pageable);

  /** Deletes all turns of one conversation and returns the number removed. */
  @Modifying
  @Transactional
  @Query(
      "DELETE FROM ConversationTurn t WHERE t.workspaceId = :workspaceId "
          + "AND t.threadTs = :threadTs")
  int deleteThread(@Param("workspaceId") String workspaceId, @Param("threadTs") String threadTs);

  /** Lists conversations of a workspace by last activity, newest first. */
  @Query(
      "SELECT new com.flamingo.ai.archiveqa.service.conversation.ConversationSummary("
          + "t.threadTs, t.channelId, MAX(t.createdAt)) "
          + "FROM ConversationTurn t WHERE t.workspaceId = :workspaceId "
          + "GROUP BY t.threadTs, t.channelId ORDER BY MAX(t.createdAt) DESC")
  List<ConversationSummary> findRecentConversations(
      @Param("workspaceId") String workspaceId, Pageable pageable);

  /** Same as {@link #findRecentConversations} restricted to one channel. */
  @Query(
      "SELECT new com.flamingo.ai.archiveqa.service.conversation.ConversationSummary("
          + "t.threadTs, t.channelId, MAX(t.createdAt)) "
          + "FROM ConversationTurn t WHERE t.workspaceId = :workspaceId "
          + "AND t.channelId = :channelId "
          + "GROUP BY t.threadTs, t.channelId ORDER BY MAX(t.createdAt) DESC")
  List<ConversationSummary> findRecentConversationsInChannel(
      @Param("workspaceId") String workspaceId,
      @Param("channelId") String channelId,
      Pageable pageable);
}
