package com.flamingo.ai.archiveqa.service.conversation;

import com.flamingo.ai.archiveqa.domain.entity.ConversationTurn;
import com.flamingo.ai.archiveqa.service.rag.model.WorkspaceScope;
import java.util.List;

/**
 * Tracks question and answer turns of threaded conversations so follow-up questions can be
 * answered with the earlier exchange in view.
 *
 * <p>Persistence failures are logged and reported through return values, never thrown.
 */
public interface ConversationService {

  int DEFAULT_HISTORY_LIMIT = 20;

  /**
   * Appends a turn to a conversation.
   *
   * @param role {@code user} or {@code assistant}; anything else is rejected without writing
   * @return true if the turn was stored
   */
  boolean append(
      WorkspaceScope scope, String threadTs, String channelId, String role, String content);

  /**
   * Returns the turns of a conversation, oldest first.
   *
   * @param limit maximum number of turns
   * @return the turns, or an empty list if there are none or they could not be read
   */
  List<ConversationTurn> history(WorkspaceScope scope, String threadTs, int limit);

  default List<ConversationTurn> history(WorkspaceScope scope, String threadTs) {
    return history(scope, threadTs, DEFAULT_HISTORY_LIMIT);
  }

  /**
   * Prefixes a question with the conversation so far. Returns the question unchanged when the
   * conversation has no turns.
   */
  String buildPrompt(WorkspaceScope scope, String threadTs, String question);

  /**
   * Deletes every turn of a conversation. Clearing an empty conversation succeeds.
   *
   * @return false only if the delete failed
   */
  boolean clear(WorkspaceScope scope, String threadTs);

  /**
   * Lists conversations by most recent activity.
   *
   * @param channelId restricts the listing to one channel, or null for all
   */
  List<ConversationSummary> recentConversations(WorkspaceScope scope, String channelId, int limit);
}
