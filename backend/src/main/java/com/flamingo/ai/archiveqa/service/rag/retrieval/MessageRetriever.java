package com.flamingo.ai.archiveqa.service.rag.retrieval;

import com.flamingo.ai.archiveqa.service.rag.model.Candidate;
import com.flamingo.ai.archiveqa.service.rag.model.WorkspaceScope;
import java.util.List;

/** Semantic search over the message archive of one workspace. */
public interface MessageRetriever {

  /**
   * Searches the archive.
   *
   * @param scope workspace to search
   * @param query natural-language query
   * @param nResults maximum number of candidates
   * @param channelFilter channel name to restrict to, or null
   * @param daysBack only messages from the last N days, or null for full history
   * @return candidates ordered by ascending distance
   */
  List<Candidate> search(
      WorkspaceScope scope, String query, int nResults, String channelFilter, Integer daysBack);
}
