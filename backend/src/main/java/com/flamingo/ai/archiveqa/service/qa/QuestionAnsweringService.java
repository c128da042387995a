package com.flamingo.ai.archiveqa.service.qa;

import com.flamingo.ai.archiveqa.api.dto.response.AnswerResponse;
import com.flamingo.ai.archiveqa.service.rag.model.Question;
import com.flamingo.ai.archiveqa.service.rag.model.WorkspaceScope;
import java.util.List;

/** Answers questions from a workspace's message archive. */
public interface QuestionAnsweringService {

  /**
   * Answers a single question. Time and channel filters the caller left unset are detected from
   * the question text.
   *
   * @throws com.flamingo.ai.archiveqa.exception.SearchException if the archive cannot be searched
   */
  AnswerResponse answer(Question question);

  /**
   * Answers a question asked inside a conversation thread, with the earlier turns as context.
   * Records both the question and the answer in the thread.
   */
  AnswerResponse answerFollowUp(Question question, String threadTs, String channelId);

  /** Suggests follow-up questions; empty when the archive has nothing on the topic. */
  List<String> suggestRelatedQuestions(WorkspaceScope scope, String question, int count);
}
