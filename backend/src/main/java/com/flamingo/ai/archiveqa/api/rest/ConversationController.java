package com.flamingo.ai.archiveqa.api.rest;

import com.flamingo.ai.archiveqa.api.dto.request.FollowUpRequest;
import com.flamingo.ai.archiveqa.api.dto.response.AnswerResponse;
import com.flamingo.ai.archiveqa.api.dto.response.ConversationTurnResponse;
import com.flamingo.ai.archiveqa.service.conversation.ConversationService;
import com.flamingo.ai.archiveqa.service.conversation.ConversationSummary;
import com.flamingo.ai.archiveqa.service.qa.QuestionAnsweringService;
import com.flamingo.ai.archiveqa.service.rag.model.Question;
import com.flamingo.ai.archiveqa.service.rag.model.WorkspaceScope;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for threaded conversations. */
@RestController
@RequestMapping("/api/workspaces/{workspaceId}/conversations")
@RequiredArgsConstructor
@Validated
public class ConversationController {

  private final QuestionAnsweringService questionAnsweringService;
  private final ConversationService conversationService;

  /** Answers a question in a thread, using the earlier turns as context. */
  @PostMapping("/{threadTs}/ask")
  public ResponseEntity<AnswerResponse> askInThread(
      @PathVariable String workspaceId,
      @PathVariable String threadTs,
      @Valid @RequestBody FollowUpRequest request) {
    Question question = Question.of(WorkspaceScope.of(workspaceId), request.getQuestion());
    return ResponseEntity.ok(
        questionAnsweringService.answerFollowUp(question, threadTs, request.getChannelId()));
  }

  /** Gets the turns of a thread, oldest first. */
  @GetMapping("/{threadTs}/messages")
  public ResponseEntity<List<ConversationTurnResponse>> getHistory(
      @PathVariable String workspaceId,
      @PathVariable String threadTs,
      @RequestParam(defaultValue = "20") @Min(1) @Max(200) int limit) {
    List<ConversationTurnResponse> turns =
        conversationService.history(WorkspaceScope.of(workspaceId), threadTs, limit).stream()
            .map(ConversationTurnResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(turns);
  }

  /** Clears a thread's history. */
  @DeleteMapping("/{threadTs}")
  public ResponseEntity<Void> clearHistory(
      @PathVariable String workspaceId, @PathVariable String threadTs) {
    if (!conversationService.clear(WorkspaceScope.of(workspaceId), threadTs)) {
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }
    return ResponseEntity.noContent().build();
  }

  /** Lists conversations by most recent activity. */
  @GetMapping
  public ResponseEntity<List<ConversationSummary>> recentConversations(
      @PathVariable String workspaceId,
      @RequestParam(required = false) String channelId,
      @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit) {
    return ResponseEntity.ok(
        conversationService.recentConversations(WorkspaceScope.of(workspaceId), channelId, limit));
  }
}
