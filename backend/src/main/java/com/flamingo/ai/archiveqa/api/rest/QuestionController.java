package com.flamingo.ai.archiveqa.api.rest;

import com.flamingo.ai.archiveqa.api.dto.request.AskRequest;
import com.flamingo.ai.archiveqa.api.dto.response.AnswerResponse;
import com.flamingo.ai.archiveqa.service.qa.QuestionAnsweringService;
import com.flamingo.ai.archiveqa.service.rag.model.Question;
import com.flamingo.ai.archiveqa.service.rag.model.WorkspaceScope;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for one-off questions against a workspace archive. */
@RestController
@RequestMapping("/api/workspaces/{workspaceId}/qa")
@RequiredArgsConstructor
@Validated
public class QuestionController {

  private final QuestionAnsweringService questionAnsweringService;

  /** Answers a question. */
  @PostMapping("/ask")
  public ResponseEntity<AnswerResponse> ask(
      @PathVariable String workspaceId, @Valid @RequestBody AskRequest request) {
    return ResponseEntity.ok(questionAnsweringService.answer(toQuestion(workspaceId, request)));
  }

  /** Suggests follow-up questions for a question. */
  @PostMapping("/suggestions")
  public ResponseEntity<List<String>> suggestions(
      @PathVariable String workspaceId,
      @Valid @RequestBody AskRequest request,
      @RequestParam(defaultValue = "3") @Min(1) @Max(10) int count) {
    return ResponseEntity.ok(
        questionAnsweringService.suggestRelatedQuestions(
            WorkspaceScope.of(workspaceId), request.getQuestion(), count));
  }

  static Question toQuestion(String workspaceId, AskRequest request) {
    return new Question(
        request.getQuestion(),
        WorkspaceScope.of(workspaceId),
        request.getChannelFilter(),
        request.getDaysBack(),
        request.getMaxSources() != null
            ? request.getMaxSources()
            : Question.DEFAULT_CONTEXT_MESSAGES);
  }
}
