package com.flamingo.ai.archiveqa.service.qa;

import com.flamingo.ai.archiveqa.api.dto.response.AnswerResponse;
import com.flamingo.ai.archiveqa.config.RagConfig;
import com.flamingo.ai.archiveqa.domain.enums.MessageRole;
import com.flamingo.ai.archiveqa.service.conversation.ConversationService;
import com.flamingo.ai.archiveqa.service.rag.context.ContextAssembler;
import com.flamingo.ai.archiveqa.service.rag.filter.MessageQualityFilter;
import com.flamingo.ai.archiveqa.service.rag.generation.AnswerGenerator;
import com.flamingo.ai.archiveqa.service.rag.generation.RawAnswer;
import com.flamingo.ai.archiveqa.service.rag.intent.QueryIntentDetector;
import com.flamingo.ai.archiveqa.service.rag.model.Candidate;
import com.flamingo.ai.archiveqa.service.rag.model.GeneratedAnswer;
import com.flamingo.ai.archiveqa.service.rag.model.QueryIntent;
import com.flamingo.ai.archiveqa.service.rag.model.Question;
import com.flamingo.ai.archiveqa.service.rag.model.WorkspaceScope;
import com.flamingo.ai.archiveqa.service.rag.postprocess.AnswerPostProcessor;
import com.flamingo.ai.archiveqa.service.rag.postprocess.SourceListFormatter;
import com.flamingo.ai.archiveqa.service.rag.retrieval.RetrievalService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the answering pipeline: intent detection, retrieval, quality filtering, context assembly,
 * generation and post-processing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuestionAnsweringServiceImpl implements QuestionAnsweringService {

  static final String NO_RESULTS_MODEL = "none";
  static final String NO_RESULTS_EXPLANATION = "No relevant messages found after filtering";
  static final String NO_RESULTS_UNFILTERED =
      "I couldn't find any relevant information in the Slack history to answer this question.";
  static final String NO_RESULTS_FILTERED_TEMPLATE =
      "I couldn't find any substantive messages in the %s. There may be very little activity"
          + " during this period, or the messages might be too short/simple to be useful (like"
          + " emoji reactions or join notifications).\n\n"
          + "Try:\n"
          + "• Asking about a different time period\n"
          + "• Asking without specifying a channel\n"
          + "• Asking about a more general topic";

  private final QueryIntentDetector intentDetector;
  private final RetrievalService retrievalService;
  private final MessageQualityFilter qualityFilter;
  private final ContextAssembler contextAssembler;
  private final AnswerGenerator answerGenerator;
  private final AnswerPostProcessor postProcessor;
  private final SourceListFormatter sourceListFormatter;
  private final ConversationService conversationService;
  private final RelatedQuestionSuggester relatedQuestionSuggester;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "qa.answer", description = "Time to answer a question")
  public AnswerResponse answer(Question question) {
    return run(question, question.text()).response();
  }

  @Override
  @Timed(value = "qa.answer_follow_up", description = "Time to answer a follow-up question")
  public AnswerResponse answerFollowUp(Question question, String threadTs, String channelId) {
    WorkspaceScope scope = question.scope();
    String prompt = conversationService.buildPrompt(scope, threadTs, question.text());
    conversationService.append(
        scope, threadTs, channelId, MessageRole.USER.wireValue(), question.text());

    PipelineResult result = run(question, prompt);

    conversationService.append(
        scope, threadTs, channelId, MessageRole.ASSISTANT.wireValue(), result.turnText());
    return result.response();
  }

  @Override
  public List<String> suggestRelatedQuestions(WorkspaceScope scope, String question, int count) {
    Question probe = Question.of(scope, question);
    List<Candidate> related =
        retrievalService.retrieve(
            probe, QueryIntent.none(), ragConfig.getRetrieval().getSuggestionProbeSize());
    return relatedQuestionSuggester.suggest(related, count);
  }

  /**
   * Retrieval always uses the question as asked; generation uses {@code generationQuestion}, which
   * for follow-ups carries the earlier turns.
   */
  private PipelineResult run(Question question, String generationQuestion) {
    log.info(
        "Answering question in workspace {}: {}", question.scope().workspaceId(), question.text());
    meterRegistry.counter("qa.questions").increment();

    QueryIntent intent = resolveIntent(question);
    List<Candidate> candidates = retrievalService.retrieve(question, intent);
    List<Candidate> messages = qualityFilter.filter(candidates, question.maxContextMessages());
    log.debug("{} candidates, {} after quality filter", candidates.size(), messages.size());

    if (messages.isEmpty()) {
      meterRegistry.counter("qa.no_results").increment();
      AnswerResponse response = noResults(intent);
      return new PipelineResult(response, response.getAnswer());
    }

    String context = contextAssembler.assemble(question.scope(), messages);
    RawAnswer raw = answerGenerator.generate(generationQuestion, context, messages);
    GeneratedAnswer answer = postProcessor.postprocess(raw, messages);

    AnswerResponse response =
        AnswerResponse.builder()
            .answer(answer.text())
            .sources(sourceListFormatter.format(question.scope(), messages))
            .confidence(answer.confidence())
            .confidenceExplanation(answer.confidenceExplanation())
            .projectLinks(answer.links())
            .contextUsed(messages.size())
            .model(raw.model())
            .build();
    return new PipelineResult(response, answer.plainText());
  }

  /** Explicit filters from the caller win; unset ones are detected from the question. */
  private QueryIntent resolveIntent(Question question) {
    Integer daysBack = question.daysBack();
    String channel = question.channelFilter();
    if (daysBack != null && channel != null) {
      return new QueryIntent(daysBack, channel);
    }
    QueryIntent detected = intentDetector.detect(question.scope(), question.text());
    return new QueryIntent(
        daysBack != null ? daysBack : detected.daysBack(),
        channel != null ? channel : detected.channelFilter());
  }

  /** The response plus the answer text recorded in a conversation, without evidence. */
  private record PipelineResult(AnswerResponse response, String turnText) {}

  static AnswerResponse noResults(QueryIntent intent) {
    List<String> filters = new ArrayList<>();
    if (intent.daysBack() != null && intent.daysBack() > 0) {
      filters.add("last " + intent.daysBack() + " days");
    }
    if (intent.channelFilter() != null && !intent.channelFilter().isBlank()) {
      filters.add("#" + intent.channelFilter() + " channel");
    }
    String answer =
        filters.isEmpty()
            ? NO_RESULTS_UNFILTERED
            : String.format(NO_RESULTS_FILTERED_TEMPLATE, String.join(" and ", filters));
    return AnswerResponse.builder()
        .answer(answer)
        .confidence(0)
        .confidenceExplanation(NO_RESULTS_EXPLANATION)
        .contextUsed(0)
        .model(NO_RESULTS_MODEL)
        .build();
  }
}
