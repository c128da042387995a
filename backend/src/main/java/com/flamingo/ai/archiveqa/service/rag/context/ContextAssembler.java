package com.flamingo.ai.archiveqa.service.rag.context;

import com.flamingo.ai.archiveqa.service.rag.model.Candidate;
import com.flamingo.ai.archiveqa.service.rag.model.CandidateMetadata;
import com.flamingo.ai.archiveqa.service.rag.model.WorkspaceScope;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Builds the context block handed to the model from filtered archive messages. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContextAssembler {

  private final MentionResolver mentionResolver;

  /**
   * One block per message, {@code [Message i] [#channel] (from author):} followed by the text with
   * mentions resolved. Blocks are separated by a blank line.
   */
  public String assemble(WorkspaceScope scope, List<Candidate> messages) {
    List<String> texts = messages.stream().map(Candidate::text).toList();
    List<String> resolved = mentionResolver.resolveAll(scope, texts);

    List<String> blocks = new ArrayList<>(messages.size());
    for (int i = 0; i < messages.size(); i++) {
      CandidateMetadata metadata = messages.get(i).metadata();
      blocks.add(
          String.format(
              "[Message %d] [#%s] (from %s):\n%s",
              i + 1,
              orUnknown(metadata.channelName()),
              orUnknown(metadata.userName()),
              resolved.get(i)));
    }
    String context = String.join("\n\n", blocks);
    log.debug("Assembled context from {} messages ({} chars)", messages.size(), context.length());
    return context;
  }

  private static String orUnknown(String value) {
    return value != null && !value.isBlank() ? value : "unknown";
  }
}
