package com.flamingo.ai.archiveqa.service.rag.postprocess;

import com.flamingo.ai.archiveqa.config.RagConfig;
import com.flamingo.ai.archiveqa.service.rag.model.Candidate;
import com.flamingo.ai.archiveqa.service.rag.model.CandidateMetadata;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Appends the "What I found:" section quoting the top messages an answer is based on. Output
 * depends only on the inputs and the configured zone.
 */
@Component
@RequiredArgsConstructor
public class EvidenceFormatter {

  static final String HEADER = "\n\nWhat I found:";

  private final FriendlyTimestampFormatter timestampFormatter;
  private final RagConfig ragConfig;

  public String format(String answerText, List<Candidate> messages) {
    if (messages.isEmpty()) {
      return answerText;
    }
    int maxEntries = ragConfig.getEvidence().getMaxEntries();
    int maxQuote = ragConfig.getEvidence().getMaxQuoteLength();

    List<String> lines = new ArrayList<>();
    lines.add(HEADER);
    for (Candidate message : messages.subList(0, Math.min(maxEntries, messages.size()))) {
      CandidateMetadata metadata = message.metadata();
      String quote = message.text().strip();
      if (quote.length() > maxQuote) {
        quote = quote.substring(0, maxQuote - 3) + "...";
      }
      lines.add(
          "• "
              + orUnknown(metadata.userName())
              + "'s update in #"
              + orUnknown(metadata.channelName())
              + " ("
              + timestampFormatter.format(metadata.timestamp())
              + "): \""
              + quote
              + "\"");
    }
    if (messages.size() > maxEntries) {
      lines.add("\n...and " + (messages.size() - maxEntries) + " more");
    }
    return answerText + String.join("\n", lines);
  }

  private static String orUnknown(String value) {
    return value != null && !value.isBlank() ? value : "unknown";
  }
}
