package com.flamingo.ai.archiveqa.service.rag.postprocess;

import com.flamingo.ai.archiveqa.config.RagConfig;
import com.flamingo.ai.archiveqa.service.directory.UserDirectoryService;
import com.flamingo.ai.archiveqa.service.rag.model.Candidate;
import com.flamingo.ai.archiveqa.service.rag.model.CandidateMetadata;
import com.flamingo.ai.archiveqa.service.rag.model.SourceCitation;
import com.flamingo.ai.archiveqa.service.rag.model.WorkspaceScope;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Builds the numbered source list returned alongside an answer. */
@Component
@RequiredArgsConstructor
@Slf4j
public class SourceListFormatter {

  private final UserDirectoryService userDirectory;
  private final RagConfig ragConfig;

  /**
   * Cites the top messages, numbered from 1. Authors missing from the message metadata are looked
   * up in one batch; authors the directory does not know are reported as "unknown".
   */
  public List<SourceCitation> format(WorkspaceScope scope, List<Candidate> messages) {
    int maxEntries = ragConfig.getSources().getMaxEntries();
    List<Candidate> top = messages.subList(0, Math.min(maxEntries, messages.size()));
    Map<String, String> authors = lookupAuthors(scope, top);

    List<SourceCitation> sources = new ArrayList<>(top.size());
    for (int i = 0; i < top.size(); i++) {
      Candidate message = top.get(i);
      CandidateMetadata metadata = message.metadata();
      String user =
          hasText(metadata.userName())
              ? metadata.userName()
              : authors.getOrDefault(metadata.userId(), "unknown");
      sources.add(
          SourceCitation.builder()
              .referenceNumber(i + 1)
              .text(truncate(message.text()))
              .channel(hasText(metadata.channelName()) ? metadata.channelName() : "unknown")
              .user(user)
              .timestamp(metadata.timestamp() != null ? metadata.timestamp() : "")
              .distance(message.distance())
              .build());
    }
    return sources;
  }

  private Map<String, String> lookupAuthors(WorkspaceScope scope, List<Candidate> messages) {
    Set<String> userIds = new LinkedHashSet<>();
    for (Candidate message : messages) {
      CandidateMetadata metadata = message.metadata();
      if (!hasText(metadata.userName()) && hasText(metadata.userId())) {
        userIds.add(metadata.userId());
      }
    }
    if (userIds.isEmpty()) {
      return Map.of();
    }
    try {
      return userDirectory.resolve(scope, userIds);
    } catch (RuntimeException e) {
      log.warn("Author lookup failed for {} source(s): {}", userIds.size(), e.getMessage());
      return Map.of();
    }
  }

  private String truncate(String text) {
    int maxLength = ragConfig.getSources().getMaxTextLength();
    return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
