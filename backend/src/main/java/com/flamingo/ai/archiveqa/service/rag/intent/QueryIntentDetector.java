package com.flamingo.ai.archiveqa.service.rag.intent;

import com.flamingo.ai.archiveqa.service.directory.ChannelDirectoryService;
import com.flamingo.ai.archiveqa.service.rag.model.QueryIntent;
import com.flamingo.ai.archiveqa.service.rag.model.WorkspaceScope;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reads time-window and channel constraints out of a question.
 *
 * <p>Both lookups walk ordered tables and stop at the first match, so table order is part of the
 * behavior: "this week" is checked before "last week", "general" before "dev".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryIntentDetector {

  /** Phrase to days-back, in match priority order. */
  static final List<Map.Entry<String, Integer>> TIME_WINDOW_RULES =
      List.of(
          Map.entry("today", 1),
          Map.entry("yesterday", 2),
          Map.entry("this week", 7),
          Map.entry("past week", 7),
          Map.entry("last week", 14),
          Map.entry("this month", 30),
          Map.entry("past month", 30),
          Map.entry("last month", 60),
          Map.entry("recent", 7),
          Map.entry("recently", 7),
          Map.entry("latest", 7));

  /** Channel names recognized in plain text, in match priority order. */
  static final List<String> CHANNEL_KEYWORDS =
      List.of(
          "general",
          "standup",
          "hackathons",
          "random",
          "engineering",
          "design",
          "product",
          "marketing",
          "sales",
          "support",
          "dev",
          "testing",
          "qa",
          "operations",
          "announcements");

  private static final Pattern CHANNEL_MENTION =
      Pattern.compile("<#([A-Z0-9]+)(?:\\|([a-zA-Z0-9_-]+))?>");

  private final ChannelDirectoryService channelDirectory;

  public QueryIntent detect(WorkspaceScope scope, String question) {
    String text = question != null ? question : "";
    Integer daysBack = detectTimeWindow(text);
    String channel = detectChannel(scope, text);
    if (daysBack != null || channel != null) {
      log.info("Detected query intent: daysBack={}, channel={}", daysBack, channel);
    }
    return new QueryIntent(daysBack, channel);
  }

  Integer detectTimeWindow(String question) {
    String lower = question.toLowerCase(Locale.ROOT);
    for (Map.Entry<String, Integer> rule : TIME_WINDOW_RULES) {
      if (lower.contains(rule.getKey())) {
        return rule.getValue();
      }
    }
    return null;
  }

  String detectChannel(WorkspaceScope scope, String question) {
    Matcher mention = CHANNEL_MENTION.matcher(question);
    if (mention.find()) {
      String inlineName = mention.group(2);
      if (inlineName != null) {
        return inlineName;
      }
      return lookupChannelName(scope, mention.group(1));
    }

    String lower = question.toLowerCase(Locale.ROOT);
    for (String keyword : CHANNEL_KEYWORDS) {
      if (lower.contains("#" + keyword)
          || lower.contains(keyword + " channel")
          || lower.contains("in " + keyword)) {
        return keyword;
      }
    }
    return null;
  }

  private String lookupChannelName(WorkspaceScope scope, String channelId) {
    try {
      return channelDirectory.channelName(scope, channelId).orElse(channelId);
    } catch (RuntimeException e) {
      log.warn("Channel lookup failed for {}, using raw id: {}", channelId, e.getMessage());
      return channelId;
    }
  }
}
