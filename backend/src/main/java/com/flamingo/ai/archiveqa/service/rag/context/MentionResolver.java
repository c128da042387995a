package com.flamingo.ai.archiveqa.service.rag.context;

import com.flamingo.ai.archiveqa.service.directory.UserDirectoryService;
import com.flamingo.ai.archiveqa.service.rag.model.WorkspaceScope;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Rewrites {@code <@U123>} and {@code <@U123|name>} user mentions as {@code @name}.
 *
 * <p>Inline names are used as-is. Bare ids across all texts are resolved with a single directory
 * call; ids the directory cannot resolve stay as raw ids.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MentionResolver {

  static final Pattern USER_MENTION = Pattern.compile("<@([A-Z0-9]+)(?:\\|([^>]+))?>");

  private final UserDirectoryService userDirectory;

  /** Resolves mentions in every text, returning the rewritten texts in the same order. */
  public List<String> resolveAll(WorkspaceScope scope, List<String> texts) {
    Set<String> unresolved = new LinkedHashSet<>();
    for (String text : texts) {
      Matcher matcher = USER_MENTION.matcher(text);
      while (matcher.find()) {
        if (matcher.group(2) == null) {
          unresolved.add(matcher.group(1));
        }
      }
    }
    Map<String, String> names = lookup(scope, unresolved);
    return texts.stream().map(text -> rewrite(text, names)).toList();
  }

  private Map<String, String> lookup(WorkspaceScope scope, Set<String> userIds) {
    if (userIds.isEmpty()) {
      return Map.of();
    }
    try {
      return userDirectory.resolve(scope, userIds);
    } catch (RuntimeException e) {
      log.warn(
          "User lookup failed for {} mention(s), keeping raw ids: {}",
          userIds.size(),
          e.getMessage());
      return Map.of();
    }
  }

  static String rewrite(String text, Map<String, String> names) {
    Matcher matcher = USER_MENTION.matcher(text);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String userId = matcher.group(1);
      String name =
          matcher.group(2) != null ? matcher.group(2) : names.getOrDefault(userId, userId);
      matcher.appendReplacement(out, Matcher.quoteReplacement("@" + name));
    }
    matcher.appendTail(out);
    return out.toString();
  }
}
