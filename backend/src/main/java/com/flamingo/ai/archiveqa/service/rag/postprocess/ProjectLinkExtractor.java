package com.flamingo.ai.archiveqa.service.rag.postprocess;

import com.flamingo.ai.archiveqa.service.rag.model.Candidate;
import com.flamingo.ai.archiveqa.service.rag.model.ExtractedLink;
import com.flamingo.ai.archiveqa.service.rag.model.LinkKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Finds GitHub repository and documentation links in the original message texts. */
@Component
public class ProjectLinkExtractor {

  private static final Pattern GITHUB_REPO =
      Pattern.compile(
          "https?://(?:www\\.)?github\\.com/[\\w\\-]+/[\\w\\-.]+", Pattern.CASE_INSENSITIVE);

  private static final List<Pattern> DOCUMENTATION =
      List.of(
          Pattern.compile(
              "https?://[\\w\\-]+\\.(?:readthedocs\\.io|github\\.io)/[\\w\\-./]*",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "https?://docs?\\.[\\w\\-]+\\.[a-z]{2,}/[\\w\\-./]*", Pattern.CASE_INSENSITIVE));

  private static final String TRAILING_PUNCTUATION = ".,!?)";

  /**
   * Links in message order; within a message GitHub links come before documentation links. Each
   * URL appears once, tagged with the channel of its first occurrence.
   */
  public List<ExtractedLink> extract(List<Candidate> messages) {
    List<ExtractedLink> links = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (Candidate message : messages) {
      String channel =
          message.metadata().channelName() != null ? message.metadata().channelName() : "unknown";
      collect(GITHUB_REPO, LinkKind.GITHUB, message.text(), channel, seen, links);
      for (Pattern pattern : DOCUMENTATION) {
        collect(pattern, LinkKind.DOCUMENTATION, message.text(), channel, seen, links);
      }
    }
    return links;
  }

  private static void collect(
      Pattern pattern,
      LinkKind kind,
      String text,
      String channel,
      Set<String> seen,
      List<ExtractedLink> links) {
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      String url = stripTrailingPunctuation(matcher.group());
      if (seen.add(url)) {
        links.add(new ExtractedLink(kind, url, channel));
      }
    }
  }

  static String stripTrailingPunctuation(String url) {
    int end = url.length();
    while (end > 0 && TRAILING_PUNCTUATION.indexOf(url.charAt(end - 1)) >= 0) {
      end--;
    }
    return url.substring(0, end);
  }
}
