package com.flamingo.ai.archiveqa.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the answering pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Retrieval retrieval = new Retrieval();
  private Generation generation = new Generation();
  private Evidence evidence = new Evidence();
  private Sources sources = new Sources();
  private Conversation conversation = new Conversation();

  @Getter
  @Setter
  public static class Retrieval {
    /** Result count used when probing the archive for related-question suggestions. */
    private int suggestionProbeSize = 20;
  }

  @Getter
  @Setter
  public static class Generation {
    private int maxTokens = 1000;
  }

  @Getter
  @Setter
  public static class Evidence {
    /** Entries rendered under "What I found:". */
    private int maxEntries = 3;

    private int maxQuoteLength = 150;

    /** Zone used to render friendly timestamps such as "Dec 15, 2pm". */
    private String zoneId = "UTC";
  }

  @Getter
  @Setter
  public static class Sources {
    private int maxEntries = 10;
    private int maxTextLength = 200;
  }

  @Getter
  @Setter
  public static class Conversation {
    /** One turn is a user message plus the assistant reply. */
    private int maxHistoryTurns = 10;
  }
}
