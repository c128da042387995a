package com.flamingo.ai.archiveqa.service.rag.generation;

import java.util.Objects;
import java.util.Optional;

/** Whether a completion model is configured, and if so which one. */
public final class CompletionCapability {

  private static final CompletionCapability ABSENT = new CompletionCapability(null);

  private final CompletionClient client;

  private CompletionCapability(CompletionClient client) {
    this.client = client;
  }

  public static CompletionCapability available(CompletionClient client) {
    return new CompletionCapability(Objects.requireNonNull(client, "client"));
  }

  public static CompletionCapability absent() {
    return ABSENT;
  }

  public Optional<CompletionClient> client() {
    return Optional.ofNullable(client);
  }

  public boolean isAvailable() {
    return client != null;
  }
}
