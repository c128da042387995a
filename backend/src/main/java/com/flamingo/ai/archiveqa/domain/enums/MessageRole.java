package com.flamingo.ai.archiveqa.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Defines the role of a conversation turn's author. */
public enum MessageRole {
  /** Question asked by the user. */
  USER,

  /** Answer produced by the assistant. */
  ASSISTANT;

  /**
   * Parses the wire form ({@code user} / {@code assistant}). Anything else, including other
   * casings, yields empty.
   */
  public static Optional<MessageRole> fromWireValue(String value) {
    if ("user".equals(value)) {
      return Optional.of(USER);
    }
    if ("assistant".equals(value)) {
      return Optional.of(ASSISTANT);
    }
    return Optional.empty();
  }

  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
