package com.flamingo.ai.archiveqa.service.rag.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Kind of project link found in archive messages. */
public enum LinkKind {
  GITHUB,
  DOCUMENTATION;

  @JsonValue
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
