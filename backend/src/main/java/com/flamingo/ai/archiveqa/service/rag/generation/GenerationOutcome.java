package com.flamingo.ai.archiveqa.service.rag.generation;

/** How a raw answer was produced. */
public enum GenerationOutcome {
  /** The completion model answered. */
  MODEL,

  /** No model is configured; the answer quotes the top message. */
  FALLBACK,

  /** The model call failed; the answer reports the error. */
  ERROR
}
