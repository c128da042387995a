package com.flamingo.ai.archiveqa.service.rag.model;

/** A retrieved archive message. Lower distance means more similar to the query. */
public record Candidate(String text, double distance, CandidateMetadata metadata) {

  public Candidate {
    text = text != null ? text : "";
    metadata = metadata != null ? metadata : CandidateMetadata.builder().build();
  }
}
