package com.flamingo.ai.archiveqa.api.dto.response;

import com.flamingo.ai.archiveqa.service.rag.model.ExtractedLink;
import com.flamingo.ai.archiveqa.service.rag.model.SourceCitation;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an answered question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerResponse {

  private String answer;
  @Builder.Default private List<SourceCitation> sources = List.of();
  private int confidence;
  private String confidenceExplanation;
  @Builder.Default private List<ExtractedLink> projectLinks = List.of();

  /** Number of archive messages the answer was generated from. */
  private int contextUsed;

  /** Chat model name, {@code mock} for the fallback generator, {@code none} without results. */
  private String model;
}
