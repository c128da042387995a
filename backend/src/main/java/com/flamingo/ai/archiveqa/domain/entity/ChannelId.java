package com.flamingo.ai.archiveqa.domain.entity;

import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Composite key of {@link Channel}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChannelId implements Serializable {

  private String workspaceId;
  private String channelId;
}
