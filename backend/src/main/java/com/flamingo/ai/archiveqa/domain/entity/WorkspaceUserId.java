package com.flamingo.ai.archiveqa.domain.entity;

import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Composite key of {@link WorkspaceUser}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkspaceUserId implements Serializable {

  private String workspaceId;
  private String userId;
}
