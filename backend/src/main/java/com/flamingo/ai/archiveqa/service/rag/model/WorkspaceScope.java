package com.flamingo.ai.archiveqa.service.rag.model;

import com.flamingo.ai.archiveqa.exception.MissingWorkspaceScopeException;

/**
 * Tenant scope of a single pipeline call. Every lookup, search and conversation read is bound to
 * exactly one workspace.
 */
public record WorkspaceScope(String workspaceId) {

  public WorkspaceScope {
    if (workspaceId == null || workspaceId.isBlank()) {
      throw new MissingWorkspaceScopeException();
    }
  }

  public static WorkspaceScope of(String workspaceId) {
    return new WorkspaceScope(workspaceId);
  }
}
