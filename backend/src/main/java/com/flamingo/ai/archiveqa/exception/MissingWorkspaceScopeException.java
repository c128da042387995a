package com.flamingo.ai.archiveqa.exception;

/**
 * Raised when a pipeline call arrives without a workspace id. This is a configuration error on the
 * caller's side and is never defaulted.
 */
public class MissingWorkspaceScopeException extends RuntimeException {

  public MissingWorkspaceScopeException() {
    super(
        "workspaceId is required for question answering; "
            + "every call must be scoped to a single workspace");
  }
}
