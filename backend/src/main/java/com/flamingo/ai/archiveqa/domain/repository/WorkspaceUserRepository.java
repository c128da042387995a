package com.flamingo.ai.archiveqa.domain.repository;

import com.flamingo.ai.archiveqa.domain.entity.WorkspaceUser;
import com.flamingo.ai.archiveqa.domain.entity.WorkspaceUserId;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for the workspace user directory. */
@Repository
public interface WorkspaceUserRepository extends JpaRepository<WorkspaceUser, WorkspaceUserId> {

  /** Batch lookup of several users of one workspace. */
  List<WorkspaceUser> findByWorkspaceIdAndUserIdIn(String workspaceId, Collection<String> userIds);
}
