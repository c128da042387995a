package com.flamingo.ai.archiveqa.service.directory;

import com.flamingo.ai.archiveqa.domain.entity.WorkspaceUser;
import com.flamingo.ai.archiveqa.domain.repository.WorkspaceUserRepository;
import com.flamingo.ai.archiveqa.service.rag.model.WorkspaceScope;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Resolves user ids to human-readable names within one workspace. */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserDirectoryService {

  private final WorkspaceUserRepository userRepository;

  /**
   * Resolves a batch of user ids in a single query. The name is the first non-blank of display
   * name, real name and user name. Unknown ids are absent from the result.
   */
  @Transactional(readOnly = true)
  public Map<String, String> resolve(WorkspaceScope scope, Set<String> userIds) {
    if (userIds.isEmpty()) {
      return Map.of();
    }
    Map<String, String> names = new HashMap<>();
    for (WorkspaceUser user :
        userRepository.findByWorkspaceIdAndUserIdIn(scope.workspaceId(), userIds)) {
      String name = preferredName(user);
      if (name != null) {
        names.put(user.getUserId(), name);
      }
    }
    log.debug("Resolved {}/{} user ids in {}", names.size(), userIds.size(), scope.workspaceId());
    return names;
  }

  private static String preferredName(WorkspaceUser user) {
    if (hasText(user.getDisplayName())) {
      return user.getDisplayName();
    }
    if (hasText(user.getRealName())) {
      return user.getRealName();
    }
    return hasText(user.getUserName()) ? user.getUserName() : null;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
