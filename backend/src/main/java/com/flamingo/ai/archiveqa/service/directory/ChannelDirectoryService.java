package com.flamingo.ai.archiveqa.service.directory;

import com.flamingo.ai.archiveqa.domain.entity.Channel;
import com.flamingo.ai.archiveqa.domain.repository.ChannelRepository;
import com.flamingo.ai.archiveqa.service.rag.model.WorkspaceScope;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Looks up channel names by id. */
@Service
@RequiredArgsConstructor
public class ChannelDirectoryService {

  private final ChannelRepository channelRepository;

  @Transactional(readOnly = true)
  public Optional<String> channelName(WorkspaceScope scope, String channelId) {
    return channelRepository
        .findByWorkspaceIdAndChannelId(scope.workspaceId(), channelId)
        .map(Channel::getChannelName)
        .filter(name -> !name.isBlank());
  }
}
