package com.flamingo.ai.archiveqa.domain.repository;

import com.flamingo.ai.archiveqa.domain.entity.Channel;
import com.flamingo.ai.archiveqa.domain.entity.ChannelId;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for the channel directory. */
@Repository
public interface ChannelRepository extends JpaRepository<Channel, ChannelId> {

  Optional<Channel> findByWorkspaceIdAndChannelId(String workspaceId, String channelId);
}
