package com.flamingo.ai.archiveqa.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Channel directory entry. */
@Entity
@Table(name = "channels")
@IdClass(ChannelId.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Channel {

  @Id
  @Column(name = "workspace_id")
  private String workspaceId;

  @Id
  @Column(name = "channel_id")
  private String channelId;

  @Column(name = "channel_name")
  private String channelName;
}
