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

/** Directory entry for a workspace member, maintained by the ingestion side. */
@Entity
@Table(name = "users")
@IdClass(WorkspaceUserId.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkspaceUser {

  @Id
  @Column(name = "workspace_id")
  private String workspaceId;

  @Id
  @Column(name = "user_id")
  private String userId;

  @Column(name = "user_name")
  private String userName;

  @Column(name = "real_name")
  private String realName;

  @Column(name = "display_name")
  private String displayName;
}
