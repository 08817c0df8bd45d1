package com.splitttr.editor.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "folder")
public class Folder extends PanacheEntityBase {
  @Id
  @Column(name = "id")
  public UUID id;

  @Column(name = "owner_user_id", nullable = false)
  public UUID ownerUserId;

  @Column(name = "parent_id")
  public UUID parentId;

  @Column(name = "name", nullable = false)
  public String name;

  @Column(name = "created_at", nullable = false)
  public Instant createdAt;
}
