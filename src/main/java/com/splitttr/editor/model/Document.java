package com.splitttr.editor.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "document", indexes = {
    @Index(name = "idx_document_owner", columnList = "owner_user_id, is_deleted"),
    @Index(name = "idx_document_folder", columnList = "parent_folder_id")
})
public class Document extends PanacheEntityBase {
  @Id
  @Column(name = "id")
  public UUID id;

  @Column(name = "owner_user_id", nullable = false)
  public UUID ownerUserId;

  @Column(name = "parent_folder_id")
  public UUID parentFolderId;

  @Column(name = "title", nullable = false)
  public String title;

  // Serialized content tree (JSON). Only the export package looks inside.
  @Column(name = "content", nullable = false, columnDefinition = "text")
  public String content;

  @Column(name = "is_deleted", nullable = false)
  public boolean deleted;

  @Column(name = "created_at", nullable = false)
  public Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  public Instant updatedAt;

  public boolean isOwnedBy(UUID userId) {
    return userId != null && userId.equals(ownerUserId);
  }
}
