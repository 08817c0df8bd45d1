package com.splitttr.editor.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

@Embeddable
public class CollaboratorId implements Serializable {
  @Column(name = "document_id", nullable = false)
  public UUID documentId;

  @Column(name = "user_id", nullable = false)
  public UUID userId;

  public CollaboratorId() {}

  public CollaboratorId(UUID documentId, UUID userId) {
    this.documentId = documentId;
    this.userId = userId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CollaboratorId that)) return false;
    return Objects.equals(documentId, that.documentId) && Objects.equals(userId, that.userId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(documentId, userId);
  }
}
