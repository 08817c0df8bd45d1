package com.splitttr.editor.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;

// A grant of a role on one document to one user. The owner never has a grant.
@Entity
@Table(name = "document_collaborator")
public class Collaborator extends PanacheEntityBase {
  @EmbeddedId
  public CollaboratorId id;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false)
  public Role role;

  @Column(name = "added_at", nullable = false)
  public Instant addedAt;
}
