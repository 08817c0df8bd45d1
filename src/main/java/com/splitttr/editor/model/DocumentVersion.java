package com.splitttr.editor.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of a document's title and content.
 *
 * <p>The generated id increases with every insert, so {@code (createdAt, id)} orders
 * snapshots even when two share a timestamp.
 */
@Entity
@Table(name = "document_version", indexes = {
    @Index(name = "idx_version_document", columnList = "document_id, created_at")
})
public class DocumentVersion extends PanacheEntityBase {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id")
  public Long id;

  @Column(name = "document_id", nullable = false, updatable = false)
  public UUID documentId;

  @Column(name = "title", nullable = false, updatable = false)
  public String title;

  @Column(name = "content", nullable = false, updatable = false, columnDefinition = "text")
  public String content;

  @Column(name = "created_at", nullable = false, updatable = false)
  public Instant createdAt;

  @Column(name = "created_by", nullable = false, updatable = false)
  public UUID createdBy;
}
