package com.splitttr.editor.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "app_user")
public class AppUser extends PanacheEntityBase {
  @Id
  @Column(name = "id")
  public UUID id;

  @Column(name = "subject", nullable = false, unique = true)
  public String subject;

  @Column(name = "username", unique = true)
  public String username;

  @Column(name = "display_name")
  public String displayName;

  @Column(name = "created_at", nullable = false)
  public Instant createdAt;
}
