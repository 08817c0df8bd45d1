package com.splitttr.editor.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;

// Ephemeral liveness row: one per (document, user), refreshed by heartbeats.
@Entity
@Table(name = "user_presence")
public class Presence extends PanacheEntityBase {
  @EmbeddedId
  public PresenceId id;

  @Column(name = "user_name", nullable = false)
  public String userName;

  @Column(name = "user_color", nullable = false)
  public String userColor;

  @Column(name = "cursor_position")
  public Integer cursorPosition;

  @Column(name = "selection_from")
  public Integer selectionFrom;

  @Column(name = "selection_to")
  public Integer selectionTo;

  @Column(name = "last_seen", nullable = false)
  public Instant lastSeen;
}
