package com.splitttr.editor.api.dto;

import com.splitttr.editor.model.Collaborator;
import com.splitttr.editor.model.Role;

import java.time.Instant;
import java.util.UUID;

public class CollaboratorDto {
  public UUID documentId;
  public UUID userId;
  public Role role;
  public Instant addedAt;

  public static CollaboratorDto of(Collaborator c) {
    CollaboratorDto dto = new CollaboratorDto();
    dto.documentId = c.id.documentId;
    dto.userId = c.id.userId;
    dto.role = c.role;
    dto.addedAt = c.addedAt;
    return dto;
  }
}
