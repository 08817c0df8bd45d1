package com.splitttr.editor.api.dto;

import com.splitttr.editor.model.Role;

import java.util.UUID;

// Either userId or username identifies the target.
public class CollaboratorRequest {
  public UUID userId;
  public String username;
  public Role role;
}
