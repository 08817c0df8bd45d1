package com.splitttr.editor.api.dto;

import com.splitttr.editor.model.Role;

public class RoleRequest {
  public Role role;
}
