package com.splitttr.editor.api.dto;

import com.splitttr.editor.model.Role;

public class AccessResponse {
  public boolean hasAccess;
  public Role role;
  public boolean owner;
}
