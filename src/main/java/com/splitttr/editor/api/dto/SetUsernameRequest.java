package com.splitttr.editor.api.dto;

public class SetUsernameRequest {
  public String username;
}
