package com.splitttr.editor.api.dto;

import com.splitttr.editor.model.AppUser;

import java.util.UUID;

public class MeResponse {
  public UUID userId;
  public String subject;
  public String username;
  public String displayName;

  public static MeResponse of(AppUser u) {
    MeResponse r = new MeResponse();
    r.userId = u.id;
    r.subject = u.subject;
    r.username = u.username;
    r.displayName = u.displayName;
    return r;
  }
}
