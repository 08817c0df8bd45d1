package com.splitttr.editor.api.dto;

import com.splitttr.editor.model.Presence;

import java.time.Instant;
import java.util.UUID;

public class PresenceDto {
  public UUID userId;
  public String userName;
  public String userColor;
  public Integer cursorPosition;
  public Integer selectionFrom;
  public Integer selectionTo;
  public Instant lastSeen;

  public static PresenceDto of(Presence p) {
    PresenceDto dto = new PresenceDto();
    dto.userId = p.id.userId;
    dto.userName = p.userName;
    dto.userColor = p.userColor;
    dto.cursorPosition = p.cursorPosition;
    dto.selectionFrom = p.selectionFrom;
    dto.selectionTo = p.selectionTo;
    dto.lastSeen = p.lastSeen;
    return dto;
  }
}
