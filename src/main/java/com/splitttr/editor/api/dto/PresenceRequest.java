package com.splitttr.editor.api.dto;

public class PresenceRequest {
  public Integer cursorPosition;
  public Integer selectionFrom;
  public Integer selectionTo;
}
