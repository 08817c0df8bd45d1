package com.splitttr.editor.api.dto;

import java.util.UUID;

public class MoveRequest {
  public UUID folderId;
}
