package com.splitttr.editor.api.dto;

import java.util.UUID;

public class CreateDocumentRequest {
  public String title;
  public String content;
  public UUID parentFolderId;
}
