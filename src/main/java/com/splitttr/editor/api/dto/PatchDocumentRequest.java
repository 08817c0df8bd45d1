package com.splitttr.editor.api.dto;

import java.util.UUID;

// Absent fields are left unchanged. Set moveFolder to apply parentFolderId, null meaning root.
public class PatchDocumentRequest {
  public String title;
  public String content;
  public boolean moveFolder;
  public UUID parentFolderId;
}
