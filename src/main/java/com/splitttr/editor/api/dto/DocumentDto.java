package com.splitttr.editor.api.dto;

import com.splitttr.editor.model.Document;

import java.time.Instant;
import java.util.UUID;

public class DocumentDto {
  public UUID id;
  public UUID ownerUserId;
  public UUID parentFolderId;
  public String title;
  public String content;
  public boolean deleted;
  public Instant createdAt;
  public Instant updatedAt;

  public static DocumentDto of(Document d) {
    DocumentDto dto = summary(d);
    dto.content = d.content;
    return dto;
  }

  // Listing shape: no content payload.
  public static DocumentDto summary(Document d) {
    DocumentDto dto = new DocumentDto();
    dto.id = d.id;
    dto.ownerUserId = d.ownerUserId;
    dto.parentFolderId = d.parentFolderId;
    dto.title = d.title;
    dto.deleted = d.deleted;
    dto.createdAt = d.createdAt;
    dto.updatedAt = d.updatedAt;
    return dto;
  }
}
