package com.splitttr.editor.api.dto;

import com.splitttr.editor.model.DocumentVersion;

import java.time.Instant;
import java.util.UUID;

public class VersionDto {
  public Long id;
  public UUID documentId;
  public String title;
  public String content;
  public Instant createdAt;
  public UUID createdBy;

  public static VersionDto of(DocumentVersion v) {
    VersionDto dto = new VersionDto();
    dto.id = v.id;
    dto.documentId = v.documentId;
    dto.title = v.title;
    dto.content = v.content;
    dto.createdAt = v.createdAt;
    dto.createdBy = v.createdBy;
    return dto;
  }
}
