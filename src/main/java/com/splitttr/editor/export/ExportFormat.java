package com.splitttr.editor.export;

import com.splitttr.editor.service.EditorException.ValidationException;

import java.util.Locale;

public enum ExportFormat {
  MARKDOWN("markdown", "md", "text/markdown"),
  HTML("html", "html", "text/html"),
  TEXT("text", "txt", "text/plain"),
  JSON("json", "json", "application/json");

  private final String id;
  private final String extension;
  private final String mimeType;

  ExportFormat(String id, String extension, String mimeType) {
    this.id = id;
    this.extension = extension;
    this.mimeType = mimeType;
  }

  public String id() {
    return id;
  }

  public String extension() {
    return "." + extension;
  }

  public String mimeType() {
    return mimeType;
  }

  // Accepts the format id or its file extension, case-insensitively.
  public static ExportFormat parse(String value) {
    if (value != null) {
      String v = value.trim().toLowerCase(Locale.ROOT);
      for (ExportFormat f : values()) {
        if (f.id.equals(v) || f.extension.equals(v)) return f;
      }
    }
    throw new ValidationException("Unsupported export format: " + value);
  }
}
