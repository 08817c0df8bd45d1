package com.splitttr.editor.api.dto;

public class ExportResponse {
  public String title;
  public String content;
  public String format;
  public String extension;
  public String mimeType;
}
