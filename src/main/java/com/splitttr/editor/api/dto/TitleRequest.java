package com.splitttr.editor.api.dto;

public class TitleRequest {
  public String title;
}
