package com.splitttr.editor.api.dto;

public class VersionComparisonDto {
  public VersionDto first;
  public VersionDto second;
  public boolean titleChanged;
  public boolean contentChanged;
}
