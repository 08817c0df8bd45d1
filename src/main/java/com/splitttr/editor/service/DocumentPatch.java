package com.splitttr.editor.service;

import java.util.UUID;

/**
 * Fields an update may change. A null component leaves that field untouched;
 * {@link FolderChange} with a null folder id moves the document to the root.
 */
public record DocumentPatch(String title, String content, FolderChange folder) {

  public record FolderChange(UUID folderId) {}

  public static DocumentPatch title(String title) {
    return new DocumentPatch(title, null, null);
  }

  public static DocumentPatch content(String content) {
    return new DocumentPatch(null, content, null);
  }

  public static DocumentPatch moveTo(UUID folderId) {
    return new DocumentPatch(null, null, new FolderChange(folderId));
  }

  public boolean isEmpty() {
    return title == null && content == null && folder == null;
  }
}
