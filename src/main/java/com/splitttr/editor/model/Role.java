package com.splitttr.editor.model;

// Access level on a document, ordered VIEWER < EDITOR < OWNER.
public enum Role {
  VIEWER,
  EDITOR,
  OWNER;

  public boolean atLeast(Role required) {
    return compareTo(required) >= 0;
  }

  public boolean canWrite() {
    return atLeast(EDITOR);
  }
}
