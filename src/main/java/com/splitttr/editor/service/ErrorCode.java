package com.splitttr.editor.service;

public enum ErrorCode {
  UNAUTHORIZED(401),
  NOT_FOUND(404),
  FORBIDDEN(403),
  VALIDATION_ERROR(400),
  CONFLICT(409);

  private final int status;

  ErrorCode(int status) {
    this.status = status;
  }

  public int status() {
    return status;
  }
}
