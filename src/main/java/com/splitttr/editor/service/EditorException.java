package com.splitttr.editor.service;

/**
 * Failure surfaced to the caller as a code and message pair. Nothing in the service
 * layer retries on these.
 */
public abstract class EditorException extends RuntimeException {

  private final ErrorCode code;

  protected EditorException(ErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  protected EditorException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public ErrorCode code() {
    return code;
  }

  public static class UnauthorizedException extends EditorException {
    public UnauthorizedException(String msg) { super(ErrorCode.UNAUTHORIZED, msg); }
  }

  public static class NotFoundException extends EditorException {
    public NotFoundException(String msg) { super(ErrorCode.NOT_FOUND, msg); }
  }

  public static class ForbiddenException extends EditorException {
    public ForbiddenException(String msg) { super(ErrorCode.FORBIDDEN, msg); }
  }

  public static class ValidationException extends EditorException {
    public ValidationException(String msg) { super(ErrorCode.VALIDATION_ERROR, msg); }
    public ValidationException(String msg, Throwable cause) { super(ErrorCode.VALIDATION_ERROR, msg, cause); }
  }

  public static class ConflictException extends EditorException {
    public ConflictException(String msg) { super(ErrorCode.CONFLICT, msg); }
  }
}
