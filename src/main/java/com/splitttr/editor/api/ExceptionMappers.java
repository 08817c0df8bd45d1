package com.splitttr.editor.api;

import com.splitttr.editor.service.EditorException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

public class ExceptionMappers {

  private static final Logger log = Logger.getLogger(ExceptionMappers.class);

  public static class ErrorBody {
    public String code;
    public String message;

    public ErrorBody(String code, String message) {
      this.code = code;
      this.message = message;
    }
  }

  @Provider
  public static class EditorExceptionMapper implements ExceptionMapper<EditorException> {
    @Override
    public Response toResponse(EditorException e) {
      String msg = e.getMessage();
      if (msg == null || msg.isBlank()) msg = e.code().name().toLowerCase();
      log.debugf("%s: %s", e.code(), msg);
      return Response.status(e.code().status())
          .type(MediaType.APPLICATION_JSON)
          .entity(new ErrorBody(e.code().name(), msg))
          .build();
    }
  }
}
