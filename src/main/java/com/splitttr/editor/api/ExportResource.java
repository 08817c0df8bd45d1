package com.splitttr.editor.api;

import com.splitttr.editor.api.dto.ExportResponse;
import com.splitttr.editor.export.ExportFormat;
import com.splitttr.editor.service.AuthService;
import com.splitttr.editor.service.ExportService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

@Path("/v1")
public class ExportResource {

  @Inject AuthService auth;
  @Inject ExportService exports;

  @GET
  @Path("/documents/{id}/export/{format}")
  @Produces(MediaType.APPLICATION_JSON)
  public ExportResponse export(@PathParam("id") UUID documentId,
                               @PathParam("format") String format,
                               @QueryParam("includeStyles") @DefaultValue("true") boolean includeStyles) {
    UUID userId = auth.currentUserId();
    ExportService.ExportResult result = exports.export(userId, documentId, ExportFormat.parse(format), includeStyles);

    ExportResponse r = new ExportResponse();
    r.title = result.title();
    r.content = result.content();
    r.format = result.format().id();
    r.extension = result.format().extension();
    r.mimeType = result.format().mimeType();
    return r;
  }

  @GET
  @Path("/documents/{id}/export/{format}/download")
  public Response download(@PathParam("id") UUID documentId,
                           @PathParam("format") String format,
                           @QueryParam("includeStyles") @DefaultValue("true") boolean includeStyles) {
    UUID userId = auth.currentUserId();
    ExportService.ExportResult result = exports.export(userId, documentId, ExportFormat.parse(format), includeStyles);

    return Response.ok(result.content().getBytes(StandardCharsets.UTF_8))
        .type(result.format().mimeType() + "; charset=UTF-8")
        .header("Content-Disposition", "attachment; filename=\"" + result.fileName() + "\"")
        .build();
  }
}
