package com.splitttr.editor.api;

import com.splitttr.editor.api.dto.DocumentDto;
import com.splitttr.editor.api.dto.VersionComparisonDto;
import com.splitttr.editor.api.dto.VersionDto;
import com.splitttr.editor.service.AuthService;
import com.splitttr.editor.service.VersionService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Path("/v1")
@Produces(MediaType.APPLICATION_JSON)
public class VersionResource {

  @Inject AuthService auth;
  @Inject VersionService versions;

  @POST
  @Path("/documents/{id}/versions")
  public Response create(@PathParam("id") UUID documentId) {
    UUID userId = auth.currentUserId();
    VersionDto dto = VersionDto.of(versions.createVersion(userId, documentId));
    return Response.status(Response.Status.CREATED).entity(dto).build();
  }

  @POST
  @Path("/documents/{id}/versions/auto")
  public Map<String, Boolean> autoCreate(@PathParam("id") UUID documentId) {
    UUID userId = auth.currentUserId();
    return Map.of("created", versions.autoCreateVersion(userId, documentId));
  }

  @GET
  @Path("/documents/{id}/versions")
  public List<VersionDto> list(@PathParam("id") UUID documentId, @QueryParam("limit") Integer limit) {
    UUID userId = auth.currentUserId();
    return versions.listVersions(userId, documentId, limit).stream().map(VersionDto::of).toList();
  }

  @GET
  @Path("/documents/{id}/versions/count")
  public Map<String, Long> count(@PathParam("id") UUID documentId) {
    UUID userId = auth.currentUserId();
    return Map.of("count", versions.getVersionCount(userId, documentId));
  }

  @GET
  @Path("/versions/compare")
  public VersionComparisonDto compare(@QueryParam("first") Long first, @QueryParam("second") Long second) {
    UUID userId = auth.currentUserId();
    VersionService.VersionComparison c = versions.compareVersions(userId, first, second);
    VersionComparisonDto dto = new VersionComparisonDto();
    dto.first = VersionDto.of(c.first());
    dto.second = VersionDto.of(c.second());
    dto.titleChanged = c.titleChanged();
    dto.contentChanged = c.contentChanged();
    return dto;
  }

  @GET
  @Path("/versions/{versionId}")
  public VersionDto get(@PathParam("versionId") Long versionId) {
    UUID userId = auth.currentUserId();
    return VersionDto.of(versions.getVersion(userId, versionId));
  }

  @DELETE
  @Path("/versions/{versionId}")
  public Response delete(@PathParam("versionId") Long versionId) {
    UUID userId = auth.currentUserId();
    versions.deleteVersion(userId, versionId);
    return Response.noContent().build();
  }

  @POST
  @Path("/versions/{versionId}/restore")
  public DocumentDto restore(@PathParam("versionId") Long versionId) {
    UUID userId = auth.currentUserId();
    return DocumentDto.of(versions.restoreVersion(userId, versionId));
  }
}
