package com.splitttr.editor.api;

import com.splitttr.editor.api.dto.*;
import com.splitttr.editor.model.Collaborator;
import com.splitttr.editor.service.AuthService;
import com.splitttr.editor.service.CollaboratorService;
import com.splitttr.editor.service.EditorException.ValidationException;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;
import java.util.UUID;

@Path("/v1")
@Produces(MediaType.APPLICATION_JSON)
public class CollaboratorResource {

  @Inject AuthService auth;
  @Inject CollaboratorService collaborators;

  @GET
  @Path("/documents/{id}/collaborators")
  public List<CollaboratorDto> list(@PathParam("id") UUID documentId) {
    UUID userId = auth.currentUserId();
    return collaborators.listCollaborators(userId, documentId).stream().map(CollaboratorDto::of).toList();
  }

  @POST
  @Path("/documents/{id}/collaborators")
  @Consumes(MediaType.APPLICATION_JSON)
  public Response add(@PathParam("id") UUID documentId, CollaboratorRequest req) {
    UUID userId = auth.currentUserId();
    if (req == null) throw new ValidationException("body required");

    Collaborator c = req.userId != null
        ? collaborators.addCollaborator(userId, documentId, req.userId, req.role)
        : collaborators.addCollaboratorByUsername(userId, documentId, req.username, req.role);
    return Response.status(Response.Status.CREATED).entity(CollaboratorDto.of(c)).build();
  }

  @PUT
  @Path("/documents/{id}/collaborators/{userId}")
  @Consumes(MediaType.APPLICATION_JSON)
  public CollaboratorDto updateRole(@PathParam("id") UUID documentId,
                                    @PathParam("userId") UUID targetUserId,
                                    RoleRequest req) {
    UUID userId = auth.currentUserId();
    return CollaboratorDto.of(
        collaborators.updateCollaboratorRole(userId, documentId, targetUserId, req == null ? null : req.role));
  }

  @DELETE
  @Path("/documents/{id}/collaborators/{userId}")
  public Response remove(@PathParam("id") UUID documentId, @PathParam("userId") UUID targetUserId) {
    UUID userId = auth.currentUserId();
    collaborators.removeCollaborator(userId, documentId, targetUserId);
    return Response.noContent().build();
  }

  @GET
  @Path("/documents/{id}/access")
  public AccessResponse access(@PathParam("id") UUID documentId) {
    UUID userId = auth.currentUserId();
    CollaboratorService.AccessCheck check = collaborators.checkAccess(userId, documentId);
    AccessResponse r = new AccessResponse();
    r.hasAccess = check.hasAccess();
    r.role = check.role();
    r.owner = check.owner();
    return r;
  }

  @POST
  @Path("/documents/{id}/transfer")
  @Consumes(MediaType.APPLICATION_JSON)
  public Response transfer(@PathParam("id") UUID documentId, TransferRequest req) {
    UUID userId = auth.currentUserId();
    collaborators.transferOwnership(userId, documentId, req == null ? null : req.newOwnerId);
    return Response.noContent().build();
  }

  @POST
  @Path("/documents/{id}/leave")
  public Response leave(@PathParam("id") UUID documentId) {
    UUID userId = auth.currentUserId();
    collaborators.leaveDocument(userId, documentId);
    return Response.noContent().build();
  }

  @GET
  @Path("/shared")
  public List<DocumentDto> shared() {
    UUID userId = auth.currentUserId();
    return collaborators.listSharedDocuments(userId).stream()
        .map(s -> DocumentDto.summary(s.document()))
        .toList();
  }
}
