package com.splitttr.editor.api;

import com.splitttr.editor.api.dto.PresenceDto;
import com.splitttr.editor.api.dto.PresenceRequest;
import com.splitttr.editor.model.AppUser;
import com.splitttr.editor.service.AuthService;
import com.splitttr.editor.service.PresenceService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Path("/v1")
@Produces(MediaType.APPLICATION_JSON)
public class PresenceResource {

  @Inject AuthService auth;
  @Inject PresenceService presence;

  @PUT
  @Path("/documents/{id}/presence")
  @Consumes(MediaType.APPLICATION_JSON)
  public PresenceDto update(@PathParam("id") UUID documentId, PresenceRequest req) {
    AppUser me = auth.upsertCurrentUser();
    String name = me.username != null ? me.username : me.displayName;

    PresenceService.Selection selection = null;
    Integer cursor = null;
    if (req != null) {
      cursor = req.cursorPosition;
      if (req.selectionFrom != null && req.selectionTo != null) {
        selection = new PresenceService.Selection(req.selectionFrom, req.selectionTo);
      }
    }
    return PresenceDto.of(presence.updatePresence(me.id, name, documentId, cursor, selection));
  }

  @POST
  @Path("/documents/{id}/presence/heartbeat")
  public Response heartbeat(@PathParam("id") UUID documentId) {
    presence.heartbeat(auth.currentUserId(), documentId);
    return Response.noContent().build();
  }

  @DELETE
  @Path("/documents/{id}/presence")
  public Response leave(@PathParam("id") UUID documentId) {
    presence.removePresence(auth.currentUserId(), documentId);
    return Response.noContent().build();
  }

  @GET
  @Path("/documents/{id}/presence")
  public List<PresenceDto> active(@PathParam("id") UUID documentId) {
    return presence.getActiveUsers(auth.currentUserId(), documentId).stream().map(PresenceDto::of).toList();
  }

  @GET
  @Path("/documents/{id}/presence/count")
  public Map<String, Long> count(@PathParam("id") UUID documentId) {
    return Map.of("count", presence.getActiveUserCount(auth.currentUserId(), documentId));
  }
}
