package com.splitttr.editor.api;

import com.splitttr.editor.api.dto.MeResponse;
import com.splitttr.editor.api.dto.SetUsernameRequest;
import com.splitttr.editor.service.AuthService;
import com.splitttr.editor.service.EditorException.ValidationException;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;

@Path("/v1")
@Produces(MediaType.APPLICATION_JSON)
public class MeResource {

  @Inject AuthService auth;

  @GET
  @Path("/me")
  public MeResponse me() {
    return MeResponse.of(auth.me());
  }

  @PUT
  @Path("/me/username")
  @Consumes(MediaType.APPLICATION_JSON)
  public MeResponse setUsername(SetUsernameRequest req) {
    if (req == null) throw new ValidationException("body required");
    return MeResponse.of(auth.setUsername(req.username));
  }
}
