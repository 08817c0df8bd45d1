package com.splitttr.editor.api;

import com.splitttr.editor.api.dto.*;
import com.splitttr.editor.service.AuthService;
import com.splitttr.editor.service.DocumentPatch;
import com.splitttr.editor.service.DocumentService;
import com.splitttr.editor.service.EditorException.NotFoundException;
import com.splitttr.editor.service.EditorException.ValidationException;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Path("/v1")
@Produces(MediaType.APPLICATION_JSON)
public class DocumentResource {

  @Inject AuthService auth;
  @Inject DocumentService documents;

  @POST
  @Path("/documents")
  @Consumes(MediaType.APPLICATION_JSON)
  public Response create(CreateDocumentRequest req) {
    UUID userId = auth.currentUserId();
    if (req == null) req = new CreateDocumentRequest();
    DocumentDto dto = DocumentDto.of(documents.createDocument(userId, req.title, req.content, req.parentFolderId));
    return Response.status(Response.Status.CREATED).entity(dto).build();
  }

  @GET
  @Path("/documents")
  public List<DocumentDto> list(@QueryParam("folderId") UUID folderId,
                                @QueryParam("includeDeleted") @DefaultValue("false") boolean includeDeleted) {
    UUID userId = auth.currentUserId();
    return documents.listDocuments(userId, folderId, includeDeleted).stream().map(DocumentDto::summary).toList();
  }

  @GET
  @Path("/documents/search")
  public List<DocumentDto> search(@QueryParam("q") String query) {
    UUID userId = auth.currentUserId();
    return documents.searchDocuments(userId, query).stream().map(DocumentDto::summary).toList();
  }

  @GET
  @Path("/documents/recent")
  public List<DocumentDto> recent(@QueryParam("limit") Integer limit) {
    UUID userId = auth.currentUserId();
    return documents.getRecentDocuments(userId, limit).stream().map(DocumentDto::summary).toList();
  }

  @GET
  @Path("/documents/trash")
  public List<DocumentDto> trash() {
    UUID userId = auth.currentUserId();
    return documents.getDeletedDocuments(userId).stream().map(DocumentDto::summary).toList();
  }

  @DELETE
  @Path("/documents/trash")
  public Map<String, Integer> emptyTrash() {
    UUID userId = auth.currentUserId();
    return Map.of("deleted", documents.emptyTrash(userId));
  }

  @GET
  @Path("/documents/{id}")
  public DocumentDto get(@PathParam("id") UUID id) {
    UUID userId = auth.currentUserId();
    return documents.getDocument(userId, id)
        .map(DocumentDto::of)
        .orElseThrow(() -> new NotFoundException("Document not found"));
  }

  @PATCH
  @Path("/documents/{id}")
  @Consumes(MediaType.APPLICATION_JSON)
  public DocumentDto patch(@PathParam("id") UUID id, PatchDocumentRequest req) {
    UUID userId = auth.currentUserId();
    if (req == null) throw new ValidationException("body required");
    DocumentPatch patch = new DocumentPatch(req.title, req.content,
        req.moveFolder ? new DocumentPatch.FolderChange(req.parentFolderId) : null);
    return DocumentDto.of(documents.updateDocument(userId, id, patch));
  }

  @PUT
  @Path("/documents/{id}/title")
  @Consumes(MediaType.APPLICATION_JSON)
  public DocumentDto rename(@PathParam("id") UUID id, TitleRequest req) {
    UUID userId = auth.currentUserId();
    return DocumentDto.of(documents.renameDocument(userId, id, req == null ? null : req.title));
  }

  @PUT
  @Path("/documents/{id}/folder")
  @Consumes(MediaType.APPLICATION_JSON)
  public DocumentDto move(@PathParam("id") UUID id, MoveRequest req) {
    UUID userId = auth.currentUserId();
    return DocumentDto.of(documents.moveDocument(userId, id, req == null ? null : req.folderId));
  }

  @POST
  @Path("/documents/{id}/duplicate")
  public Response duplicate(@PathParam("id") UUID id) {
    UUID userId = auth.currentUserId();
    DocumentDto dto = DocumentDto.of(documents.duplicateDocument(userId, id));
    return Response.status(Response.Status.CREATED).entity(dto).build();
  }

  @DELETE
  @Path("/documents/{id}")
  public Response delete(@PathParam("id") UUID id) {
    UUID userId = auth.currentUserId();
    documents.deleteDocument(userId, id);
    return Response.noContent().build();
  }

  @POST
  @Path("/documents/{id}/restore")
  public Response restore(@PathParam("id") UUID id) {
    UUID userId = auth.currentUserId();
    documents.restoreDocument(userId, id);
    return Response.noContent().build();
  }

  @DELETE
  @Path("/documents/{id}/permanent")
  public Response purge(@PathParam("id") UUID id) {
    UUID userId = auth.currentUserId();
    documents.permanentlyDeleteDocument(userId, id);
    return Response.noContent().build();
  }
}
