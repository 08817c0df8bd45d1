package com.splitttr.editor.service;

import com.splitttr.editor.model.Collaborator;
import com.splitttr.editor.model.Document;
import com.splitttr.editor.model.Role;
import com.splitttr.editor.repo.CollaboratorRepository;
import com.splitttr.editor.repo.DocumentRepository;
import com.splitttr.editor.service.EditorException.ForbiddenException;
import com.splitttr.editor.service.EditorException.NotFoundException;
import com.splitttr.editor.service.EditorException.UnauthorizedException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
public class AccessControlService {

  @Inject DocumentRepository documents;
  @Inject CollaboratorRepository collaborators;

  public record ResolvedAccess(Role role, boolean owner) {}

  public record DocumentAccess(Document document, Role role, boolean owner) {}

  /**
   * Ownership model:
   * - The owner always resolves to OWNER.
   * - Anyone else resolves to the role of their single grant, or has no access.
   * - A soft-deleted document resolves to no access for everybody.
   */
  @Transactional
  public Optional<ResolvedAccess> resolveAccess(Document document, UUID userId) {
    if (document == null || userId == null || document.deleted) return Optional.empty();

    if (document.isOwnedBy(userId)) return Optional.of(new ResolvedAccess(Role.OWNER, true));

    Collaborator grant = collaborators.findGrant(document.id, userId);
    if (grant == null) return Optional.empty();
    return Optional.of(new ResolvedAccess(grant.role, false));
  }

  @Transactional
  public DocumentAccess requireRole(UUID documentId, UUID userId, Role minRole) {
    if (userId == null) throw new UnauthorizedException("User not authenticated");

    Document doc = documentId == null ? null : documents.findById(documentId);
    if (doc == null || doc.deleted) throw new NotFoundException("Document not found");

    ResolvedAccess access = resolveAccess(doc, userId)
        .orElseThrow(() -> new ForbiddenException("You don't have access to this document"));
    if (!access.role().atLeast(minRole)) {
      throw new ForbiddenException(minRole.name().toLowerCase() + " role required");
    }
    // OWNER means the owning identity; a grant carrying the OWNER role does not qualify.
    if (minRole == Role.OWNER && !access.owner()) {
      throw new ForbiddenException("Only the owner can do this");
    }
    return new DocumentAccess(doc, access.role(), access.owner());
  }

  // Owner-only lifecycle paths (restore, purge) must see soft-deleted documents too.
  @Transactional
  public Document requireOwner(UUID documentId, UUID userId) {
    if (userId == null) throw new UnauthorizedException("User not authenticated");

    Document doc = documentId == null ? null : documents.findById(documentId);
    if (doc == null) throw new NotFoundException("Document not found");
    if (!doc.isOwnedBy(userId)) {
      if (doc.deleted) throw new NotFoundException("Document not found");
      throw new ForbiddenException("Only the owner can do this");
    }
    return doc;
  }
}
