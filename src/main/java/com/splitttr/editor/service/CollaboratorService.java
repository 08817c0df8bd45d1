package com.splitttr.editor.service;

import com.splitttr.editor.model.AppUser;
import com.splitttr.editor.model.Collaborator;
import com.splitttr.editor.model.CollaboratorId;
import com.splitttr.editor.model.Document;
import com.splitttr.editor.model.Role;
import com.splitttr.editor.repo.AppUserRepository;
import com.splitttr.editor.repo.CollaboratorRepository;
import com.splitttr.editor.repo.DocumentRepository;
import com.splitttr.editor.repo.PresenceRepository;
import com.splitttr.editor.service.EditorException.ConflictException;
import com.splitttr.editor.service.EditorException.NotFoundException;
import com.splitttr.editor.service.EditorException.UnauthorizedException;
import com.splitttr.editor.service.EditorException.ValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

// Collaborator grants and ownership transfer.
@ApplicationScoped
public class CollaboratorService {

  private static final Logger log = Logger.getLogger(CollaboratorService.class);

  @Inject CollaboratorRepository collaborators;
  @Inject DocumentRepository documents;
  @Inject AppUserRepository users;
  @Inject PresenceRepository presence;
  @Inject AccessControlService access;

  public record AccessCheck(boolean hasAccess, Role role, boolean owner) {
    static AccessCheck none() {
      return new AccessCheck(false, null, false);
    }
  }

  public record SharedDocument(Document document, Role role) {}

  @Transactional
  public Collaborator addCollaborator(UUID userId, UUID documentId, UUID targetUserId, Role role) {
    Document doc = access.requireRole(documentId, userId, Role.OWNER).document();
    if (targetUserId == null) throw new ValidationException("userId required");
    if (role == null) role = Role.VIEWER;

    if (doc.isOwnedBy(targetUserId)) {
      throw new ValidationException("Cannot add the owner as a collaborator");
    }
    if (collaborators.findGrant(documentId, targetUserId) != null) {
      throw new ConflictException("User is already a collaborator");
    }

    Collaborator c = new Collaborator();
    c.id = new CollaboratorId(documentId, targetUserId);
    c.role = role;
    c.addedAt = Instant.now();
    collaborators.persist(c);
    return c;
  }

  @Transactional
  public Collaborator addCollaboratorByUsername(UUID userId, UUID documentId, String username, Role role) {
    access.requireRole(documentId, userId, Role.OWNER);

    String normalized = username == null ? "" : username.trim().toLowerCase();
    if (normalized.isEmpty()) throw new ValidationException("Username is required");

    AppUser target = users.findByUsername(normalized);
    if (target == null) throw new NotFoundException("User not found");

    return addCollaborator(userId, documentId, target.id, role);
  }

  @Transactional
  public void removeCollaborator(UUID userId, UUID documentId, UUID targetUserId) {
    access.requireRole(documentId, userId, Role.OWNER);

    Collaborator c = collaborators.findGrant(documentId, targetUserId);
    if (c == null) throw new NotFoundException("Collaborator not found");

    collaborators.delete(c);
    presence.deleteFor(documentId, targetUserId);
  }

  @Transactional
  public Collaborator updateCollaboratorRole(UUID userId, UUID documentId, UUID targetUserId, Role newRole) {
    access.requireRole(documentId, userId, Role.OWNER);
    if (newRole == null) throw new ValidationException("role required");

    Collaborator c = collaborators.findGrant(documentId, targetUserId);
    if (c == null) throw new NotFoundException("Collaborator not found");

    c.role = newRole;
    return c;
  }

  @Transactional
  public List<Collaborator> listCollaborators(UUID userId, UUID documentId) {
    access.requireRole(documentId, userId, Role.VIEWER);
    return collaborators.listForDocument(documentId);
  }

  @Transactional
  public AccessCheck checkAccess(UUID userId, UUID documentId) {
    if (userId == null || documentId == null) return AccessCheck.none();
    return access.resolveAccess(documents.findById(documentId), userId)
        .map(a -> new AccessCheck(true, a.role(), a.owner()))
        .orElseGet(AccessCheck::none);
  }

  @Transactional
  public List<SharedDocument> listSharedDocuments(UUID userId) {
    if (userId == null) throw new UnauthorizedException("User not authenticated");

    List<SharedDocument> out = new ArrayList<>();
    for (Collaborator c : collaborators.listForUser(userId)) {
      Document doc = documents.findById(c.id.documentId);
      if (doc == null || doc.deleted) continue;
      out.add(new SharedDocument(doc, c.role));
    }
    return out;
  }

  @Transactional
  public void leaveDocument(UUID userId, UUID documentId) {
    if (userId == null) throw new UnauthorizedException("User not authenticated");

    Collaborator c = collaborators.findGrant(documentId, userId);
    if (c == null) throw new NotFoundException("You are not a collaborator on this document");

    collaborators.delete(c);
    presence.deleteFor(documentId, userId);
  }

  /**
   * Hands the document to {@code newOwnerId}. The previous owner keeps EDITOR access
   * through a grant, and any grant the new owner held is dropped.
   */
  @Transactional
  public void transferOwnership(UUID userId, UUID documentId, UUID newOwnerId) {
    Document doc = access.requireRole(documentId, userId, Role.OWNER).document();
    if (newOwnerId == null) throw new ValidationException("newOwnerId required");
    if (newOwnerId.equals(userId)) throw new ValidationException("You are already the owner");

    Collaborator existing = collaborators.findGrant(documentId, newOwnerId);
    if (existing != null) {
      collaborators.delete(existing);
      collaborators.flush();
    }

    Collaborator previousOwner = new Collaborator();
    previousOwner.id = new CollaboratorId(documentId, userId);
    previousOwner.role = Role.EDITOR;
    previousOwner.addedAt = Instant.now();
    collaborators.persist(previousOwner);

    doc.ownerUserId = newOwnerId;
    doc.updatedAt = Instant.now();
    log.infof("Ownership of document %s transferred from %s to %s", documentId, userId, newOwnerId);
  }
}
