package com.splitttr.editor.service;

import com.splitttr.editor.model.Document;
import com.splitttr.editor.model.Folder;
import com.splitttr.editor.model.Role;
import com.splitttr.editor.repo.CollaboratorRepository;
import com.splitttr.editor.repo.DocumentRepository;
import com.splitttr.editor.repo.FolderRepository;
import com.splitttr.editor.repo.PresenceRepository;
import com.splitttr.editor.repo.VersionRepository;
import com.splitttr.editor.service.EditorException.ForbiddenException;
import com.splitttr.editor.service.EditorException.NotFoundException;
import com.splitttr.editor.service.EditorException.UnauthorizedException;
import com.splitttr.editor.service.EditorException.ValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

// Document records: lifecycle, placement and access-filtered reads.
@ApplicationScoped
public class DocumentService {

  private static final Logger log = Logger.getLogger(DocumentService.class);

  public static final String EMPTY_CONTENT = "{\"type\":\"doc\",\"content\":[]}";

  private static final DateTimeFormatter DEFAULT_TITLE_FORMAT =
      DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US);

  @Inject DocumentRepository documents;
  @Inject FolderRepository folders;
  @Inject CollaboratorRepository collaborators;
  @Inject VersionRepository versions;
  @Inject PresenceRepository presence;
  @Inject AccessControlService access;

  @ConfigProperty(name = "editor.search.limit", defaultValue = "20")
  int searchLimit;

  @Transactional
  public Document createDocument(UUID userId, String title, String content, UUID parentFolderId) {
    requireIdentity(userId);
    if (parentFolderId != null) requireOwnedFolder(userId, parentFolderId);

    Instant now = Instant.now();

    Document doc = new Document();
    doc.id = UUID.randomUUID();
    doc.ownerUserId = userId;
    doc.parentFolderId = parentFolderId;
    doc.title = (title == null || title.isBlank()) ? defaultTitle(userId, now) : title.trim();
    doc.content = content == null ? EMPTY_CONTENT : content;
    doc.deleted = false;
    doc.createdAt = now;
    doc.updatedAt = now;

    documents.persist(doc);
    return doc;
  }

  @Transactional
  public Optional<Document> getDocument(UUID userId, UUID documentId) {
    if (userId == null || documentId == null) return Optional.empty();
    Document doc = documents.findById(documentId);
    return access.resolveAccess(doc, userId).map(a -> doc);
  }

  @Transactional
  public List<Document> listDocuments(UUID userId, UUID folderId, boolean includeDeleted) {
    requireIdentity(userId);

    Map<UUID, Document> merged = new LinkedHashMap<>();
    for (Document d : documents.listOwned(userId)) {
      if (d.deleted && !includeDeleted) continue;
      merged.put(d.id, d);
    }
    // Soft-deleted documents stay invisible to collaborators even with includeDeleted.
    for (Document d : documents.listShared(userId)) {
      if (d.deleted) continue;
      merged.putIfAbsent(d.id, d);
    }

    List<Document> out = new ArrayList<>();
    for (Document d : merged.values()) {
      if (folderId == null || folderId.equals(d.parentFolderId)) out.add(d);
    }
    out.sort(Comparator.comparing((Document d) -> d.updatedAt).reversed());
    return out;
  }

  @Transactional
  public List<Document> searchDocuments(UUID userId, String query) {
    requireIdentity(userId);
    if (query == null || query.isBlank()) return List.of();
    return documents.searchVisible(userId, query.trim(), searchLimit);
  }

  @Transactional
  public List<Document> getRecentDocuments(UUID userId, Integer limit) {
    requireIdentity(userId);
    int l = limit == null ? 10 : Math.min(Math.max(limit, 1), 100);
    return documents.listRecent(userId, l);
  }

  @Transactional
  public List<Document> getDeletedDocuments(UUID userId) {
    requireIdentity(userId);
    return documents.listOwned(userId, true);
  }

  @Transactional
  public Document updateDocument(UUID userId, UUID documentId, DocumentPatch patch) {
    Document doc = access.requireRole(documentId, userId, Role.EDITOR).document();
    if (patch == null || patch.isEmpty()) return doc;

    if (patch.title() != null) {
      if (patch.title().isBlank()) throw new ValidationException("Title must not be blank");
      doc.title = patch.title().trim();
    }
    if (patch.content() != null) {
      doc.content = patch.content();
    }
    if (patch.folder() != null) {
      UUID target = patch.folder().folderId();
      if (target != null) requireOwnedFolder(userId, target);
      doc.parentFolderId = target;
    }
    doc.updatedAt = Instant.now();
    return doc;
  }

  @Transactional
  public Document renameDocument(UUID userId, UUID documentId, String title) {
    if (title == null || title.isBlank()) throw new ValidationException("Title must not be blank");
    return updateDocument(userId, documentId, DocumentPatch.title(title));
  }

  @Transactional
  public Document moveDocument(UUID userId, UUID documentId, UUID targetFolderId) {
    return updateDocument(userId, documentId, DocumentPatch.moveTo(targetFolderId));
  }

  @Transactional
  public Document duplicateDocument(UUID userId, UUID documentId) {
    Document source = access.requireRole(documentId, userId, Role.OWNER).document();
    Instant now = Instant.now();

    Document copy = new Document();
    copy.id = UUID.randomUUID();
    copy.ownerUserId = userId;
    copy.parentFolderId = source.parentFolderId;
    copy.title = source.title + " (Copy)";
    copy.content = source.content;
    copy.deleted = false;
    copy.createdAt = now;
    copy.updatedAt = now;

    documents.persist(copy);
    return copy;
  }

  // Soft delete. Deleting an already deleted document is a no-op for its owner.
  @Transactional
  public void deleteDocument(UUID userId, UUID documentId) {
    Document doc = access.requireOwner(documentId, userId);
    if (doc.deleted) return;

    doc.deleted = true;
    doc.updatedAt = Instant.now();
  }

  @Transactional
  public void restoreDocument(UUID userId, UUID documentId) {
    Document doc = access.requireOwner(documentId, userId);
    if (!doc.deleted) return;

    doc.deleted = false;
    doc.updatedAt = Instant.now();
  }

  @Transactional
  public void permanentlyDeleteDocument(UUID userId, UUID documentId) {
    Document doc = access.requireOwner(documentId, userId);
    purge(doc);
    log.infof("Document %s permanently deleted by %s", doc.id, userId);
  }

  @Transactional
  public int emptyTrash(UUID userId) {
    requireIdentity(userId);
    List<Document> trash = documents.listOwned(userId, true);
    for (Document doc : trash) {
      purge(doc);
    }
    if (!trash.isEmpty()) log.infof("Emptied trash of %s: %d document(s)", userId, trash.size());
    return trash.size();
  }

  private void purge(Document doc) {
    long v = versions.deleteForDocument(doc.id);
    long c = collaborators.deleteForDocument(doc.id);
    long p = presence.deleteForDocument(doc.id);
    documents.delete(doc);
    log.debugf("Purged document %s (%d versions, %d grants, %d presence rows)", doc.id, v, c, p);
  }

  private Folder requireOwnedFolder(UUID userId, UUID folderId) {
    Folder folder = folders.findById(folderId);
    if (folder == null) throw new NotFoundException("Folder not found");
    if (!Objects.equals(folder.ownerUserId, userId)) throw new ForbiddenException("You don't own this folder");
    return folder;
  }

  private String defaultTitle(UUID userId, Instant now) {
    LocalDate today = now.atZone(ZoneOffset.UTC).toLocalDate();
    Instant startOfDay = today.atStartOfDay(ZoneOffset.UTC).toInstant();
    long count = documents.countCreatedSince(userId, startOfDay) + 1;

    String base = DEFAULT_TITLE_FORMAT.format(today);
    return count == 1 ? base : base + " (" + count + ")";
  }

  private static void requireIdentity(UUID userId) {
    if (userId == null) throw new UnauthorizedException("User not authenticated");
  }
}
