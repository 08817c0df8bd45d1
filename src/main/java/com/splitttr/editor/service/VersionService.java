package com.splitttr.editor.service;

import com.splitttr.editor.model.Document;
import com.splitttr.editor.model.DocumentVersion;
import com.splitttr.editor.model.Role;
import com.splitttr.editor.repo.DocumentRepository;
import com.splitttr.editor.repo.VersionRepository;
import com.splitttr.editor.service.EditorException.ForbiddenException;
import com.splitttr.editor.service.EditorException.NotFoundException;
import com.splitttr.editor.service.EditorException.ValidationException;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Bounded, append-only snapshot history per document.
 *
 * <p>At most {@code editor.versions.max} snapshots are kept per document; the oldest
 * by {@code (createdAt, id)} are evicted first. Automatic snapshots are gated by
 * {@code editor.versions.min-interval}.
 */
@ApplicationScoped
public class VersionService {

  private static final Logger log = Logger.getLogger(VersionService.class);

  @Inject VersionRepository versions;
  @Inject DocumentRepository documents;
  @Inject AccessControlService access;

  @ConfigProperty(name = "editor.versions.max", defaultValue = "50")
  int maxVersions;

  @ConfigProperty(name = "editor.versions.min-interval", defaultValue = "5M")
  Duration minInterval;

  @ConfigProperty(name = "editor.versions.default-list-limit", defaultValue = "20")
  int defaultListLimit;

  public record VersionComparison(DocumentVersion first, DocumentVersion second,
                                  boolean titleChanged, boolean contentChanged) {}

  @Transactional
  public DocumentVersion createVersion(UUID userId, UUID documentId) {
    Document doc = access.requireRole(documentId, userId, Role.VIEWER).document();
    makeRoom(documentId);
    return snapshot(doc, userId, Instant.now());
  }

  /**
   * Snapshots only when the latest version is older than the minimum interval.
   * The document row is locked for the check and the insert, so concurrent callers
   * in the same window serialize and only the first one snapshots.
   */
  @Transactional
  public boolean autoCreateVersion(UUID userId, UUID documentId) {
    access.requireRole(documentId, userId, Role.VIEWER);
    Document doc = documents.findById(documentId, LockModeType.PESSIMISTIC_WRITE);

    Instant now = Instant.now();
    DocumentVersion latest = versions.findLatest(documentId);
    if (latest != null && Duration.between(latest.createdAt, now).compareTo(minInterval) < 0) {
      return false;
    }

    makeRoom(documentId);
    snapshot(doc, userId, now);
    log.debugf("Auto snapshot of document %s by %s", documentId, userId);
    return true;
  }

  @Transactional
  public List<DocumentVersion> listVersions(UUID userId, UUID documentId, Integer limit) {
    access.requireRole(documentId, userId, Role.VIEWER);
    int l = limit == null ? defaultListLimit : Math.min(Math.max(limit, 1), maxVersions);
    return versions.listNewestFirst(documentId, l);
  }

  @Transactional
  public DocumentVersion getVersion(UUID userId, Long versionId) {
    DocumentVersion v = requireVersion(versionId);
    access.requireRole(v.documentId, userId, Role.VIEWER);
    return v;
  }

  /**
   * Overwrites the document with the chosen snapshot after saving the current state
   * as a new version, so a restore can itself be undone.
   */
  @Transactional
  public Document restoreVersion(UUID userId, Long versionId) {
    DocumentVersion v = requireVersion(versionId);
    AccessControlService.DocumentAccess da = access.requireRole(v.documentId, userId, Role.VIEWER);
    if (!da.role().canWrite()) {
      throw new ForbiddenException("Editor access required to restore versions");
    }

    Document doc = da.document();
    Instant now = Instant.now();
    makeRoom(doc.id);
    snapshot(doc, userId, now);

    doc.content = v.content;
    doc.title = v.title;
    doc.updatedAt = now;

    log.infof("Document %s restored to version %d by %s", doc.id, v.id, userId);
    return doc;
  }

  @Transactional
  public VersionComparison compareVersions(UUID userId, Long firstId, Long secondId) {
    DocumentVersion first = requireVersion(firstId);
    DocumentVersion second = requireVersion(secondId);
    if (!first.documentId.equals(second.documentId)) {
      throw new ValidationException("Versions belong to different documents");
    }
    access.requireRole(first.documentId, userId, Role.VIEWER);

    return new VersionComparison(first, second,
        !Objects.equals(first.title, second.title),
        !Objects.equals(first.content, second.content));
  }

  @Transactional
  public void deleteVersion(UUID userId, Long versionId) {
    DocumentVersion v = requireVersion(versionId);
    access.requireRole(v.documentId, userId, Role.OWNER);
    versions.delete(v);
  }

  @Transactional
  public long getVersionCount(UUID userId, UUID documentId) {
    access.requireRole(documentId, userId, Role.VIEWER);
    return versions.countForDocument(documentId);
  }

  @Scheduled(every = "{editor.versions.cleanup-every}", delayed = "1m", concurrentExecution = SKIP)
  void evictOverCapVersions() {
    cleanupOldVersions();
  }

  // Safety net for surplus left behind by concurrent snapshotting.
  public int cleanupOldVersions() {
    List<UUID> overCap = QuarkusTransaction.requiringNew()
        .call(() -> versions.documentsOverCap(maxVersions));
    int deleted = 0;
    for (UUID documentId : overCap) {
      deleted += evictSurplus(documentId, maxVersions);
    }
    if (deleted > 0) log.infof("Version cleanup evicted %d snapshot(s)", deleted);
    return deleted;
  }

  private DocumentVersion snapshot(Document doc, UUID userId, Instant at) {
    DocumentVersion v = new DocumentVersion();
    v.documentId = doc.id;
    v.title = doc.title;
    v.content = doc.content;
    v.createdAt = at;
    v.createdBy = userId;
    versions.persist(v);
    return v;
  }

  // Leaves room for one more snapshot under the cap.
  private void makeRoom(UUID documentId) {
    evictSurplus(documentId, maxVersions - 1);
  }

  /**
   * Deletes the oldest snapshots beyond {@code keep} in a transaction of its own. A failure
   * only rolls back the eviction; the caller's transaction and the snapshot it writes survive,
   * and the scheduled cleanup trims the overshoot later.
   */
  private int evictSurplus(UUID documentId, int keep) {
    try {
      return QuarkusTransaction.requiringNew().call(() -> {
        List<DocumentVersion> all = versions.listOldestFirst(documentId);
        int surplus = all.size() - Math.max(keep, 0);
        for (int i = 0; i < surplus; i++) {
          versions.delete(all.get(i));
        }
        return Math.max(surplus, 0);
      });
    } catch (RuntimeException e) {
      log.warnf(e, "Evicting old versions of document %s failed", documentId);
      return 0;
    }
  }

  private DocumentVersion requireVersion(Long versionId) {
    DocumentVersion v = versionId == null ? null : versions.findById(versionId);
    if (v == null) throw new NotFoundException("Version not found");
    return v;
  }
}
