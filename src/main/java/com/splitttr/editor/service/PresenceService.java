package com.splitttr.editor.service;

import com.splitttr.editor.model.Presence;
import com.splitttr.editor.model.PresenceId;
import com.splitttr.editor.model.Role;
import com.splitttr.editor.repo.PresenceRepository;
import com.splitttr.editor.service.EditorException.UnauthorizedException;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Best-effort liveness of viewers. Clients heartbeat roughly every 10 seconds; rows older
 * than {@code editor.presence.stale-after} are not reported and rows older than twice
 * that are swept. Nothing here takes part in document transactions.
 */
@ApplicationScoped
public class PresenceService {

  private static final Logger log = Logger.getLogger(PresenceService.class);

  private static final List<String> COLORS = List.of(
      "#EF4444", "#F97316", "#EAB308", "#22C55E", "#14B8A6",
      "#3B82F6", "#8B5CF6", "#EC4899", "#F43F5E", "#06B6D4");

  @Inject PresenceRepository presence;
  @Inject AccessControlService access;

  @ConfigProperty(name = "editor.presence.stale-after", defaultValue = "30S")
  Duration staleAfter;

  public record Selection(int from, int to) {}

  @Transactional
  public Presence updatePresence(UUID userId, String userName, UUID documentId,
                                 Integer cursorPosition, Selection selection) {
    access.requireRole(documentId, userId, Role.VIEWER);

    Presence p = presence.findPresence(documentId, userId);
    boolean fresh = p == null;
    if (fresh) {
      p = new Presence();
      p.id = new PresenceId(documentId, userId);
      p.userColor = colorFor(userId);
    }
    p.userName = (userName == null || userName.isBlank()) ? "Anonymous" : userName;
    p.cursorPosition = cursorPosition;
    p.selectionFrom = selection == null ? null : selection.from();
    p.selectionTo = selection == null ? null : selection.to();
    p.lastSeen = Instant.now();
    if (fresh) presence.persist(p);
    return p;
  }

  @Transactional
  public void heartbeat(UUID userId, UUID documentId) {
    Presence p = own(userId, documentId);
    if (p != null) p.lastSeen = Instant.now();
  }

  @Transactional
  public void updateCursorPosition(UUID userId, UUID documentId, int cursorPosition) {
    Presence p = own(userId, documentId);
    if (p == null) return;
    p.cursorPosition = cursorPosition;
    p.lastSeen = Instant.now();
  }

  @Transactional
  public void updateSelection(UUID userId, UUID documentId, Selection selection) {
    Presence p = own(userId, documentId);
    if (p == null || selection == null) return;
    p.selectionFrom = selection.from();
    p.selectionTo = selection.to();
    p.lastSeen = Instant.now();
  }

  @Transactional
  public void removePresence(UUID userId, UUID documentId) {
    requireIdentity(userId);
    presence.deleteFor(documentId, userId);
  }

  // Other users seen within the stale threshold.
  @Transactional
  public List<Presence> getActiveUsers(UUID userId, UUID documentId) {
    access.requireRole(documentId, userId, Role.VIEWER);
    Instant threshold = Instant.now().minus(staleAfter);
    return presence.listSeenAfter(documentId, threshold).stream()
        .filter(p -> !p.id.userId.equals(userId))
        .toList();
  }

  @Transactional
  public long getActiveUserCount(UUID userId, UUID documentId) {
    access.requireRole(documentId, userId, Role.VIEWER);
    return presence.countSeenAfter(documentId, Instant.now().minus(staleAfter));
  }

  @Scheduled(every = "{editor.presence.sweep-every}", concurrentExecution = SKIP)
  @Transactional
  void sweepStalePresence() {
    cleanupStalePresence();
  }

  @Transactional
  public int cleanupStalePresence() {
    Instant threshold = Instant.now().minus(staleAfter.multipliedBy(2));
    int deleted = (int) presence.deleteSeenBefore(threshold);
    if (deleted > 0) log.debugf("Swept %d stale presence row(s)", deleted);
    return deleted;
  }

  private Presence own(UUID userId, UUID documentId) {
    requireIdentity(userId);
    return presence.findPresence(documentId, userId);
  }

  static String colorFor(UUID userId) {
    return COLORS.get(Math.floorMod(userId.hashCode(), COLORS.size()));
  }

  private static void requireIdentity(UUID userId) {
    if (userId == null) throw new UnauthorizedException("User not authenticated");
  }
}
