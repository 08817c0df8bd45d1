package com.splitttr.editor.repo;

import com.splitttr.editor.model.Presence;
import com.splitttr.editor.model.PresenceId;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class PresenceRepository implements PanacheRepositoryBase<Presence, PresenceId> {

  public Presence findPresence(UUID documentId, UUID userId) {
    return findById(new PresenceId(documentId, userId));
  }

  public List<Presence> listSeenAfter(UUID documentId, Instant threshold) {
    return list("id.documentId = ?1 and lastSeen > ?2 order by lastSeen desc", documentId, threshold);
  }

  public long countSeenAfter(UUID documentId, Instant threshold) {
    return count("id.documentId = ?1 and lastSeen > ?2", documentId, threshold);
  }

  public long deleteSeenBefore(Instant threshold) {
    return delete("lastSeen < ?1", threshold);
  }

  public long deleteForDocument(UUID documentId) {
    return delete("id.documentId", documentId);
  }

  public long deleteFor(UUID documentId, UUID userId) {
    return delete("id.documentId = ?1 and id.userId = ?2", documentId, userId);
  }
}
