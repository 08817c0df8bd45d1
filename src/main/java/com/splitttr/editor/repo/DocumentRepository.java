package com.splitttr.editor.repo;

import com.splitttr.editor.model.Document;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class DocumentRepository implements PanacheRepositoryBase<Document, UUID> {

  public List<Document> listOwned(UUID ownerUserId) {
    return list("ownerUserId", Sort.descending("updatedAt"), ownerUserId);
  }

  public List<Document> listOwned(UUID ownerUserId, boolean deleted) {
    return list("ownerUserId = ?1 and deleted = ?2", Sort.descending("updatedAt"), ownerUserId, deleted);
  }

  public List<Document> listRecent(UUID ownerUserId, int limit) {
    return find("ownerUserId = ?1 and deleted = false", Sort.descending("updatedAt"), ownerUserId)
        .page(0, Math.max(1, limit))
        .list();
  }

  // Documents shared with the user through a collaborator grant.
  public List<Document> listShared(UUID userId) {
    return list("id in (select c.id.documentId from Collaborator c where c.id.userId = ?1) "
        + "order by updatedAt desc", userId);
  }

  public long countCreatedSince(UUID ownerUserId, Instant since) {
    return count("ownerUserId = ?1 and createdAt >= ?2", ownerUserId, since);
  }

  // Matches the term literally: LIKE wildcards in it are escaped with '!'.
  public List<Document> searchVisible(UUID userId, String q, int limit) {
    String term = q.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    return find("deleted = false and lower(title) like lower(?2) escape '!' and (ownerUserId = ?1 or id in "
            + "(select c.id.documentId from Collaborator c where c.id.userId = ?1)) "
            + "order by updatedAt desc",
        userId, "%" + term + "%")
        .page(0, Math.max(1, limit))
        .list();
  }
}
