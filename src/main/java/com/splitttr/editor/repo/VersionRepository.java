package com.splitttr.editor.repo;

import com.splitttr.editor.model.DocumentVersion;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class VersionRepository implements PanacheRepositoryBase<DocumentVersion, Long> {

  private static final Sort OLDEST_FIRST = Sort.ascending("createdAt", "id");
  private static final Sort NEWEST_FIRST = Sort.descending("createdAt", "id");

  public List<DocumentVersion> listOldestFirst(UUID documentId) {
    return list("documentId", OLDEST_FIRST, documentId);
  }

  public List<DocumentVersion> listNewestFirst(UUID documentId, int limit) {
    return find("documentId", NEWEST_FIRST, documentId)
        .page(0, Math.max(1, limit))
        .list();
  }

  public DocumentVersion findLatest(UUID documentId) {
    return find("documentId", NEWEST_FIRST, documentId).firstResult();
  }

  public long countForDocument(UUID documentId) {
    return count("documentId", documentId);
  }

  // Document ids holding more than the given number of versions.
  public List<UUID> documentsOverCap(int cap) {
    return getEntityManager()
        .createQuery("select v.documentId from DocumentVersion v group by v.documentId "
            + "having count(v) > :cap", UUID.class)
        .setParameter("cap", (long) cap)
        .getResultList();
  }

  public long deleteForDocument(UUID documentId) {
    return delete("documentId", documentId);
  }
}
