package com.splitttr.editor.repo;

import com.splitttr.editor.model.Collaborator;
import com.splitttr.editor.model.CollaboratorId;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class CollaboratorRepository implements PanacheRepositoryBase<Collaborator, CollaboratorId> {

  public Collaborator findGrant(UUID documentId, UUID userId) {
    return findById(new CollaboratorId(documentId, userId));
  }

  public List<Collaborator> listForDocument(UUID documentId) {
    return list("id.documentId = ?1 order by addedAt asc", documentId);
  }

  public List<Collaborator> listForUser(UUID userId) {
    return list("id.userId = ?1 order by addedAt desc", userId);
  }

  public long deleteForDocument(UUID documentId) {
    return delete("id.documentId", documentId);
  }
}
