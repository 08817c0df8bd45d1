package com.splitttr.editor.service;

import com.splitttr.editor.model.Document;
import com.splitttr.editor.model.Role;
import com.splitttr.editor.service.EditorException.ForbiddenException;
import com.splitttr.editor.service.EditorException.NotFoundException;
import com.splitttr.editor.service.EditorException.UnauthorizedException;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@QuarkusTest
class AccessControlServiceTest {

  @Inject AccessControlService access;
  @Inject DocumentService documents;
  @Inject CollaboratorService collaborators;

  UUID owner;
  UUID viewer;
  UUID stranger;
  Document doc;

  @BeforeEach
  void setUp() {
    owner = UUID.randomUUID();
    viewer = UUID.randomUUID();
    stranger = UUID.randomUUID();
    doc = documents.createDocument(owner, "Plan", null, null);
    collaborators.addCollaborator(owner, doc.id, viewer, Role.VIEWER);
  }

  @Test
  void ownerResolvesToOwner() {
    AccessControlService.ResolvedAccess a = access.resolveAccess(doc, owner).orElseThrow();
    assertThat(a.role()).isEqualTo(Role.OWNER);
    assertThat(a.owner()).isTrue();
  }

  @Test
  void collaboratorResolvesToGrantRole() {
    AccessControlService.ResolvedAccess a = access.resolveAccess(doc, viewer).orElseThrow();
    assertThat(a.role()).isEqualTo(Role.VIEWER);
    assertThat(a.owner()).isFalse();
    assertThat(access.resolveAccess(doc, stranger)).isEmpty();
  }

  @Test
  void requireRoleEnforcesMinimum() {
    assertThat(access.requireRole(doc.id, viewer, Role.VIEWER).role()).isEqualTo(Role.VIEWER);
    assertThatThrownBy(() -> access.requireRole(doc.id, viewer, Role.EDITOR))
        .isInstanceOf(ForbiddenException.class)
        .hasMessage("editor role required");
    assertThatThrownBy(() -> access.requireRole(doc.id, stranger, Role.VIEWER))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void ownerRoleGrantPassesRoleChecksButNotOwnerChecks() {
    UUID grantee = UUID.randomUUID();
    collaborators.addCollaborator(owner, doc.id, grantee, Role.OWNER);

    assertThat(access.requireRole(doc.id, grantee, Role.EDITOR).owner()).isFalse();
    assertThatThrownBy(() -> access.requireRole(doc.id, grantee, Role.OWNER))
        .isInstanceOf(ForbiddenException.class)
        .hasMessage("Only the owner can do this");
    assertThat(access.requireRole(doc.id, owner, Role.OWNER).owner()).isTrue();
  }

  @Test
  void requireRoleChecksIdentityAndExistence() {
    assertThatThrownBy(() -> access.requireRole(doc.id, null, Role.VIEWER))
        .isInstanceOf(UnauthorizedException.class);
    assertThatThrownBy(() -> access.requireRole(UUID.randomUUID(), owner, Role.VIEWER))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void softDeletedDocumentIsInvisibleToEveryone() {
    documents.deleteDocument(owner, doc.id);

    assertThatThrownBy(() -> access.requireRole(doc.id, owner, Role.VIEWER))
        .isInstanceOf(NotFoundException.class);
    assertThatThrownBy(() -> access.requireRole(doc.id, viewer, Role.VIEWER))
        .isInstanceOf(NotFoundException.class);
    assertThat(collaborators.checkAccess(owner, doc.id).hasAccess()).isFalse();
  }

  @Test
  void ownerLifecyclePathsSeeDeletedDocuments() {
    documents.deleteDocument(owner, doc.id);

    assertThat(access.requireOwner(doc.id, owner).id).isEqualTo(doc.id);
    assertThatThrownBy(() -> access.requireOwner(doc.id, viewer))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void nonOwnerOfLiveDocumentIsForbidden() {
    assertThatThrownBy(() -> access.requireOwner(doc.id, viewer))
        .isInstanceOf(ForbiddenException.class);
  }
}
