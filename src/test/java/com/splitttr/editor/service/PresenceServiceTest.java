package com.splitttr.editor.service;

import com.splitttr.editor.TestFixtures;
import com.splitttr.editor.model.Document;
import com.splitttr.editor.model.Presence;
import com.splitttr.editor.model.Role;
import com.splitttr.editor.service.EditorException.ForbiddenException;
import com.splitttr.editor.service.EditorException.UnauthorizedException;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@QuarkusTest
class PresenceServiceTest {

  @Inject PresenceService presence;
  @Inject DocumentService documents;
  @Inject CollaboratorService collaborators;
  @Inject TestFixtures fixtures;

  UUID alice;
  UUID bob;
  Document doc;

  @BeforeEach
  void setUp() {
    alice = UUID.randomUUID();
    bob = UUID.randomUUID();
    doc = documents.createDocument(alice, "Live", null, null);
    collaborators.addCollaborator(alice, doc.id, bob, Role.VIEWER);
  }

  @Test
  void activeUsersExcludeTheCaller() {
    presence.updatePresence(alice, "alice", doc.id, 3, null);
    presence.updatePresence(bob, "bob", doc.id, 7, new PresenceService.Selection(1, 4));

    List<Presence> seenByAlice = presence.getActiveUsers(alice, doc.id);
    assertThat(seenByAlice).hasSize(1);
    Presence p = seenByAlice.get(0);
    assertThat(p.userName).isEqualTo("bob");
    assertThat(p.cursorPosition).isEqualTo(7);
    assertThat(p.selectionFrom).isEqualTo(1);
    assertThat(p.selectionTo).isEqualTo(4);
    assertThat(p.userColor).isEqualTo(PresenceService.colorFor(bob));

    assertThat(presence.getActiveUserCount(alice, doc.id)).isEqualTo(2);
  }

  @Test
  void strangersCannotJoin() {
    assertThatThrownBy(() -> presence.updatePresence(UUID.randomUUID(), "x", doc.id, null, null))
        .isInstanceOf(ForbiddenException.class);
    assertThatThrownBy(() -> presence.heartbeat(null, doc.id))
        .isInstanceOf(UnauthorizedException.class);
  }

  @Test
  void firstWriteStoresACompleteRow() {
    Presence created = presence.updatePresence(bob, null, doc.id, 5, null);
    assertThat(created.lastSeen).isNotNull();

    Presence stored = presence.getActiveUsers(alice, doc.id).get(0);
    assertThat(stored.userName).isEqualTo("Anonymous");
    assertThat(stored.userColor).isEqualTo(PresenceService.colorFor(bob));
    assertThat(stored.cursorPosition).isEqualTo(5);
    assertThat(stored.lastSeen).isNotNull();
  }

  @Test
  void blankNameBecomesAnonymous() {
    assertThat(presence.updatePresence(bob, " ", doc.id, null, null).userName).isEqualTo("Anonymous");
  }

  @Test
  void staleRowsAreHiddenUntilHeartbeat() {
    presence.updatePresence(bob, "bob", doc.id, null, null);
    fixtures.agePresence(doc.id, bob, Duration.ofSeconds(40));

    assertThat(presence.getActiveUsers(alice, doc.id)).isEmpty();

    presence.heartbeat(bob, doc.id);
    assertThat(presence.getActiveUsers(alice, doc.id)).hasSize(1);
  }

  @Test
  void cursorAndSelectionUpdates() {
    presence.updatePresence(bob, "bob", doc.id, 1, null);

    presence.updateCursorPosition(bob, doc.id, 42);
    presence.updateSelection(bob, doc.id, new PresenceService.Selection(5, 9));

    Presence p = presence.getActiveUsers(alice, doc.id).get(0);
    assertThat(p.cursorPosition).isEqualTo(42);
    assertThat(p.selectionFrom).isEqualTo(5);
    assertThat(p.selectionTo).isEqualTo(9);
  }

  @Test
  void sweepDeletesRowsOlderThanTwiceTheThreshold() {
    presence.updatePresence(alice, "alice", doc.id, null, null);
    presence.updatePresence(bob, "bob", doc.id, null, null);
    fixtures.agePresence(doc.id, bob, Duration.ofSeconds(61));

    assertThat(presence.cleanupStalePresence()).isGreaterThanOrEqualTo(1);

    presence.heartbeat(bob, doc.id);
    assertThat(presence.getActiveUsers(alice, doc.id)).isEmpty();
    assertThat(presence.getActiveUserCount(alice, doc.id)).isEqualTo(1);
  }

  @Test
  void scheduledSweepRemovesStaleRows() {
    presence.updatePresence(bob, "bob", doc.id, null, null);
    fixtures.agePresence(doc.id, bob, Duration.ofSeconds(61));

    presence.sweepStalePresence();
    presence.heartbeat(bob, doc.id);

    assertThat(presence.getActiveUserCount(alice, doc.id)).isZero();
  }

  @Test
  void leavingRemovesPresence() {
    presence.updatePresence(bob, "bob", doc.id, null, null);
    presence.removePresence(bob, doc.id);

    assertThat(presence.getActiveUsers(alice, doc.id)).isEmpty();
  }

  @Test
  void colorIsStablePerUser() {
    UUID someone = UUID.randomUUID();
    assertThat(PresenceService.colorFor(someone)).isEqualTo(PresenceService.colorFor(someone)).startsWith("#");
  }
}
