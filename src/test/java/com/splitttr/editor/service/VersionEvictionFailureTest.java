package com.splitttr.editor.service;

import com.splitttr.editor.TestFixtures;
import com.splitttr.editor.model.Document;
import com.splitttr.editor.model.DocumentVersion;
import com.splitttr.editor.repo.VersionRepository;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.mockito.InjectSpy;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;

@QuarkusTest
class VersionEvictionFailureTest {

  @InjectSpy VersionRepository versionRepository;
  @Inject VersionService versions;
  @Inject DocumentService documents;
  @Inject TestFixtures fixtures;

  @Test
  void failedEvictionKeepsTheSnapshotAndCleanupTrimsLater() {
    UUID owner = UUID.randomUUID();
    Document doc = documents.createDocument(owner, "Draft", null, null);
    for (int i = 0; i < 50; i++) {
      versions.createVersion(owner, doc.id);
    }

    doAnswer(inv -> {
      QuarkusTransaction.setRollbackOnly();
      throw new PersistenceException("delete failed");
    }).when(versionRepository).delete(any(DocumentVersion.class));

    DocumentVersion latest = versions.createVersion(owner, doc.id);
    assertThat(latest.id).isNotNull();
    assertThat(versions.getVersionCount(owner, doc.id)).isEqualTo(51);

    Mockito.reset(versionRepository);
    assertThat(versions.cleanupOldVersions()).isGreaterThanOrEqualTo(1);
    assertThat(versions.getVersionCount(owner, doc.id)).isEqualTo(50);
    assertThat(versions.listVersions(owner, doc.id, 1)).extracting(v -> v.id)
        .containsExactly(latest.id);
  }

  @Test
  void autoSnapshotSurvivesFailedEviction() {
    UUID owner = UUID.randomUUID();
    Document doc = documents.createDocument(owner, "Draft", null, null);
    for (int i = 0; i < 50; i++) {
      versions.createVersion(owner, doc.id);
    }
    fixtures.ageVersions(doc.id, Duration.ofHours(1));

    doAnswer(inv -> {
      throw new PersistenceException("delete failed");
    }).when(versionRepository).delete(any(DocumentVersion.class));

    assertThat(versions.autoCreateVersion(owner, doc.id)).isTrue();
    assertThat(versions.getVersionCount(owner, doc.id)).isEqualTo(51);
  }
}
