package com.splitttr.editor.service;

import com.splitttr.editor.export.ExportFormat;
import com.splitttr.editor.model.Document;
import com.splitttr.editor.model.Role;
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
class ExportServiceTest {

  private static final String CONTENT =
      "{\"type\":\"doc\",\"content\":[{\"type\":\"heading\",\"attrs\":{\"level\":1},\"content\":"
          + "[{\"type\":\"text\",\"text\":\"Notes\"}]},{\"type\":\"paragraph\",\"content\":"
          + "[{\"type\":\"text\",\"text\":\"hi\",\"marks\":[{\"type\":\"bold\"}]}]}]}";

  @Inject ExportService exports;
  @Inject DocumentService documents;
  @Inject CollaboratorService collaborators;

  UUID owner;
  Document doc;

  @BeforeEach
  void setUp() {
    owner = UUID.randomUUID();
    doc = documents.createDocument(owner, "Meeting notes", CONTENT, null);
  }

  @Test
  void markdown() {
    ExportService.ExportResult r = exports.exportToMarkdown(owner, doc.id);

    assertThat(r.title()).isEqualTo("Meeting notes");
    assertThat(r.content()).isEqualTo("# Notes\n\n**hi**");
    assertThat(r.format()).isEqualTo(ExportFormat.MARKDOWN);
    assertThat(r.fileName()).isEqualTo("Meeting notes.md");
  }

  @Test
  void anonymousCallerIsUnauthorized() {
    assertThatThrownBy(() -> exports.exportToMarkdown(null, doc.id))
        .isInstanceOf(UnauthorizedException.class);
    assertThatThrownBy(() -> exports.export(null, UUID.randomUUID(), ExportFormat.TEXT, false))
        .isInstanceOf(UnauthorizedException.class);
  }

  @Test
  void htmlIsStandaloneByDefault() {
    assertThat(exports.exportToHTML(owner, doc.id).content())
        .startsWith("<!DOCTYPE html>")
        .contains("<title>Meeting notes</title>");
    assertThat(exports.exportToHTML(owner, doc.id, false).content())
        .isEqualTo("<h1>Notes</h1><p><strong>hi</strong></p>");
  }

  @Test
  void textAndJson() {
    assertThat(exports.exportToText(owner, doc.id).content()).isEqualTo("Notes\n\nhi");
    assertThat(exports.exportToJSON(owner, doc.id).content()).isEqualTo(CONTENT);
  }

  @Test
  void viewerCanExportButStrangerCannot() {
    UUID viewer = UUID.randomUUID();
    collaborators.addCollaborator(owner, doc.id, viewer, Role.VIEWER);

    assertThat(exports.exportToText(viewer, doc.id).content()).isEqualTo("Notes\n\nhi");
    assertThatThrownBy(() -> exports.exportToMarkdown(UUID.randomUUID(), doc.id))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void deletedDocumentIsNotExported() {
    documents.deleteDocument(owner, doc.id);

    assertThatThrownBy(() -> exports.exportToJSON(owner, doc.id))
        .isInstanceOf(NotFoundException.class);
  }
}
