package com.splitttr.editor.service;

import com.splitttr.editor.export.ExportFormat;
import com.splitttr.editor.export.SerializationEngine;
import com.splitttr.editor.model.Document;
import com.splitttr.editor.service.EditorException.NotFoundException;
import com.splitttr.editor.service.EditorException.UnauthorizedException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import java.util.UUID;

@ApplicationScoped
public class ExportService {

  @Inject DocumentService documents;
  @Inject SerializationEngine engine;

  public record ExportResult(String title, String content, ExportFormat format) {
    public String fileName() {
      String base = title == null ? "" : title.replaceAll("[\\\\/:*?\"<>|\\r\\n]", "").trim();
      if (base.isEmpty()) base = "document";
      return base + format.extension();
    }
  }

  public ExportResult exportToMarkdown(UUID userId, UUID documentId) {
    return export(userId, documentId, ExportFormat.MARKDOWN, false);
  }

  public ExportResult exportToHTML(UUID userId, UUID documentId) {
    return exportToHTML(userId, documentId, true);
  }

  public ExportResult exportToHTML(UUID userId, UUID documentId, boolean includeStyles) {
    return export(userId, documentId, ExportFormat.HTML, includeStyles);
  }

  public ExportResult exportToText(UUID userId, UUID documentId) {
    return export(userId, documentId, ExportFormat.TEXT, false);
  }

  public ExportResult exportToJSON(UUID userId, UUID documentId) {
    return export(userId, documentId, ExportFormat.JSON, false);
  }

  @Transactional
  public ExportResult export(UUID userId, UUID documentId, ExportFormat format, boolean includeStyles) {
    if (userId == null) throw new UnauthorizedException("User not authenticated");
    Document doc = documents.getDocument(userId, documentId)
        .orElseThrow(() -> new NotFoundException("Document not found"));
    String payload = engine.render(format, doc.content, doc.title, includeStyles);
    return new ExportResult(doc.title, payload, format);
  }
}
