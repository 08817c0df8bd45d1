package com.splitttr.editor.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Converts stored content into export representations. Stateless apart from the
 * parser; every call parses the content afresh, and malformed content fails with a
 * validation error for every format, JSON included.
 */
@Singleton
public class SerializationEngine {

  private final ContentTreeParser parser;

  @Inject
  public SerializationEngine(ObjectMapper mapper) {
    this.parser = new ContentTreeParser(mapper);
  }

  public ContentNode parse(String content) {
    return parser.parse(content);
  }

  public String toMarkdown(String content) {
    return parse(content).accept(new MarkdownEmitter());
  }

  public String toHtml(String content, boolean standalone, String title) {
    String body = parse(content).accept(new HtmlEmitter());
    return standalone ? HtmlEmitter.standalone(title, body) : body;
  }

  public String toText(String content) {
    return parse(content).accept(new PlainTextEmitter());
  }

  // Lossless interchange: the stored content is returned as-is once it parses.
  public String toJson(String content) {
    parse(content);
    return content;
  }

  public String render(ExportFormat format, String content, String title, boolean includeStyles) {
    return switch (format) {
      case MARKDOWN -> toMarkdown(content);
      case HTML -> toHtml(content, includeStyles, title);
      case TEXT -> toText(content);
      case JSON -> toJson(content);
    };
  }
}
