package com.splitttr.editor.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.splitttr.editor.export.ContentNode.*;
import com.splitttr.editor.service.EditorException.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the stored JSON content string into a {@link ContentNode} tree.
 *
 * <p>Shape rules: every node is an object, {@code content} is an array of nodes,
 * {@code marks} is an array of objects and {@code text} is a string. Anything else is
 * rejected with a {@link ValidationException}. A node without a {@code type} is kept
 * as an unknown node.
 */
public class ContentTreeParser {

  private final ObjectMapper mapper;

  public ContentTreeParser(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public ContentNode parse(String json) {
    if (json == null || json.isBlank()) throw new ValidationException("Content is empty");

    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Content is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new ValidationException("Content root must be an object");
    }
    return node(root);
  }

  private ContentNode node(JsonNode json) {
    if (!json.isObject()) throw new ValidationException("Content node must be an object");

    String type = json.path("type").isTextual() ? json.get("type").asText() : null;
    JsonNode attrs = json.path("attrs");

    if ("text".equals(type)) {
      return new Text(text(json), marks(json.get("marks")));
    }

    List<ContentNode> children = children(json.get("content"));
    if (type == null) return new Unknown(null, children);

    return switch (type) {
      case "doc" -> new Doc(children);
      case "paragraph" -> new Paragraph(children);
      case "heading" -> new Heading(level(attrs), children);
      case "bulletList" -> new BulletList(children);
      case "orderedList" -> new OrderedList(children);
      case "listItem" -> new ListItem(children);
      case "taskList" -> new TaskList(children);
      case "taskItem" -> new TaskItem(attrs.path("checked").asBoolean(false), children);
      case "codeBlock" -> new CodeBlock(attrs.path("language").isTextual() ? attrs.get("language").asText() : "", children);
      case "blockquote" -> new Blockquote(children);
      case "horizontalRule" -> new HorizontalRule();
      case "hardBreak" -> new HardBreak();
      default -> new Unknown(type, children);
    };
  }

  private List<ContentNode> children(JsonNode content) {
    if (content == null || content.isNull()) return List.of();
    if (!content.isArray()) throw new ValidationException("Node content must be an array");

    List<ContentNode> out = new ArrayList<>(content.size());
    for (JsonNode child : content) {
      out.add(node(child));
    }
    return List.copyOf(out);
  }

  private static String text(JsonNode json) {
    JsonNode t = json.get("text");
    if (t == null || t.isNull()) return "";
    if (!t.isTextual()) throw new ValidationException("Text node text must be a string");
    return t.asText();
  }

  private static List<Mark> marks(JsonNode marks) {
    if (marks == null || marks.isNull()) return List.of();
    if (!marks.isArray()) throw new ValidationException("Text marks must be an array");

    List<Mark> out = new ArrayList<>(marks.size());
    for (JsonNode m : marks) {
      if (!m.isObject()) throw new ValidationException("Mark must be an object");
      Mark.Type type = Mark.Type.fromName(m.path("type").asText(null));
      String href = type == Mark.Type.LINK ? m.path("attrs").path("href").asText("") : null;
      out.add(new Mark(type, href));
    }
    return List.copyOf(out);
  }

  private static int level(JsonNode attrs) {
    int level = attrs.path("level").asInt(1);
    return Math.min(Math.max(level, 1), 6);
  }
}
