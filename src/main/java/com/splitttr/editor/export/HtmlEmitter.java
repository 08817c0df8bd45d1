package com.splitttr.editor.export;

import com.splitttr.editor.export.ContentNode.*;

import java.util.List;
import java.util.stream.Collectors;

// HTML fragment rendering. Every text run and attribute value goes through escape().
public class HtmlEmitter implements NodeVisitor<String> {

  private static final String STYLES = """
      body { font-family: system-ui, -apple-system, sans-serif; line-height: 1.6; max-width: 800px; margin: 0 auto; padding: 20px; }
      h1, h2, h3, h4, h5, h6 { margin-top: 1.5em; margin-bottom: 0.5em; }
      p { margin: 1em 0; }
      ul, ol { padding-left: 2em; }
      ul.task-list { list-style: none; padding-left: 1em; }
      blockquote { border-left: 3px solid #ccc; margin-left: 0; padding-left: 1em; color: #666; }
      code { background: #f4f4f4; padding: 2px 6px; border-radius: 3px; }
      pre { background: #f4f4f4; padding: 1em; border-radius: 5px; overflow-x: auto; }
      pre code { background: none; padding: 0; }
      a { color: #0066cc; }
      hr { border: none; border-top: 1px solid #ccc; margin: 2em 0; }
      """;

  private final PlainTextEmitter raw = new PlainTextEmitter();

  // Wraps a rendered fragment into a minimal standalone page.
  public static String standalone(String title, String body) {
    return "<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n"
        + "<title>" + escape(title == null ? "" : title) + "</title>\n"
        + "<style>\n" + STYLES + "</style>\n</head>\n<body>\n"
        + body
        + "\n</body>\n</html>\n";
  }

  public static String escape(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '&' -> sb.append("&amp;");
        case '<' -> sb.append("&lt;");
        case '>' -> sb.append("&gt;");
        case '"' -> sb.append("&quot;");
        case '\'' -> sb.append("&#039;");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }

  @Override
  public String visitDoc(Doc node) {
    return inner(node.children());
  }

  @Override
  public String visitParagraph(Paragraph node) {
    return "<p>" + inner(node.children()) + "</p>";
  }

  @Override
  public String visitHeading(Heading node) {
    int level = node.level();
    return "<h" + level + ">" + inner(node.children()) + "</h" + level + ">";
  }

  @Override
  public String visitBulletList(BulletList node) {
    return "<ul>" + inner(node.children()) + "</ul>";
  }

  @Override
  public String visitOrderedList(OrderedList node) {
    return "<ol>" + inner(node.children()) + "</ol>";
  }

  @Override
  public String visitListItem(ListItem node) {
    return "<li>" + inner(node.children()) + "</li>";
  }

  @Override
  public String visitTaskList(TaskList node) {
    return "<ul class=\"task-list\">" + inner(node.children()) + "</ul>";
  }

  @Override
  public String visitTaskItem(TaskItem node) {
    String box = node.checked()
        ? "<input type=\"checkbox\" checked disabled>"
        : "<input type=\"checkbox\" disabled>";
    return "<li>" + box + " " + inner(node.children()) + "</li>";
  }

  @Override
  public String visitCodeBlock(CodeBlock node) {
    String code = node.children().stream().map(c -> c.accept(raw)).collect(Collectors.joining());
    String open = node.language().isEmpty()
        ? "<code>"
        : "<code class=\"language-" + escape(node.language()) + "\">";
    return "<pre>" + open + escape(code) + "</code></pre>";
  }

  @Override
  public String visitBlockquote(Blockquote node) {
    return "<blockquote>" + inner(node.children()) + "</blockquote>";
  }

  @Override
  public String visitHorizontalRule(HorizontalRule node) {
    return "<hr>";
  }

  @Override
  public String visitHardBreak(HardBreak node) {
    return "<br>";
  }

  @Override
  public String visitText(Text node) {
    String text = escape(node.text());
    for (Mark mark : node.marks()) {
      text = switch (mark.type()) {
        case BOLD -> "<strong>" + text + "</strong>";
        case ITALIC -> "<em>" + text + "</em>";
        case STRIKE -> "<s>" + text + "</s>";
        case CODE -> "<code>" + text + "</code>";
        case UNDERLINE -> "<u>" + text + "</u>";
        case LINK -> "<a href=\"" + escape(mark.href() == null ? "" : mark.href()) + "\">" + text + "</a>";
        case OTHER -> text;
      };
    }
    return text;
  }

  @Override
  public String visitUnknown(Unknown node) {
    return inner(node.children());
  }

  private String inner(List<ContentNode> nodes) {
    return nodes.stream().map(n -> n.accept(this)).collect(Collectors.joining());
  }
}
