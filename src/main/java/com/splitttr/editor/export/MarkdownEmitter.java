package com.splitttr.editor.export;

import com.splitttr.editor.export.ContentNode.*;

import java.util.Arrays;
import java.util.List;
import java.util.function.IntFunction;
import java.util.stream.Collectors;

/**
 * Markdown rendering. Not thread-safe: tracks list nesting while it walks, so use one
 * instance per render.
 */
public class MarkdownEmitter implements NodeVisitor<String> {

  private static final String INDENT = "  ";

  private final PlainTextEmitter raw = new PlainTextEmitter();
  private int depth;

  @Override
  public String visitDoc(Doc node) {
    return join(node.children(), "\n\n");
  }

  @Override
  public String visitParagraph(Paragraph node) {
    return join(node.children(), "");
  }

  @Override
  public String visitHeading(Heading node) {
    return "#".repeat(node.level()) + " " + join(node.children(), "");
  }

  @Override
  public String visitBulletList(BulletList node) {
    return list(node.children(), i -> "- ");
  }

  // Numbered by position; the source numbering is ignored.
  @Override
  public String visitOrderedList(OrderedList node) {
    return list(node.children(), i -> (i + 1) + ". ");
  }

  @Override
  public String visitTaskList(TaskList node) {
    return list(node.children(), i -> "- ");
  }

  @Override
  public String visitListItem(ListItem node) {
    return item("- ", node.children());
  }

  @Override
  public String visitTaskItem(TaskItem node) {
    return item("- " + checkbox(node), node.children());
  }

  @Override
  public String visitCodeBlock(CodeBlock node) {
    String code = node.children().stream().map(c -> c.accept(raw)).collect(Collectors.joining());
    return "```" + node.language() + "\n" + code + "\n```";
  }

  @Override
  public String visitBlockquote(Blockquote node) {
    String inner = join(node.children(), "\n\n");
    return Arrays.stream(inner.split("\n", -1))
        .map(line -> "> " + line)
        .collect(Collectors.joining("\n"));
  }

  @Override
  public String visitHorizontalRule(HorizontalRule node) {
    return "---";
  }

  @Override
  public String visitHardBreak(HardBreak node) {
    return "\n";
  }

  // Marks wrap innermost-first in the order they appear.
  @Override
  public String visitText(Text node) {
    String text = node.text();
    for (Mark mark : node.marks()) {
      text = switch (mark.type()) {
        case BOLD -> "**" + text + "**";
        case ITALIC -> "*" + text + "*";
        case STRIKE -> "~~" + text + "~~";
        case CODE -> "`" + text + "`";
        case LINK -> "[" + text + "](" + (mark.href() == null ? "" : mark.href()) + ")";
        case UNDERLINE, OTHER -> text;
      };
    }
    return text;
  }

  @Override
  public String visitUnknown(Unknown node) {
    return join(node.children(), "");
  }

  private String list(List<ContentNode> items, IntFunction<String> marker) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < items.size(); i++) {
      if (i > 0) sb.append('\n');
      ContentNode child = items.get(i);
      if (child instanceof ListItem li) {
        sb.append(item(marker.apply(i), li.children()));
      } else if (child instanceof TaskItem ti) {
        sb.append(item(marker.apply(i) + checkbox(ti), ti.children()));
      } else {
        sb.append(child.accept(this));
      }
    }
    return sb.toString();
  }

  private String item(String marker, List<ContentNode> children) {
    String indent = INDENT.repeat(depth);
    StringBuilder sb = new StringBuilder(indent).append(marker);
    boolean first = true;
    for (ContentNode child : children) {
      if (isList(child)) {
        depth++;
        try {
          sb.append('\n').append(child.accept(this));
        } finally {
          depth--;
        }
      } else {
        if (!first) sb.append('\n').append(indent).append(INDENT);
        sb.append(child.accept(this));
      }
      first = false;
    }
    return sb.toString();
  }

  private String join(List<ContentNode> nodes, String separator) {
    return nodes.stream().map(n -> n.accept(this)).collect(Collectors.joining(separator));
  }

  private static String checkbox(TaskItem item) {
    return item.checked() ? "[x] " : "[ ] ";
  }

  private static boolean isList(ContentNode node) {
    return node instanceof BulletList || node instanceof OrderedList || node instanceof TaskList;
  }
}
