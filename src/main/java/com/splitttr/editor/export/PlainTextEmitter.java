package com.splitttr.editor.export;

import com.splitttr.editor.export.ContentNode.*;

import java.util.List;
import java.util.stream.Collectors;

// Text only: formatting is dropped, blocks are separated by blank lines.
public class PlainTextEmitter implements NodeVisitor<String> {

  private static final String BULLET = "• ";

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
    return join(node.children(), "");
  }

  @Override
  public String visitBulletList(BulletList node) {
    return join(node.children(), "\n");
  }

  @Override
  public String visitOrderedList(OrderedList node) {
    return join(node.children(), "\n");
  }

  @Override
  public String visitListItem(ListItem node) {
    return BULLET + join(node.children(), "\n");
  }

  @Override
  public String visitTaskList(TaskList node) {
    return join(node.children(), "\n");
  }

  @Override
  public String visitTaskItem(TaskItem node) {
    return BULLET + join(node.children(), "\n");
  }

  @Override
  public String visitCodeBlock(CodeBlock node) {
    return join(node.children(), "");
  }

  @Override
  public String visitBlockquote(Blockquote node) {
    return join(node.children(), "\n\n");
  }

  @Override
  public String visitHorizontalRule(HorizontalRule node) {
    return "---";
  }

  @Override
  public String visitHardBreak(HardBreak node) {
    return "\n";
  }

  @Override
  public String visitText(Text node) {
    return node.text();
  }

  @Override
  public String visitUnknown(Unknown node) {
    return join(node.children(), "");
  }

  private String join(List<ContentNode> nodes, String separator) {
    return nodes.stream().map(n -> n.accept(this)).collect(Collectors.joining(separator));
  }
}
