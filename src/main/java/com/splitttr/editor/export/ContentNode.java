package com.splitttr.editor.export;

import java.util.List;

/**
 * Typed content tree of a document. The node kinds form a closed set; anything the
 * parser does not recognise becomes {@link Unknown} and renders as its children.
 */
public sealed interface ContentNode {

  <R> R accept(NodeVisitor<R> visitor);

  List<ContentNode> children();

  record Doc(List<ContentNode> children) implements ContentNode {
    public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitDoc(this); }
  }

  record Paragraph(List<ContentNode> children) implements ContentNode {
    public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitParagraph(this); }
  }

  record Heading(int level, List<ContentNode> children) implements ContentNode {
    public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitHeading(this); }
  }

  record BulletList(List<ContentNode> children) implements ContentNode {
    public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitBulletList(this); }
  }

  record OrderedList(List<ContentNode> children) implements ContentNode {
    public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitOrderedList(this); }
  }

  record ListItem(List<ContentNode> children) implements ContentNode {
    public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitListItem(this); }
  }

  record TaskList(List<ContentNode> children) implements ContentNode {
    public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitTaskList(this); }
  }

  record TaskItem(boolean checked, List<ContentNode> children) implements ContentNode {
    public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitTaskItem(this); }
  }

  record CodeBlock(String language, List<ContentNode> children) implements ContentNode {
    public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitCodeBlock(this); }
  }

  record Blockquote(List<ContentNode> children) implements ContentNode {
    public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitBlockquote(this); }
  }

  record HorizontalRule() implements ContentNode {
    public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitHorizontalRule(this); }
    public List<ContentNode> children() { return List.of(); }
  }

  record HardBreak() implements ContentNode {
    public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitHardBreak(this); }
    public List<ContentNode> children() { return List.of(); }
  }

  record Text(String text, List<Mark> marks) implements ContentNode {
    public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitText(this); }
    public List<ContentNode> children() { return List.of(); }
  }

  record Unknown(String type, List<ContentNode> children) implements ContentNode {
    public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitUnknown(this); }
  }
}
