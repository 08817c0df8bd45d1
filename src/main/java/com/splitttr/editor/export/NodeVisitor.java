package com.splitttr.editor.export;

import com.splitttr.editor.export.ContentNode.*;

// One method per node kind; an emitter that implements this handles every kind.
public interface NodeVisitor<R> {
  R visitDoc(Doc node);

  R visitParagraph(Paragraph node);

  R visitHeading(Heading node);

  R visitBulletList(BulletList node);

  R visitOrderedList(OrderedList node);

  R visitListItem(ListItem node);

  R visitTaskList(TaskList node);

  R visitTaskItem(TaskItem node);

  R visitCodeBlock(CodeBlock node);

  R visitBlockquote(Blockquote node);

  R visitHorizontalRule(HorizontalRule node);

  R visitHardBreak(HardBreak node);

  R visitText(Text node);

  R visitUnknown(Unknown node);
}
