package com.splitttr.editor.export;

import com.splitttr.editor.export.ContentNode.*;

import java.util.Arrays;
import java.util.List;

// Small tree builders for emitter tests.
final class Nodes {

  private Nodes() {}

  static Doc doc(ContentNode... children) {
    return new Doc(List.of(children));
  }

  static Paragraph p(ContentNode... children) {
    return new Paragraph(List.of(children));
  }

  static Paragraph p(String text) {
    return p(text(text));
  }

  static Heading h(int level, String text) {
    return new Heading(level, List.of(text(text)));
  }

  static Text text(String text, Mark... marks) {
    return new Text(text, Arrays.asList(marks));
  }

  static BulletList bullets(ContentNode... items) {
    return new BulletList(List.of(items));
  }

  static OrderedList ordered(ContentNode... items) {
    return new OrderedList(List.of(items));
  }

  static ListItem li(ContentNode... children) {
    return new ListItem(List.of(children));
  }

  static TaskList tasks(ContentNode... items) {
    return new TaskList(List.of(items));
  }

  static TaskItem task(boolean checked, String text) {
    return new TaskItem(checked, List.of(p(text)));
  }

  static CodeBlock code(String language, String text) {
    return new CodeBlock(language, List.of(text(text)));
  }

  static Blockquote quote(ContentNode... children) {
    return new Blockquote(List.of(children));
  }
}
