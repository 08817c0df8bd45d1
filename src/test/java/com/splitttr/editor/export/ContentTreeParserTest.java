package com.splitttr.editor.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.splitttr.editor.export.ContentNode.*;
import com.splitttr.editor.service.EditorException.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentTreeParserTest {

  private final ContentTreeParser parser = new ContentTreeParser(new ObjectMapper());

  @Test
  void parsesKnownNodes() {
    ContentNode root = parser.parse("""
        {"type":"doc","content":[
          {"type":"heading","attrs":{"level":2},"content":[{"type":"text","text":"T"}]},
          {"type":"taskList","content":[{"type":"taskItem","attrs":{"checked":true},"content":[]}]},
          {"type":"codeBlock","attrs":{"language":"go"},"content":[{"type":"text","text":"x"}]},
          {"type":"horizontalRule"}
        ]}""");

    assertThat(root).isInstanceOf(Doc.class);
    assertThat(root.children()).hasSize(4);
    assertThat(((Heading) root.children().get(0)).level()).isEqualTo(2);
    TaskItem item = (TaskItem) root.children().get(1).children().get(0);
    assertThat(item.checked()).isTrue();
    assertThat(((CodeBlock) root.children().get(2)).language()).isEqualTo("go");
    assertThat(root.children().get(3)).isInstanceOf(HorizontalRule.class);
  }

  @Test
  void readsMarksAndLinkHref() {
    ContentNode root = parser.parse("""
        {"type":"text","text":"x","marks":[{"type":"bold"},{"type":"link","attrs":{"href":"https://a.b"}},{"type":"highlight"}]}""");

    Text text = (Text) root;
    assertThat(text.marks()).containsExactly(
        Mark.of(Mark.Type.BOLD), Mark.link("https://a.b"), Mark.of(Mark.Type.OTHER));
  }

  @Test
  void clampsHeadingLevel() {
    assertThat(((Heading) parser.parse("{\"type\":\"heading\",\"attrs\":{\"level\":9}}")).level()).isEqualTo(6);
    assertThat(((Heading) parser.parse("{\"type\":\"heading\",\"attrs\":{\"level\":0}}")).level()).isEqualTo(1);
    assertThat(((Heading) parser.parse("{\"type\":\"heading\"}")).level()).isEqualTo(1);
  }

  @Test
  void unrecognisedOrMissingTypeBecomesUnknown() {
    ContentNode mention = parser.parse("{\"type\":\"mention\",\"content\":[{\"type\":\"text\",\"text\":\"@a\"}]}");
    assertThat(mention).isInstanceOf(Unknown.class);
    assertThat(((Unknown) mention).type()).isEqualTo("mention");
    assertThat(mention.children()).hasSize(1);

    assertThat(parser.parse("{\"content\":[]}")).isInstanceOf(Unknown.class);
  }

  @Test
  void rejectsMalformedContent() {
    assertThatThrownBy(() -> parser.parse("")).isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> parser.parse("{not json")).isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> parser.parse("[]")).isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> parser.parse("{\"type\":\"doc\",\"content\":{}}"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> parser.parse("{\"type\":\"doc\",\"content\":[1]}"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> parser.parse("{\"type\":\"text\",\"text\":5}"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> parser.parse("{\"type\":\"text\",\"text\":\"a\",\"marks\":\"bold\"}"))
        .isInstanceOf(ValidationException.class);
  }
}
