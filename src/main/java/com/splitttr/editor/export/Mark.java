package com.splitttr.editor.export;

// Inline formatting on a text node. href is only set for links.
public record Mark(Type type, String href) {

  public enum Type {
    BOLD,
    ITALIC,
    STRIKE,
    CODE,
    UNDERLINE,
    LINK,
    OTHER;

    static Type fromName(String name) {
      if (name == null) return OTHER;
      return switch (name) {
        case "bold" -> BOLD;
        case "italic" -> ITALIC;
        case "strike" -> STRIKE;
        case "code" -> CODE;
        case "underline" -> UNDERLINE;
        case "link" -> LINK;
        default -> OTHER;
      };
    }
  }

  public static Mark of(Type type) {
    return new Mark(type, null);
  }

  public static Mark link(String href) {
    return new Mark(Type.LINK, href);
  }
}
