package com.github.fsmcompiler;

/**
 * The kinds of tokens produced by the {@link Lexer}.
 */
public enum TokenKind {
  // identifiers not found in the keyword set
  ID("<id>"),
  // verbatim text between a balanced pair of delimiters, delimiters included
  FREEFORM("<freeform>"),
  SYMBOL("<symbol>"),
  KEYWORD("<keyword>"),
  NUMBER("<number>"),
  // string and character literals
  STRING("<string>"),
  LINE_COMMENT("<linecomment>"),
  BLOCK_COMMENT("<blockcomment>"),
  EOF("<eof>");

  private final String display;

  private TokenKind(final String display) {
    this.display = display;
  }

  /**
   * How the kind shows up in diagnostics.
   */
  public String getDisplay() {
    return display;
  }

  public boolean isComment() {
    return this == LINE_COMMENT || this == BLOCK_COMMENT;
  }
}
