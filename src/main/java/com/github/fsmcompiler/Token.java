package com.github.fsmcompiler;

import java.util.Objects;

/**
 * This object represents one immutable lexical token along with the source line it started on.
 */
public final class Token {
  private final int line;
  private final TokenKind kind;
  private final String lexeme;

  public Token(final int line, final TokenKind kind, final String lexeme) {
    this.line = line;
    this.kind = Objects.requireNonNull(kind);
    this.lexeme = Objects.requireNonNull(lexeme);
  }

  static Token symbol(final int line, final String lexeme) {
    return new Token(line, TokenKind.SYMBOL, lexeme);
  }

  public int getLine() {
    return line;
  }

  public TokenKind getKind() {
    return kind;
  }

  public String getLexeme() {
    return lexeme;
  }

  /**
   * Symbols and keywords are named by their lexeme, everything else by its kind.
   */
  public String describe() {
    return kind == TokenKind.SYMBOL || kind == TokenKind.KEYWORD ? lexeme : kind.getDisplay();
  }

  public boolean is(final TokenKind kind) {
    return this.kind == kind;
  }

  public boolean is(final String lexeme) {
    return (kind == TokenKind.SYMBOL || kind == TokenKind.KEYWORD) && this.lexeme.equals(lexeme);
  }

  /**
   * The lexeme with its first and last character stripped, i.e. a freeform block's inner text.
   */
  public String innerText() {
    return lexeme.length() < 2 ? "" : lexeme.substring(1, lexeme.length() - 1);
  }

  @Override
  public int hashCode() {
    return Objects.hash(line, kind, lexeme);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Token)) {
      return false;
    }
    final Token other = (Token) obj;
    return line == other.line && kind == other.kind && lexeme.equals(other.lexeme);
  }

  @Override
  public String toString() {
    return "Token [line=" + line + ", kind=" + kind + ", lexeme=" + lexeme + "]";
  }
}
