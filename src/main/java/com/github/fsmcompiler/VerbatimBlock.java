package com.github.fsmcompiler;

/**
 * Opaque target-language text lifted from a freeform block, delimiters stripped. It is never
 * parsed, only copied into the generated code behind a line marker pointing back at {@link #line}.
 */
public final class VerbatimBlock {
  private final int line;
  private final String text;

  public VerbatimBlock(final int line, final String text) {
    this.line = line;
    this.text = text;
  }

  public int getLine() {
    return line;
  }

  public String getText() {
    return text;
  }

  @Override
  public String toString() {
    return "VerbatimBlock [line=" + line + ", text=" + text + "]";
  }
}
