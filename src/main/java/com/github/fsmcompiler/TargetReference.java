package com.github.fsmcompiler;

/**
 * A reference to a state by id, along with the line the reference was made on.
 */
public final class TargetReference {
  private final String id;
  private final int line;

  public TargetReference(final String id, final int line) {
    this.id = id;
    this.line = line;
  }

  public String getId() {
    return id;
  }

  public int getLine() {
    return line;
  }

  @Override
  public String toString() {
    return "TargetReference [id=" + id + ", line=" + line + "]";
  }
}
