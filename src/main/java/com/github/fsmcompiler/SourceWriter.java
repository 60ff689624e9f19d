package com.github.fsmcompiler;

/**
 * Accumulates generated text line by line with a fixed indentation unit. Verbatim blocks are
 * preceded by a {@code #line} marker when a marker path is set.
 */
final class SourceWriter {
  private final StringBuilder out = new StringBuilder();
  private final String indent;
  private final String markerPath;

  /**
   * @param markerPath the already resolved source path for line markers, null to omit markers
   */
  SourceWriter(final String indent, final String markerPath) {
    this.indent = indent;
    this.markerPath = markerPath == null ? null : escape(markerPath);
  }

  SourceWriter line(final int depth, final Object... parts) {
    for (int i = 0; i < depth; i++) {
      out.append(indent);
    }
    for (final Object part : parts) {
      out.append(part);
    }
    out.append('\n');
    return this;
  }

  SourceWriter blank() {
    out.append('\n');
    return this;
  }

  /**
   * Copies the block's text as is, behind a marker pointing at the block's line in the .fsm file.
   */
  SourceWriter verbatim(final VerbatimBlock block) {
    if (markerPath != null) {
      out.append("#line ").append(block.getLine()).append(" \"").append(markerPath)
          .append("\"\n");
    }
    out.append(block.getText()).append('\n');
    return this;
  }

  static String escape(final String path) {
    return path.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  @Override
  public String toString() {
    return out.toString();
  }
}
