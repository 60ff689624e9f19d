package com.github.fsmcompiler;

/**
 * Unified single exception that's thrown by every stage of the compiler. The code enum
 * encapsulates the various error conditions and each code belongs to a broader {@link Category}.
 * 
 * Every instance carries the path of the offending source and the 1-based line, so that
 * {@link #getMessage()} reads as a ready to print {@code path:line: message} diagnostic. Stages
 * fail fast: the first exception raised ends the compilation.
 */
public final class FsmCompilerException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  private final String path;
  private final int line;
  private final String detail;

  public FsmCompilerException(final Code code, final String path, final int line) {
    this(code, path, line, code.getDescription());
  }

  public FsmCompilerException(final Code code, final String path, final int line,
      final String detail) {
    super(diagnostic(path, line, detail));
    this.code = code;
    this.path = path;
    this.line = line;
    this.detail = detail;
  }

  public FsmCompilerException(final Code code, final String path, final int line,
      final String detail, final Throwable throwable) {
    super(diagnostic(path, line, detail), throwable);
    this.code = code;
    this.path = path;
    this.line = line;
    this.detail = detail;
  }

  public Code getCode() {
    return code;
  }

  public Category getCategory() {
    return code.getCategory();
  }

  public String getPath() {
    return path;
  }

  public int getLine() {
    return line;
  }

  /**
   * The bare message without the location prefix.
   */
  public String getDetail() {
    return detail;
  }

  private static String diagnostic(final String path, final int line, final String detail) {
    return new StringBuilder().append(path).append(':').append(line).append(": ").append(detail)
        .toString();
  }

  public static enum Category {
    LEX_ERROR, PARSE_ERROR, DUPLICATE_DECLARATION, UNKNOWN_REFERENCE, IO_FAILURE, INVALID_CONFIG;
  }

  public static enum Code {
    // 1.
    LEX_ERROR("Malformed character stream", Category.LEX_ERROR),
    // 2.
    PARSE_ERROR("Unexpected token", Category.PARSE_ERROR),
    // 3.
    DUPLICATE_BLOCK("Verbatim block declared more than once in the same scope",
        Category.DUPLICATE_DECLARATION),
    // 4.
    DUPLICATE_STATE("State declared more than once", Category.DUPLICATE_DECLARATION),
    // 5.
    DUPLICATE_TRANSITION("Transition declared more than once in the same state",
        Category.DUPLICATE_DECLARATION),
    // 6.
    SIGNATURE_MISMATCH("Transitions sharing an id declare different parameter lists",
        Category.DUPLICATE_DECLARATION),
    // 7.
    UNKNOWN_TRANSITION("Transition is not declared in the current state",
        Category.UNKNOWN_REFERENCE),
    // 8.
    UNKNOWN_STATE("State is not declared", Category.UNKNOWN_REFERENCE),
    // 9.
    CYCLIC_SEQUENCE("Sequence transition calls itself", Category.UNKNOWN_REFERENCE),
    // 10.
    IO_FAILURE("Failed to read or write a file", Category.IO_FAILURE),
    // 11.
    INVALID_CONFIG("Compiler configuration is invalid", Category.INVALID_CONFIG);

    private final String description;
    private final Category category;

    private Code(final String description, final Category category) {
      this.description = description;
      this.category = category;
    }

    public String getDescription() {
      return description;
    }

    public Category getCategory() {
      return category;
    }
  }

}
