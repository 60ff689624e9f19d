package com.github.fsmcompiler;

import java.util.Arrays;
import java.util.HashSet;

/**
 * This class encapsulates all the configuration parameters for the {@link FsmCompiler}. Use the
 * {@code CompilerConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. every parameter has a default, so {@code CompilerConfigurationBuilder.newBuilder().build()}
 * is a complete configuration producing .h, .cpp and .dot files.<br>
 * 2. line markers are on by default so that the downstream C++ compiler reports errors in
 * verbatim blocks against the .fsm file rather than the generated one.<br>
 */
public final class CompilerConfiguration {
  static final String DEFAULT_BANNER = "Generated with fsmc, the FSM compiler. Do not edit.";

  private final LexerConfiguration lexerConfiguration;
  private final String indent;
  private final String banner;
  private final String debugMacro;
  private final String declarationExtension;
  private final String definitionExtension;
  private final String graphExtension;
  private final boolean emitLineMarkers;

  public LexerConfiguration getLexerConfiguration() {
    return lexerConfiguration;
  }

  public String getIndent() {
    return indent;
  }

  public String getBanner() {
    return banner;
  }

  public String getDebugMacro() {
    return debugMacro;
  }

  public String getDeclarationExtension() {
    return declarationExtension;
  }

  public String getDefinitionExtension() {
    return definitionExtension;
  }

  public String getGraphExtension() {
    return graphExtension;
  }

  public boolean getEmitLineMarkers() {
    return emitLineMarkers;
  }

  public final static class CompilerConfigurationBuilder {
    private LexerConfiguration lexerConfiguration;
    private String indent = "    ";
    private String banner = DEFAULT_BANNER;
    private String debugMacro = "DEBUG_FSM";
    private String declarationExtension = "h";
    private String definitionExtension = "cpp";
    private String graphExtension = "dot";
    private boolean emitLineMarkers = true;

    public static CompilerConfigurationBuilder newBuilder() {
      return new CompilerConfigurationBuilder();
    }

    public CompilerConfigurationBuilder lexerConfiguration(
        final LexerConfiguration lexerConfiguration) {
      this.lexerConfiguration = lexerConfiguration;
      return this;
    }

    public CompilerConfigurationBuilder indent(final String indent) {
      this.indent = indent;
      return this;
    }

    public CompilerConfigurationBuilder banner(final String banner) {
      this.banner = banner;
      return this;
    }

    public CompilerConfigurationBuilder debugMacro(final String debugMacro) {
      this.debugMacro = debugMacro;
      return this;
    }

    public CompilerConfigurationBuilder declarationExtension(final String declarationExtension) {
      this.declarationExtension = declarationExtension;
      return this;
    }

    public CompilerConfigurationBuilder definitionExtension(final String definitionExtension) {
      this.definitionExtension = definitionExtension;
      return this;
    }

    public CompilerConfigurationBuilder graphExtension(final String graphExtension) {
      this.graphExtension = graphExtension;
      return this;
    }

    public CompilerConfigurationBuilder emitLineMarkers(final boolean emitLineMarkers) {
      this.emitLineMarkers = emitLineMarkers;
      return this;
    }

    public CompilerConfiguration build() throws FsmCompilerException {
      final CompilerConfiguration config = new CompilerConfiguration(
          lexerConfiguration != null ? lexerConfiguration : LexerConfiguration.fsmGrammar(),
          indent, banner, debugMacro, declarationExtension, definitionExtension, graphExtension,
          emitLineMarkers);
      config.validate();
      return config;
    }

    private CompilerConfigurationBuilder() {}
  }

  private void validate() throws FsmCompilerException {
    StringBuilder messages = new StringBuilder();
    if (indent == null || !indent.trim().isEmpty()) {
      messages.append("Indent must be whitespace only. ");
    }
    if (banner == null || banner.contains("\n")) {
      messages.append("Banner cannot be null or span several lines. ");
    }
    if (debugMacro == null || !debugMacro.matches("[A-Za-z_][A-Za-z0-9_]*")) {
      messages.append("Debug macro must be a valid preprocessor identifier. ");
    }
    validateExtension(messages, "Declaration", declarationExtension);
    validateExtension(messages, "Definition", definitionExtension);
    validateExtension(messages, "Graph", graphExtension);
    if (new HashSet<>(Arrays.asList(declarationExtension, definitionExtension, graphExtension))
        .size() < 3) {
      messages.append("Output extensions must be distinct. ");
    }
    if (messages.length() > 0) {
      throw new FsmCompilerException(FsmCompilerException.Code.INVALID_CONFIG, "<config>", 0,
          messages.toString().trim());
    }
  }

  private static void validateExtension(final StringBuilder messages, final String what,
      final String extension) {
    if (extension == null || !extension.matches("[A-Za-z0-9_]+")) {
      messages.append(what).append(" extension must be non-empty and alphanumeric. ");
    }
  }

  @Override
  public String toString() {
    return "CompilerConfiguration [lexerConfiguration=" + lexerConfiguration + ", indent='"
        + indent + "', banner=" + banner + ", debugMacro=" + debugMacro
        + ", declarationExtension=" + declarationExtension + ", definitionExtension="
        + definitionExtension + ", graphExtension=" + graphExtension + ", emitLineMarkers="
        + emitLineMarkers + "]";
  }

  private CompilerConfiguration(final LexerConfiguration lexerConfiguration, final String indent,
      final String banner, final String debugMacro, final String declarationExtension,
      final String definitionExtension, final String graphExtension,
      final boolean emitLineMarkers) {
    this.lexerConfiguration = lexerConfiguration;
    this.indent = indent;
    this.banner = banner;
    this.debugMacro = debugMacro;
    this.declarationExtension = declarationExtension;
    this.definitionExtension = definitionExtension;
    this.graphExtension = graphExtension;
    this.emitLineMarkers = emitLineMarkers;
  }

}
