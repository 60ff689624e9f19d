package com.github.fsmcompiler;

import java.nio.file.Path;
import java.util.List;

/**
 * A compiler from FSM descriptions to a C++ class declaration, its definition and a Graphviz
 * graph.
 *
 * Notes for users:<br>
 * 1. compilation is a strictly sequential pipeline: tokenize, expand freeform bodies, parse,
 * validate, emit. Every stage throws the first {@link FsmCompilerException} it runs into and
 * nothing after it runs.<br>
 *
 * 2. a compiler instance holds configuration only. No state survives from one run to the next,
 * so the same instance can be reused for as many inputs as needed, from any thread.<br>
 *
 * 3. {@link #compile(Path)} never touches the output files; hand the returned
 * {@link Compilation} to an {@link ArtifactWriter} to persist it.<br>
 *
 * 4. the output is a pure function of the input: states and transitions are ordered by id, not
 * by declaration order, so recompiling an unchanged file yields byte-identical artifacts.<br>
 */
public interface FsmCompiler {

  /**
   * Tokenize the source and explode the fsm and state bodies. Comments are dropped and the list
   * ends with an EOF token.
   */
  List<Token> tokenize(final String path, final String source) throws FsmCompilerException;

  /**
   * Tokenize and parse the source into a model sorted by id. The model is not validated yet.
   */
  FsmModel parse(final String path, final String source) throws FsmCompilerException;

  /**
   * Resolve the sequence transitions of the model and check every reference in it.
   */
  void validate(final String path, final FsmModel fsm) throws FsmCompilerException;

  /**
   * Run the whole pipeline on in-memory source.
   *
   * @param path the input path as given by the user, used in diagnostics and to derive the
   *        output paths
   * @param sourcePath the absolute input path written into line markers
   */
  Compilation compile(final Path path, final String sourcePath, final String source)
      throws FsmCompilerException;

  /**
   * Read the given UTF-8 file and run the whole pipeline on it.
   */
  Compilation compile(final Path path) throws FsmCompilerException;

  /**
   * Returns the config that this compiler is wired with.
   */
  CompilerConfiguration getConfiguration();

  /**
   * A simple builder to let users use fluent APIs to build compilers.
   */
  public final static class FsmCompilerBuilder {
    private CompilerConfiguration config;

    public static FsmCompilerBuilder newBuilder() {
      return new FsmCompilerBuilder();
    }

    public FsmCompilerBuilder config(final CompilerConfiguration config) {
      this.config = config;
      return this;
    }

    public FsmCompiler build() throws FsmCompilerException {
      if (config == null) {
        config = CompilerConfiguration.CompilerConfigurationBuilder.newBuilder().build();
      }
      return new FsmCompilerImpl(config);
    }

    private FsmCompilerBuilder() {}
  }

}
