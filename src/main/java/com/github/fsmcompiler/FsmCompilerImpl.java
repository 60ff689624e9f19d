package com.github.fsmcompiler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmcompiler.FsmCompilerException.Code;

/**
 * The FSM compiler pipeline.
 *
 * Notes for users:<br>
 * 1. this instance is thread-safe, it holds nothing but its immutable configuration and the
 * stateless emitters<br>
 *
 * 2. every run gets its own run id, its own token buffer and its own model. The run id shows up
 * in every log line of the run.<br>
 *
 * 3. output paths are derived from the input path: same directory, same base name, extension
 * replaced by the configured ones.<br>
 */
public final class FsmCompilerImpl implements FsmCompiler {
  private static final Logger logger = LogManager.getLogger(FsmCompilerImpl.class.getSimpleName());

  private final CompilerConfiguration config;
  private final Emitter declarationEmitter;
  private final Emitter definitionEmitter;
  private final Emitter graphEmitter;

  public FsmCompilerImpl(final CompilerConfiguration config) throws FsmCompilerException {
    if (config == null) {
      throw new FsmCompilerException(Code.INVALID_CONFIG, "<config>", 0,
          "Compiler configuration cannot be null");
    }
    this.config = config;
    this.declarationEmitter = new DeclarationEmitter(config);
    this.definitionEmitter = new DefinitionEmitter(config);
    this.graphEmitter = new GraphEmitter(config);
    logDebug(null, null, "Wired compiler with " + config);
  }

  @Override
  public List<Token> tokenize(final String path, final String source)
      throws FsmCompilerException {
    final LexerConfiguration lexerConfig = config.getLexerConfiguration();
    final List<Token> tokens = new Lexer(lexerConfig, path, source, 1).tokenize();
    return new FreeformExpander(lexerConfig, path).expand(tokens);
  }

  @Override
  public FsmModel parse(final String path, final String source) throws FsmCompilerException {
    return new FsmParser(path, tokenize(path, source)).parse();
  }

  @Override
  public void validate(final String path, final FsmModel fsm) throws FsmCompilerException {
    new FsmValidator(path).validate(fsm);
  }

  @Override
  public Compilation compile(final Path path, final String sourcePath, final String source)
      throws FsmCompilerException {
    final String runId = UUID.randomUUID().toString();
    final String displayPath = path.toString();
    final CompilationStatistics statistics = new CompilationStatistics(runId);
    logInfo(runId, displayPath, "Compiling");
    try {
      final List<Token> tokens = tokenize(displayPath, source);
      statistics.tokens = tokens.size();
      logDebug(runId, displayPath, String.format("Tokenized into %d tokens", tokens.size()));

      final FsmModel fsm = new FsmParser(displayPath, tokens).parse();
      logDebug(runId, displayPath, String.format("Parsed fsm %s with %d states, begins at %s",
          fsm.getId(), fsm.getStates().size(), fsm.getBegin()));

      validate(displayPath, fsm);
      statistics.count(fsm);

      final String baseName = SourcePaths.baseName(path);
      final Path directory = SourcePaths.directory(path);
      final Compilation compilation = new Compilation(fsm,
          declarationEmitter.emit(fsm, baseName, sourcePath),
          definitionEmitter.emit(fsm, baseName, sourcePath),
          graphEmitter.emit(fsm, baseName, sourcePath),
          SourcePaths.join(directory, baseName, config.getDeclarationExtension()),
          SourcePaths.join(directory, baseName, config.getDefinitionExtension()),
          SourcePaths.join(directory, baseName, config.getGraphExtension()), statistics);
      statistics.finish();
      logInfo(runId, displayPath, "Successfully compiled with " + statistics);
      return compilation;
    } catch (FsmCompilerException exception) {
      // the caller owns the user facing diagnostic
      logInfo(runId, displayPath, "Compilation failed with " + exception.getCode());
      throw exception;
    }
  }

  @Override
  public Compilation compile(final Path path) throws FsmCompilerException {
    final String source;
    try {
      source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    } catch (IOException exception) {
      throw new FsmCompilerException(Code.IO_FAILURE, path.toString(), 0,
          "Error opening input file: " + exception.getMessage(), exception);
    }
    return compile(path, SourcePaths.realPath(path).toString(), source);
  }

  @Override
  public CompilerConfiguration getConfiguration() {
    return config;
  }

  private static void logInfo(final String runId, final String path, final String message) {
    logger.info(new StringBuilder().append("[r:").append(runId).append("][f:").append(path)
        .append("] ").append(message).toString());
  }

  private static void logDebug(final String runId, final String path, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[r:").append(runId).append("][f:").append(path)
          .append("] ").append(message).toString());
    }
  }
}
