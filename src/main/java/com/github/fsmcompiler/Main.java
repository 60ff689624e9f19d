package com.github.fsmcompiler;

import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Command line entry point: {@code fsmc <input.fsm>}. Writes the .h, .cpp and .dot files next to
 * the input, or a single {@code path:line: message} diagnostic to stderr.
 */
public final class Main {
  private static final Logger logger = LogManager.getLogger(Main.class.getSimpleName());

  public static void main(String[] args) {
    System.exit(run(args, System.err));
  }

  /**
   * Returns the process exit code.
   */
  static int run(final String[] args, final PrintStream err) {
    if (args == null || args.length != 1) {
      err.println("Usage: fsmc inputfile");
      return 1;
    }
    try {
      final FsmCompiler compiler = FsmCompiler.FsmCompilerBuilder.newBuilder().build();
      final Compilation compilation = compiler.compile(Paths.get(args[0]));
      new ArtifactWriter().write(compilation);
      return 0;
    } catch (FsmCompilerException exception) {
      if (logger.isDebugEnabled()) {
        logger.debug("Compilation of " + args[0] + " failed", exception);
      }
      err.println(exception.getMessage());
      return 1;
    } catch (InvalidPathException exception) {
      err.println(args[0] + ":0: Invalid input path: " + exception.getReason());
      return 1;
    }
  }

  private Main() {}
}
