package com.github.fsmcompiler;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.github.fsmcompiler.FsmCompilerException.Code;

/**
 * Path helpers deriving the output locations from the input path.
 */
final class SourcePaths {

  /**
   * The directory holding {@code path}, relative paths without a parent map to the empty path.
   */
  static Path directory(final Path path) {
    final Path parent = path.getParent();
    return parent == null ? Paths.get("") : parent;
  }

  /**
   * The file name without its last extension, {@code "a/door.fsm"} gives {@code "door"}.
   */
  static String baseName(final Path path) {
    final String name = path.getFileName() == null ? "" : path.getFileName().toString();
    final int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  static Path join(final Path directory, final String baseName, final String extension) {
    return directory.resolve(baseName + "." + extension);
  }

  /**
   * Resolves the absolute path of an existing file, symbolic links included.
   */
  static Path realPath(final Path path) throws FsmCompilerException {
    try {
      return path.toRealPath();
    } catch (IOException exception) {
      throw new FsmCompilerException(Code.IO_FAILURE, path.toString(), 0,
          "Cannot resolve input file: " + exception.getMessage(), exception);
    }
  }

  private SourcePaths() {}
}
