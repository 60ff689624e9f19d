package com.github.fsmcompiler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmcompiler.FsmCompilerException.Code;

/**
 * Persists a {@link Compilation} as one unit: either all three artifacts are replaced or none is.
 *
 * Notes:<br>
 * 1. every artifact is first staged into a fresh sibling file. Staged files are created like any
 * other file, so they get the permissions the umask gives; a target that already exists passes
 * its own permissions on to its replacement.<br>
 *
 * 2. only once all three are staged are they moved over their targets. Targets that existed are
 * kept aside until every move went through, and restored if one did not.<br>
 */
public final class ArtifactWriter {
  private static final Logger logger = LogManager.getLogger(ArtifactWriter.class.getSimpleName());

  public void write(final Compilation compilation) throws FsmCompilerException {
    final List<Artifact> artifacts = new ArrayList<>(3);
    artifacts.add(new Artifact(compilation.getDeclarationPath(), compilation.getDeclaration()));
    artifacts.add(new Artifact(compilation.getDefinitionPath(), compilation.getDefinition()));
    artifacts.add(new Artifact(compilation.getGraphPath(), compilation.getGraph()));

    try {
      // 1. stage everything, nothing visible changes yet
      for (final Artifact artifact : artifacts) {
        stage(artifact);
      }
      // 2. swap the staged files in
      for (final Artifact artifact : artifacts) {
        commit(artifact);
      }
    } catch (FsmCompilerException exception) {
      rollback(artifacts);
      throw exception;
    } finally {
      for (final Artifact artifact : artifacts) {
        deleteQuietly(artifact.staged);
        deleteQuietly(artifact.backup);
      }
    }
    logger.info(String.format("Wrote %s, %s and %s", compilation.getDeclarationPath(),
        compilation.getDefinitionPath(), compilation.getGraphPath()));
  }

  private void stage(final Artifact artifact) throws FsmCompilerException {
    final Path target = artifact.target;
    if (Files.isDirectory(target)) {
      throw failure(target, target + " is a directory", null);
    }
    try {
      artifact.staged = sibling(target, "new");
      Files.write(artifact.staged, artifact.content.getBytes(StandardCharsets.UTF_8),
          StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
      if (Files.exists(target)) {
        copyPermissions(target, artifact.staged);
      }
    } catch (IOException exception) {
      throw failure(target, exception.getMessage(), exception);
    }
  }

  private void commit(final Artifact artifact) throws FsmCompilerException {
    final Path target = artifact.target;
    try {
      if (Files.exists(target)) {
        artifact.backup = sibling(target, "old");
        move(target, artifact.backup);
      }
      move(artifact.staged, target);
      artifact.staged = null;
      artifact.committed = true;
    } catch (IOException exception) {
      throw failure(target, exception.getMessage(), exception);
    }
  }

  /**
   * Puts every target back the way it was before {@link #write(Compilation)} started.
   */
  private void rollback(final List<Artifact> artifacts) {
    for (final Artifact artifact : artifacts) {
      try {
        if (artifact.backup != null) {
          move(artifact.backup, artifact.target);
          artifact.backup = null;
        } else if (artifact.committed) {
          Files.deleteIfExists(artifact.target);
        }
      } catch (IOException exception) {
        logger.warn("Failed to restore " + artifact.target + ", previous content left in "
            + artifact.backup, exception);
        // keep it on disk
        artifact.backup = null;
      }
    }
  }

  private static void move(final Path source, final Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException exception) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void copyPermissions(final Path from, final Path to) throws IOException {
    final PosixFileAttributeView source =
        Files.getFileAttributeView(from, PosixFileAttributeView.class);
    final PosixFileAttributeView destination =
        Files.getFileAttributeView(to, PosixFileAttributeView.class);
    if (source != null && destination != null) {
      destination.setPermissions(source.readAttributes().permissions());
    }
  }

  private static Path sibling(final Path target, final String suffix) {
    return target.resolveSibling(
        "." + target.getFileName() + "." + UUID.randomUUID().toString() + "." + suffix);
  }

  private static FsmCompilerException failure(final Path target, final String reason,
      final IOException cause) {
    return new FsmCompilerException(Code.IO_FAILURE, target.toString(), 0,
        "Error writing output file: " + reason, cause);
  }

  private static void deleteQuietly(final Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException exception) {
      logger.warn("Failed to delete temporary file " + path, exception);
    }
  }

  private static final class Artifact {
    private final Path target;
    private final String content;
    private Path staged;
    private Path backup;
    private boolean committed;

    private Artifact(final Path target, final String content) {
      this.target = target;
      this.content = content;
    }
  }
}
