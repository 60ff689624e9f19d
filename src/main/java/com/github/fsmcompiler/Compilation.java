package com.github.fsmcompiler;

import java.nio.file.Path;

/**
 * The in-memory outcome of a successful compilation: the validated model, the three rendered
 * artifacts and where they belong. Nothing is written to disk until {@link ArtifactWriter} is
 * asked to.
 */
public final class Compilation {
  private final FsmModel model;
  private final String declaration;
  private final String definition;
  private final String graph;
  private final Path declarationPath;
  private final Path definitionPath;
  private final Path graphPath;
  private final CompilationStatistics statistics;

  Compilation(final FsmModel model, final String declaration, final String definition,
      final String graph, final Path declarationPath, final Path definitionPath,
      final Path graphPath, final CompilationStatistics statistics) {
    this.model = model;
    this.declaration = declaration;
    this.definition = definition;
    this.graph = graph;
    this.declarationPath = declarationPath;
    this.definitionPath = definitionPath;
    this.graphPath = graphPath;
    this.statistics = statistics;
  }

  public FsmModel getModel() {
    return model;
  }

  public String getDeclaration() {
    return declaration;
  }

  public String getDefinition() {
    return definition;
  }

  public String getGraph() {
    return graph;
  }

  public Path getDeclarationPath() {
    return declarationPath;
  }

  public Path getDefinitionPath() {
    return definitionPath;
  }

  public Path getGraphPath() {
    return graphPath;
  }

  public CompilationStatistics getStatistics() {
    return statistics;
  }

  @Override
  public String toString() {
    return "Compilation [fsm=" + model.getId() + ", declarationPath=" + declarationPath
        + ", definitionPath=" + definitionPath + ", graphPath=" + graphPath + ", statistics="
        + statistics + "]";
  }
}
