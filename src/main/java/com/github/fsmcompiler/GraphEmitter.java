package com.github.fsmcompiler;

/**
 * Emits a Graphviz digraph with one node per state and one labeled edge per direct transition.
 * Sequence transitions have no single arrow in the source and are left out.
 */
final class GraphEmitter implements Emitter {
  private final CompilerConfiguration config;

  GraphEmitter(final CompilerConfiguration config) {
    this.config = config;
  }

  @Override
  public String emit(final FsmModel fsm, final String baseName, final String sourcePath) {
    final SourceWriter out = new SourceWriter(config.getIndent(), null);

    out.line(0, "// ", config.getBanner()).blank();
    out.line(0, "digraph ", fsm.getId(), " {");
    for (final FsmState state : fsm.getStates()) {
      out.line(1, state.getId(), " [label=\"", state.getId(), "\"];");
    }
    out.blank();
    for (final FsmState state : fsm.getStates()) {
      for (final Transition transition : state.getTransitions()) {
        if (transition.getKind() == TransitionKind.STATE) {
          out.line(1, state.getId(), " -> ", transition.getTarget().getId(), " [label=\"",
              transition.getId(), "\"];");
        }
      }
    }
    out.line(0, "}");
    return out.toString();
  }
}
