package com.github.fsmcompiler;

/**
 * Emits the class declaration: the state enumeration, the constructor binding the context, one
 * method per distinct transition id and the hook signatures.
 */
final class DeclarationEmitter implements Emitter {
  private final CompilerConfiguration config;

  DeclarationEmitter(final CompilerConfiguration config) {
    this.config = config;
  }

  @Override
  public String emit(final FsmModel fsm, final String baseName, final String sourcePath) {
    final SourceWriter out =
        new SourceWriter(config.getIndent(), config.getEmitLineMarkers() ? sourcePath : null);

    out.line(0, "// ", config.getBanner()).blank();
    out.line(0, "#pragma once").blank();

    if (fsm.getHeader().isPresent()) {
      out.verbatim(fsm.getHeader().get()).blank();
    }

    out.line(0, "class ", fsm.getId(), " {");
    out.line(0, "public:");

    out.line(1, "enum class State {");
    for (final FsmState state : fsm.getStates()) {
      out.line(2, state.getId(), ",");
    }
    out.line(1, "};").blank();

    out.line(1, fsm.getId(), "(", fsm.getContextClass(), "& ctx): ", fsm.getContextField(),
        "(ctx), __state(State::", fsm.getBegin(), ") {}").blank();
    out.line(1, "State currentState() const { return __state; }").blank();

    out.line(0, "#ifdef ", config.getDebugMacro());
    out.line(1, "const char* stateName(State state) const;");
    out.line(1, "void printf(const char* fmt, ...);");
    out.line(0, "#endif").blank();

    for (final Transition transition : fsm.getDistinctTransitions()) {
      out.line(1, "bool ", transition.getId(), "(", transition.formatParameters(), ");");
    }
    out.blank();

    out.line(0, "protected:");
    out.line(1, "bool before() const;");
    out.line(1, "bool before(State state) const;");
    out.line(1, "void after() const;");
    out.line(1, "void after(State state) const;").blank();
    out.line(1, fsm.getContextClass(), "& ", fsm.getContextField(), ";");
    out.line(1, "State __state;");
    out.line(0, "};");
    return out.toString();
  }
}
