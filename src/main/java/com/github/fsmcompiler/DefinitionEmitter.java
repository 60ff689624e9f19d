package com.github.fsmcompiler;

import java.util.List;
import java.util.Optional;

import com.github.fsmcompiler.SequenceTransition.Step;

/**
 * Emits the class definition: the debug helpers, the four hooks and one dispatch method per
 * distinct transition id.
 *
 * A dispatch method switches on the current state. Every state declaring the transition runs the
 * global guard, then the state guard, then either the precondition and the state assignment
 * (direct) or a short-circuiting {@code &&} chain of the step calls (sequence). The {@code after}
 * hooks only run once the transition succeeded. States not declaring the transition fall through
 * to {@code return false}.
 */
final class DefinitionEmitter implements Emitter {
  private static final String OK = "__ok";
  private static final String CONTINUATION = "            ";

  private final CompilerConfiguration config;

  DefinitionEmitter(final CompilerConfiguration config) {
    this.config = config;
  }

  @Override
  public String emit(final FsmModel fsm, final String baseName, final String sourcePath) {
    final SourceWriter out =
        new SourceWriter(config.getIndent(), config.getEmitLineMarkers() ? sourcePath : null);

    out.line(0, "// ", config.getBanner()).blank();
    out.line(0, "#include \"", baseName, ".", config.getDeclarationExtension(), "\"").blank();

    if (fsm.getCpp().isPresent()) {
      out.verbatim(fsm.getCpp().get()).blank();
    }

    emitDebugHelpers(out, fsm);
    emitHooks(out, fsm);

    for (final Transition transition : fsm.getDistinctTransitions()) {
      emitDispatch(out, fsm, transition);
    }
    return out.toString();
  }

  private void emitDebugHelpers(final SourceWriter out, final FsmModel fsm) {
    out.line(0, "#ifdef ", config.getDebugMacro());
    out.line(0, "#include <stdarg.h>").blank();
    out.line(0, "const char* ", fsm.getId(), "::stateName(State state) const {");
    out.line(1, "switch (state) {");
    for (final FsmState state : fsm.getStates()) {
      out.line(2, "case State::", state.getId(), ": return \"", state.getId(), "\";");
    }
    out.line(2, "default: break;");
    out.line(1, "}").blank();
    out.line(1, "return nullptr;");
    out.line(0, "}").blank();

    out.line(0, "void ", fsm.getId(), "::printf(const char* fmt, ...) {");
    out.line(1, "va_list args;");
    out.line(1, "va_start(args, fmt);");
    out.line(1, fsm.getContextField(), ".printf(fmt, args);");
    out.line(1, "va_end(args);");
    out.line(0, "}");
    out.line(0, "#endif").blank();
  }

  private void emitHooks(final SourceWriter out, final FsmModel fsm) {
    out.line(0, "bool ", fsm.getId(), "::before() const {");
    if (fsm.getBefore().isPresent()) {
      out.verbatim(fsm.getBefore().get());
    }
    out.line(1, "return true;");
    out.line(0, "}").blank();

    out.line(0, "bool ", fsm.getId(), "::before(State state) const {");
    out.line(1, "switch (state) {");
    for (final FsmState state : fsm.getStates()) {
      emitStateHook(out, state, state.getBefore());
    }
    out.line(2, "default: break;");
    out.line(1, "}").blank();
    out.line(1, "return true;");
    out.line(0, "}").blank();

    out.line(0, "void ", fsm.getId(), "::after() const {");
    if (fsm.getAfter().isPresent()) {
      out.verbatim(fsm.getAfter().get());
    }
    out.line(0, "}").blank();

    out.line(0, "void ", fsm.getId(), "::after(State state) const {");
    out.line(1, "switch (state) {");
    for (final FsmState state : fsm.getStates()) {
      emitStateHook(out, state, state.getAfter());
    }
    out.line(2, "default: break;");
    out.line(1, "}");
    out.line(0, "}").blank();
  }

  private void emitStateHook(final SourceWriter out, final FsmState state,
      final Optional<VerbatimBlock> hook) {
    if (hook.isPresent()) {
      out.line(2, "case State::", state.getId(), ": {");
      out.verbatim(hook.get());
      out.line(2, "}");
      out.line(2, "break;");
    }
  }

  private void emitDispatch(final SourceWriter out, final FsmModel fsm,
      final Transition signature) {
    out.line(0, "bool ", fsm.getId(), "::", signature.getId(), "(", signature.formatParameters(),
        ") {");
    out.line(1, "switch (__state) {");

    for (final FsmState state : fsm.getStates()) {
      final Optional<Transition> declared = state.findTransition(signature.getId());
      if (!declared.isPresent()) {
        continue;
      }
      final Transition transition = declared.get();
      final String target = transition.getTarget().getId();

      out.line(2, "case State::", state.getId(), ": {");
      emitGuard(out, "before()", "Failed global precondition while switching to %s", target);
      emitGuard(out, "before(__state)", "Failed state precondition while switching to %s",
          target);

      if (transition.getKind() == TransitionKind.STATE) {
        emitDirect(out, (DirectTransition) transition);
      } else {
        emitSequence(out, (SequenceTransition) transition);
      }

      out.line(2, "}");
      out.line(2, "break;").blank();
    }

    out.line(2, "default: break;");
    out.line(1, "}").blank();
    out.line(1, "return false;");
    out.line(0, "}").blank();
  }

  private void emitGuard(final SourceWriter out, final String call, final String format,
      final String target) {
    out.line(3, "if (!", call, ") {");
    emitTrace(out, 4, format, target);
    out.blank();
    out.line(4, "return false;");
    out.line(3, "}").blank();
  }

  private void emitDirect(final SourceWriter out, final DirectTransition transition) {
    final String target = transition.getTarget().getId();
    if (transition.getPrecondition().isPresent()) {
      out.verbatim(transition.getPrecondition().get());
    }
    out.line(3, "__state = State::", target, ";");
    out.line(3, "after(__state);");
    out.line(3, "after();").blank();
    emitTrace(out, 3, "Switched to %s", target);
    out.line(3, "return true;");
  }

  /**
   * {@code &&} stops at the first step returning false, so later steps never run once an earlier
   * one failed, and the after hooks only run when the whole chain succeeded.
   */
  private void emitSequence(final SourceWriter out, final SequenceTransition transition) {
    final List<Step> steps = transition.getSteps();
    for (int i = 0; i < steps.size(); i++) {
      final Step step = steps.get(i);
      final String call = step.getId() + "(" + step.formatArguments() + ")";
      final String end = i == steps.size() - 1 ? ";" : " &&";
      if (i == 0) {
        out.line(3, "bool ", OK, " = ", call, end);
      } else {
        out.line(3, CONTINUATION, call, end);
      }
    }
    out.blank();
    out.line(3, "if (", OK, ") {");
    out.line(4, "after(__state);");
    out.line(4, "after();");
    out.line(3, "}");
    out.line(3, "else {");
    emitTrace(out, 4, "Failed to switch to %s", transition.getTarget().getId());
    out.line(3, "}").blank();
    out.line(3, "return ", OK, ";");
  }

  private void emitTrace(final SourceWriter out, final int depth, final String format,
      final String target) {
    out.line(0, "#ifdef ", config.getDebugMacro());
    out.line(depth, "printf(");
    out.line(depth + 1, "\"FSM %s:%u ", format, "\",");
    out.line(depth + 1, "__FUNCTION__, __LINE__, stateName(State::", target, ")");
    out.line(depth, ");");
    out.line(0, "#endif");
  }
}
