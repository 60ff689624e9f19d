package com.github.fsmcompiler;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmcompiler.FsmCompilerException.Code;
import com.github.fsmcompiler.SequenceTransition.Step;

/**
 * Resolves the target of every sequence transition by simulating its call chain over the state
 * graph, then checks that every transition lands on a declared state.
 *
 * All states and all their transitions are visited in sorted order, and the first problem found
 * is the one reported. A machine without states is rejected.
 */
final class FsmValidator {
  private static final Logger logger = LogManager.getLogger(FsmValidator.class.getSimpleName());

  private final String path;

  FsmValidator(final String path) {
    this.path = path;
  }

  void validate(final FsmModel fsm) throws FsmCompilerException {
    if (fsm.getBegin() == null) {
      // the generated constructor needs an initial state
      throw new FsmCompilerException(Code.UNKNOWN_STATE, path, fsm.getLine(),
          String.format("Fsm \"%s\" declares no states", fsm.getId()));
    }
    final Map<String, Transition> signatures = new HashMap<>();
    for (final FsmState state : fsm.getStates()) {
      for (final Transition transition : state.getTransitions()) {
        checkSignature(signatures, state, transition);
        if (transition.getKind() == TransitionKind.SEQUENCE) {
          final FsmState landing = walk(fsm, state, transition.getId(), transition.getLine(),
              new ArrayDeque<String>());
          ((SequenceTransition) transition)
              .resolveTarget(new TargetReference(landing.getId(), transition.getLine()));
          logDebug(String.format("Resolved sequence %s.%s to %s", state.getId(),
              transition.getId(), landing.getId()));
        }
        final TargetReference target = transition.getTarget();
        if (!fsm.findState(target.getId()).isPresent()) {
          throw unknownState(target);
        }
      }
    }
  }

  /**
   * Simulates calling {@code transitionId} while the machine is in {@code state} and returns the
   * state the machine ends up in. {@code callStack} holds the state.transition pairs currently
   * being walked.
   */
  private FsmState walk(final FsmModel fsm, final FsmState state, final String transitionId,
      final int line, final Deque<String> callStack) throws FsmCompilerException {
    final Transition transition = state.findTransition(transitionId).orElse(null);
    if (transition == null) {
      throw new FsmCompilerException(Code.UNKNOWN_TRANSITION, path, line, String
          .format("Unknown transition \"%s\" in state \"%s\"", transitionId, state.getId()));
    }

    if (transition.getKind() == TransitionKind.STATE) {
      final TargetReference target = transition.getTarget();
      final FsmState next = fsm.findState(target.getId()).orElse(null);
      if (next == null) {
        throw unknownState(target);
      }
      return next;
    }

    final String frame = state.getId() + "." + transitionId;
    if (callStack.contains(frame)) {
      throw new FsmCompilerException(Code.CYCLIC_SEQUENCE, path, line,
          String.format("Sequence \"%s\" calls itself through %s", frame, callStack));
    }
    callStack.push(frame);
    FsmState current = state;
    for (final Step step : ((SequenceTransition) transition).getSteps()) {
      current = walk(fsm, current, step.getId(), step.getLine(), callStack);
    }
    callStack.pop();
    return current;
  }

  private void checkSignature(final Map<String, Transition> signatures, final FsmState state,
      final Transition transition) throws FsmCompilerException {
    final Transition first = signatures.putIfAbsent(transition.getId(), transition);
    if (first != null && !first.hasSameSignature(transition)) {
      throw new FsmCompilerException(Code.SIGNATURE_MISMATCH, path, transition.getLine(),
          String.format("Transition \"%s\" in \"%s\" declares (%s), previously declared as (%s)",
              transition.getId(), state.getId(), transition.formatParameters(),
              first.formatParameters()));
    }
  }

  private FsmCompilerException unknownState(final TargetReference target) {
    return new FsmCompilerException(Code.UNKNOWN_STATE, path, target.getLine(),
        String.format("Unknown state \"%s\"", target.getId()));
  }

  private static void logDebug(final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(message);
    }
  }
}
