package com.github.fsmcompiler;

/**
 * Tags the two shapes a {@link Transition} can take.
 */
public enum TransitionKind {
  // explicit move to a named state, optionally guarded by a precondition
  STATE,
  // chain of calls to other transitions, the resulting state is derived by the validator
  SEQUENCE;
}
