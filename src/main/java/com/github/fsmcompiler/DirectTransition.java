package com.github.fsmcompiler;

import java.util.List;
import java.util.Optional;

/**
 * {@code id(params) => Target;} or {@code id(params) => Target { precondition }}.
 */
public final class DirectTransition extends Transition {
  private final TargetReference target;
  private final Optional<VerbatimBlock> precondition;

  public DirectTransition(final String id, final int line, final List<Parameter> parameters,
      final TargetReference target, final Optional<VerbatimBlock> precondition) {
    super(id, line, parameters);
    this.target = target;
    this.precondition = precondition == null ? Optional.empty() : precondition;
  }

  @Override
  public TransitionKind getKind() {
    return TransitionKind.STATE;
  }

  @Override
  public TargetReference getTarget() {
    return target;
  }

  /**
   * The guard, already rewritten so that {@code allow} reads {@code return true} and
   * {@code forbid} reads {@code return false}.
   */
  public Optional<VerbatimBlock> getPrecondition() {
    return precondition;
  }

  @Override
  public String toString() {
    return "DirectTransition [id=" + getId() + ", parameters=" + getParameters() + ", target="
        + target + ", precondition=" + precondition + "]";
  }
}
