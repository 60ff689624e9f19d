package com.github.fsmcompiler;

import java.util.Collections;
import java.util.List;

/**
 * {@code id(params) => first(args) => second(args);}. Each step calls another transition of the
 * machine; the state reached after the last step is resolved by {@link FsmValidator}.
 */
public final class SequenceTransition extends Transition {
  private final List<Step> steps;
  private TargetReference resolvedTarget;

  public SequenceTransition(final String id, final int line, final List<Parameter> parameters,
      final List<Step> steps) {
    super(id, line, parameters);
    this.steps = Collections.unmodifiableList(steps);
  }

  @Override
  public TransitionKind getKind() {
    return TransitionKind.SEQUENCE;
  }

  @Override
  public TargetReference getTarget() {
    return resolvedTarget;
  }

  void resolveTarget(final TargetReference resolvedTarget) {
    this.resolvedTarget = resolvedTarget;
  }

  public List<Step> getSteps() {
    return steps;
  }

  @Override
  public String toString() {
    return "SequenceTransition [id=" + getId() + ", parameters=" + getParameters() + ", steps="
        + steps + ", resolvedTarget=" + resolvedTarget + "]";
  }

  /**
   * One call in the chain. Arguments are plain identifiers, never expressions.
   */
  public final static class Step {
    private final String id;
    private final int line;
    private final List<Argument> arguments;

    public Step(final String id, final int line, final List<Argument> arguments) {
      this.id = id;
      this.line = line;
      this.arguments = Collections.unmodifiableList(arguments);
    }

    public String getId() {
      return id;
    }

    public int getLine() {
      return line;
    }

    public List<Argument> getArguments() {
      return arguments;
    }

    public String formatArguments() {
      final StringBuilder builder = new StringBuilder();
      for (final Argument argument : arguments) {
        if (builder.length() > 0) {
          builder.append(", ");
        }
        builder.append(argument.getId());
      }
      return builder.toString();
    }

    @Override
    public String toString() {
      return id + "(" + formatArguments() + ")";
    }
  }

  public final static class Argument {
    private final String id;
    private final int line;

    public Argument(final String id, final int line) {
      this.id = id;
      this.line = line;
    }

    public String getId() {
      return id;
    }

    public int getLine() {
      return line;
    }

    @Override
    public String toString() {
      return id;
    }
  }
}
