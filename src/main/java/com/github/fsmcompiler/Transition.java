package com.github.fsmcompiler;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named transition declared inside a state. Transitions with the same id in different states
 * compile to a single dispatch method, so they must agree on their parameter list.
 */
public abstract class Transition {
  private final String id;
  private final int line;
  private final List<Parameter> parameters;

  protected Transition(final String id, final int line, final List<Parameter> parameters) {
    this.id = Objects.requireNonNull(id);
    this.line = line;
    this.parameters = Collections.unmodifiableList(parameters);
  }

  public String getId() {
    return id;
  }

  public int getLine() {
    return line;
  }

  public List<Parameter> getParameters() {
    return parameters;
  }

  public abstract TransitionKind getKind();

  /**
   * The state the machine lands on once this transition succeeds. For sequences this is only
   * known after validation and is null before.
   */
  public abstract TargetReference getTarget();

  /**
   * True if both transitions would produce the same method signature.
   */
  public boolean hasSameSignature(final Transition other) {
    return parameters.equals(other.parameters);
  }

  /**
   * Renders the parameter list the way it appears in a C++ signature, without parentheses.
   */
  public String formatParameters() {
    final StringBuilder builder = new StringBuilder();
    for (final Parameter parameter : parameters) {
      if (builder.length() > 0) {
        builder.append(", ");
      }
      builder.append(parameter.getType()).append(' ').append(parameter.getId());
    }
    return builder.toString();
  }

  /**
   * A typed formal parameter. Two parameters are equal when type and name match, the line is
   * ignored.
   */
  public final static class Parameter {
    private final String type;
    private final String id;
    private final int line;

    public Parameter(final String type, final String id, final int line) {
      this.type = type;
      this.id = id;
      this.line = line;
    }

    public String getType() {
      return type;
    }

    public String getId() {
      return id;
    }

    public int getLine() {
      return line;
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, id);
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Parameter)) {
        return false;
      }
      final Parameter other = (Parameter) obj;
      return Objects.equals(type, other.type) && Objects.equals(id, other.id);
    }

    @Override
    public String toString() {
      return type + " " + id;
    }
  }
}
