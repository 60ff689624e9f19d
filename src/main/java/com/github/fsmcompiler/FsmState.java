package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A state of the machine with its optional hooks and its transitions keyed by id. Transitions are
 * kept in declaration order until {@link #sortTransitions()} puts them in id order.
 */
public final class FsmState {
  private final String id;
  private final int line;
  private Optional<VerbatimBlock> before = Optional.empty();
  private Optional<VerbatimBlock> after = Optional.empty();
  private Map<String, Transition> transitions = new LinkedHashMap<>();

  public FsmState(final String id, final int line) {
    this.id = id;
    this.line = line;
  }

  public String getId() {
    return id;
  }

  public int getLine() {
    return line;
  }

  public Optional<VerbatimBlock> getBefore() {
    return before;
  }

  public Optional<VerbatimBlock> getAfter() {
    return after;
  }

  void setBefore(final VerbatimBlock before) {
    this.before = Optional.of(before);
  }

  void setAfter(final VerbatimBlock after) {
    this.after = Optional.of(after);
  }

  public Optional<Transition> findTransition(final String transitionId) {
    return Optional.ofNullable(transitions.get(transitionId));
  }

  public boolean hasTransition(final String transitionId) {
    return transitions.containsKey(transitionId);
  }

  public Collection<Transition> getTransitions() {
    return Collections.unmodifiableCollection(transitions.values());
  }

  /**
   * Returns false, leaving the state untouched, if the id is already taken.
   */
  boolean addTransition(final Transition transition) {
    return transitions.putIfAbsent(transition.getId(), transition) == null;
  }

  void sortTransitions() {
    final List<Transition> sorted = new ArrayList<>(transitions.values());
    sorted.sort(Comparator.comparing(Transition::getId));
    final Map<String, Transition> resorted = new LinkedHashMap<>();
    for (final Transition transition : sorted) {
      resorted.put(transition.getId(), transition);
    }
    transitions = resorted;
  }

  @Override
  public String toString() {
    return "FsmState [id=" + id + ", line=" + line + ", transitions=" + transitions.keySet() + "]";
  }
}
