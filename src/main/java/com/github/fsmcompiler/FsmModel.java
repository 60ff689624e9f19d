package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The root of a parsed machine description.
 *
 * Lifecycle:<br>
 * 1. built write-once by {@link FsmParser}, states in declaration order<br>
 * 2. {@link #sort()} re-orders states and transitions by id for deterministic output<br>
 * 3. {@link FsmValidator} attaches resolved sequence targets<br>
 * 4. read-only during emission<br>
 */
public final class FsmModel {
  private final String id;
  private final int line;
  private Optional<VerbatimBlock> header = Optional.empty();
  private Optional<VerbatimBlock> cpp = Optional.empty();
  private Optional<VerbatimBlock> before = Optional.empty();
  private Optional<VerbatimBlock> after = Optional.empty();
  private String contextClass;
  private String contextField;
  // id of the first declared state, regardless of sort order
  private String begin;
  private Map<String, FsmState> states = new LinkedHashMap<>();

  public FsmModel(final String id, final int line) {
    this.id = id;
    this.line = line;
  }

  public String getId() {
    return id;
  }

  public int getLine() {
    return line;
  }

  public Optional<VerbatimBlock> getHeader() {
    return header;
  }

  public Optional<VerbatimBlock> getCpp() {
    return cpp;
  }

  public Optional<VerbatimBlock> getBefore() {
    return before;
  }

  public Optional<VerbatimBlock> getAfter() {
    return after;
  }

  public String getContextClass() {
    return contextClass;
  }

  public String getContextField() {
    return contextField;
  }

  public String getBegin() {
    return begin;
  }

  public Collection<FsmState> getStates() {
    return Collections.unmodifiableCollection(states.values());
  }

  public Optional<FsmState> findState(final String stateId) {
    return Optional.ofNullable(states.get(stateId));
  }

  /**
   * One transition per distinct id across all states, sorted by id. Where several states declare
   * the same id, the one found in the first state (by sort order) is the representative.
   */
  public List<Transition> getDistinctTransitions() {
    final Map<String, Transition> distinct = new TreeMap<>();
    for (final FsmState state : states.values()) {
      for (final Transition transition : state.getTransitions()) {
        distinct.putIfAbsent(transition.getId(), transition);
      }
    }
    return new ArrayList<>(distinct.values());
  }

  void setHeader(final VerbatimBlock header) {
    this.header = Optional.of(header);
  }

  void setCpp(final VerbatimBlock cpp) {
    this.cpp = Optional.of(cpp);
  }

  void setBefore(final VerbatimBlock before) {
    this.before = Optional.of(before);
  }

  void setAfter(final VerbatimBlock after) {
    this.after = Optional.of(after);
  }

  void bindContext(final String contextClass, final String contextField) {
    this.contextClass = contextClass;
    this.contextField = contextField;
  }

  /**
   * Returns false, leaving the model untouched, if the id is already taken. The first state ever
   * added becomes the initial state.
   */
  boolean addState(final FsmState state) {
    if (states.putIfAbsent(state.getId(), state) != null) {
      return false;
    }
    if (begin == null) {
      begin = state.getId();
    }
    return true;
  }

  void sort() {
    final List<FsmState> sorted = new ArrayList<>(states.values());
    sorted.sort(Comparator.comparing(FsmState::getId));
    final Map<String, FsmState> resorted = new LinkedHashMap<>();
    for (final FsmState state : sorted) {
      state.sortTransitions();
      resorted.put(state.getId(), state);
    }
    states = resorted;
  }

  @Override
  public String toString() {
    return "FsmModel [id=" + id + ", line=" + line + ", contextClass=" + contextClass
        + ", contextField=" + contextField + ", begin=" + begin + ", states=" + states.values()
        + "]";
  }
}
