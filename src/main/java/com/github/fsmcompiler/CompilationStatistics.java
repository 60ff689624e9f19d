package com.github.fsmcompiler;

/**
 * Simple statistics holder for one compilation run.
 */
public final class CompilationStatistics {
  private final long startMillis = System.currentTimeMillis();
  private final String runId;
  int tokens;
  int states;
  int transitions;
  int sequences;
  long elapsedMillis;

  CompilationStatistics(final String runId) {
    this.runId = runId;
  }

  public String getRunId() {
    return runId;
  }

  public long getStartMillis() {
    return startMillis;
  }

  /**
   * Tokens after freeform expansion, the trailing EOF included.
   */
  public int getTokens() {
    return tokens;
  }

  public int getStates() {
    return states;
  }

  /**
   * Transitions across all states, direct and sequence alike.
   */
  public int getTransitions() {
    return transitions;
  }

  public int getSequences() {
    return sequences;
  }

  public long getElapsedMillis() {
    return elapsedMillis;
  }

  void count(final FsmModel fsm) {
    for (final FsmState state : fsm.getStates()) {
      states++;
      for (final Transition transition : state.getTransitions()) {
        transitions++;
        if (transition.getKind() == TransitionKind.SEQUENCE) {
          sequences++;
        }
      }
    }
  }

  void finish() {
    elapsedMillis = System.currentTimeMillis() - startMillis;
  }

  @Override
  public String toString() {
    return "CompilationStatistics [runId=" + runId + ", tokens=" + tokens + ", states=" + states
        + ", transitions=" + transitions + ", sequences=" + sequences + ", elapsedMillis="
        + elapsedMillis + "]";
  }
}
