package com.github.fsmcompiler;

/**
 * Renders a validated model into one generated artifact. Implementations make no decisions of
 * their own: the same model and configuration always render the same text.
 */
interface Emitter {

  /**
   * @param fsm a sorted and validated model
   * @param baseName the input file name without directory and extension
   * @param sourcePath the absolute input path used in line markers
   */
  String emit(FsmModel fsm, String baseName, String sourcePath);
}
