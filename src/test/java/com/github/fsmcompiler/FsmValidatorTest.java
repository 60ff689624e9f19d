package com.github.fsmcompiler;

import static com.github.fsmcompiler.FixtureSource.fsm;
import static com.github.fsmcompiler.FixtureSource.validated;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

import com.github.fsmcompiler.FsmCompilerException.Category;
import com.github.fsmcompiler.FsmCompilerException.Code;

/**
 * Tests for sequence resolution and reference checks.
 */
public class FsmValidatorTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static Transition transition(final FsmModel fsm, final String state,
      final String transition) {
    return fsm.findState(state).get().findTransition(transition).get();
  }

  @Test
  public void testSequenceResolvesToLandingState() throws FsmCompilerException {
    final FsmModel fsm = validated(fsm(
        "A { go() => B; run() => go() => hop(); }",
        "B { hop() => C; }",
        "C { }"));
    final TargetReference target = transition(fsm, "A", "run").getTarget();
    assertEquals("C", target.getId());
    // the resolved target points at the sequence declaration
    assertEquals(3, target.getLine());
  }

  @Test
  public void testTurnstileSequence() throws Exception {
    final FsmModel fsm = validated(FixtureSource.read(FixtureSource.TURNSTILE));
    assertEquals("Locked", transition(fsm, "Locked", "payAndPass").getTarget().getId());
  }

  @Test
  public void testNestedSequences() throws FsmCompilerException {
    final FsmModel fsm = validated(fsm(
        "A { go() => B; run() => go() => hop(); twice() => run() => back(); }",
        "B { hop() => C; }",
        "C { back() => A; }"));
    assertEquals("C", transition(fsm, "A", "run").getTarget().getId());
    assertEquals("A", transition(fsm, "A", "twice").getTarget().getId());
  }

  @Test
  public void testUnknownTransitionInLandingState() {
    final FsmCompilerException error = assertThrows(FsmCompilerException.class,
        () -> validated(fsm(
            "A {",
            "  go() => B;",
            "  run() => go()",
            "    => nope();",
            "}",
            "B { }")));
    assertEquals(Code.UNKNOWN_TRANSITION, error.getCode());
    assertEquals(Category.UNKNOWN_REFERENCE, error.getCategory());
    // reported where the step is written
    assertEquals(6, error.getLine());
    assertEquals("Unknown transition \"nope\" in state \"B\"", error.getDetail());
  }

  @Test
  public void testUnknownState() {
    final FsmCompilerException error = assertThrows(FsmCompilerException.class,
        () -> validated(fsm("A { go() => Nowhere; }")));
    assertEquals(Code.UNKNOWN_STATE, error.getCode());
    assertEquals(Category.UNKNOWN_REFERENCE, error.getCategory());
    assertEquals(3, error.getLine());
    assertEquals("test.fsm:3: Unknown state \"Nowhere\"", error.getMessage());
  }

  @Test
  public void testSelfCallingSequence() {
    final FsmCompilerException error = assertThrows(FsmCompilerException.class,
        () -> validated(fsm("A { loop() => loop(); }")));
    assertEquals(Code.CYCLIC_SEQUENCE, error.getCode());
  }

  @Test
  public void testMutuallyRecursiveSequences() {
    final FsmCompilerException error = assertThrows(FsmCompilerException.class,
        () -> validated(fsm("A { x() => y(); y() => x(); }")));
    assertEquals(Code.CYCLIC_SEQUENCE, error.getCode());
    assertEquals(3, error.getLine());
  }

  @Test
  public void testRepeatedStepIsNotACycle() throws FsmCompilerException {
    final FsmModel fsm = validated(fsm(
        "A { step() => B; two() => step() => step(); }",
        "B { step() => A; }"));
    assertEquals("A", transition(fsm, "A", "two").getTarget().getId());
  }

  @Test
  public void testSignatureMismatch() {
    final FsmCompilerException error = assertThrows(FsmCompilerException.class,
        () -> validated(fsm("B { go(long a) => A; }", "A { go(int a) => B; }")));
    assertEquals(Code.SIGNATURE_MISMATCH, error.getCode());
    // A sorts first, so the declaration in B is the odd one out
    assertEquals(3, error.getLine());
    assertEquals("Transition \"go\" in \"B\" declares (long a), previously declared as (int a)",
        error.getDetail());
  }

  @Test
  public void testFirstErrorInSortedOrderWins() {
    final FsmCompilerException error = assertThrows(FsmCompilerException.class,
        () -> validated(fsm("Zulu { go() => Nowhere; }", "Alpha { go() => Elsewhere; }")));
    assertEquals(4, error.getLine());
    assertEquals("Unknown state \"Elsewhere\"", error.getDetail());
  }

  @Test
  public void testMachineWithoutStates() {
    final FsmCompilerException error =
        assertThrows(FsmCompilerException.class, () -> validated(fsm()));
    assertEquals(Code.UNKNOWN_STATE, error.getCode());
    assertEquals(1, error.getLine());
    assertEquals("Fsm \"F\" declares no states", error.getDetail());
  }
}
