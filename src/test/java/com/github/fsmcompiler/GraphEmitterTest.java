package com.github.fsmcompiler;

import static com.github.fsmcompiler.FixtureSource.fsm;
import static com.github.fsmcompiler.FixtureSource.validated;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.github.fsmcompiler.CompilerConfiguration.CompilerConfigurationBuilder;

/**
 * Tests for the Graphviz output.
 */
public class GraphEmitterTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testDoorGraph() throws FsmCompilerException {
    final FsmModel fsm = validated(fsm(
        "Open { close() => Closed; slam() => close(); }",
        "Closed { open() => Open; }"));
    final String graph =
        new GraphEmitter(CompilerConfigurationBuilder.newBuilder().build()).emit(fsm, "door",
            "/src/door.fsm");
    final String expected = "// " + CompilerConfiguration.DEFAULT_BANNER + "\n"
        + "\n"
        + "digraph F {\n"
        + "    Closed [label=\"Closed\"];\n"
        + "    Open [label=\"Open\"];\n"
        + "\n"
        + "    Closed -> Open [label=\"open\"];\n"
        + "    Open -> Closed [label=\"close\"];\n"
        + "}\n";
    assertEquals(expected, graph);
  }

  @Test
  public void testSequencesHaveNoEdgeAndNoLineMarkers() throws Exception {
    final FsmModel fsm = validated(FixtureSource.read(FixtureSource.TURNSTILE));
    final String graph = new GraphEmitter(CompilerConfigurationBuilder.newBuilder().build())
        .emit(fsm, "turnstile", "/src/turnstile.fsm");
    assertTrue(graph.contains("    Locked -> Unlocked [label=\"coin\"];\n"));
    assertTrue(graph.contains("    Broken -> Locked [label=\"repair\"];\n"));
    assertFalse(graph.contains("payAndPass"));
    assertFalse(graph.contains("#line"));
  }

  @Test
  public void testIndentFollowsConfiguration() throws FsmCompilerException {
    final FsmModel fsm = validated(fsm("A { }"));
    final String graph =
        new GraphEmitter(CompilerConfigurationBuilder.newBuilder().indent("\t").build()).emit(fsm,
            "a", "/src/a.fsm");
    assertTrue(graph, graph.contains("\n\tA [label=\"A\"];\n"));
  }
}
