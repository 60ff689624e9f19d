package com.github.fsmcompiler;

import static com.github.fsmcompiler.FixtureSource.fsm;
import static com.github.fsmcompiler.FixtureSource.validated;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.github.fsmcompiler.CompilerConfiguration.CompilerConfigurationBuilder;

/**
 * Tests for the generated class declaration.
 */
public class DeclarationEmitterTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testDoorDeclaration() throws FsmCompilerException {
    final FsmModel fsm = validated("fsm Door {\n"
        + "  class Ctx as ctx;\n"
        + "  Open { close() => Closed; slam() => close(); }\n"
        + "  Closed { open() => Open; }\n"
        + "}\n");
    final String declaration =
        new DeclarationEmitter(CompilerConfigurationBuilder.newBuilder().build()).emit(fsm,
            "door", "/src/door.fsm");
    final String expected = "// " + CompilerConfiguration.DEFAULT_BANNER + "\n"
        + "\n"
        + "#pragma once\n"
        + "\n"
        + "class Door {\n"
        + "public:\n"
        + "    enum class State {\n"
        + "        Closed,\n"
        + "        Open,\n"
        + "    };\n"
        + "\n"
        + "    Door(Ctx& ctx): ctx(ctx), __state(State::Open) {}\n"
        + "\n"
        + "    State currentState() const { return __state; }\n"
        + "\n"
        + "#ifdef DEBUG_FSM\n"
        + "    const char* stateName(State state) const;\n"
        + "    void printf(const char* fmt, ...);\n"
        + "#endif\n"
        + "\n"
        + "    bool close();\n"
        + "    bool open();\n"
        + "    bool slam();\n"
        + "\n"
        + "protected:\n"
        + "    bool before() const;\n"
        + "    bool before(State state) const;\n"
        + "    void after() const;\n"
        + "    void after(State state) const;\n"
        + "\n"
        + "    Ctx& ctx;\n"
        + "    State __state;\n"
        + "};\n";
    assertEquals(expected, declaration);
  }

  @Test
  public void testHeaderBlockWithLineMarker() throws Exception {
    final FsmModel fsm = validated(FixtureSource.read(FixtureSource.TURNSTILE));
    final String declaration =
        new DeclarationEmitter(CompilerConfigurationBuilder.newBuilder().build()).emit(fsm,
            "turnstile", "/src/turnstile.fsm");

    // 1. the header lands between the pragma and the class
    final int pragma = declaration.indexOf("#pragma once");
    final int header = declaration.indexOf("#line 2 \"/src/turnstile.fsm\"\n");
    final int include = declaration.indexOf("#include \"Turnstile.h\"");
    final int klass = declaration.indexOf("class TurnstileFsm {");
    assertTrue(pragma >= 0 && pragma < header && header < include && include < klass);

    // 2. parameters show up in the signatures, once per distinct id
    assertTrue(declaration.contains("    bool coin(int cents);\n"));
    assertTrue(declaration.contains("    bool payAndPass(int cents);\n"));
    assertEquals(declaration.indexOf("bool coin("), declaration.lastIndexOf("bool coin("));
    assertTrue(declaration.contains("TurnstileFsm(Turnstile& ctx): turnstile(ctx), "
        + "__state(State::Locked) {}"));
  }

  @Test
  public void testCustomBannerMacroAndNoMarkers() throws Exception {
    final CompilerConfiguration config = CompilerConfigurationBuilder.newBuilder()
        .banner("custom banner").debugMacro("TRACE_FSM").emitLineMarkers(false).build();
    final FsmModel fsm = validated(FixtureSource.read(FixtureSource.TURNSTILE));
    final String declaration = new DeclarationEmitter(config).emit(fsm, "turnstile",
        "/src/turnstile.fsm");
    assertTrue(declaration.startsWith("// custom banner\n\n"));
    assertTrue(declaration.contains("#ifdef TRACE_FSM\n"));
    assertFalse(declaration.contains("#line"));
    assertFalse(declaration.contains("DEBUG_FSM"));
  }
}
