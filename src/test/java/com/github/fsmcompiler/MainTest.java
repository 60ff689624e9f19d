package com.github.fsmcompiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests for the command line entry point.
 */
public class MainTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

  private int run(final String... args) throws Exception {
    try (PrintStream err = new PrintStream(stderr, true, StandardCharsets.UTF_8.name())) {
      return Main.run(args, err);
    }
  }

  private String stderr() {
    return new String(stderr.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test
  public void testUsage() throws Exception {
    assertEquals(1, run());
    assertEquals("Usage: fsmc inputfile", stderr().trim());

    stderr.reset();
    assertEquals(1, run("a.fsm", "b.fsm"));
    assertEquals("Usage: fsmc inputfile", stderr().trim());
  }

  @Test
  public void testSuccessIsSilent() throws Exception {
    final Path input =
        FixtureSource.copy(FixtureSource.TURNSTILE, folder.newFile("turnstile.fsm").toPath());
    assertEquals(0, run(input.toString()));
    assertEquals("", stderr());
    assertTrue(Files.exists(input.resolveSibling("turnstile.h")));
    assertTrue(Files.exists(input.resolveSibling("turnstile.cpp")));
    assertTrue(Files.exists(input.resolveSibling("turnstile.dot")));
  }

  @Test
  public void testDiagnosticOnError() throws Exception {
    final Path input = folder.newFile("bad.fsm").toPath();
    Files.write(input, "fsm F {\n  class C as c\n  S {}\n}\n".getBytes(StandardCharsets.UTF_8));
    assertEquals(1, run(input.toString()));
    assertEquals(input + ":3: \";\" expected, found \"<id>\"", stderr().trim());
    assertEquals(1, folder.getRoot().listFiles().length);
  }

  @Test
  public void testMissingInput() throws Exception {
    final String input = folder.getRoot().toPath().resolve("nope.fsm").toString();
    assertEquals(1, run(input));
    assertTrue(stderr(), stderr().startsWith(input + ":0: Error opening input file"));
  }
}
