package com.github.fsmcompiler;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.openjdk.jmh.annotations.Benchmark;

import com.github.fsmcompiler.FsmCompiler.FsmCompilerBuilder;

public class FsmCompilerBenchmarkTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Path INPUT = Paths.get("turnstile.fsm");

  @Benchmark
  public void testCompileTurnstile() throws Exception {
    // 1. prep the compiler and the source
    final FsmCompiler compiler = FsmCompilerBuilder.newBuilder().build();
    final String source = FixtureSource.read(FixtureSource.TURNSTILE);

    // 2. run the whole pipeline in memory
    final Compilation compilation = compiler.compile(INPUT, "/src/turnstile.fsm", source);

    // 3. touch every artifact
    int length = compilation.getDeclaration().length() + compilation.getDefinition().length()
        + compilation.getGraph().length();
    length += compilation.getStatistics().getTokens();
  }

  public static void main(String args[]) throws Exception {
    FsmCompilerBenchmarkTest test = new FsmCompilerBenchmarkTest();
    test.testCompileTurnstile();
  }

}
