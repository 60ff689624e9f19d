package com.github.fsmcompiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.github.fsmcompiler.CompilerConfiguration.CompilerConfigurationBuilder;
import com.github.fsmcompiler.FsmCompiler.FsmCompilerBuilder;
import com.github.fsmcompiler.FsmCompilerException.Category;
import com.github.fsmcompiler.LexerConfiguration.LexerConfigurationBuilder;

/**
 * Tests for the compiler and lexer configurations.
 */
public class ConfigurationTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testDefaults() throws FsmCompilerException {
    final CompilerConfiguration config = CompilerConfigurationBuilder.newBuilder().build();
    assertEquals("    ", config.getIndent());
    assertEquals(CompilerConfiguration.DEFAULT_BANNER, config.getBanner());
    assertEquals("DEBUG_FSM", config.getDebugMacro());
    assertEquals("h", config.getDeclarationExtension());
    assertEquals("cpp", config.getDefinitionExtension());
    assertEquals("dot", config.getGraphExtension());
    assertTrue(config.getEmitLineMarkers());

    final FsmCompiler compiler = FsmCompilerBuilder.newBuilder().config(config).build();
    assertSame(config, compiler.getConfiguration());
    assertEquals("h", FsmCompilerBuilder.newBuilder().build().getConfiguration()
        .getDeclarationExtension());
  }

  @Test
  public void testInvalidCompilerConfiguration() {
    final FsmCompilerException error = assertThrows(FsmCompilerException.class,
        () -> CompilerConfigurationBuilder.newBuilder().indent("--").banner("two\nlines")
            .debugMacro("1BAD").graphExtension("h").build());
    assertEquals(Category.INVALID_CONFIG, error.getCategory());
    assertEquals("<config>", error.getPath());
    final String detail = error.getDetail();
    assertTrue(detail, detail.contains("Indent"));
    assertTrue(detail, detail.contains("Banner"));
    assertTrue(detail, detail.contains("Debug macro"));
    assertTrue(detail, detail.contains("distinct"));
  }

  @Test
  public void testInvalidExtension() {
    final FsmCompilerException error = assertThrows(FsmCompilerException.class,
        () -> CompilerConfigurationBuilder.newBuilder().definitionExtension("c.pp").build());
    assertTrue(error.getDetail(), error.getDetail().startsWith("Definition extension"));
  }

  @Test
  public void testInvalidLexerConfiguration() {
    // 1. keywords must be identifiers
    FsmCompilerException error = assertThrows(FsmCompilerException.class,
        () -> LexerConfigurationBuilder.newBuilder().keywords("fsm", "not-a-word").build());
    assertEquals(Category.INVALID_CONFIG, error.getCategory());

    // 2. symbols cannot start like a freeform block
    error = assertThrows(FsmCompilerException.class,
        () -> LexerConfigurationBuilder.newBuilder().freeform('{', '}').symbols("{{").build());
    assertEquals(Category.INVALID_CONFIG, error.getCategory());

    // 3. freeform delimiters must differ
    error = assertThrows(FsmCompilerException.class,
        () -> LexerConfigurationBuilder.newBuilder().freeform('|', '|').build());
    assertEquals(Category.INVALID_CONFIG, error.getCategory());
  }

  @Test
  public void testCustomFreeformDelimiters() throws FsmCompilerException {
    final LexerConfiguration config =
        LexerConfigurationBuilder.newBuilder().freeform('[', ']').build();
    final Lexer lexer = new Lexer(config, "test.fsm", "a [ b [ c ] ] d", 1);
    assertEquals(TokenKind.ID, lexer.next().getKind());
    final Token block = lexer.next();
    assertEquals(TokenKind.FREEFORM, block.getKind());
    assertEquals("[ b [ c ] ]", block.getLexeme());
    assertEquals("d", lexer.next().getLexeme());
    // braces no longer open anything
    assertNull(config.freeformOpenedBy('{'));
  }
}
