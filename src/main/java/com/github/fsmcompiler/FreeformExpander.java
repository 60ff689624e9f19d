package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Explodes the freeform blocks whose payload is itself FSM source back into tokens.
 *
 * The top-level lexer treats every brace block as opaque so that header, hook and precondition
 * snippets pass through uninterpreted. Only two grammatical positions hold structured content:
 * the body after {@code fsm <id>} and the body after a state {@code <id>}. Each is found by a
 * linear scan and its freeform token is replaced, in place, by {@code "{"}, the re-lexed payload
 * and {@code "}"}.
 */
final class FreeformExpander {
  private static final Logger logger = LogManager.getLogger(FreeformExpander.class.getSimpleName());

  private final LexerConfiguration config;
  private final String path;

  FreeformExpander(final LexerConfiguration config, final String path) {
    this.config = config;
    this.path = path;
  }

  /**
   * Runs both passes over the given buffer and returns it.
   */
  List<Token> expand(final List<Token> tokens) throws FsmCompilerException {
    final int fsmBodies = expandFsmBody(tokens);
    final int stateBodies = expandStateBodies(tokens);
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Expanded %d fsm and %d state bodies in %s", fsmBodies,
          stateBodies, path));
    }
    return tokens;
  }

  // fsm <id> <freeform>
  int expandFsmBody(final List<Token> tokens) throws FsmCompilerException {
    int expanded = 0;
    int index = 0;
    while (index + 2 < tokens.size()) {
      if (tokens.get(index).is("fsm") && tokens.get(index).is(TokenKind.KEYWORD)
          && tokens.get(index + 1).is(TokenKind.ID)
          && tokens.get(index + 2).is(TokenKind.FREEFORM)) {
        index = splice(tokens, index + 2);
        expanded++;
      } else {
        index++;
      }
    }
    return expanded;
  }

  // <id> <freeform>
  int expandStateBodies(final List<Token> tokens) throws FsmCompilerException {
    int expanded = 0;
    int index = 0;
    while (index + 1 < tokens.size()) {
      if (tokens.get(index).is(TokenKind.ID) && tokens.get(index + 1).is(TokenKind.FREEFORM)) {
        index = splice(tokens, index + 1);
        expanded++;
      } else {
        index++;
      }
    }
    return expanded;
  }

  /**
   * Replaces the freeform token at {@code index} and returns the index right after the inserted
   * closing brace, so that nested blocks of the payload are left alone.
   */
  private int splice(final List<Token> tokens, final int index) throws FsmCompilerException {
    final Token freeform = tokens.get(index);
    final List<Token> payload =
        new Lexer(config, path, freeform.innerText(), freeform.getLine()).tokenize();
    final Token eof = payload.remove(payload.size() - 1);

    final List<Token> replacement = new ArrayList<>(payload.size() + 2);
    replacement.add(Token.symbol(freeform.getLine(), "{"));
    replacement.addAll(payload);
    replacement.add(Token.symbol(eof.getLine(), "}"));

    tokens.remove(index);
    tokens.addAll(index, replacement);
    return index + replacement.size();
  }
}
