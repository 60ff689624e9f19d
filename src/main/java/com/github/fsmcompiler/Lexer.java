package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmcompiler.FsmCompilerException.Code;
import com.github.fsmcompiler.LexerConfiguration.FreeformDelimiters;

/**
 * A C-like tokenizer. Tokens are produced lazily by {@link #next()}, the sequence always ends with
 * an {@link TokenKind#EOF} token and can be restarted with {@link #reset()}.
 *
 * Notes:<br>
 * 1. comments are handed out as {@link TokenKind#LINE_COMMENT} and
 * {@link TokenKind#BLOCK_COMMENT}; {@link #tokenize()} drops them.<br>
 * 2. a freeform block is captured verbatim, delimiters included, counting nested occurrences of
 * the same delimiter pair. Nothing inside it is interpreted, strings and comments included.<br>
 * 3. the lexer never shares position state with another instance. Re-lexing a freeform payload
 * means creating a new lexer seeded with the payload's starting line.<br>
 */
public final class Lexer {
  private static final Logger logger = LogManager.getLogger(Lexer.class.getSimpleName());

  private final LexerConfiguration config;
  private final String path;
  private final String source;
  private final int startLine;

  private int position;
  private int line;
  private boolean exhausted;

  public Lexer(final LexerConfiguration config, final String path, final String source,
      final int startLine) {
    this.config = config;
    this.path = path;
    this.source = source == null ? "" : source;
    this.startLine = startLine;
    reset();
  }

  /**
   * Rewind to the beginning of the source.
   */
  public void reset() {
    position = 0;
    line = startLine;
    exhausted = false;
  }

  /**
   * Drain the lexer into a list, skipping comments. The last element is always the EOF token.
   */
  public List<Token> tokenize() throws FsmCompilerException {
    final List<Token> tokens = new ArrayList<>();
    Token token;
    do {
      do {
        token = next();
      } while (token.getKind().isComment());
      tokens.add(token);
    } while (!token.is(TokenKind.EOF));
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Tokenized %s from line %d into %d tokens", path, startLine,
          tokens.size()));
    }
    return tokens;
  }

  public Token next() throws FsmCompilerException {
    if (exhausted) {
      return new Token(line, TokenKind.EOF, "");
    }
    skipWhitespace();
    if (position >= source.length()) {
      exhausted = true;
      return new Token(line, TokenKind.EOF, "");
    }

    final char current = source.charAt(position);
    final FreeformDelimiters delimiters = config.freeformOpenedBy(current);
    if (delimiters != null) {
      return freeform(delimiters);
    }
    if (current == '/' && peekChar(1) == '/') {
      return lineComment();
    }
    if (current == '/' && peekChar(1) == '*') {
      return blockComment();
    }
    if (isIdentifierStart(current)) {
      return identifier();
    }
    if (current >= '0' && current <= '9') {
      return number();
    }
    if (current == '"' || current == '\'') {
      return string(current);
    }
    for (final String symbol : config.getSymbols()) {
      if (source.startsWith(symbol, position)) {
        position += symbol.length();
        return Token.symbol(line, symbol);
      }
    }
    throw error(line, String.format("Invalid character in input: '%s'", printable(current)));
  }

  private void skipWhitespace() {
    while (position < source.length()) {
      final char current = source.charAt(position);
      if (current == '\n') {
        line++;
      } else if (!Character.isWhitespace(current)) {
        return;
      }
      position++;
    }
  }

  private Token freeform(final FreeformDelimiters delimiters) throws FsmCompilerException {
    final int openLine = line;
    final int begin = position;
    int depth = 0;
    while (position < source.length()) {
      final char current = source.charAt(position++);
      if (current == '\n') {
        line++;
      } else if (current == delimiters.getOpen()) {
        depth++;
      } else if (current == delimiters.getClose()) {
        depth--;
        if (depth == 0) {
          return new Token(openLine, TokenKind.FREEFORM, source.substring(begin, position));
        }
      }
    }
    throw error(openLine, String.format("Unbalanced freeform block, '%c' missing its '%c'",
        delimiters.getOpen(), delimiters.getClose()));
  }

  private Token lineComment() {
    final int begin = position;
    while (position < source.length() && source.charAt(position) != '\n') {
      position++;
    }
    return new Token(line, TokenKind.LINE_COMMENT, source.substring(begin, position));
  }

  private Token blockComment() throws FsmCompilerException {
    final int openLine = line;
    final int end = source.indexOf("*/", position + 2);
    if (end < 0) {
      throw error(openLine, "Unterminated comment");
    }
    final String lexeme = source.substring(position, end + 2);
    line += countNewlines(lexeme);
    position = end + 2;
    return new Token(openLine, TokenKind.BLOCK_COMMENT, lexeme);
  }

  private Token identifier() {
    final int begin = position;
    while (position < source.length() && isIdentifierPart(source.charAt(position))) {
      position++;
    }
    final String lexeme = source.substring(begin, position);
    return new Token(line, config.isKeyword(lexeme) ? TokenKind.KEYWORD : TokenKind.ID, lexeme);
  }

  private Token number() {
    final int begin = position;
    while (position < source.length()) {
      final char current = source.charAt(position);
      if (!isIdentifierPart(current) && current != '.') {
        break;
      }
      position++;
    }
    return new Token(line, TokenKind.NUMBER, source.substring(begin, position));
  }

  private Token string(final char quote) throws FsmCompilerException {
    final int begin = position++;
    while (position < source.length()) {
      final char current = source.charAt(position++);
      if (current == quote) {
        return new Token(line, TokenKind.STRING, source.substring(begin, position));
      } else if (current == '\\' && position < source.length()
          && source.charAt(position) != '\n') {
        position++;
      } else if (current == '\n') {
        break;
      }
    }
    throw error(line, quote == '"' ? "Unterminated string" : "Unterminated character literal");
  }

  private char peekChar(final int offset) {
    final int index = position + offset;
    return index < source.length() ? source.charAt(index) : '\0';
  }

  private FsmCompilerException error(final int errorLine, final String message) {
    return new FsmCompilerException(Code.LEX_ERROR, path, errorLine, message);
  }

  private static boolean isIdentifierStart(final char character) {
    return character == '_' || (character >= 'a' && character <= 'z')
        || (character >= 'A' && character <= 'Z');
  }

  private static boolean isIdentifierPart(final char character) {
    return isIdentifierStart(character) || (character >= '0' && character <= '9');
  }

  private static int countNewlines(final String text) {
    int count = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        count++;
      }
    }
    return count;
  }

  private static String printable(final char character) {
    return Character.isISOControl(character) ? String.format("\\u%04x", (int) character)
        : String.valueOf(character);
  }

  @Override
  public String toString() {
    return "Lexer [path=" + path + ", startLine=" + startLine + ", line=" + line + ", position="
        + position + "]";
  }
}
