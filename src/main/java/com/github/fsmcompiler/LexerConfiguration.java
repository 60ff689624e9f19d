package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * This class encapsulates the lexical grammar handed to a {@link Lexer}: the keyword set, the
 * symbol set and the freeform delimiter pairs. Use the {@code LexerConfigurationBuilder} to build
 * it, or {@link #fsmGrammar()} for the grammar of the FSM description language.
 *
 * Notes:<br>
 * 1. symbols are matched longest first, so "=>" wins over a hypothetical "=".<br>
 * 2. a freeform opening delimiter always wins over a symbol starting with the same character, and
 * so the builder rejects such overlaps.<br>
 */
public final class LexerConfiguration {
  private final Set<String> keywords;
  private final List<String> symbols;
  private final List<FreeformDelimiters> freeformDelimiters;

  public static LexerConfiguration fsmGrammar() {
    try {
      return LexerConfigurationBuilder.newBuilder()
          .keywords("header", "cpp", "fsm", "class", "as", "before", "after", "allow", "forbid")
          .symbols("=>", "(", ")", ";", ",").freeform('{', '}').build();
    } catch (FsmCompilerException exception) {
      throw new IllegalStateException("Built-in FSM grammar is invalid", exception);
    }
  }

  public Set<String> getKeywords() {
    return keywords;
  }

  /**
   * Symbols sorted by descending length.
   */
  public List<String> getSymbols() {
    return symbols;
  }

  public List<FreeformDelimiters> getFreeformDelimiters() {
    return freeformDelimiters;
  }

  public boolean isKeyword(final String identifier) {
    return keywords.contains(identifier);
  }

  FreeformDelimiters freeformOpenedBy(final char character) {
    for (final FreeformDelimiters delimiters : freeformDelimiters) {
      if (delimiters.getOpen() == character) {
        return delimiters;
      }
    }
    return null;
  }

  /**
   * A pair of characters opening and closing a freeform block.
   */
  public final static class FreeformDelimiters {
    private final char open;
    private final char close;

    FreeformDelimiters(final char open, final char close) {
      this.open = open;
      this.close = close;
    }

    public char getOpen() {
      return open;
    }

    public char getClose() {
      return close;
    }

    @Override
    public String toString() {
      return "" + open + close;
    }
  }

  public final static class LexerConfigurationBuilder {
    private final Set<String> keywords = new LinkedHashSet<>();
    private final Set<String> symbols = new LinkedHashSet<>();
    private final List<FreeformDelimiters> freeformDelimiters = new ArrayList<>();

    public static LexerConfigurationBuilder newBuilder() {
      return new LexerConfigurationBuilder();
    }

    public LexerConfigurationBuilder keywords(final String... keywords) {
      for (String keyword : keywords) {
        this.keywords.add(keyword);
      }
      return this;
    }

    public LexerConfigurationBuilder symbols(final String... symbols) {
      for (String symbol : symbols) {
        this.symbols.add(symbol);
      }
      return this;
    }

    public LexerConfigurationBuilder freeform(final char open, final char close) {
      this.freeformDelimiters.add(new FreeformDelimiters(open, close));
      return this;
    }

    public LexerConfiguration build() throws FsmCompilerException {
      final LexerConfiguration config =
          new LexerConfiguration(keywords, new ArrayList<>(symbols), freeformDelimiters);
      config.validate();
      return config;
    }

    private LexerConfigurationBuilder() {}
  }

  private void validate() throws FsmCompilerException {
    StringBuilder messages = new StringBuilder();
    for (final String keyword : keywords) {
      if (keyword == null || !keyword.matches("[A-Za-z_][A-Za-z0-9_]*")) {
        messages.append("Keyword '").append(keyword).append("' is not an identifier. ");
      }
    }
    for (final String symbol : symbols) {
      if (symbol == null || symbol.isEmpty()) {
        messages.append("Symbols cannot be null or empty. ");
      } else if (freeformOpenedBy(symbol.charAt(0)) != null) {
        messages.append("Symbol '").append(symbol)
            .append("' starts with a freeform delimiter. ");
      }
    }
    for (final FreeformDelimiters delimiters : freeformDelimiters) {
      if (delimiters.getOpen() == delimiters.getClose()) {
        messages.append("Freeform delimiters '").append(delimiters)
            .append("' must be distinct characters. ");
      }
    }
    if (messages.length() > 0) {
      throw new FsmCompilerException(FsmCompilerException.Code.INVALID_CONFIG, "<config>", 0,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "LexerConfiguration [keywords=" + keywords + ", symbols=" + symbols
        + ", freeformDelimiters=" + freeformDelimiters + "]";
  }

  private LexerConfiguration(final Set<String> keywords, final List<String> symbols,
      final List<FreeformDelimiters> freeformDelimiters) {
    this.keywords = Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
    final List<String> sortedSymbols = new ArrayList<>(symbols);
    sortedSymbols.sort(Comparator.comparingInt(symbol -> symbol == null ? 0 : -symbol.length()));
    this.symbols = Collections.unmodifiableList(sortedSymbols);
    this.freeformDelimiters = Collections.unmodifiableList(new ArrayList<>(freeformDelimiters));
  }

}
