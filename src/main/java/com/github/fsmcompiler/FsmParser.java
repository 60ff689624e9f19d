package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmcompiler.FsmCompilerException.Code;
import com.github.fsmcompiler.SequenceTransition.Argument;
import com.github.fsmcompiler.SequenceTransition.Step;
import com.github.fsmcompiler.Transition.Parameter;

/**
 * Recursive-descent parser over an already expanded token list (see {@link FreeformExpander}).
 *
 * <pre>
 * fsm        := (("header"|"cpp") FREEFORM)* "fsm" ID "{"
 *               "class" ID "as" ID ";"
 *               (("before"|"after") FREEFORM)*
 *               state* "}" EOF
 * state      := ID "{" (("before"|"after") FREEFORM)* transition* "}"
 * transition := ID params ( "=>" ID (FREEFORM ";"? | ";")
 *                         | "=>" ID args (("=>"|",") ID args)* ";" )
 * params     := "(" (ID ID ("," ID ID)*)? ")"
 * args       := "(" (ID ("," ID)*)? ")"
 * </pre>
 *
 * The first error ends the parse, no partial model is ever returned.
 */
final class FsmParser {
  private static final Logger logger = LogManager.getLogger(FsmParser.class.getSimpleName());

  private static final Pattern ALLOW = Pattern.compile("\\ballow\\b");
  private static final Pattern FORBID = Pattern.compile("\\bforbid\\b");

  private final String path;
  private final List<Token> tokens;
  private int current;

  FsmParser(final String path, final List<Token> tokens) {
    this.path = path;
    this.tokens = tokens;
  }

  FsmModel parse() throws FsmCompilerException {
    current = 0;
    VerbatimBlock header = null;
    VerbatimBlock cpp = null;

    // verbatim blocks copied into the generated declaration and definition
    while (peek(1).is("header") || peek(1).is("cpp")) {
      final Token directive = peek(1);
      if ((directive.is("header") && header != null) || (directive.is("cpp") && cpp != null)) {
        throw duplicate(Code.DUPLICATE_BLOCK, directive.getLine(),
            String.format("Duplicated \"%s\" block in fsm", directive.getLexeme()));
      }
      match();
      final VerbatimBlock block = verbatim();
      if (directive.is("header")) {
        header = block;
      } else {
        cpp = block;
      }
    }

    match("fsm");
    final Token name = match(TokenKind.ID);
    final FsmModel fsm = new FsmModel(name.getLexeme(), name.getLine());
    if (header != null) {
      fsm.setHeader(header);
    }
    if (cpp != null) {
      fsm.setCpp(cpp);
    }
    match("{");

    match("class");
    final String contextClass = match(TokenKind.ID).getLexeme();
    match("as");
    final String contextField = match(TokenKind.ID).getLexeme();
    match(";");
    fsm.bindContext(contextClass, contextField);

    // global hooks
    while (peek(1).is("before") || peek(1).is("after")) {
      final Token event = match();
      if ((event.is("before") && fsm.getBefore().isPresent())
          || (event.is("after") && fsm.getAfter().isPresent())) {
        throw duplicate(Code.DUPLICATE_BLOCK, event.getLine(),
            String.format("Duplicated event \"%s\" in fsm", event.getLexeme()));
      }
      if (event.is("before")) {
        fsm.setBefore(verbatim());
      } else {
        fsm.setAfter(verbatim());
      }
    }

    while (peek(1).is(TokenKind.ID)) {
      parseState(fsm);
    }

    match("}");
    match(TokenKind.EOF);

    fsm.sort();
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Parsed %s: %s", path, fsm));
    }
    return fsm;
  }

  private void parseState(final FsmModel fsm) throws FsmCompilerException {
    final Token name = match(TokenKind.ID);
    final FsmState state = new FsmState(name.getLexeme(), name.getLine());
    if (!fsm.addState(state)) {
      throw duplicate(Code.DUPLICATE_STATE, name.getLine(),
          String.format("Duplicated state \"%s\" in \"%s\"", state.getId(), fsm.getId()));
    }

    match("{");
    while (peek(1).is("before") || peek(1).is("after")) {
      final Token event = match();
      if ((event.is("before") && state.getBefore().isPresent())
          || (event.is("after") && state.getAfter().isPresent())) {
        throw duplicate(Code.DUPLICATE_BLOCK, event.getLine(), String
            .format("Duplicated event \"%s\" in \"%s\"", event.getLexeme(), state.getId()));
      }
      if (event.is("before")) {
        state.setBefore(verbatim());
      } else {
        state.setAfter(verbatim());
      }
    }

    while (peek(1).is(TokenKind.ID)) {
      parseTransition(state);
    }
    match("}");
  }

  private void parseTransition(final FsmState state) throws FsmCompilerException {
    final Token name = match(TokenKind.ID);
    if (state.hasTransition(name.getLexeme())) {
      throw duplicate(Code.DUPLICATE_TRANSITION, name.getLine(), String
          .format("Duplicated transition \"%s\" in \"%s\"", name.getLexeme(), state.getId()));
    }
    final List<Parameter> parameters = parseParameters();

    final Transition transition;
    if (!peek(3).is("(")) {
      // a direct move to another state
      match("=>");
      final Token target = match(TokenKind.ID);
      Optional<VerbatimBlock> precondition = Optional.empty();
      if (peek(1).is(TokenKind.FREEFORM) && peek(1).getLexeme().startsWith("{")) {
        final VerbatimBlock guard = verbatim();
        precondition =
            Optional.of(new VerbatimBlock(guard.getLine(), rewriteGuard(guard.getText())));
        if (peek(1).is(";")) {
          match();
        }
      } else {
        match(";");
      }
      transition = new DirectTransition(name.getLexeme(), name.getLine(), parameters,
          new TargetReference(target.getLexeme(), target.getLine()), precondition);
    } else {
      // a chain of other transitions that will land on some state
      final List<Step> steps = new ArrayList<>();
      match("=>");
      while (true) {
        final Token step = match(TokenKind.ID);
        steps.add(new Step(step.getLexeme(), step.getLine(), parseArguments()));
        if (!peek(1).is("=>") && !peek(1).is(",")) {
          break;
        }
        match();
      }
      match(";");
      transition = new SequenceTransition(name.getLexeme(), name.getLine(), parameters, steps);
    }
    state.addTransition(transition);
  }

  private List<Parameter> parseParameters() throws FsmCompilerException {
    match("(");
    final List<Parameter> parameters = new ArrayList<>();
    if (!peek(1).is(")")) {
      while (true) {
        final Token type = match(TokenKind.ID);
        final Token id = match(TokenKind.ID);
        parameters.add(new Parameter(type.getLexeme(), id.getLexeme(), id.getLine()));
        if (peek(1).is(")")) {
          break;
        }
        match(",");
      }
    }
    match(")");
    return parameters;
  }

  private List<Argument> parseArguments() throws FsmCompilerException {
    match("(");
    final List<Argument> arguments = new ArrayList<>();
    if (!peek(1).is(")")) {
      while (true) {
        final Token id = match(TokenKind.ID);
        arguments.add(new Argument(id.getLexeme(), id.getLine()));
        if (peek(1).is(")")) {
          break;
        }
        match(",");
      }
    }
    match(")");
    return arguments;
  }

  static String rewriteGuard(final String text) {
    final String allowed = ALLOW.matcher(text).replaceAll(Matcher.quoteReplacement("return true"));
    return FORBID.matcher(allowed).replaceAll(Matcher.quoteReplacement("return false"));
  }

  private VerbatimBlock verbatim() throws FsmCompilerException {
    final Token freeform = match(TokenKind.FREEFORM);
    return new VerbatimBlock(freeform.getLine(), freeform.innerText());
  }

  /**
   * 1-based lookahead. Reading past the end keeps returning the trailing EOF token.
   */
  Token peek(final int index) {
    final int position = current + index - 1;
    return position < tokens.size() ? tokens.get(position) : tokens.get(tokens.size() - 1);
  }

  private Token match() {
    final Token token = peek(1);
    current++;
    return token;
  }

  private Token match(final String lexeme) throws FsmCompilerException {
    if (!peek(1).is(lexeme)) {
      throw expected(lexeme);
    }
    return match();
  }

  private Token match(final TokenKind kind) throws FsmCompilerException {
    if (!peek(1).is(kind)) {
      throw expected(kind.getDisplay());
    }
    return match();
  }

  private FsmCompilerException expected(final String what) {
    final Token found = peek(1);
    return new FsmCompilerException(Code.PARSE_ERROR, path, found.getLine(),
        String.format("\"%s\" expected, found \"%s\"", what, found.describe()));
  }

  private FsmCompilerException duplicate(final Code code, final int line, final String message) {
    return new FsmCompilerException(code, path, line, message);
  }
}
