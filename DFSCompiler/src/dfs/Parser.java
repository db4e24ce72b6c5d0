package dfs;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import dfs.Tokenizer.Token;
import dfs.Tokenizer.TokenKind;

/**
 * Recursive descent parser producing an {@link AST}.
 *
 * <p>Parsing never stops at the first syntax error: a failed statement is recorded and skipped up
 * to the next {@code ;} or {@code }} at the same depth, and a failed unit up to the next unit or
 * declaration, so a single call reports every error found.
 */
public class Parser {

  private static final class ArgList {
    private final List<Value> values = new ArrayList<>();
    private final List<Expression.TagArg> tags = new ArrayList<>();
  }

  private final ImmutableList<Token> tokens;
  private final int maxNestingDepth;
  private final List<CompilerException> errors = new ArrayList<>();
  private int index = 0;
  private int depth = 0;
  // Reported once, then rethrown by every enclosing block.
  private CompilerException unclosedBlock;

  public Parser(List<Token> tokens, CompilerOptions options) {
    this.tokens = ImmutableList.copyOf(tokens);
    this.maxNestingDepth = options.maxNestingDepth();
  }

  public ImmutableList<CompilerException> errors() {
    return ImmutableList.copyOf(errors);
  }

  public AST parse() {
    Tokenizer.Pos start = peek().pos();
    List<AST.Use> uses = new ArrayList<>();
    List<Expression.Declaration> declarations = new ArrayList<>();
    List<AST.Unit> units = new ArrayList<>();
    while (!peek().is(TokenKind.EOF)) {
      int startIndex = index;
      try {
        Token token = peek();
        if (token.is(TokenKind.EVENT_HEAD)) {
          units.add(event());
        } else if (token.isKeyword("fn")) {
          units.add(function());
        } else if (token.isKeyword("proc")) {
          units.add(process());
        } else if (isDeclarationStart(token)) {
          declarations.add(declaration());
          expectSymbol(';');
        } else if (token.isKeyword("use")) {
          uses.add(use());
        } else {
          throw expected("a declaration, import, event, function or process");
        }
      } catch (CompilerException ex) {
        recordError(ex);
        synchronizeTopLevel(startIndex);
      }
    }
    return AST.create(uses, declarations, units, start);
  }

  private static boolean isDeclarationStart(Token token) {
    return token.is(TokenKind.KEYWORD) && VariableScope.fromKeyword(token.text()).isPresent();
  }

  private static boolean isUnitStart(Token token) {
    return token.is(TokenKind.EVENT_HEAD)
        || token.isKeyword("fn")
        || token.isKeyword("proc")
        || token.isKeyword("use")
        || isDeclarationStart(token);
  }

  // use "path";
  private AST.Use use() throws CompilerException {
    Token keyword = advance();
    Token path = peek();
    if (!path.is(TokenKind.TEXT) && !path.is(TokenKind.STRING)) {
      throw expected("a file path");
    }
    advance();
    expectSymbol(';');
    return AST.Use.create(path.text(), keyword.pos());
  }

  private AST.Event event() throws CompilerException {
    Token head = advance();
    boolean cancelled = false;
    if (peek().isSymbol('!')) {
      advance();
      cancelled = true;
    }
    return AST.Event.create(head.text(), cancelled, block(), head.pos());
  }

  private AST.Function function() throws CompilerException {
    Token keyword = advance();
    Token name = expect(TokenKind.IDENTIFIER, "a function name");
    Optional<String> overrideName = overrideName();

    expectSymbol('(');
    List<AST.Param> params = new ArrayList<>();
    if (!peek().isSymbol(')')) {
      do {
        params.add(param());
      } while (acceptSymbol(','));
    }
    expectSymbol(')');

    return AST.Function.create(name.text(), overrideName, params, block(), keyword.pos());
  }

  // name: type?* = default, where '?' and '*' may come in either order
  private AST.Param param() throws CompilerException {
    Token name = expect(TokenKind.IDENTIFIER, "a parameter name");
    ValueKind kind = ValueKind.ANY;
    if (acceptSymbol(':')) {
      kind = valueKind("parameter");
    }

    boolean optional = false;
    boolean variadic = false;
    while (peek().isSymbol('?') || peek().isSymbol('*')) {
      Token marker = advance();
      boolean repeated = marker.isSymbol('?') ? optional : variadic;
      if (repeated) {
        throw new CompilerException(
            CompilerException.Kind.PARSE,
            marker.pos(),
            String.format("parameter '%s' is already marked '%s'", name.text(), marker.text()));
      }
      optional |= marker.isSymbol('?');
      variadic |= marker.isSymbol('*');
    }

    Optional<Value> defaultValue = Optional.empty();
    if (acceptSymbol('=')) {
      defaultValue = Optional.of(value());
    }
    return AST.Param.create(name.text(), kind, optional, variadic, defaultValue, name.pos());
  }

  private ValueKind valueKind(String what) throws CompilerException {
    Token type = expect(TokenKind.IDENTIFIER, "a " + what + " type");
    Optional<ValueKind> parsed = ValueKind.fromSourceName(type.text());
    if (!parsed.isPresent()) {
      throw new CompilerException(
          CompilerException.Kind.PARSE,
          type.pos(),
          String.format("unknown %s type '%s'", what, type.text()));
    }
    return parsed.get();
  }

  private AST.Process process() throws CompilerException {
    Token keyword = advance();
    Token name = expect(TokenKind.IDENTIFIER, "a process name");
    Optional<String> overrideName = overrideName();
    return AST.Process.create(name.text(), overrideName, block(), keyword.pos());
  }

  private Optional<String> overrideName() throws CompilerException {
    if (!acceptSymbol(':')) {
      return Optional.empty();
    }
    return Optional.of(expect(TokenKind.RAW_NAME, "a `quoted` name").text());
  }

  private ImmutableList<Expression> block() throws CompilerException {
    Token open = expectSymbol('{');
    if (depth == maxNestingDepth) {
      skipNestedBlock();
      errors.add(
          new CompilerException(
              CompilerException.Kind.NESTING_TOO_DEEP,
              open.pos(),
              String.format("blocks are nested deeper than %d levels", maxNestingDepth)));
      return ImmutableList.of();
    }

    depth++;
    List<Expression> body = new ArrayList<>();
    while (!peek().isSymbol('}')) {
      if (peek().is(TokenKind.EOF)) {
        depth--;
        if (unclosedBlock == null) {
          unclosedBlock = expected("'}'");
        }
        throw unclosedBlock;
      }

      int startIndex = index;
      try {
        body.add(expression());
      } catch (CompilerException ex) {
        if (ex == unclosedBlock) {
          depth--;
          throw ex;
        }
        recordError(ex);
        synchronizeStatement(startIndex);
      }
    }
    advance();
    depth--;
    return ImmutableList.copyOf(body);
  }

  private Expression expression() throws CompilerException {
    Token token = peek();
    if (token.is(TokenKind.KEYWORD)) {
      switch (token.text()) {
        case "line":
        case "local":
        case "game":
        case "save":
          return terminated(declaration());
        case "ifp":
        case "ife":
        case "ifg":
        case "ifv":
          return conditional();
        case "repeat":
          return repeat();
        case "start":
          return terminated(start());
        case "else":
          throw new CompilerException(
              CompilerException.Kind.PARSE, token.pos(), "'else' without a preceding conditional");
        default:
          break;
      }
    } else if (token.is(TokenKind.IDENTIFIER)) {
      if (isActionStart()) {
        return terminated(action());
      } else if (peek(1).isSymbol('(')) {
        return terminated(call());
      } else if (peek(1).isSymbol('=')) {
        return terminated(assignment());
      }
    }
    throw expected("an expression");
  }

  private Expression terminated(Expression expression) throws CompilerException {
    expectSymbol(';');
    return expression;
  }

  private boolean isActionStart() {
    return peek().is(TokenKind.IDENTIFIER)
        && Category.fromPrefix(peek().text()).isPresent()
        && (peek(1).isSymbol('.') || peek(1).isSymbol(':'));
  }

  // c:selector.name(args)
  private Expression.Action action() throws CompilerException {
    Token prefix = advance();
    Category category = Category.fromPrefix(prefix.text()).get();
    Optional<String> selector = Optional.empty();
    if (acceptSymbol(':')) {
      selector = Optional.of(expect(TokenKind.IDENTIFIER, "a selector").text());
    }
    expectSymbol('.');
    Token name = expect(TokenKind.IDENTIFIER, "an action name");
    expectSymbol('(');
    ArgList args = arguments();
    return Expression.Action.create(
        category, selector, name.text(), args.values, args.tags, prefix.pos());
  }

  // ifp !selector:name(args), or ifp selector:!name(args)
  private Expression.Condition conditionHead() throws CompilerException {
    Token keyword = peek();
    Optional<Category> category = Category.fromConditionalKeyword(keyword.text());
    if (!keyword.is(TokenKind.KEYWORD) || !category.isPresent()) {
      throw expected("'ifp', 'ife', 'ifg' or 'ifv'");
    }
    advance();

    boolean negated = acceptSymbol('!');
    Optional<String> selector = Optional.empty();
    if (peek().is(TokenKind.IDENTIFIER) && peek(1).isSymbol(':')) {
      selector = Optional.of(advance().text());
      advance();
    }
    if (peek().isSymbol('!')) {
      if (negated) {
        throw new CompilerException(
            CompilerException.Kind.PARSE, peek().pos(), "condition is already negated");
      }
      advance();
      negated = true;
    }

    Token name = expect(TokenKind.IDENTIFIER, "a condition name");
    expectSymbol('(');
    ArgList args = arguments();
    return Expression.Condition.create(
        category.get(), selector, negated, name.text(), args.values, args.tags, keyword.pos());
  }

  private Expression.Conditional conditional() throws CompilerException {
    Expression.Condition condition = conditionHead();
    ImmutableList<Expression> thenBody = block();
    Optional<ImmutableList<Expression>> elseBody = Optional.empty();
    if (peek().isKeyword("else")) {
      advance();
      elseBody = Optional.of(block());
    }
    return Expression.Conditional.create(condition, thenBody, elseBody);
  }

  private Expression.Repeat repeat() throws CompilerException {
    Token keyword = advance();
    Token token = peek();
    if (token.isKeyword("forever")) {
      advance();
      expectSymbol('(');
      expectSymbol(')');
      return Expression.Repeat.forever(block(), keyword.pos());
    } else if (token.isKeyword("while")) {
      advance();
      expectSymbol('(');
      Expression.Condition condition = conditionHead();
      expectSymbol(')');
      return Expression.Repeat.whileTrue(condition, block(), keyword.pos());
    } else if (token.is(TokenKind.IDENTIFIER)) {
      advance();
      expectSymbol('(');
      ArgList args = arguments();
      return Expression.Repeat.named(token.text(), args.values, args.tags, block(), keyword.pos());
    }
    throw expected("'forever', 'while' or a repeat action");
  }

  private Expression.Call call() throws CompilerException {
    Token name = advance();
    expectSymbol('(');
    ArgList args = arguments();
    if (!args.tags.isEmpty()) {
      throw new CompilerException(
          CompilerException.Kind.PARSE,
          args.tags.get(0).pos(),
          "function calls do not take tags");
    }
    return Expression.Call.create(name.text(), args.values, name.pos());
  }

  private Expression.Start start() throws CompilerException {
    Token keyword = advance();
    Token name = expect(TokenKind.IDENTIFIER, "a process name");
    expectSymbol('(');
    ArgList args = arguments();
    if (!args.values.isEmpty()) {
      throw new CompilerException(
          CompilerException.Kind.PARSE,
          args.values.get(0).pos(),
          "processes only take tags, e.g. localVariables=\"Copy\"");
    }
    return Expression.Start.create(name.text(), args.tags, keyword.pos());
  }

  // scope name: `override`: type = initializer
  private Expression.Declaration declaration() throws CompilerException {
    Token keyword = advance();
    VariableScope scope = VariableScope.fromKeyword(keyword.text()).get();
    Token name = expect(TokenKind.IDENTIFIER, "a variable name");
    Optional<String> overrideName = Optional.empty();
    if (peek().isSymbol(':') && peek(1).is(TokenKind.RAW_NAME)) {
      overrideName = overrideName();
    }
    Optional<ValueKind> kind = Optional.empty();
    if (acceptSymbol(':')) {
      kind = Optional.of(valueKind("variable"));
    }

    Optional<Expression> initializer = Optional.empty();
    if (acceptSymbol('=')) {
      initializer = Optional.of(initializer());
    }
    return Expression.Declaration.create(
        scope, name.text(), overrideName, kind, initializer, keyword.pos());
  }

  // name = initializer
  private Expression.Assignment assignment() throws CompilerException {
    Token name = advance();
    expectSymbol('=');
    return Expression.Assignment.create(
        Value.VariableRef.create(name.text(), name.pos()), initializer());
  }

  private Expression initializer() throws CompilerException {
    if (isActionStart()) {
      return action();
    }
    return Expression.ValueExpr.create(value());
  }

  // Consumes through the closing ')'.
  private ArgList arguments() throws CompilerException {
    ArgList args = new ArgList();
    if (acceptSymbol(')')) {
      return args;
    }

    do {
      Token token = peek();
      if (token.is(TokenKind.IDENTIFIER) && peek(1).isSymbol('=')) {
        advance();
        advance();
        Token option = peek();
        if (!option.is(TokenKind.STRING) && !option.is(TokenKind.TEXT)) {
          throw expected("a tag option");
        }
        advance();
        args.tags.add(Expression.TagArg.create(token.text(), option.text(), token.pos()));
      } else {
        args.values.add(value());
      }
    } while (acceptSymbol(','));
    expectSymbol(')');
    return args;
  }

  private Value value() throws CompilerException {
    Token token = peek();
    switch (token.kind()) {
      case NUMBER:
      case SYMBOL:
        if (token.is(TokenKind.NUMBER) || (token.isSymbol('-') && peek(1).is(TokenKind.NUMBER))) {
          return Value.Number.create(number(), token.pos());
        }
        break;
      case STRING:
        advance();
        return Value.StringLiteral.create(token.text(), token.pos());
      case TEXT:
        advance();
        return Value.Text.create(token.text(), token.pos());
      case GAME_VALUE:
        advance();
        return Value.GameValue.parse(token.text(), token.pos());
      case IDENTIFIER:
        advance();
        return Value.VariableRef.create(token.text(), token.pos());
      case COMPOSITE_HEAD:
        advance();
        return composite(token);
      default:
        break;
    }
    throw expected("a value");
  }

  private double number() throws CompilerException {
    boolean negative = acceptSymbol('-');
    Token token = expect(TokenKind.NUMBER, "a number");
    double value = Double.parseDouble(token.text());
    return Numbers.normalize(negative ? -value : value);
  }

  private String string() throws CompilerException {
    Token token = peek();
    if (!token.is(TokenKind.STRING) && !token.is(TokenKind.TEXT)) {
      throw expected("a string");
    }
    advance();
    return token.text();
  }

  // The head token already consumed the '('.
  private Value composite(Token head) throws CompilerException {
    Tokenizer.Pos pos = head.pos();
    Value value;
    switch (head.text()) {
      case "Number":
        if (peek().is(TokenKind.NUMBER) || peek().isSymbol('-')) {
          value = Value.Number.create(number(), pos);
        } else {
          value = Value.DynamicNumber.create(string(), pos);
        }
        break;
      case "Location":
        {
          double x = number();
          expectSymbol(',');
          double y = number();
          expectSymbol(',');
          double z = number();
          Optional<Double> pitch = Optional.empty();
          Optional<Double> yaw = Optional.empty();
          if (acceptSymbol(',')) {
            pitch = Optional.of(number());
            expectSymbol(',');
            yaw = Optional.of(number());
          }
          value = Value.Location.create(x, y, z, pitch, yaw, pos);
          break;
        }
      case "Vector":
        {
          double x = number();
          expectSymbol(',');
          double y = number();
          expectSymbol(',');
          double z = number();
          value = Value.Vector.create(x, y, z, pos);
          break;
        }
      case "Sound":
        {
          String name = string();
          expectSymbol(',');
          double volume = number();
          expectSymbol(',');
          double pitch = number();
          Optional<String> variant = Optional.empty();
          if (acceptSymbol(',')) {
            variant = Optional.of(string());
          }
          value = Value.Sound.create(name, volume, pitch, variant, pos);
          break;
        }
      case "Potion":
      case "Effect":
        {
          String potion = string();
          expectSymbol(',');
          double amplifier = number();
          expectSymbol(',');
          double duration = number();
          value = Value.Potion.create(potion, amplifier, duration, pos);
          break;
        }
      case "Particle":
        value = particle(pos);
        break;
      case "Item":
      case "Entity":
        value = Value.Item.create(string(), pos);
        break;
      default:
        throw new CompilerException(
            CompilerException.Kind.PARSE, pos, "unknown composite value " + head.text());
    }
    expectSymbol(')');
    return value;
  }

  // Particle("type", amount, horizontal, vertical, field=value...)
  private Value.Particle particle(Tokenizer.Pos pos) throws CompilerException {
    String particle = string();
    expectSymbol(',');
    double amount = number();
    expectSymbol(',');
    double horizontal = number();
    expectSymbol(',');
    double vertical = number();

    ImmutableMap.Builder<String, Value> fields = ImmutableMap.builder();
    while (acceptSymbol(',')) {
      Token name = expect(TokenKind.IDENTIFIER, "a particle field name");
      expectSymbol('=');
      fields.put(name.text(), value());
    }
    return Value.Particle.create(
        particle, amount, horizontal, vertical, fields.buildKeepingLast(), pos);
  }

  private Token peek() {
    return peek(0);
  }

  private Token peek(int ahead) {
    return tokens.get(Math.min(index + ahead, tokens.size() - 1));
  }

  private Token advance() {
    Token token = peek();
    if (index < tokens.size() - 1) {
      index++;
    }
    return token;
  }

  private boolean acceptSymbol(char symbol) {
    if (peek().isSymbol(symbol)) {
      advance();
      return true;
    }
    return false;
  }

  private Token expectSymbol(char symbol) throws CompilerException {
    if (!peek().isSymbol(symbol)) {
      throw expected("'" + symbol + "'");
    }
    return advance();
  }

  private Token expect(TokenKind kind, String what) throws CompilerException {
    if (!peek().is(kind)) {
      throw expected(what);
    }
    return advance();
  }

  private CompilerException expected(String what) {
    Token found = peek();
    return new CompilerException(
        CompilerException.Kind.PARSE,
        found.pos(),
        String.format("expected %s, found %s", what, found.describe()));
  }

  private void recordError(CompilerException ex) {
    // An error token was already reported by the tokenizer.
    if (ex.kind() == CompilerException.Kind.PARSE && peek().is(TokenKind.ERROR)) {
      return;
    }
    errors.add(ex);
  }

  private void synchronizeStatement(int startIndex) {
    if (index == startIndex) {
      advance();
    }

    int nested = 0;
    while (!peek().is(TokenKind.EOF)) {
      Token token = peek();
      if (token.isSymbol('{')) {
        nested++;
      } else if (token.isSymbol('}')) {
        if (nested == 0) {
          return;
        }
        nested--;
      } else if (token.isSymbol(';') && nested == 0) {
        advance();
        return;
      }
      advance();
    }
  }

  private void synchronizeTopLevel(int startIndex) {
    if (index == startIndex) {
      advance();
    }

    int nested = depth;
    depth = 0;
    while (!peek().is(TokenKind.EOF)) {
      Token token = peek();
      if (nested == 0 && isUnitStart(token)) {
        return;
      } else if (token.isSymbol('{')) {
        nested++;
      } else if (token.isSymbol('}')) {
        nested = Math.max(0, nested - 1);
      }
      advance();
    }
  }

  // Skips a block opened beyond the nesting limit without recursing into it.
  private void skipNestedBlock() {
    int nested = 1;
    while (nested > 0 && !peek().is(TokenKind.EOF)) {
      Token token = advance();
      if (token.isSymbol('{')) {
        nested++;
      } else if (token.isSymbol('}')) {
        nested--;
      }
    }
  }
}
