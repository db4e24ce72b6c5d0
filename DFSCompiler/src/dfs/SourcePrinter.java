package dfs;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/** Prints an {@link AST} as source text the parser reads back into the same tree. */
final class SourcePrinter extends VoidDefaultASTVisitor {
  private static final String INDENT = "    ";

  private final StringBuilder out = new StringBuilder();
  private int depth = 0;

  static String print(AST ast) {
    SourcePrinter printer = new SourcePrinter();
    ast.accept(printer, null);
    return printer.out.toString();
  }

  private SourcePrinter() {}

  @Override
  public void visitImpl(AST ast) {
    for (AST.Use use : ast.uses()) {
      out.append("use ").append(quote(use.path(), Tokenizer.TEXT_QUOTE)).append(";\n");
    }
    if (!ast.uses().isEmpty() && !ast.declarations().isEmpty()) {
      out.append('\n');
    }
    ast.declarations().forEach(d -> d.accept(this, null));
    boolean first = ast.declarations().isEmpty() && ast.uses().isEmpty();
    for (AST.Unit unit : ast.units()) {
      if (!first) {
        out.append('\n');
      }
      first = false;
      unit.accept(this, null);
    }
  }

  // @join! {
  @Override
  public void visitImpl(AST.Event event) {
    out.append('@').append(event.name());
    if (event.cancelled()) {
      out.append('!');
    }
    body(event.body());
    out.append('\n');
  }

  // fn greet: `Greet Player`(name: text, extra?) {
  @Override
  public void visitImpl(AST.Function function) {
    out.append("fn ").append(function.name());
    appendRawName(function.overrideName());
    out.append('(');
    String separator = "";
    for (AST.Param param : function.params()) {
      out.append(separator).append(param.name());
      if (param.kind() != ValueKind.ANY) {
        out.append(": ").append(param.kind().sourceName());
      }
      if (param.optional()) {
        out.append('?');
      }
      if (param.variadic()) {
        out.append('*');
      }
      if (param.defaultValue().isPresent()) {
        out.append(" = ");
        param.defaultValue().get().accept(this, null);
      }
      separator = ", ";
    }
    out.append(')');
    body(function.body());
    out.append('\n');
  }

  @Override
  public void visitImpl(AST.Process process) {
    out.append("proc ").append(process.name());
    appendRawName(process.overrideName());
    body(process.body());
    out.append('\n');
  }

  @Override
  public void visitImpl(Expression.Action action) {
    indent();
    appendAction(action);
    out.append(";\n");
  }

  @Override
  public void visitImpl(Expression.Conditional conditional) {
    indent();
    conditional.condition().accept(this, null);
    body(conditional.thenBody());
    if (conditional.hasElse()) {
      out.append(" else");
      body(conditional.elseBody());
    }
    out.append('\n');
  }

  // ifp selection:!isSneaking(...)
  @Override
  public void visitImpl(Expression.Condition condition) {
    out.append(condition.category().conditionalKeyword().get()).append(' ');
    condition.selector().ifPresent(s -> out.append(s).append(':'));
    if (condition.negated()) {
      out.append('!');
    }
    out.append(condition.name());
    appendArguments(condition.args(), condition.tags());
  }

  @Override
  public void visitImpl(Expression.Repeat repeat) {
    indent();
    out.append("repeat ");
    switch (repeat.kind()) {
      case FOREVER:
        out.append("forever()");
        break;
      case WHILE:
        out.append("while(");
        repeat.condition().get().accept(this, null);
        out.append(')');
        break;
      case NAMED:
        out.append(repeat.name().get());
        appendArguments(repeat.args(), repeat.tags());
        break;
    }
    body(repeat.body());
    out.append('\n');
  }

  @Override
  public void visitImpl(Expression.Call call) {
    indent();
    out.append(call.name());
    appendArguments(call.args(), ImmutableList.of());
    out.append(";\n");
  }

  @Override
  public void visitImpl(Expression.Start start) {
    indent();
    out.append("start ").append(start.name());
    appendArguments(ImmutableList.of(), start.tags());
    out.append(";\n");
  }

  // line x: `raw` = v.set(...);
  @Override
  public void visitImpl(Expression.Declaration declaration) {
    indent();
    out.append(declaration.scope().keyword()).append(' ').append(declaration.name());
    appendRawName(declaration.overrideName());
    declaration.kind().ifPresent(k -> out.append(": ").append(k.sourceName()));
    if (declaration.initializer().isPresent()) {
      out.append(" = ");
      appendInitializer(declaration.initializer().get());
    }
    out.append(";\n");
  }

  @Override
  public void visitImpl(Expression.Assignment assignment) {
    indent();
    out.append(assignment.target().name()).append(" = ");
    appendInitializer(assignment.initializer());
    out.append(";\n");
  }

  private void appendInitializer(Expression initializer) {
    if (initializer.type() == Expression.Type.ACTION) {
      appendAction(initializer.cast());
    } else {
      initializer.<Expression.ValueExpr>cast().value().accept(this, null);
    }
  }

  @Override
  public void visitImpl(Value.Number number) {
    out.append(Numbers.format(number.value()));
  }

  @Override
  public void visitImpl(Value.DynamicNumber number) {
    out.append("Number(").append(quote(number.formula(), Tokenizer.STRING_QUOTE)).append(')');
  }

  @Override
  public void visitImpl(Value.Text text) {
    out.append(quote(text.text(), Tokenizer.TEXT_QUOTE));
  }

  @Override
  public void visitImpl(Value.StringLiteral string) {
    out.append(quote(string.text(), Tokenizer.STRING_QUOTE));
  }

  @Override
  public void visitImpl(Value.Location loc) {
    out.append("Location(");
    appendNumbers(loc.x(), loc.y(), loc.z());
    if (loc.pitch().isPresent() || loc.yaw().isPresent()) {
      out.append(", ");
      appendNumbers(loc.pitch().orElse(0.0), loc.yaw().orElse(0.0));
    }
    out.append(')');
  }

  @Override
  public void visitImpl(Value.Vector vec) {
    out.append("Vector(");
    appendNumbers(vec.x(), vec.y(), vec.z());
    out.append(')');
  }

  @Override
  public void visitImpl(Value.Sound sound) {
    out.append("Sound(").append(quote(sound.name(), Tokenizer.STRING_QUOTE)).append(", ");
    appendNumbers(sound.volume(), sound.pitch());
    sound
        .variant()
        .ifPresent(v -> out.append(", ").append(quote(v, Tokenizer.STRING_QUOTE)));
    out.append(')');
  }

  @Override
  public void visitImpl(Value.Potion potion) {
    out.append("Potion(").append(quote(potion.potion(), Tokenizer.STRING_QUOTE)).append(", ");
    appendNumbers(potion.amplifier(), potion.duration());
    out.append(')');
  }

  @Override
  public void visitImpl(Value.Particle particle) {
    out.append("Particle(").append(quote(particle.particle(), Tokenizer.STRING_QUOTE));
    out.append(", ");
    appendNumbers(particle.amount(), particle.horizontalSpread(), particle.verticalSpread());
    for (Map.Entry<String, Value> field : particle.fields().entrySet()) {
      out.append(", ").append(field.getKey()).append('=');
      field.getValue().accept(this, null);
    }
    out.append(')');
  }

  @Override
  public void visitImpl(Value.Item item) {
    out.append("Item(").append(quote(item.data(), Tokenizer.STRING_QUOTE)).append(')');
  }

  @Override
  public void visitImpl(Value.GameValue gameValue) {
    out.append('$');
    gameValue.selector().ifPresent(s -> out.append(s).append(':'));
    out.append(gameValue.name());
  }

  @Override
  public void visitImpl(Value.VariableRef ref) {
    out.append(ref.name());
  }

  private void appendAction(Expression.Action action) {
    out.append(action.category().prefix());
    action.selector().ifPresent(s -> out.append(':').append(s));
    out.append('.').append(action.name());
    appendArguments(action.args(), action.tags());
  }

  private void appendArguments(List<Value> args, List<Expression.TagArg> tags) {
    out.append('(');
    String separator = "";
    for (Value arg : args) {
      out.append(separator);
      arg.accept(this, null);
      separator = ", ";
    }
    for (Expression.TagArg tag : tags) {
      out.append(separator)
          .append(tag.name())
          .append('=')
          .append(quote(tag.option(), Tokenizer.TEXT_QUOTE));
      separator = ", ";
    }
    out.append(')');
  }

  private void appendNumbers(double... values) {
    for (int i = 0; i < values.length; i++) {
      if (i > 0) {
        out.append(", ");
      }
      out.append(Numbers.format(values[i]));
    }
  }

  private void appendRawName(Optional<String> raw) {
    raw.ifPresent(r -> out.append(": ").append(quote(r, Tokenizer.RAW_QUOTE)));
  }

  // Opens a body on the current line; the caller ends the line after the closing brace.
  private void body(List<Expression> body) {
    out.append(" {\n");
    depth++;
    body.forEach(e -> e.accept(this, null));
    depth--;
    indent();
    out.append('}');
  }

  private void indent() {
    for (int i = 0; i < depth; i++) {
      out.append(INDENT);
    }
  }

  static String quote(String text, char quote) {
    StringBuilder quoted = new StringBuilder().append(quote);
    for (char c : text.toCharArray()) {
      if (c == '\\' || c == quote) {
        quoted.append('\\').append(c);
      } else if (c == '\n') {
        quoted.append("\\n");
      } else {
        quoted.append(c);
      }
    }
    return quoted.append(quote).toString();
  }
}
