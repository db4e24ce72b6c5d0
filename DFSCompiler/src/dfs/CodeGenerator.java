package dfs;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Verify;
import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

/**
 * Lowers an analyzed AST into one {@link BlockGraph} per unit. Nodes rejected by analysis are
 * left out; everything else is assumed valid against the catalogue.
 */
public class CodeGenerator {
  static final String CANCEL_ATTRIBUTE = "LS-CANCEL";
  static final String NOT_ATTRIBUTE = "NOT";
  static final String SET_VARIABLE_ACTION = "=";
  static final String FOREVER_ACTION = "Forever";
  static final String WHILE_ACTION = "While";
  static final String DYNAMIC_ACTION = "dynamic";
  static final String HIDDEN_TAG = "Is Hidden";
  static final String HIDDEN_OPTION = "False";
  static final int HINT_SLOT = 25;
  static final int HIDDEN_SLOT = 26;

  static final String FUNCTION_BLOCK = "func";
  static final String PROCESS_BLOCK = "process";
  static final String CALL_BLOCK = "call_func";
  static final String START_BLOCK = "start_process";
  static final String REPEAT_BLOCK = "repeat";

  private final AnnotatedAST annotated;
  private final ActionCatalogue catalogue;

  private final List<CodeBlock> blocks = new ArrayList<>();
  private final Deque<CodeBlock.BracketType> openBrackets = new ArrayDeque<>();

  public CodeGenerator(AnnotatedAST annotated, ActionCatalogue catalogue) {
    this.annotated = annotated;
    this.catalogue = catalogue;
  }

  /** Returns the graph of every usable unit, in source order. */
  public ImmutableMap<AST.Unit, BlockGraph> generate() {
    ImmutableMap.Builder<AST.Unit, BlockGraph> graphs = ImmutableMap.builder();
    for (AST.Unit unit : annotated.ast().units()) {
      if (!annotated.isRejected(unit)) {
        graphs.put(unit, generate(unit));
      }
    }
    return graphs.buildOrThrow();
  }

  private BlockGraph generate(AST.Unit unit) {
    blocks.clear();
    switch (unit.type()) {
      case EVENT:
        eventHeader(unit.cast());
        break;
      case FUNCTION:
        functionHeader(unit.cast());
        break;
      case PROCESS:
        processHeader(unit.cast());
        break;
    }
    body(unit.body());

    Verify.verify(openBrackets.isEmpty(), "unclosed brackets in %s", unit.name());
    return BlockGraph.create(blocks);
  }

  private void eventHeader(AST.Event event) {
    EventSchema schema = catalogue.event(event.name()).get();
    CodeBlock.Builder header = CodeBlock.block(schema.block()).setAction(schema.externalName());
    if (event.cancelled()) {
      header.setAttribute(CANCEL_ATTRIBUTE);
    }
    blocks.add(header.build());
  }

  private void functionHeader(AST.Function function) {
    CodeBlock.Builder header = CodeBlock.block(FUNCTION_BLOCK).setData(function.externalName());
    for (int i = 0; i < function.params().size(); i++) {
      AST.Param param = function.params().get(i);
      header.addParam(
          i,
          EncodedValue.FunctionParam.create(
              param.defaultValue().map(v -> encode(v, param.kind())),
              param.name(),
              param.optional(),
              param.variadic(),
              param.kind().paramType()));
    }
    header.addParam(HINT_SLOT, EncodedValue.Hint.create(EncodedValue.Hint.FUNCTION));
    blocks.add(header.setTags(hiddenTag(FUNCTION_BLOCK)).build());
  }

  private void processHeader(AST.Process process) {
    blocks.add(
        CodeBlock.block(PROCESS_BLOCK)
            .setData(process.externalName())
            .setTags(hiddenTag(PROCESS_BLOCK))
            .build());
  }

  private static ImmutableSortedMap<String, BlockTag> hiddenTag(String block) {
    return ImmutableSortedMap.of(
        HIDDEN_TAG, BlockTag.create(HIDDEN_OPTION, HIDDEN_SLOT, DYNAMIC_ACTION, block));
  }

  private void body(List<Expression> body) {
    for (Expression expression : body) {
      if (!annotated.isRejected(expression)) {
        expression(expression);
      }
    }
  }

  private void expression(Expression expression) {
    switch (expression.type()) {
      case ACTION:
        blocks.add(action(expression.cast(), Optional.empty()));
        break;
      case CONDITIONAL:
        conditional(expression.cast());
        break;
      case REPEAT:
        repeat(expression.cast());
        break;
      case CALL:
        blocks.add(call(expression.cast()));
        break;
      case START:
        blocks.add(start(expression.cast()));
        break;
      case DECLARATION:
        declaration(expression.cast());
        break;
      case ASSIGNMENT:
        assignment(expression.cast());
        break;
      case VALUE:
        // A bare value has no effect.
        break;
    }
  }

  private CodeBlock action(Expression.Action action, Optional<EncodedValue> leading) {
    Category category = action.category();
    ActionSchema schema = catalogue.action(category, action.name()).get();
    CodeBlock.Builder block =
        CodeBlock.block(category.actionBlock()).setAction(schema.externalName());
    if (category.isTargeted()) {
      block.setTarget(target(action.selector()));
    }

    List<Value> args = action.args();
    if (leading.isPresent()) {
      // Stands in for the declared variable while binding.
      args = action.withLeadingArgument(Value.VariableRef.create("", action.pos())).args();
    }
    addArguments(block, bind(schema, args), leading);
    block.setTags(
        tags(schema.tags(), action.tags(), schema.externalName(), category.actionBlock()));
    return block.build();
  }

  private void conditional(Expression.Conditional conditional) {
    Expression.Condition condition = conditional.condition();
    Category category = condition.category();
    String blockName = category.conditionalBlock().get();
    ActionSchema schema = catalogue.conditional(category, condition.name()).get();

    CodeBlock.Builder block = CodeBlock.block(blockName).setAction(schema.externalName());
    if (category.isTargeted()) {
      block.setTarget(target(condition.selector()));
    }
    if (condition.negated()) {
      block.setAttribute(NOT_ATTRIBUTE);
    }
    addArguments(block, bind(schema, condition.args()), Optional.empty());
    block.setTags(tags(schema.tags(), condition.tags(), schema.externalName(), blockName));
    blocks.add(block.build());
    bracketed(CodeBlock.BracketType.NORM, conditional.thenBody());

    if (conditional.hasElse()) {
      blocks.add(CodeBlock.block(CodeBlock.ELSE).build());
      bracketed(CodeBlock.BracketType.NORM, conditional.elseBody());
    }
  }

  private void repeat(Expression.Repeat repeat) {
    CodeBlock.Builder block = CodeBlock.block(REPEAT_BLOCK);
    switch (repeat.kind()) {
      case FOREVER:
        block.setAction(FOREVER_ACTION);
        break;
      case WHILE:
        {
          Expression.Condition condition = repeat.condition().get();
          Category category = condition.category();
          ActionSchema schema = catalogue.conditional(category, condition.name()).get();
          block.setAction(WHILE_ACTION).setSubAction(schema.externalName());
          if (category.isTargeted()) {
            block.setTarget(target(condition.selector()));
          }
          if (condition.negated()) {
            block.setAttribute(NOT_ATTRIBUTE);
          }
          addArguments(block, bind(schema, condition.args()), Optional.empty());
          block.setTags(tags(schema.tags(), condition.tags(), WHILE_ACTION, REPEAT_BLOCK));
          break;
        }
      case NAMED:
        {
          ActionSchema schema = catalogue.repeat(repeat.name().get()).get();
          block.setAction(schema.externalName());
          addArguments(block, bind(schema, repeat.args()), Optional.empty());
          block.setTags(tags(schema.tags(), repeat.tags(), schema.externalName(), REPEAT_BLOCK));
          break;
        }
    }
    blocks.add(block.build());
    bracketed(CodeBlock.BracketType.REPEAT, repeat.body());
  }

  private void bracketed(CodeBlock.BracketType type, List<Expression> body) {
    blocks.add(CodeBlock.bracket(CodeBlock.Direction.OPEN, type));
    openBrackets.push(type);
    body(body);
    Verify.verify(openBrackets.pop() == type);
    blocks.add(CodeBlock.bracket(CodeBlock.Direction.CLOSE, type));
  }

  private CodeBlock call(Expression.Call call) {
    Signature signature = annotated.signatures().function(call.name()).get();
    CodeBlock.Builder block = CodeBlock.block(CALL_BLOCK).setData(signature.externalName());
    for (int i = 0; i < call.args().size(); i++) {
      block.addParam(i, encode(call.args().get(i), signature.paramFor(i).kind()));
    }
    return block.build();
  }

  private CodeBlock start(Expression.Start start) {
    Signature signature = annotated.signatures().process(start.name()).get();
    return CodeBlock.block(START_BLOCK)
        .setData(signature.externalName())
        .setTags(tags(catalogue.startProcessTags(), start.tags(), DYNAMIC_ACTION, START_BLOCK))
        .build();
  }

  private void declaration(Expression.Declaration declaration) {
    if (!declaration.initializer().isPresent()) {
      return;
    }

    Symbol symbol = Symbol.of(declaration);
    initialize(
        symbol,
        declaration.initializer().get(),
        declaration.kind().orElse(ValueKind.ANY));
  }

  private void assignment(Expression.Assignment assignment) {
    Optional<Symbol> symbol = annotated.symbol(assignment.target());
    Verify.verify(symbol.isPresent(), "unresolved variable %s", assignment.target().name());
    initialize(symbol.get(), assignment.initializer(), ValueKind.ANY);
  }

  private void initialize(Symbol symbol, Expression initializer, ValueKind kind) {
    EncodedValue variable = EncodedValue.Variable.create(symbol.externalName(), symbol.scope());
    if (initializer.type() == Expression.Type.ACTION) {
      blocks.add(action(initializer.cast(), Optional.of(variable)));
    } else {
      Value value = initializer.<Expression.ValueExpr>cast().value();
      blocks.add(
          CodeBlock.block(Category.VARIABLE.actionBlock())
              .setAction(SET_VARIABLE_ACTION)
              .addParam(0, variable)
              .addParam(1, encode(value, kind))
              .build());
    }
  }

  private static ImmutableList<ArgumentBinder.Binding> bind(
      ActionSchema schema, List<Value> args) {
    try {
      return ArgumentBinder.bind(schema.name(), schema.params(), args, Tokenizer.Pos.internal());
    } catch (CompilerException ex) {
      throw new VerifyException("arguments were not validated: " + ex.format(), ex);
    }
  }

  private void addArguments(
      CodeBlock.Builder block,
      List<ArgumentBinder.Binding> bindings,
      Optional<EncodedValue> leading) {
    for (int slot = 0; slot < bindings.size(); slot++) {
      ArgumentBinder.Binding binding = bindings.get(slot);
      if (slot == 0 && leading.isPresent()) {
        block.addParam(slot, leading.get());
      } else {
        block.addParam(slot, encode(binding.value(), binding.param().kind()));
      }
    }
  }

  private static ImmutableSortedMap<String, BlockTag> tags(
      List<TagSpec> specs, List<Expression.TagArg> given, String action, String block) {
    ImmutableSortedMap.Builder<String, BlockTag> tags = ImmutableSortedMap.naturalOrder();
    for (TagSpec spec : specs) {
      String option =
          given.stream()
              .filter(t -> t.name().equals(spec.name()))
              .map(Expression.TagArg::option)
              .findFirst()
              .orElse(spec.defaultOption());
      tags.put(spec.externalName(), BlockTag.create(option, spec.slot(), action, block));
    }
    return tags.buildOrThrow();
  }

  private static String target(Optional<String> selector) {
    return selector
        .flatMap(Selector::fromSourceName)
        .orElse(Selector.DEFAULT)
        .externalName();
  }

  // Literal strings and text are converted to whatever the parameter expects.
  private EncodedValue encode(Value value, ValueKind kind) {
    switch (value.type()) {
      case NUMBER:
        return EncodedValue.Simple.number(value.<Value.Number>cast().value());
      case DYNAMIC_NUMBER:
        return EncodedValue.Simple.number(value.<Value.DynamicNumber>cast().formula());
      case TEXT:
        {
          String text = value.<Value.Text>cast().text();
          return kind == ValueKind.STRING
              ? EncodedValue.Simple.string(text)
              : EncodedValue.Simple.text(text);
        }
      case STRING:
        {
          String text = value.<Value.StringLiteral>cast().text();
          return kind == ValueKind.TEXT
              ? EncodedValue.Simple.text(text)
              : EncodedValue.Simple.string(text);
        }
      case LOCATION:
        {
          Value.Location loc = value.cast();
          return EncodedValue.Location.create(
              loc.x(), loc.y(), loc.z(), loc.pitch().orElse(0.0), loc.yaw().orElse(0.0));
        }
      case VECTOR:
        {
          Value.Vector vec = value.cast();
          return EncodedValue.Vector.create(vec.x(), vec.y(), vec.z());
        }
      case SOUND:
        {
          Value.Sound sound = value.cast();
          return EncodedValue.Sound.create(
              sound.name(), sound.variant(), sound.volume(), sound.pitch());
        }
      case POTION:
        {
          Value.Potion potion = value.cast();
          return EncodedValue.Potion.create(
              potion.potion(), potion.amplifier(), potion.duration());
        }
      case PARTICLE:
        return particle(value.cast());
      case ITEM:
        return EncodedValue.Item.create(value.<Value.Item>cast().data());
      case GAME_VALUE:
        {
          Value.GameValue gameValue = value.cast();
          return EncodedValue.GameValue.create(
              catalogue.gameValue(gameValue.name()).get(), target(gameValue.selector()));
        }
      case VARIABLE:
        {
          Value.VariableRef ref = value.cast();
          Optional<Symbol> symbol = annotated.symbol(ref);
          Verify.verify(symbol.isPresent(), "unresolved variable %s", ref.name());
          return EncodedValue.Variable.create(symbol.get().externalName(), symbol.get().scope());
        }
    }
    throw new VerifyException("unhandled value type " + value.type());
  }

  private static EncodedValue.Particle particle(Value.Particle particle) {
    ImmutableMap.Builder<String, Object> data = ImmutableMap.builder();
    for (ParticleField field : ParticleField.values()) {
      Value value = particle.fields().get(field.sourceName());
      if (value == null) {
        continue;
      }

      switch (field) {
        case MOTION:
          {
            Value.Vector motion = value.cast();
            data.put("x", motion.x()).put("y", motion.y()).put("z", motion.z());
            break;
          }
        case MATERIAL:
          data.put(field.key(), literalText(value));
          break;
        default:
          data.put(field.key(), value.<Value.Number>cast().value());
          break;
      }
    }
    return EncodedValue.Particle.create(
        particle.particle(),
        (int) particle.amount(),
        particle.horizontalSpread(),
        particle.verticalSpread(),
        data.buildOrThrow());
  }

  private static String literalText(Value value) {
    return value.type() == Value.Type.TEXT
        ? value.<Value.Text>cast().text()
        : value.<Value.StringLiteral>cast().text();
  }
}
