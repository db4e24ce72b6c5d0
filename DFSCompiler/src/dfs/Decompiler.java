package dfs;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Rebuilds a source-level {@link AST} from block graphs.
 *
 * <p>Bracket pairs become nested bodies, external names are mapped back through the catalogue,
 * and a declaration is synthesized for every variable the graphs use: game and save variables at
 * file level, line and local variables in the innermost body that contains all of their uses.
 * Anything that cannot be mapped back is kept under a sanitized name and reported as a warning.
 */
public class Decompiler {
  private static final String EVENT_BLOCK = "event";
  private static final String ENTITY_EVENT_BLOCK = "entity_event";
  private static final Pattern NUMBER_LITERAL = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");

  // A nested body, or the unit body when it has no parent.
  private static final class Body {
    private final Optional<Body> parent;
    private final int depth;
    private final List<Node> nodes = new ArrayList<>();

    Body(Optional<Body> parent) {
      this.parent = parent;
      this.depth = parent.map(p -> p.depth + 1).orElse(0);
    }
  }

  private static final class Node {
    private final CodeBlock block;
    private final int index;
    private Optional<Body> body = Optional.empty();
    private Optional<Body> elseBody = Optional.empty();

    Node(CodeBlock block, int index) {
      this.block = block;
      this.index = index;
    }
  }

  private static final class Use {
    private final Node node;
    private final Body body;

    Use(Node node, Body body) {
      this.node = node;
      this.body = body;
    }
  }

  private final ActionCatalogue catalogue;
  private final CompilerOptions options;
  private final List<CompilerException> diagnostics = new ArrayList<>();

  // Keyed by the encoded variable, so equal names in different scopes stay distinct.
  private final NameAllocator variableNames = new NameAllocator("var");
  private final NameAllocator functionNames = new NameAllocator("function");
  private final NameAllocator processNames = new NameAllocator("process");
  private final Map<EncodedValue.Variable, Expression.Declaration> globals = new LinkedHashMap<>();

  // Per unit.
  private final Map<Body, List<EncodedValue.Variable>> hoisted = new IdentityHashMap<>();
  private final Map<Node, EncodedValue.Variable> inlined = new IdentityHashMap<>();

  public Decompiler(ActionCatalogue catalogue, CompilerOptions options) {
    this.catalogue = catalogue;
    this.options = options;
  }

  /** Warnings collected so far. */
  public ImmutableList<CompilerException> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  /**
   * Decompiles each graph into one unit of a single file.
   *
   * @throws CompilerException if a graph is empty, has an unknown header, or its brackets cannot
   *     be matched to the blocks that open them
   */
  public AST decompile(List<BlockGraph> graphs) throws CompilerException {
    // Names first, so calls resolve to functions declared later in the file.
    for (BlockGraph graph : graphs) {
      if (graph.blocks().isEmpty()) {
        throw error(Tokenizer.Pos.internal(), "empty code line");
      }
      CodeBlock header = graph.header();
      if (header.isBlock(CodeGenerator.FUNCTION_BLOCK)) {
        functionName(header.data());
      } else if (header.isBlock(CodeGenerator.PROCESS_BLOCK)) {
        processName(header.data());
      }
    }

    ImmutableList.Builder<AST.Unit> units = ImmutableList.builder();
    for (BlockGraph graph : graphs) {
      units.add(unit(graph));
    }
    return AST.create(globals.values(), units.build(), Tokenizer.Pos.internal());
  }

  private AST.Unit unit(BlockGraph graph) throws CompilerException {
    CodeBlock header = graph.header();
    Tokenizer.Pos pos = Tokenizer.Pos.block(0);
    if (header.isBracket() || !header.block().isPresent()) {
      throw error(pos, "a code line must start with an event, function or process block");
    }

    Body root = buildTree(graph.blocks());
    Set<EncodedValue.Variable> params = new HashSet<>();
    String block = header.block().get();
    switch (block) {
      case EVENT_BLOCK:
      case ENTITY_EVENT_BLOCK:
        {
          String external = header.action().orElse("");
          String name =
              catalogue
                  .eventByExternalName(external)
                  .map(EventSchema::name)
                  .orElseGet(() -> unrecognized(pos, "event", external));
          boolean cancelled =
              header.attribute().equals(Optional.of(CodeGenerator.CANCEL_ATTRIBUTE));
          inferDeclarations(root, params);
          return AST.Event.create(name, cancelled, body(root), pos);
        }
      case CodeGenerator.FUNCTION_BLOCK:
        {
          String name = functionName(header.data());
          String raw = header.data().get();
          ImmutableList<AST.Param> signature = functionParams(header, params);
          inferDeclarations(root, params);
          return AST.Function.create(name, rawName(name, raw), signature, body(root), pos);
        }
      case CodeGenerator.PROCESS_BLOCK:
        {
          String name = processName(header.data());
          String raw = header.data().get();
          inferDeclarations(root, params);
          return AST.Process.create(name, rawName(name, raw), body(root), pos);
        }
      default:
        throw error(pos, String.format("unrecognized code line header '%s'", block));
    }
  }

  private ImmutableList<AST.Param> functionParams(
      CodeBlock header, Set<EncodedValue.Variable> params) {
    Tokenizer.Pos pos = Tokenizer.Pos.block(0);
    ImmutableList.Builder<AST.Param> result = ImmutableList.builder();
    for (Parameter parameter : header.params()) {
      EncodedValue value = parameter.value();
      if (value.kind() == EncodedValue.Kind.HINT) {
        continue;
      } else if (value.kind() != EncodedValue.Kind.PARAMETER) {
        warn(
            CompilerException.Kind.UNRECOGNIZED_BLOCK,
            pos,
            String.format("ignored %s item in function header", value.kind().id()));
        continue;
      }

      EncodedValue.FunctionParam param = value.cast();
      EncodedValue.Variable variable =
          EncodedValue.Variable.create(param.name(), VariableScope.LINE);
      params.add(variable);
      Optional<ValueKind> kind = ValueKind.fromParamType(param.type());
      if (!kind.isPresent()) {
        warn(
            CompilerException.Kind.UNRECOGNIZED_BLOCK,
            pos,
            String.format("unrecognized parameter type '%s', using any", param.type()));
      }
      String name = variableNames.allocate(variable, param.name());
      Optional<Value> defaultValue = param.defaultValue().flatMap(v -> value(v, pos));
      if (defaultValue.isPresent()
          && (!param.optional()
              || !SignatureRegistry.isDefaultValueType(defaultValue.get().type()))) {
        warn(
            CompilerException.Kind.UNRECOGNIZED_BLOCK,
            pos,
            String.format("dropped unsupported default value of parameter '%s'", name));
        defaultValue = Optional.empty();
      }
      result.add(
          AST.Param.create(
              name,
              kind.orElse(ValueKind.ANY),
              param.optional(),
              param.plural(),
              defaultValue,
              pos));
    }
    return result.build();
  }

  private String functionName(Optional<String> raw) throws CompilerException {
    if (!raw.isPresent()) {
      throw error(Tokenizer.Pos.block(0), "function header has no name");
    }
    return functionNames.allocate(raw.get(), raw.get());
  }

  private String processName(Optional<String> raw) throws CompilerException {
    if (!raw.isPresent()) {
      throw error(Tokenizer.Pos.block(0), "process header has no name");
    }
    return processNames.allocate(raw.get(), raw.get());
  }

  private static Optional<String> rawName(String name, String raw) {
    return name.equals(raw) ? Optional.empty() : Optional.of(raw);
  }

  /** Nests the blocks after the header by matching each bracket pair to the block before it. */
  private Body buildTree(List<CodeBlock> blocks) throws CompilerException {
    Body current = new Body(Optional.empty());
    Deque<Body> enclosing = new ArrayDeque<>();
    // The body whose open bracket must come next.
    Optional<Body> pending = Optional.empty();
    CodeBlock.BracketType pendingType = CodeBlock.BracketType.NORM;

    for (int i = 1; i < blocks.size(); i++) {
      CodeBlock block = blocks.get(i);
      Tokenizer.Pos pos = Tokenizer.Pos.block(i);
      if (block.isBracket()) {
        if (block.isOpen()) {
          if (!pending.isPresent() || block.bracketType().get() != pendingType) {
            throw error(pos, "bracket does not open the body of the block before it");
          }
          // The unit body is the first level.
          if (enclosing.size() + 2 > options.maxNestingDepth()) {
            throw new CompilerException(
                CompilerException.Kind.NESTING_TOO_DEEP,
                pos,
                String.format(
                    "blocks are nested deeper than %d levels", options.maxNestingDepth()));
          }
          enclosing.push(current);
          current = pending.get();
          pending = Optional.empty();
        } else {
          if (pending.isPresent() || enclosing.isEmpty()) {
            throw error(pos, "unmatched closing bracket");
          }
          current = enclosing.pop();
        }
        continue;
      }

      if (pending.isPresent()) {
        throw error(pos, "expected an opening bracket");
      }

      if (block.isBlock(CodeBlock.ELSE)) {
        Node last = current.nodes.isEmpty() ? null : current.nodes.get(current.nodes.size() - 1);
        if (last == null
            || !isConditional(last.block)
            || last.elseBody.isPresent()
            || !blocks.get(i - 1).isBracket()) {
          throw error(pos, "'else' does not follow a conditional body");
        }
        last.elseBody = Optional.of(new Body(Optional.of(current)));
        pending = last.elseBody;
        pendingType = CodeBlock.BracketType.NORM;
        continue;
      }

      Node node = new Node(block, i);
      current.nodes.add(node);
      if (isConditional(block)) {
        node.body = Optional.of(new Body(Optional.of(current)));
        pending = node.body;
        pendingType = CodeBlock.BracketType.NORM;
      } else if (block.isBlock(CodeGenerator.REPEAT_BLOCK)) {
        node.body = Optional.of(new Body(Optional.of(current)));
        pending = node.body;
        pendingType = CodeBlock.BracketType.REPEAT;
      }
    }

    if (pending.isPresent() || !enclosing.isEmpty()) {
      throw error(Tokenizer.Pos.block(blocks.size()), "code line ends inside a body");
    }
    return current;
  }

  private static boolean isConditional(CodeBlock block) {
    return block.block().flatMap(Category::fromConditionalBlock).isPresent();
  }

  private void inferDeclarations(Body root, Set<EncodedValue.Variable> params) {
    hoisted.clear();
    inlined.clear();

    Map<EncodedValue.Variable, List<Use>> uses = new LinkedHashMap<>();
    collectUses(root, uses);
    for (Map.Entry<EncodedValue.Variable, List<Use>> entry : uses.entrySet()) {
      EncodedValue.Variable variable = entry.getKey();
      if (params.contains(variable)) {
        continue;
      }

      Use first = entry.getValue().get(0);
      Tokenizer.Pos pos = Tokenizer.Pos.block(first.node.index);
      String name = variableNames.allocate(variable, variable.name());
      if (variable.scope().isGlobal()) {
        if (!globals.containsKey(variable)) {
          globals.put(variable, declaration(variable, Optional.empty(), pos));
          inferred(variable, name, pos, "at file level");
        }
        continue;
      }

      Body body = first.body;
      for (Use use : entry.getValue()) {
        body = commonAncestor(body, use.body);
      }

      if (first.body == body && canInline(first.node, variable)) {
        inlined.put(first.node, variable);
        inferred(variable, name, pos, "at its first assignment");
      } else {
        hoisted.computeIfAbsent(body, b -> new ArrayList<>()).add(variable);
        inferred(variable, name, pos, "at the start of its enclosing body");
      }
    }
  }

  // Uses are recorded in block order.
  private static void collectUses(Body body, Map<EncodedValue.Variable, List<Use>> uses) {
    for (Node node : body.nodes) {
      for (Parameter param : node.block.params()) {
        if (param.value().kind() == EncodedValue.Kind.VARIABLE) {
          uses.computeIfAbsent(param.value().cast(), v -> new ArrayList<>())
              .add(new Use(node, body));
        }
      }
      node.body.ifPresent(b -> collectUses(b, uses));
      node.elseBody.ifPresent(b -> collectUses(b, uses));
    }
  }

  private static Body commonAncestor(Body a, Body b) {
    while (a.depth > b.depth) {
      a = a.parent.get();
    }
    while (b.depth > a.depth) {
      b = b.parent.get();
    }
    while (a != b) {
      a = a.parent.get();
      b = b.parent.get();
    }
    return a;
  }

  // The variable must be the action's first argument and appear nowhere else in it.
  private static boolean canInline(Node node, EncodedValue.Variable variable) {
    CodeBlock block = node.block;
    if (!block.block().flatMap(Category::fromActionBlock).isPresent()
        || block.params().isEmpty()) {
      return false;
    }

    Parameter first = block.params().get(0);
    return first.slot() == 0
        && first.value().equals(variable)
        && block.params().stream().skip(1).noneMatch(p -> p.value().equals(variable));
  }

  private void inferred(
      EncodedValue.Variable variable, String name, Tokenizer.Pos pos, String where) {
    warn(
        CompilerException.Kind.INFERRED_DECLARATION,
        pos,
        String.format(
            "declared %s variable '%s' %s", variable.scope().keyword(), name, where));
  }

  private Expression.Declaration declaration(
      EncodedValue.Variable variable, Optional<Expression> initializer, Tokenizer.Pos pos) {
    String name = variableNames.allocate(variable, variable.name());
    return Expression.Declaration.create(
        variable.scope(), name, rawName(name, variable.name()), initializer, pos);
  }

  private ImmutableList<Expression> body(Body body) {
    ImmutableList.Builder<Expression> expressions = ImmutableList.builder();
    for (EncodedValue.Variable variable : hoisted.getOrDefault(body, ImmutableList.of())) {
      // A body holding a use is never empty.
      Tokenizer.Pos pos = Tokenizer.Pos.block(body.nodes.get(0).index);
      expressions.add(declaration(variable, Optional.empty(), pos));
    }
    for (Node node : body.nodes) {
      expression(node).ifPresent(expressions::add);
    }
    return expressions.build();
  }

  private Optional<Expression> expression(Node node) {
    CodeBlock block = node.block;
    Tokenizer.Pos pos = Tokenizer.Pos.block(node.index);
    String kind = block.block().get();

    Optional<Category> category = Category.fromActionBlock(kind);
    if (category.isPresent()) {
      EncodedValue.Variable variable = inlined.get(node);
      if (variable == null) {
        return Optional.of(action(category.get(), block, false, pos));
      }
      Expression initializer = initializer(category.get(), block, pos);
      return Optional.of(declaration(variable, Optional.of(initializer), pos));
    }

    category = Category.fromConditionalBlock(kind);
    if (category.isPresent()) {
      Expression.Condition condition =
          condition(category.get(), block.action().orElse(""), block, pos);
      return Optional.of(
          Expression.Conditional.create(
              condition, body(node.body.get()), node.elseBody.map(this::body)));
    }

    switch (kind) {
      case CodeGenerator.REPEAT_BLOCK:
        return Optional.of(repeat(node, pos));
      case CodeGenerator.CALL_BLOCK:
        {
          String raw = block.data().orElse("");
          return Optional.of(
              Expression.Call.create(
                  functionNames.allocate(raw, raw), values(block.params(), 0, pos), pos));
        }
      case CodeGenerator.START_BLOCK:
        {
          String raw = block.data().orElse("");
          return Optional.of(
              Expression.Start.create(
                  processNames.allocate(raw, raw),
                  tags(catalogue::startProcessTagByExternalName, true, block, pos),
                  pos));
        }
      default:
        warn(
            CompilerException.Kind.UNRECOGNIZED_BLOCK,
            pos,
            String.format("skipped unrecognized block '%s'", kind));
        return Optional.empty();
    }
  }

  // The action without its leading variable, or the assigned value of a plain assignment.
  private Expression initializer(Category category, CodeBlock block, Tokenizer.Pos pos) {
    if (category == Category.VARIABLE
        && block.action().equals(Optional.of(CodeGenerator.SET_VARIABLE_ACTION))
        && block.params().size() == 2
        && block.tags().isEmpty()) {
      Optional<Value> value = value(block.params().get(1).value(), pos);
      if (value.isPresent()) {
        return Expression.ValueExpr.create(value.get());
      }
    }
    return action(category, block, true, pos);
  }

  private Expression.Action action(
      Category category, CodeBlock block, boolean skipFirst, Tokenizer.Pos pos) {
    String external = block.action().orElse("");
    Optional<ActionSchema> schema = catalogue.actionByExternalName(category, external);
    String name =
        schema
            .map(ActionSchema::name)
            .orElseGet(() -> unrecognized(pos, category.prefix() + " action", external));
    return Expression.Action.create(
        category,
        category.isTargeted() ? selector(block.target(), pos) : Optional.empty(),
        name,
        values(block.params(), skipFirst ? 1 : 0, pos),
        tags(schemaTags(schema), schema.isPresent(), block, pos),
        pos);
  }

  private Expression.Condition condition(
      Category category, String external, CodeBlock block, Tokenizer.Pos pos) {
    Optional<ActionSchema> schema = catalogue.conditionalByExternalName(category, external);
    String what = category.conditionalKeyword().get() + " condition";
    String name =
        schema.map(ActionSchema::name).orElseGet(() -> unrecognized(pos, what, external));
    return Expression.Condition.create(
        category,
        category.isTargeted() ? selector(block.target(), pos) : Optional.empty(),
        block.attribute().equals(Optional.of(CodeGenerator.NOT_ATTRIBUTE)),
        name,
        values(block.params(), 0, pos),
        tags(schemaTags(schema), schema.isPresent(), block, pos),
        pos);
  }

  private Expression.Repeat repeat(Node node, Tokenizer.Pos pos) {
    CodeBlock block = node.block;
    ImmutableList<Expression> body = body(node.body.get());
    String action = block.action().orElse("");
    if (action.equals(CodeGenerator.FOREVER_ACTION)) {
      return Expression.Repeat.forever(body, pos);
    } else if (action.equals(CodeGenerator.WHILE_ACTION)) {
      String external = block.subAction().orElse("");
      return Expression.Repeat.whileTrue(
          condition(whileCategory(external, block.target().isPresent()), external, block, pos),
          body,
          pos);
    }

    Optional<ActionSchema> schema = catalogue.repeatByExternalName(action);
    String name =
        schema.map(ActionSchema::name).orElseGet(() -> unrecognized(pos, "repeat", action));
    return Expression.Repeat.named(
        name,
        values(block.params(), 0, pos),
        tags(schemaTags(schema), schema.isPresent(), block, pos),
        body,
        pos);
  }

  // The encoded while loop does not name the condition's category; a target implies a
  // player or entity condition.
  private Category whileCategory(String external, boolean targeted) {
    Category fallback = targeted ? Category.PLAYER : Category.VARIABLE;
    for (Category category : Category.values()) {
      if (category.conditionalBlock().isPresent()
          && category.isTargeted() == targeted
          && catalogue.conditionalByExternalName(category, external).isPresent()) {
        return category;
      }
    }
    return fallback;
  }

  private static Function<String, Optional<TagSpec>> schemaTags(Optional<ActionSchema> schema) {
    return external -> schema.flatMap(s -> s.tagByExternalName(external));
  }

  // Tags left at their default option are omitted.
  private ImmutableList<Expression.TagArg> tags(
      Function<String, Optional<TagSpec>> lookup,
      boolean known,
      CodeBlock block,
      Tokenizer.Pos pos) {
    ImmutableList.Builder<Expression.TagArg> tags = ImmutableList.builder();
    for (Map.Entry<String, BlockTag> entry : block.tags().entrySet()) {
      String option = entry.getValue().option();
      Optional<TagSpec> spec = lookup.apply(entry.getKey());
      if (spec.isPresent()) {
        if (!option.equals(spec.get().defaultOption())) {
          tags.add(Expression.TagArg.create(spec.get().name(), option, pos));
        }
      } else if (!entry.getKey().equals(CodeGenerator.HIDDEN_TAG)) {
        if (known) {
          warn(
              CompilerException.Kind.UNRECOGNIZED_BLOCK,
              pos,
              String.format("unrecognized tag '%s'", entry.getKey()));
        }
        tags.add(
            Expression.TagArg.create(NameAllocator.sanitize(entry.getKey(), "tag"), option, pos));
      }
    }
    return tags.build();
  }

  private Optional<String> selector(Optional<String> target, Tokenizer.Pos pos) {
    if (!target.isPresent()) {
      return Optional.empty();
    }

    Optional<Selector> selector = Selector.fromExternalName(target.get());
    if (!selector.isPresent()) {
      warn(
          CompilerException.Kind.UNRECOGNIZED_BLOCK,
          pos,
          String.format("dropped unrecognized target '%s'", target.get()));
      return Optional.empty();
    }
    return selector.get() == Selector.DEFAULT
        ? Optional.empty()
        : Optional.of(selector.get().sourceName());
  }

  private ImmutableList<Value> values(List<Parameter> params, int skip, Tokenizer.Pos pos) {
    ImmutableList.Builder<Value> values = ImmutableList.builder();
    for (Parameter param : params.subList(Math.min(skip, params.size()), params.size())) {
      value(param.value(), pos).ifPresent(values::add);
    }
    return values.build();
  }

  private Optional<Value> value(EncodedValue value, Tokenizer.Pos pos) {
    switch (value.kind()) {
      case NUMBER:
        {
          String name = value.<EncodedValue.Simple>cast().name();
          // Literals that would not print back unchanged stay formulas.
          if (NUMBER_LITERAL.matcher(name).matches()) {
            double number = Double.parseDouble(name);
            if (Double.isFinite(number) && Numbers.format(number).equals(name)) {
              return Optional.of(Value.Number.create(number, pos));
            }
          }
          return Optional.of(Value.DynamicNumber.create(name, pos));
        }
      case STRING:
        return Optional.of(
            Value.StringLiteral.create(value.<EncodedValue.Simple>cast().name(), pos));
      case TEXT:
        return Optional.of(Value.Text.create(value.<EncodedValue.Simple>cast().name(), pos));
      case LOCATION:
        {
          EncodedValue.Location loc = value.cast();
          boolean level = loc.pitch() == 0 && loc.yaw() == 0;
          return Optional.of(
              Value.Location.create(
                  loc.x(),
                  loc.y(),
                  loc.z(),
                  level ? Optional.empty() : Optional.of(loc.pitch()),
                  level ? Optional.empty() : Optional.of(loc.yaw()),
                  pos));
        }
      case VECTOR:
        {
          EncodedValue.Vector vec = value.cast();
          return Optional.of(Value.Vector.create(vec.x(), vec.y(), vec.z(), pos));
        }
      case SOUND:
        {
          EncodedValue.Sound sound = value.cast();
          return Optional.of(
              Value.Sound.create(
                  sound.sound(), sound.volume(), sound.pitch(), sound.variant(), pos));
        }
      case POTION:
        {
          EncodedValue.Potion potion = value.cast();
          return Optional.of(
              Value.Potion.create(potion.potion(), potion.amplifier(), potion.duration(), pos));
        }
      case PARTICLE:
        return Optional.of(particle(value.cast(), pos));
      case ITEM:
        return Optional.of(Value.Item.create(value.<EncodedValue.Item>cast().item(), pos));
      case GAME_VALUE:
        {
          EncodedValue.GameValue gameValue = value.cast();
          String name =
              catalogue
                  .gameValueByExternalName(gameValue.type())
                  .orElseGet(() -> unrecognized(pos, "game value", gameValue.type()));
          return Optional.of(
              Value.GameValue.create(name, selector(Optional.of(gameValue.target()), pos), pos));
        }
      case VARIABLE:
        {
          EncodedValue.Variable variable = value.cast();
          return Optional.of(
              Value.VariableRef.create(
                  variableNames.allocate(variable, variable.name()), pos));
        }
      case PARAMETER:
      case HINT:
        break;
    }
    warn(
        CompilerException.Kind.UNRECOGNIZED_BLOCK,
        pos,
        String.format("dropped unexpected %s item", value.kind().id()));
    return Optional.empty();
  }

  private Value.Particle particle(EncodedValue.Particle particle, Tokenizer.Pos pos) {
    ImmutableMap<String, Object> data = particle.data();
    ImmutableMap.Builder<String, Value> fields = ImmutableMap.builder();
    for (ParticleField field : ParticleField.values()) {
      if (field == ParticleField.MOTION) {
        if (data.get("x") instanceof Number
            && data.get("y") instanceof Number
            && data.get("z") instanceof Number) {
          fields.put(
              field.sourceName(),
              Value.Vector.create(
                  ((Number) data.get("x")).doubleValue(),
                  ((Number) data.get("y")).doubleValue(),
                  ((Number) data.get("z")).doubleValue(),
                  pos));
        }
        continue;
      }

      Object value = data.get(field.key());
      if (value instanceof String) {
        fields.put(field.sourceName(), Value.StringLiteral.create((String) value, pos));
      } else if (value instanceof Number) {
        fields.put(field.sourceName(), Value.Number.create(((Number) value).doubleValue(), pos));
      }
    }

    for (String key : data.keySet()) {
      if (!key.equals("y") && !key.equals("z") && !ParticleField.fromKey(key).isPresent()) {
        warn(
            CompilerException.Kind.UNRECOGNIZED_BLOCK,
            pos,
            String.format("dropped unrecognized particle field '%s'", key));
      }
    }

    return Value.Particle.create(
        particle.particle(),
        particle.amount(),
        particle.horizontal(),
        particle.vertical(),
        fields.buildOrThrow(),
        pos);
  }

  private String unrecognized(Tokenizer.Pos pos, String what, String external) {
    warn(
        CompilerException.Kind.UNRECOGNIZED_BLOCK,
        pos,
        String.format("unrecognized %s '%s'", what, external));
    return NameAllocator.sanitize(external, "unknown");
  }

  private void warn(CompilerException.Kind kind, Tokenizer.Pos pos, String msg) {
    diagnostics.add(new CompilerException(kind, pos, msg));
  }

  private static CompilerException error(Tokenizer.Pos pos, String msg) {
    return new CompilerException(CompilerException.Kind.SERIALIZATION, pos, msg);
  }
}
