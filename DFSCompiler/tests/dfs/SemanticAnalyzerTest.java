package dfs;

import static com.google.common.truth.Truth.assertThat;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.truth.Correspondence;

public class SemanticAnalyzerTest {

  private static final ActionCatalogue CATALOGUE = TestCatalogue.create();

  private static AnnotatedAST analyze(CompilerOptions options, String... lines) {
    Tokenizer tokenizer =
        new Tokenizer("/test/file.dfrs", Arrays.stream(lines).collect(Collectors.joining("\n")));
    Parser parser = new Parser(tokenizer.tokenize(), options);
    AST ast = parser.parse();
    assertThat(tokenizer.errors()).isEmpty();
    assertThat(parser.errors()).isEmpty();

    return new SemanticAnalyzer(ast, CATALOGUE, options).analyze();
  }

  private static AnnotatedAST analyze(String... lines) {
    return analyze(CompilerOptions.defaults(), lines);
  }

  private static void assertValid(String... lines) {
    assertThat(analyze(lines).diagnostics()).isEmpty();
  }

  private static CompilerException assertSingleError(
      CompilerException.Kind kind, String... lines) {
    ImmutableList<CompilerException> diagnostics = analyze(lines).diagnostics();
    assertThat(diagnostics).comparingElementsUsing(kinds()).containsExactly(kind);
    return diagnostics.get(0);
  }

  private static Tokenizer.Pos pos(int line, int column) {
    return new Tokenizer.Pos("/test/file.dfrs", line, column);
  }

  @Test
  public void undeclaredVariable() {
    AnnotatedAST annotated =
        analyze(
            "@join {", //
            "    p.sendMessage(score);",
            "}");

    assertThat(annotated.diagnostics())
        .comparingElementsUsing(kinds())
        .containsExactly(CompilerException.Kind.UNDECLARED_VARIABLE);
    CompilerException error = annotated.diagnostics().get(0);
    assertThat(error.pos()).isEqualTo(pos(1, 18));
    assertThat(error.errorMsg()).isEqualTo("undeclared variable 'score'");
    assertThat(error.format())
        .isEqualTo("ERROR: /test/file.dfrs@2:19 ScopeError: undeclared variable 'score'");

    Expression action = annotated.ast().units().get(0).body().get(0);
    assertThat(annotated.isRejected(action)).isTrue();
  }

  @Test
  public void bindsDeclaredVariables() {
    AnnotatedAST annotated =
        analyze(
            "save total;",
            "@join {",
            "    line count: `Join Count` = 1;",
            "    p.sendMessage(count, total);",
            "}");

    assertThat(annotated.diagnostics()).isEmpty();
    Expression.Action action = annotated.ast().units().get(0).body().get(1).cast();
    Symbol count = annotated.symbol(action.args().get(0).cast()).get();
    assertThat(count.scope()).isEqualTo(VariableScope.LINE);
    assertThat(count.externalName()).isEqualTo("Join Count");
    Symbol total = annotated.symbol(action.args().get(1).cast()).get();
    assertThat(total.scope()).isEqualTo(VariableScope.SAVE);
  }

  @Test
  public void useBeforeDeclaration() {
    assertSingleError(
        CompilerException.Kind.UNDECLARED_VARIABLE,
        "@join {",
        "    p.sendMessage(count);",
        "    line count;",
        "}");
  }

  @Test
  public void initializerCannotSeeItsVariable() {
    assertSingleError(
        CompilerException.Kind.UNDECLARED_VARIABLE,
        "@join {",
        "    line count = count;",
        "}");
  }

  @Test
  public void nestedBodyEndsScope() {
    CompilerException error =
        assertSingleError(
            CompilerException.Kind.UNDECLARED_VARIABLE,
            "@join {",
            "    ifp isSneaking() {",
            "        local flag = 1;",
            "    }",
            "    p.sendMessage(flag);",
            "}");

    assertThat(error.pos()).isEqualTo(pos(4, 18));
  }

  @Test
  public void duplicateDeclaration() {
    CompilerException error =
        assertSingleError(
            CompilerException.Kind.DUPLICATE_DECLARATION,
            "@join {",
            "    line x;",
            "    line x;",
            "}");

    assertThat(error.pos()).isEqualTo(pos(2, 4));
    assertThat(error.errorMsg())
        .isEqualTo(
            "duplicate declaration of line variable 'x', previous declaration at"
                + " /test/file.dfrs@2:5");
  }

  @Test
  public void sameNameDifferentScopes() {
    assertValid(
        "@join {", //
        "    line x;",
        "    local x;",
        "    p.sendMessage(x);",
        "}");
  }

  @Test
  public void shadowingInNestedBody() {
    assertValid(
        "@join {",
        "    line x;",
        "    ifp isSneaking() {",
        "        line x;",
        "    }",
        "}");
  }

  @Test
  public void fileLevelDeclarations() {
    assertSingleError(CompilerException.Kind.INVALID_DECLARATION, "line x;");
    assertSingleError(CompilerException.Kind.INVALID_DECLARATION, "game x = 5;");
    assertValid("game x;", "save y;");
  }

  @Test
  public void unitGlobalsNeedOption() {
    String[] lines = {
      "@join {", //
      "    game players;",
      "    p.sendMessage(players);",
      "}"
    };

    assertThat(analyze(lines).diagnostics())
        .comparingElementsUsing(kinds())
        .containsExactly(CompilerException.Kind.INVALID_DECLARATION);
    assertThat(
            analyze(CompilerOptions.builder().setAllowUnitGlobals(true).build(), lines)
                .diagnostics())
        .isEmpty();
  }

  @Test
  public void duplicateEventsFunctionsAndProcesses() {
    ImmutableList<CompilerException> diagnostics =
        analyze(
                "@join {",
                "}",
                "@join {",
                "}",
                "fn greet() {",
                "}",
                "fn greet() {",
                "}",
                "proc worker {",
                "}",
                "proc worker {",
                "}")
            .diagnostics();

    assertThat(diagnostics).hasSize(3);
    assertThat(diagnostics)
        .comparingElementsUsing(kinds())
        .containsExactly(
            CompilerException.Kind.DUPLICATE_DECLARATION,
            CompilerException.Kind.DUPLICATE_DECLARATION,
            CompilerException.Kind.DUPLICATE_DECLARATION);
  }

  @Test
  public void functionParamsAreLineVariables() {
    AnnotatedAST annotated =
        analyze(
            "fn greet(name: text) {", //
            "    p.sendMessage(name);",
            "}");

    assertThat(annotated.diagnostics()).isEmpty();
    Expression.Action action = annotated.ast().units().get(0).body().get(0).cast();
    assertThat(annotated.symbol(action.args().get(0).cast()).get().scope())
        .isEqualTo(VariableScope.LINE);
  }

  @Test
  public void callArity() {
    CompilerException error =
        assertSingleError(
            CompilerException.Kind.ARITY_MISMATCH,
            "fn greet(name: text) {",
            "}",
            "@join {",
            "    greet();",
            "}");

    assertThat(error.pos()).isEqualTo(pos(3, 4));
    assertThat(error.errorMsg())
        .isEqualTo("function 'greet' takes 1 argument(s) but 0 were supplied");

    assertSingleError(
        CompilerException.Kind.ARITY_MISMATCH,
        "fn greet(name: text) {",
        "}",
        "@join {",
        "    greet('a', 'b');",
        "}");
  }

  @Test
  public void optionalAndVariadicParams() {
    assertValid(
        "fn greet(name, title?) {",
        "}",
        "fn log(first, rest*) {",
        "}",
        "@join {",
        "    greet('Steve');",
        "    greet('Steve', 'Sir');",
        "    log('a', 'b');",
        "    log('a', 'b', 'c', 'd');",
        "}");

    CompilerException error =
        assertSingleError(
            CompilerException.Kind.ARITY_MISMATCH,
            "fn log(first, rest*) {",
            "}",
            "@join {",
            "    log('a');",
            "}");
    assertThat(error.errorMsg())
        .isEqualTo("function 'log' takes at least 2 argument(s) but 1 were supplied");

    error =
        assertSingleError(
            CompilerException.Kind.ARITY_MISMATCH,
            "fn greet(name, title?) {",
            "}",
            "@join {",
            "    greet();",
            "}");
    assertThat(error.errorMsg()).contains("takes 1 to 2 argument(s)");
  }

  @Test
  public void callsResolveRegardlessOfOrder() {
    assertValid(
        "@join {", //
        "    greet('Steve');",
        "    start worker();",
        "}",
        "fn greet(name) {",
        "}",
        "proc worker {",
        "}");
  }

  @Test
  public void undefinedFunctionAndProcess() {
    ImmutableList<CompilerException> diagnostics =
        analyze(
                "@join {", //
                "    greet();",
                "    start worker();",
                "}")
            .diagnostics();

    assertThat(diagnostics)
        .comparingElementsUsing(messages())
        .containsExactly("undefined function 'greet'", "undefined process 'worker'");
  }

  @Test
  public void callArgumentKind() {
    CompilerException error =
        assertSingleError(
            CompilerException.Kind.INVALID_ARGUMENT,
            "fn greet(name: text) {",
            "}",
            "@join {",
            "    greet(5);",
            "}");

    assertThat(error.errorMsg()).isEqualTo("parameter 'name' of 'greet' expects a text value");
  }

  @Test
  public void invalidFunctionParams() {
    assertSingleError(
        CompilerException.Kind.INVALID_DECLARATION,
        "fn greet(title?, name) {", //
        "}");
    assertSingleError(
        CompilerException.Kind.INVALID_DECLARATION,
        "fn greet(rest*, name) {", //
        "}");
  }

  @Test
  public void unknownNames() {
    assertThat(
            analyze(
                    "@quit {",
                    "    p.fly();",
                    "    ifp isFlying() {",
                    "    }",
                    "    repeat often() {",
                    "    }",
                    "    p.sendMessage($bogus);",
                    "}")
                .diagnostics())
        .comparingElementsUsing(messages())
        .containsExactly(
            "unknown event 'quit'",
            "unknown action 'p.fly'",
            "unknown condition 'ifp isFlying'",
            "unknown repeat 'often'",
            "unknown game value 'bogus'");
  }

  @Test
  public void selectors() {
    assertValid(
        "@join {",
        "    p:selection.sendMessage('a');",
        "    p:all.giveItems(Item('stone'));",
        "    e:allMobs.heal();",
        "    ifp !default:isSneaking() {",
        "    }",
        "    p.sendMessage($selection:location);",
        "}");

    assertThat(
            analyze(
                    "@join {",
                    "    g:selection.spawnParticle(Particle('flame', 1, 0, 0),"
                        + " Location(0, 0, 0));",
                    "    p:bogus.sendMessage();",
                    "    p:killer.giveItems(Item('stone'));",
                    "    p:allMobs.sendMessage();",
                    "}")
                .diagnostics())
        .comparingElementsUsing(messages())
        .containsExactly(
            "'g.spawnParticle' does not take a selector",
            "unknown selector 'bogus'",
            "selector 'killer' is not allowed for 'p.giveItems'",
            "selector 'allMobs' is not allowed for 'p.sendMessage'");
  }

  @Test
  public void tags() {
    assertValid(
        "@join {",
        "    p.sendMessage('a', alignmentMode=\"Centered\");",
        "    start worker(localVariables='Share', targetMode=\"With no targets\");",
        "}",
        "proc worker {",
        "}");

    assertThat(
            analyze(
                    "@join {",
                    "    p.sendMessage('a', alignmentMode=\"Left\");",
                    "    p.sendMessage('a', fontSize=\"Big\");",
                    "    c.wait(alignmentMode=\"Regular\");",
                    "    p.sendMessage(alignmentMode=\"Regular\", alignmentMode=\"Regular\");",
                    "}")
                .diagnostics())
        .comparingElementsUsing(kinds())
        .containsExactly(
            CompilerException.Kind.INVALID_TAG,
            CompilerException.Kind.INVALID_TAG,
            CompilerException.Kind.INVALID_TAG,
            CompilerException.Kind.INVALID_TAG);
  }

  @Test
  public void actionArguments() {
    assertValid(
        "@join {",
        "    p.sendMessage();",
        "    p.sendMessage('a', \"b\", $playerCount);",
        "    p.playSound(Sound('Pling', 1, 2));",
        "    p.playSound(Sound('Pling', 1, 2), Location(1, 2, 3));",
        "    p.givePotion(Effect('speed', 1, 20));",
        "    c.wait();",
        "    c.wait(20, timeUnit=\"Seconds\");",
        "}");

    assertThat(
            analyze(
                    "@join {",
                    "    p.teleport();",
                    "    p.teleport(Location(0, 0, 0), 5);",
                    "    p.teleport(5);",
                    "}")
                .diagnostics())
        .comparingElementsUsing(messages())
        .containsExactly(
            "missing argument 'location' for p.teleport",
            "unexpected argument for p.teleport, which takes 1 parameter(s)",
            "argument 'location' of p.teleport expects a location value, found number")
        .inOrder();
  }

  @Test
  public void declarationInitializers() {
    assertValid(
        "@join {",
        "    line a = 5;",
        "    line b = v.add(2);",
        "    line c = v.shift(Vector(0, 1, 0));",
        "}");

    assertSingleError(
        CompilerException.Kind.INVALID_ARGUMENT,
        "@join {", //
        "    line b = v.add('two');",
        "}");
  }

  @Test
  public void particleFields() {
    assertValid(
        "@join {",
        "    g.spawnParticle(Particle('dust', 1, 0, 0, rgb=255, motion=Vector(0, 1, 0),"
            + " material='stone'), Location(0, 0, 0));",
        "}");

    assertThat(
            analyze(
                    "@join {",
                    "    line size = 1;",
                    "    g.spawnParticle(Particle('dust', 1, 0, 0, glow=1, size=size),"
                        + " Location(0, 0, 0));",
                    "}")
                .diagnostics())
        .comparingElementsUsing(messages())
        .containsExactly(
            "unknown particle field 'glow'", "particle field 'size' expects a number literal");
  }

  @Test
  public void particleAmountMustBeWhole() {
    AnnotatedAST annotated =
        analyze(
            "@join {",
            "    g.spawnParticle(Particle('dust', 1.5, 0, 0), Location(0, 0, 0));",
            "    g.spawnParticle(Particle('dust', 3000000000, 0, 0), Location(0, 0, 0));",
            "    g.spawnParticle(Particle('dust', 2, 0, 0, rgb=0.5), Location(0, 0, 0));",
            "    g.spawnParticle(Particle('dust', 2, 0, 0, size=0.5), Location(0, 0, 0));",
            "}");

    assertThat(annotated.diagnostics())
        .comparingElementsUsing(messages())
        .containsExactly(
            "particle amount must be a whole number, found 1.5",
            "particle amount must be a whole number, found 3000000000",
            "particle field 'rgb' expects a whole number")
        .inOrder();
    assertThat(annotated.diagnostics().get(0).kind())
        .isEqualTo(CompilerException.Kind.INVALID_ARGUMENT);
    assertThat(annotated.diagnostics().get(0).pos()).isEqualTo(pos(1, 20));

    ImmutableList<Expression> body = annotated.ast().units().get(0).body();
    assertThat(annotated.isRejected(body.get(0))).isTrue();
    assertThat(annotated.isRejected(body.get(3))).isFalse();
  }

  @Test
  public void assignments() {
    AnnotatedAST annotated =
        analyze(
            "@join {",
            "    line count = 1;",
            "    count = v.add(2);",
            "    count = 'ten';",
            "}");

    assertThat(annotated.diagnostics()).isEmpty();
    Expression.Assignment add = annotated.ast().units().get(0).body().get(1).cast();
    Symbol count = annotated.symbol(add.target()).get();
    assertThat(count.name()).isEqualTo("count");
    assertThat(count.scope()).isEqualTo(VariableScope.LINE);

    CompilerException error =
        assertSingleError(
            CompilerException.Kind.UNDECLARED_VARIABLE,
            "@join {", //
            "    total = 5;",
            "}");
    assertThat(error.errorMsg()).isEqualTo("undeclared variable 'total'");
    assertThat(error.pos()).isEqualTo(pos(1, 4));

    assertSingleError(
        CompilerException.Kind.INVALID_ARGUMENT,
        "@join {",
        "    line count = 1;",
        "    count = v.add('two');",
        "}");
  }

  @Test
  public void declaredTypes() {
    assertValid(
        "@join {",
        "    line count: number = 5;",
        "    line label: string = \"styled\";",
        "    line spot: location;",
        "    line copy: number = count;",
        "}");

    CompilerException error =
        assertSingleError(
            CompilerException.Kind.INVALID_ARGUMENT,
            "@join {", //
            "    line count: number = 'ten';",
            "}");
    assertThat(error.errorMsg())
        .isEqualTo("variable 'count' is declared as number but initialized with a string value");
  }

  @Test
  public void optionalVariadicParams() {
    assertValid(
        "fn sum(values?*) {",
        "}",
        "fn log(first, rest*?) {",
        "}",
        "@join {",
        "    sum();",
        "    sum(1, 2, 3);",
        "    log('a');",
        "    log('a', 'b', 'c');",
        "}");

    CompilerException error =
        assertSingleError(
            CompilerException.Kind.ARITY_MISMATCH,
            "fn log(first, rest?*) {",
            "}",
            "@join {",
            "    log();",
            "}");
    assertThat(error.errorMsg())
        .isEqualTo("function 'log' takes at least 1 argument(s) but 0 were supplied");
  }

  @Test
  public void parameterDefaults() {
    assertValid(
        "fn greet(name, title: text? = \"Sir\", times: number? = 1, at? = Location(0, 64, 0)) {",
        "}");

    CompilerException error =
        assertSingleError(
            CompilerException.Kind.INVALID_DECLARATION,
            "fn greet(name = 'Steve') {", //
            "}");
    assertThat(error.errorMsg())
        .isEqualTo("required parameter 'name' cannot have a default value");

    error =
        assertSingleError(
            CompilerException.Kind.INVALID_DECLARATION,
            "fn greet(count? = $playerCount) {", //
            "}");
    assertThat(error.errorMsg())
        .isEqualTo("default value of parameter 'count' must be a literal, found game_value");

    error =
        assertSingleError(
            CompilerException.Kind.INVALID_ARGUMENT,
            "fn greet(count: number? = 'many') {", //
            "}");
    assertThat(error.errorMsg())
        .isEqualTo("default value of parameter 'count' must be a number value");
  }

  @Test
  public void everyPassReports() {
    assertThat(
            analyze(
                    "@join {",
                    "    p.sendMessage(missing);",
                    "    greet();",
                    "    p.fly();",
                    "}")
                .diagnostics())
        .comparingElementsUsing(kinds())
        .containsExactly(
            CompilerException.Kind.UNDECLARED_VARIABLE,
            CompilerException.Kind.UNDEFINED_FUNCTION,
            CompilerException.Kind.UNKNOWN_ACTION);
  }

  private static Correspondence<CompilerException, CompilerException.Kind> kinds() {
    return Correspondence.from((e, k) -> e.kind() == k, "has kind");
  }

  private static Correspondence<CompilerException, String> messages() {
    return Correspondence.from((e, m) -> e.errorMsg().equals(m), "has message");
  }
}
