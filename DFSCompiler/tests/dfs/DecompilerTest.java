package dfs;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.truth.Correspondence;

public class DecompilerTest {

  private static final ActionCatalogue CATALOGUE = TestCatalogue.create();

  private static final CodeBlock OPEN =
      CodeBlock.bracket(CodeBlock.Direction.OPEN, CodeBlock.BracketType.NORM);
  private static final CodeBlock CLOSE =
      CodeBlock.bracket(CodeBlock.Direction.CLOSE, CodeBlock.BracketType.NORM);
  private static final CodeBlock OPEN_REPEAT =
      CodeBlock.bracket(CodeBlock.Direction.OPEN, CodeBlock.BracketType.REPEAT);
  private static final CodeBlock CLOSE_REPEAT =
      CodeBlock.bracket(CodeBlock.Direction.CLOSE, CodeBlock.BracketType.REPEAT);

  private static final CodeBlock JOIN = CodeBlock.block("event").setAction("Join").build();

  private Decompiler decompiler = new Decompiler(CATALOGUE, CompilerOptions.defaults());

  private String decompile(CodeBlock... blocks) throws CompilerException {
    BlockGraph graph = BlockGraph.create(ImmutableList.copyOf(blocks));
    return SourcePrinter.print(decompiler.decompile(ImmutableList.of(graph)));
  }

  private static CodeBlock.Builder sendMessage() {
    return CodeBlock.block("player_action")
        .setAction("SendMessage")
        .setTarget("Default")
        .setTags(
            ImmutableSortedMap.of(
                "Alignment Mode",
                BlockTag.create("Regular", 26, "SendMessage", "player_action")));
  }

  private static CodeBlock isSneaking() {
    return CodeBlock.block("if_player").setAction("IsSneaking").setTarget("Default").build();
  }

  private static String source(String... lines) {
    return String.join("\n", lines) + "\n";
  }

  // Compiles, decompiles and checks that the text and the block graphs survive unchanged.
  private static void assertRoundTrip(String source) {
    Compiler.CompileResult compiled = Compiler.compile(source, CATALOGUE);
    assertThat(compiled.diagnostics()).isEmpty();

    Compiler.DecompileResult decompiled =
        Compiler.decompile(codestrings(compiled), CATALOGUE, CompilerOptions.defaults());
    assertThat(decompiled.hasErrors()).isFalse();
    assertThat(decompiled.source()).hasValue(source);

    Compiler.CompileResult recompiled = Compiler.compile(decompiled.source().get(), CATALOGUE);
    assertThat(recompiled.diagnostics()).isEmpty();
    assertThat(graphs(recompiled)).containsExactlyElementsIn(graphs(compiled)).inOrder();
  }

  private static ImmutableList<String> codestrings(Compiler.CompileResult result) {
    return result.lines().stream()
        .map(Compiler.CompiledLine::codestring)
        .collect(ImmutableList.toImmutableList());
  }

  private static ImmutableList<BlockGraph> graphs(Compiler.CompileResult result) {
    return result.lines().stream()
        .map(Compiler.CompiledLine::graph)
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void synthesizesGlobalDeclaration() throws Exception {
    String text =
        decompile(
            JOIN,
            sendMessage()
                .addParam(0, EncodedValue.Variable.create("score", VariableScope.SAVE))
                .build());

    assertThat(text)
        .isEqualTo(source("save score;", "", "@join {", "    p.sendMessage(score);", "}"));
    assertThat(decompiler.diagnostics())
        .comparingElementsUsing(kinds())
        .containsExactly(CompilerException.Kind.INFERRED_DECLARATION);
    assertThat(decompiler.diagnostics().get(0).isError()).isFalse();
  }

  @Test
  public void synthesizedDeclarationRecompiles() throws Exception {
    BlockGraph graph =
        BlockGraph.create(
            ImmutableList.of(
                JOIN,
                sendMessage()
                    .addParam(0, EncodedValue.Variable.create("score", VariableScope.SAVE))
                    .build()));

    Compiler.DecompileResult decompiled =
        Compiler.decompile(CodeStrings.serialize(graph), CATALOGUE);
    Compiler.CompileResult recompiled = Compiler.compile(decompiled.source().get(), CATALOGUE);

    assertThat(recompiled.diagnostics()).isEmpty();
    assertThat(graphs(recompiled)).containsExactly(graph);
  }

  @Test
  public void declarationScopeFollowsVariableScope() throws Exception {
    String text =
        decompile(
            JOIN,
            sendMessage()
                .addParam(0, EncodedValue.Variable.create("a", VariableScope.GAME))
                .addParam(1, EncodedValue.Variable.create("b", VariableScope.LOCAL))
                .addParam(2, EncodedValue.Variable.create("c", VariableScope.LINE))
                .build());

    assertThat(text)
        .isEqualTo(
            source(
                "game a;",
                "",
                "@join {",
                "    local b;",
                "    line c;",
                "    p.sendMessage(a, b, c);",
                "}"));
    assertThat(decompiler.diagnostics()).hasSize(3);
  }

  @Test
  public void sameNameInDifferentScopes() throws Exception {
    String text =
        decompile(
            JOIN,
            sendMessage()
                .addParam(0, EncodedValue.Variable.create("x", VariableScope.GAME))
                .addParam(1, EncodedValue.Variable.create("x", VariableScope.LINE))
                .build());

    assertThat(text)
        .isEqualTo(
            source(
                "game x;",
                "",
                "@join {",
                "    line x_2: `x`;",
                "    p.sendMessage(x, x_2);",
                "}"));
  }

  @Test
  public void firstAssignmentBecomesInitializer() {
    assertRoundTrip(
        source(
            "@join {",
            "    line count = 0;",
            "    repeat multiple(3) {",
            "        v.add(count, 1);",
            "    }",
            "    p.sendMessage(count);",
            "}"));
  }

  @Test
  public void declarationHoistedAboveBranches() {
    assertRoundTrip(
        source(
            "@join {",
            "    local flag;",
            "    ifp isSneaking() {",
            "        v.set(flag, 1);",
            "    } else {",
            "        v.set(flag, 2);",
            "    }",
            "    p.sendMessage(flag);",
            "}"));
  }

  @Test
  public void functionsAndProcesses() {
    assertRoundTrip(
        source(
            "fn greet(name: text, extra?) {",
            "    p.sendMessage(name, extra);",
            "}",
            "",
            "proc cleanup {",
            "    c.wait(20, timeUnit=\"Seconds\");",
            "}",
            "",
            "@join! {",
            "    greet(\"Bob\");",
            "    start cleanup(targetMode=\"With no targets\");",
            "}"));
  }

  @Test
  public void parameterDefaults() {
    assertRoundTrip(
        source(
            "fn go(to: location? = Location(0, 64, 0), label? = \"Home\", rest: number?*) {",
            "    p.teleport(to);",
            "}"));
  }

  @Test
  public void optionalVariadicParameterKeepsBothMarkers() throws Exception {
    EncodedValue.FunctionParam values =
        EncodedValue.FunctionParam.create(Optional.empty(), "values", true, true, "num");
    String text = decompile(CodeBlock.block("func").setData("sum").addParam(0, values).build());

    assertThat(text).isEqualTo(source("fn sum(values: number?*) {", "}"));

    Compiler.CompileResult recompiled = Compiler.compile(text, CATALOGUE);
    assertThat(recompiled.diagnostics()).isEmpty();
    CodeBlock header = recompiled.lines().get(0).graph().blocks().get(0);
    assertThat(header.params().get(0).value()).isEqualTo(values);
  }

  @Test
  public void unsupportedParameterDefaultIsDropped() throws Exception {
    String text =
        decompile(
            CodeBlock.block("func")
                .setData("give")
                .addParam(
                    0,
                    EncodedValue.FunctionParam.create(
                        Optional.of(EncodedValue.Item.create("{id:\"minecraft:stone\"}")),
                        "stack",
                        true,
                        false,
                        "item"))
                .build());

    assertThat(text).isEqualTo(source("fn give(stack: item?) {", "}"));
    assertThat(decompiler.diagnostics())
        .comparingElementsUsing(messages())
        .containsExactly("dropped unsupported default value of parameter 'stack'");
  }

  @Test
  public void numbersThatWouldNotPrintBackStayFormulas() throws Exception {
    String text =
        decompile(
            JOIN,
            CodeBlock.block("control")
                .setAction("Wait")
                .addParam(0, EncodedValue.Simple.number("1" + "0".repeat(400)))
                .build(),
            CodeBlock.block("control")
                .setAction("Wait")
                .addParam(0, EncodedValue.Simple.number("2.50"))
                .build());

    assertThat(text)
        .isEqualTo(
            source(
                "@join {",
                "    c.wait(Number('1" + "0".repeat(400) + "'));",
                "    c.wait(Number('2.50'));",
                "}"));
  }

  @Test
  public void sourceOnlyConstructsPrintBack() {
    String text =
        source(
            "use \"lib/common.dfrs\";",
            "",
            "save total: `Total Joins`: number;",
            "",
            "@join {",
            "    line label: string = 'plain';",
            "    label = \"styled\";",
            "    total = v.add(1);",
            "}");
    Parser parser =
        new Parser(
            new Tokenizer("/test/file.dfrs", text).tokenize(), CompilerOptions.defaults());

    AST ast = parser.parse();

    assertThat(parser.errors()).isEmpty();
    assertThat(SourcePrinter.print(ast)).isEqualTo(text);
  }

  @Test
  public void selectorsTagsAndValues() {
    assertRoundTrip(
        source(
            "@join {",
            "    p:selection.sendMessage(\"Hi\", $playerCount, alignmentMode=\"Centered\");",
            "    p.playSound(Sound('Pling', 1, 2, 'High'), Location(1, 2, 3, 45, 90));",
            "    g.spawnParticle(Particle('Dust', 4, 0.5, 0, rgb=16711680), $location);",
            "    p.givePotion(Potion('Speed', 1, 100));",
            "    c.wait(Number('%math(1+1)'));",
            "}"));
  }

  @Test
  public void conditionsAndRepeats() {
    assertRoundTrip(
        source(
            "@join {",
            "    ifp selection:!isSneaking() {",
            "        repeat forever() {",
            "            c.wait();",
            "        }",
            "    }",
            "    repeat while(ifp isSneaking()) {",
            "        c.wait();",
            "    }",
            "}"));
  }

  @Test
  public void whileConditionCategoryFromTarget() throws Exception {
    String text =
        decompile(
            JOIN,
            CodeBlock.block("repeat")
                .setAction("While")
                .setSubAction("IsSneaking")
                .setTarget("Default")
                .build(),
            OPEN_REPEAT,
            CLOSE_REPEAT);

    assertThat(text)
        .isEqualTo(source("@join {", "    repeat while(ifp isSneaking()) {", "    }", "}"));
    assertThat(decompiler.diagnostics()).isEmpty();
  }

  @Test
  public void negatedConditionWithSelector() throws Exception {
    String text =
        decompile(
            JOIN,
            CodeBlock.block("if_player")
                .setAction("IsSneaking")
                .setTarget("Selection")
                .setAttribute("NOT")
                .build(),
            OPEN,
            CLOSE);

    assertThat(text)
        .isEqualTo(source("@join {", "    ifp selection:!isSneaking() {", "    }", "}"));
  }

  @Test
  public void unknownActionKeepsSanitizedName() throws Exception {
    String text =
        decompile(JOIN, CodeBlock.block("player_action").setAction("Do Thing!").build());

    assertThat(text).isEqualTo(source("@join {", "    p.Do_Thing();", "}"));
    assertThat(decompiler.diagnostics())
        .comparingElementsUsing(messages())
        .containsExactly("unrecognized p action 'Do Thing!'");
    assertThat(decompiler.diagnostics().get(0).kind())
        .isEqualTo(CompilerException.Kind.UNRECOGNIZED_BLOCK);
    assertThat(decompiler.diagnostics().get(0).pos()).isEqualTo(Tokenizer.Pos.block(1));
  }

  @Test
  public void unknownBlockIsSkipped() throws Exception {
    String text = decompile(JOIN, CodeBlock.block("mystery").setAction("Foo").build());

    assertThat(text).isEqualTo(source("@join {", "}"));
    assertThat(decompiler.diagnostics())
        .comparingElementsUsing(messages())
        .containsExactly("skipped unrecognized block 'mystery'");
  }

  @Test
  public void variableNamesAreSanitized() throws Exception {
    String text =
        decompile(
            JOIN,
            sendMessage()
                .addParam(0, EncodedValue.Variable.create("my score", VariableScope.SAVE))
                .build());

    assertThat(text)
        .isEqualTo(
            source(
                "save my_score: `my score`;",
                "",
                "@join {",
                "    p.sendMessage(my_score);",
                "}"));
  }

  @Test
  public void globalsSharedAcrossLines() throws Exception {
    CodeBlock use =
        sendMessage()
            .addParam(0, EncodedValue.Variable.create("score", VariableScope.SAVE))
            .build();
    AST ast =
        decompiler.decompile(
            ImmutableList.of(
                BlockGraph.create(ImmutableList.of(JOIN, use)),
                BlockGraph.create(
                    ImmutableList.of(CodeBlock.block("process").setData("tick").build(), use))));

    assertThat(ast.declarations()).hasSize(1);
    assertThat(ast.units()).hasSize(2);
    assertThat(decompiler.diagnostics()).hasSize(1);
  }

  @Test
  public void emptyGraph() {
    CompilerException ex =
        assertThrows(
            CompilerException.class,
            () -> decompiler.decompile(ImmutableList.of(BlockGraph.create(ImmutableList.of()))));
    assertThat(ex.kind()).isEqualTo(CompilerException.Kind.SERIALIZATION);
  }

  @Test
  public void unknownHeader() {
    CompilerException ex =
        assertThrows(
            CompilerException.class,
            () -> decompile(CodeBlock.block("player_action").setAction("SendMessage").build()));
    assertThat(ex.kind()).isEqualTo(CompilerException.Kind.SERIALIZATION);
    assertThat(ex.errorMsg()).isEqualTo("unrecognized code line header 'player_action'");
  }

  @Test
  public void bracketWithoutBody() {
    CompilerException ex =
        assertThrows(CompilerException.class, () -> decompile(JOIN, OPEN, CLOSE));
    assertThat(ex.pos()).isEqualTo(Tokenizer.Pos.block(1));
  }

  @Test
  public void nestingTooDeep() {
    decompiler =
        new Decompiler(CATALOGUE, CompilerOptions.builder().setMaxNestingDepth(2).build());

    CompilerException ex =
        assertThrows(
            CompilerException.class,
            () -> decompile(JOIN, isSneaking(), OPEN, isSneaking(), OPEN, CLOSE, CLOSE));
    assertThat(ex.kind()).isEqualTo(CompilerException.Kind.NESTING_TOO_DEEP);
    assertThat(ex.pos()).isEqualTo(Tokenizer.Pos.block(4));
  }

  @Test
  public void badCodestring() {
    Compiler.DecompileResult result = Compiler.decompile("not a codestring", CATALOGUE);

    assertThat(result.source()).isEmpty();
    assertThat(result.hasErrors()).isTrue();
    assertThat(result.diagnostics())
        .comparingElementsUsing(kinds())
        .containsExactly(CompilerException.Kind.SERIALIZATION);
  }

  private static Correspondence<CompilerException, CompilerException.Kind> kinds() {
    return Correspondence.from((e, k) -> e.kind() == k, "has kind");
  }

  private static Correspondence<CompilerException, String> messages() {
    return Correspondence.from((e, m) -> e.errorMsg().equals(m), "has message");
  }
}
