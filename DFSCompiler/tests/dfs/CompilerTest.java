package dfs;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.truth.Correspondence;

public class CompilerTest {

  private static final ActionCatalogue CATALOGUE = TestCatalogue.create();

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private Compiler.CompileResult compile() {
    return compile(CompilerOptions.builder().setFileName("/test/file.dfrs").build());
  }

  private Compiler.CompileResult compile(CompilerOptions options) {
    return Compiler.compile(file.toString(), CATALOGUE, options);
  }

  @Test
  public void compilesEventToOneLine() throws Exception {
    println("game players;");
    println("@join {");
    println("    p.sendMessage(\"Hi\");");
    println("}");

    Compiler.CompileResult result = compile();

    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.hasErrors()).isFalse();
    assertThat(result.lines()).hasSize(1);

    Compiler.CompiledLine line = result.lines().get(0);
    assertThat(line.name()).isEqualTo("Event join");
    ImmutableList<CodeBlock> blocks = line.graph().blocks();
    assertThat(blocks).hasSize(2);
    assertThat(blocks.get(0).block()).hasValue("event");
    assertThat(blocks.get(0).action()).hasValue("Join");
    assertThat(blocks.get(1).block()).hasValue("player_action");
    assertThat(blocks.get(1).action()).hasValue("SendMessage");
    assertThat(blocks.get(1).params())
        .containsExactly(Parameter.create(0, EncodedValue.Simple.text("Hi")));

    assertThat(CodeStrings.deserialize(line.codestring())).isEqualTo(line.graph());
  }

  @Test
  public void invalidCallIsDroppedButFunctionIsKept() {
    println("fn greet(name: any) {");
    println("    p.sendMessage(name);");
    println("}");
    println("@join {");
    println("    greet();");
    println("}");

    Compiler.CompileResult result = compile();

    assertThat(result.hasErrors()).isTrue();
    assertThat(result.diagnostics()).hasSize(1);
    CompilerException error = result.diagnostics().get(0);
    assertThat(error.kind()).isEqualTo(CompilerException.Kind.ARITY_MISMATCH);
    assertThat(error.format())
        .isEqualTo(
            "ERROR: /test/file.dfrs@5:5 ArityError: function 'greet' takes 1 argument(s) but 0"
                + " were supplied");

    assertThat(result.lines())
        .comparingElementsUsing(lineNames())
        .containsExactly("Function greet", "Event join")
        .inOrder();
    assertThat(result.lines().get(0).graph().blocks()).hasSize(2);
    // Only the header remains.
    assertThat(result.lines().get(1).graph().blocks()).hasSize(1);
  }

  @Test
  public void namesLinesByUnitType() {
    println("fn greet() {");
    println("}");
    println("proc tick {");
    println("}");
    println("@mobDamage {");
    println("}");

    assertThat(compile().lines())
        .comparingElementsUsing(lineNames())
        .containsExactly("Function greet", "Process tick", "Event mobDamage")
        .inOrder();
  }

  @Test
  public void diagnosticsAreSortedByPosition() {
    println("@join {");
    println("    p.fly();");
    println("    p.sendMessage(score);");
    println("}");

    Compiler.CompileResult result = compile();

    assertThat(result.diagnostics())
        .comparingElementsUsing(messages())
        .containsExactly("unknown action 'p.fly'", "undeclared variable 'score'")
        .inOrder();
    assertThat(result.lines()).hasSize(1);
  }

  @Test
  public void lexErrorsAreReported() {
    println("@join {");
    println("    p.sendMessage(#);");
    println("}");

    Compiler.CompileResult result = compile();

    assertThat(result.hasErrors()).isTrue();
    assertThat(result.diagnostics().get(0).kind()).isEqualTo(CompilerException.Kind.LEX);
    assertThat(result.diagnostics().get(0).pos())
        .isEqualTo(new Tokenizer.Pos("/test/file.dfrs", 1, 18));
  }

  @Test
  public void numberTooLargeIsALexError() {
    String huge = "1" + "0".repeat(400);
    println("@join {");
    println("    line x = 1;");
    println("    v.add(x, " + huge + ");");
    println("    p.teleport(Location(" + huge + ", 0, 0));");
    println("}");

    Compiler.CompileResult result = compile();

    assertThat(result.diagnostics())
        .comparingElementsUsing(kinds())
        .containsExactly(CompilerException.Kind.LEX, CompilerException.Kind.LEX);
    assertThat(result.diagnostics().get(0).pos())
        .isEqualTo(new Tokenizer.Pos("/test/file.dfrs", 2, 13));
    assertThat(result.lines()).hasSize(1);
    assertThat(result.lines().get(0).graph().blocks()).hasSize(2);
  }

  @Test
  public void negativeZeroEncodesAsZero() throws Exception {
    println("@join {");
    println("    p.teleport(Location(-0, 0, 0));");
    println("}");

    Compiler.CompileResult result = compile();

    assertThat(result.diagnostics()).isEmpty();
    Compiler.CompiledLine line = result.lines().get(0);
    assertThat(line.graph().blocks().get(1).params())
        .containsExactly(Parameter.create(0, EncodedValue.Location.create(0, 0, 0, 0, 0)));
    assertThat(CodeStrings.deserialize(line.codestring())).isEqualTo(line.graph());
  }

  @Test
  public void reassignmentCompilesToSetVariable() {
    println("@join {");
    println("    line x = 1;");
    println("    x = v.add(2);");
    println("    x = 5;");
    println("}");

    Compiler.CompileResult result = compile();

    assertThat(result.diagnostics()).isEmpty();
    ImmutableList<CodeBlock> blocks = result.lines().get(0).graph().blocks();
    assertThat(blocks).hasSize(4);
    EncodedValue x = EncodedValue.Variable.create("x", VariableScope.LINE);
    assertThat(blocks.get(2).action()).hasValue("+=");
    assertThat(blocks.get(2).params())
        .containsExactly(Parameter.create(0, x), Parameter.create(1, EncodedValue.Simple.number(2)))
        .inOrder();
    assertThat(blocks.get(3).action()).hasValue("=");
    assertThat(blocks.get(3).params())
        .containsExactly(Parameter.create(0, x), Parameter.create(1, EncodedValue.Simple.number(5)))
        .inOrder();
  }

  @Test
  public void importsAreListed() {
    println("use \"lib/common.dfrs\";");
    println("use \"lib/more.dfrs\";");
    println("@join {");
    println("}");

    Compiler.CompileResult result = compile();

    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.imports()).containsExactly("lib/common.dfrs", "lib/more.dfrs").inOrder();
    assertThat(result.lines()).hasSize(1);
  }

  @Test
  public void nestingTooDeepProducesNothing() {
    println("@join {");
    println("    p.sendMessage(\"fine\");");
    println("}");
    println("@mobDamage {");
    println("    ifp isSneaking() {");
    println("        ifp isSneaking() {");
    println("        }");
    println("    }");
    println("}");

    Compiler.CompileResult result =
        compile(
            CompilerOptions.builder()
                .setFileName("/test/file.dfrs")
                .setMaxNestingDepth(2)
                .build());

    assertThat(result.lines()).isEmpty();
    assertThat(result.diagnostics())
        .comparingElementsUsing(kinds())
        .contains(CompilerException.Kind.NESTING_TOO_DEEP);
  }

  @Test
  public void decompileSynthesizesDeclaration() {
    BlockGraph graph =
        BlockGraph.create(
            ImmutableList.of(
                CodeBlock.block("event").setAction("Join").build(),
                CodeBlock.block("set_var")
                    .setAction("+=")
                    .addParam(0, EncodedValue.Variable.create("visits", VariableScope.SAVE))
                    .addParam(1, EncodedValue.Simple.number(1))
                    .build()));

    Compiler.DecompileResult result = Compiler.decompile(CodeStrings.serialize(graph), CATALOGUE);

    assertThat(result.hasErrors()).isFalse();
    assertThat(result.source()).hasValue("save visits;\n\n@join {\n    v.add(visits, 1);\n}\n");
    assertThat(result.diagnostics())
        .comparingElementsUsing(messages())
        .containsExactly("declared save variable 'visits' at file level");
  }

  @Test
  public void decompileReportsBadCodestring() {
    Compiler.DecompileResult result = Compiler.decompile("%%%", CATALOGUE);

    assertThat(result.source()).isEmpty();
    assertThat(result.diagnostics())
        .comparingElementsUsing(kinds())
        .containsExactly(CompilerException.Kind.SERIALIZATION);
  }

  @Test
  public void compileDecompileCompile() {
    println("save visits;");
    println("");
    println("fn announce(message: text) {");
    println("    p:all.sendMessage(message);");
    println("}");
    println("");
    println("@join {");
    println("    v.add(visits, 1);");
    println("    ifv lessThan(visits, 10) {");
    println("        announce(\"Welcome!\");");
    println("    } else {");
    println("        p:selection.giveItems(Item('{id:\"minecraft:cake\"}'));");
    println("    }");
    println("}");

    Compiler.CompileResult compiled = compile();
    assertThat(compiled.diagnostics()).isEmpty();

    ImmutableList<String> codestrings =
        compiled.lines().stream()
            .map(Compiler.CompiledLine::codestring)
            .collect(ImmutableList.toImmutableList());
    Compiler.DecompileResult decompiled =
        Compiler.decompile(codestrings, CATALOGUE, CompilerOptions.defaults());
    assertThat(decompiled.source()).hasValue(file.toString());

    Compiler.CompileResult recompiled = Compiler.compile(decompiled.source().get(), CATALOGUE);
    assertThat(recompiled.diagnostics()).isEmpty();
    assertThat(recompiled.lines())
        .comparingElementsUsing(sameGraph())
        .containsExactlyElementsIn(compiled.lines())
        .inOrder();
  }

  private static Correspondence<Compiler.CompiledLine, String> lineNames() {
    return Correspondence.from((l, n) -> l.name().equals(n), "has name");
  }

  private static Correspondence<Compiler.CompiledLine, Compiler.CompiledLine> sameGraph() {
    return Correspondence.from(
        (a, b) -> a.graph().equals(b.graph()) && a.codestring().equals(b.codestring()),
        "has the same graph as");
  }

  private static Correspondence<CompilerException, CompilerException.Kind> kinds() {
    return Correspondence.from((e, k) -> e.kind() == k, "has kind");
  }

  private static Correspondence<CompilerException, String> messages() {
    return Correspondence.from((e, m) -> e.errorMsg().equals(m), "has message");
  }
}
