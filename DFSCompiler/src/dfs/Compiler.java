package dfs;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

/**
 * Entry points of the pipeline: source text to codestrings and back.
 *
 * <p>Neither direction throws for bad input; everything wrong with it is reported in the result's
 * diagnostics.
 */
public final class Compiler {
  private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

  private static final Comparator<CompilerException> BY_POSITION =
      Comparator.comparing(CompilerException::pos);

  /** The output of one unit: its header name, block graph and codestring. */
  @AutoValue
  public abstract static class CompiledLine {
    // e.g. "Event join", "Function greet"
    public abstract String name();

    public abstract BlockGraph graph();

    public abstract String codestring();

    static CompiledLine create(String name, BlockGraph graph, String codestring) {
      return new AutoValue_Compiler_CompiledLine(name, graph, codestring);
    }
  }

  @AutoValue
  public abstract static class CompileResult {
    public abstract ImmutableList<CompiledLine> lines();

    /** Paths named by {@code use} statements, in source order, for the caller to resolve. */
    public abstract ImmutableList<String> imports();

    /** Errors and warnings from every pass, ordered by position. */
    public abstract ImmutableList<CompilerException> diagnostics();

    public boolean hasErrors() {
      return diagnostics().stream().anyMatch(CompilerException::isError);
    }

    static CompileResult create(
        Iterable<CompiledLine> lines,
        Iterable<String> imports,
        Iterable<CompilerException> diagnostics) {
      return new AutoValue_Compiler_CompileResult(
          ImmutableList.copyOf(lines), ImmutableList.copyOf(imports), sorted(diagnostics));
    }
  }

  @AutoValue
  public abstract static class DecompileResult {
    /** The reconstructed source, absent when the codestring could not be decoded. */
    public abstract Optional<String> source();

    public abstract ImmutableList<CompilerException> diagnostics();

    public boolean hasErrors() {
      return diagnostics().stream().anyMatch(CompilerException::isError);
    }

    static DecompileResult create(
        Optional<String> source, Iterable<CompilerException> diagnostics) {
      return new AutoValue_Compiler_DecompileResult(source, sorted(diagnostics));
    }
  }

  public static CompileResult compile(String text, ActionCatalogue catalogue) {
    return compile(text, catalogue, CompilerOptions.defaults());
  }

  /**
   * Compiles every unit of {@code text}. Statements and units rejected by analysis are left out
   * of the result, except that nesting beyond {@link CompilerOptions#maxNestingDepth()} produces
   * no lines at all.
   */
  public static CompileResult compile(
      String text, ActionCatalogue catalogue, CompilerOptions options) {
    Tokenizer tokenizer = new Tokenizer(options.fileName(), text);
    ImmutableList<Tokenizer.Token> tokens = tokenizer.tokenize();
    Parser parser = new Parser(tokens, options);
    AST ast = parser.parse();
    logger.debug(
        "{}: {} tokens, {} declarations, {} units",
        options.fileName(),
        tokens.size(),
        ast.declarations().size(),
        ast.units().size());

    AnnotatedAST annotated = new SemanticAnalyzer(ast, catalogue, options).analyze();
    ImmutableList<CompilerException> diagnostics =
        ImmutableList.<CompilerException>builder()
            .addAll(tokenizer.errors())
            .addAll(parser.errors())
            .addAll(annotated.diagnostics())
            .build();

    ImmutableList.Builder<CompiledLine> lines = ImmutableList.builder();
    if (diagnostics.stream().anyMatch(e -> e.kind() == CompilerException.Kind.NESTING_TOO_DEEP)) {
      logger.debug("{}: nesting too deep, no code lines generated", options.fileName());
    } else {
      for (Map.Entry<AST.Unit, BlockGraph> entry :
          new CodeGenerator(annotated, catalogue).generate().entrySet()) {
        AST.Unit unit = entry.getKey();
        BlockGraph graph = entry.getValue();
        lines.add(CompiledLine.create(lineName(unit), graph, CodeStrings.serialize(graph)));
        logger.debug("{}: {} blocks", lineName(unit), graph.blocks().size());
      }
    }

    CompileResult result =
        CompileResult.create(
            lines.build(),
            ast.uses().stream().map(AST.Use::path).collect(ImmutableList.toImmutableList()),
            diagnostics);
    logger.info(
        "Compiled {}: {} code line(s), {} error(s), {} warning(s)",
        options.fileName(),
        result.lines().size(),
        countErrors(result.diagnostics()),
        result.diagnostics().size() - countErrors(result.diagnostics()));
    return result;
  }

  public static DecompileResult decompile(String codestring, ActionCatalogue catalogue) {
    return decompile(codestring, catalogue, CompilerOptions.defaults());
  }

  public static DecompileResult decompile(
      String codestring, ActionCatalogue catalogue, CompilerOptions options) {
    return decompile(ImmutableList.of(codestring), catalogue, options);
  }

  /** Decompiles several code lines into one source file, sharing file-level declarations. */
  public static DecompileResult decompile(
      List<String> codestrings, ActionCatalogue catalogue, CompilerOptions options) {
    Decompiler decompiler = new Decompiler(catalogue, options);
    DecompileResult result;
    try {
      ImmutableList.Builder<BlockGraph> graphs = ImmutableList.builder();
      for (String codestring : codestrings) {
        graphs.add(CodeStrings.deserialize(codestring));
      }
      AST ast = decompiler.decompile(graphs.build());
      result =
          DecompileResult.create(Optional.of(SourcePrinter.print(ast)), decompiler.diagnostics());
    } catch (CompilerException ex) {
      logger.debug("Decompilation failed: {}", ex.format());
      result =
          DecompileResult.create(
              Optional.empty(), Iterables.concat(decompiler.diagnostics(), ImmutableList.of(ex)));
    }

    logger.info(
        "Decompiled {} code line(s): {} error(s), {} warning(s)",
        codestrings.size(),
        countErrors(result.diagnostics()),
        result.diagnostics().size() - countErrors(result.diagnostics()));
    return result;
  }

  static String lineName(AST.Unit unit) {
    switch (unit.type()) {
      case EVENT:
        return "Event " + unit.name();
      case FUNCTION:
        return "Function " + unit.name();
      case PROCESS:
        return "Process " + unit.name();
    }
    throw new IllegalArgumentException("unknown unit type " + unit.type());
  }

  private static int countErrors(List<CompilerException> diagnostics) {
    return (int) diagnostics.stream().filter(CompilerException::isError).count();
  }

  private static ImmutableList<CompilerException> sorted(
      Iterable<CompilerException> diagnostics) {
    return ImmutableList.sortedCopyOf(BY_POSITION, diagnostics);
  }

  private Compiler() {}
}
