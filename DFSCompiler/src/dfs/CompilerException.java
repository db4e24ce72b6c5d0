package dfs;

/**
 * A diagnostic produced by any pass of the pipeline.
 *
 * <p>Most passes collect these rather than throwing them; they are only thrown when the stage
 * producing them cannot continue, e.g. a malformed codestring.
 */
public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Severity {
    ERROR,
    WARNING;
  }

  public enum Kind {
    LEX("LexError"),
    PARSE("ParseError"),
    UNDECLARED_VARIABLE("ScopeError"),
    DUPLICATE_DECLARATION("ScopeError"),
    ARITY_MISMATCH("ArityError"),
    UNDEFINED_FUNCTION("ArityError"),
    UNKNOWN_ACTION("ValidationError"),
    INVALID_SELECTOR("ValidationError"),
    INVALID_TAG("ValidationError"),
    INVALID_ARGUMENT("ValidationError"),
    UNKNOWN_GAME_VALUE("ValidationError"),
    INVALID_DECLARATION("ValidationError"),
    SERIALIZATION("SerializationError"),
    NESTING_TOO_DEEP("NestingTooDeep"),
    INFERRED_DECLARATION("InferredDeclaration", Severity.WARNING),
    UNRECOGNIZED_BLOCK("UnrecognizedBlock", Severity.WARNING);

    private final String family;
    private final Severity defaultSeverity;

    Kind(String family) {
      this(family, Severity.ERROR);
    }

    Kind(String family, Severity defaultSeverity) {
      this.family = family;
      this.defaultSeverity = defaultSeverity;
    }

    public String family() {
      return family;
    }

    public Severity defaultSeverity() {
      return defaultSeverity;
    }
  }

  private final Kind kind;
  private final Tokenizer.Pos pos;
  private final String errorMsg;

  public CompilerException(Kind kind, Tokenizer.Pos pos, String errorMsg) {
    super(errorMsg);
    this.kind = kind;
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public CompilerException(Kind kind, Tokenizer.Pos pos, String errorMsg, Throwable cause) {
    super(errorMsg, cause);
    this.kind = kind;
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public Kind kind() {
    return kind;
  }

  public Severity severity() {
    return kind.defaultSeverity();
  }

  public boolean isError() {
    return severity() == Severity.ERROR;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  public String errorMsg() {
    return errorMsg;
  }

  public String format() {
    return String.format("%s: %s %s: %s", severity(), pos, kind.family(), errorMsg);
  }

  @Override
  public String toString() {
    return format();
  }
}
