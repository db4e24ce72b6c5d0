package dfs;

import java.util.Optional;

/** Resolves calls and process starts against the registered signatures. */
final class CallValidator extends ErrorCollectingValidator {
  private final SignatureRegistry registry;

  CallValidator(SignatureRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void visitImpl(Expression.Call call) {
    Optional<Signature> signature = registry.function(call.name());
    if (!signature.isPresent()) {
      reject(
          call,
          CompilerException.Kind.UNDEFINED_FUNCTION,
          call.pos(),
          String.format("undefined function '%s'", call.name()));
      return;
    }

    Signature sig = signature.get();
    int count = call.args().size();
    if (!sig.acceptsArgumentCount(count)) {
      reject(
          call,
          CompilerException.Kind.ARITY_MISMATCH,
          call.pos(),
          String.format(
              "function '%s' takes %s argument(s) but %d were supplied",
              call.name(),
              sig.describeArity(),
              count));
      return;
    }

    for (int i = 0; i < count; i++) {
      Value arg = call.args().get(i);
      AST.Param param = sig.paramFor(i);
      if (!param.kind().accepts(arg)) {
        reject(
            call,
            CompilerException.Kind.INVALID_ARGUMENT,
            arg.pos(),
            String.format(
                "parameter '%s' of '%s' expects a %s value",
                param.name(),
                call.name(),
                param.kind().sourceName()));
      }
    }
  }

  @Override
  public void visitImpl(Expression.Start start) {
    if (!registry.process(start.name()).isPresent()) {
      reject(
          start,
          CompilerException.Kind.UNDEFINED_FUNCTION,
          start.pos(),
          String.format("undefined process '%s'", start.name()));
    }
  }
}
