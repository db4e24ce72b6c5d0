package dfs;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * Matches positional values against a schema's parameters.
 *
 * <p>Binding is greedy from the left: an optional parameter takes a value only if enough values
 * remain for the required parameters after it and the value fits its kind; a plural parameter
 * takes every fitting value it can spare.
 */
final class ArgumentBinder {

  @AutoValue
  abstract static class Binding {
    abstract Value value();

    abstract ParamSpec param();

    static Binding create(Value value, ParamSpec param) {
      return new AutoValue_ArgumentBinder_Binding(value, param);
    }
  }

  static ImmutableList<Binding> bind(
      String action, List<ParamSpec> params, List<? extends Value> values, Tokenizer.Pos pos)
      throws CompilerException {
    int[] requiredAfter = new int[params.size()];
    for (int i = params.size() - 2; i >= 0; i--) {
      requiredAfter[i] = requiredAfter[i + 1] + (params.get(i + 1).optional() ? 0 : 1);
    }

    ImmutableList.Builder<Binding> bindings = ImmutableList.builder();
    int next = 0;
    for (int i = 0; i < params.size(); i++) {
      ParamSpec param = params.get(i);
      int spare = values.size() - next - requiredAfter[i];
      if (spare <= 0 || (param.optional() && !param.kind().accepts(values.get(next)))) {
        if (!param.optional()) {
          throw new CompilerException(
              CompilerException.Kind.INVALID_ARGUMENT,
              pos,
              String.format("missing argument '%s' for %s", param.name(), action));
        }
        continue;
      }

      Value value = values.get(next);
      if (!param.kind().accepts(value)) {
        throw kindMismatch(action, param, value);
      }
      bindings.add(Binding.create(value, param));
      next++;

      if (param.plural()) {
        for (spare--; spare > 0 && param.kind().accepts(values.get(next)); spare--) {
          bindings.add(Binding.create(values.get(next++), param));
        }
      }
    }

    if (next < values.size()) {
      Value extra = values.get(next);
      throw new CompilerException(
          CompilerException.Kind.INVALID_ARGUMENT,
          extra.pos(),
          String.format(
              "unexpected argument for %s, which takes %d parameter(s)", action, params.size()));
    }
    return bindings.build();
  }

  private static CompilerException kindMismatch(String action, ParamSpec param, Value value) {
    return new CompilerException(
        CompilerException.Kind.INVALID_ARGUMENT,
        value.pos(),
        String.format(
            "argument '%s' of %s expects a %s value, found %s",
            param.name(),
            action,
            param.kind().sourceName(),
            value.type().name().toLowerCase()));
  }

  private ArgumentBinder() {}
}
