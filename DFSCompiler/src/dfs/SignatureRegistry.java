package dfs;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * Collects every function and process signature before any body is checked, so units may refer
 * to each other regardless of their order in the file.
 */
public final class SignatureRegistry extends ErrorCollectingValidator {
  private static final ImmutableSet<Value.Type> DEFAULT_TYPES =
      Sets.immutableEnumSet(
          Value.Type.NUMBER,
          Value.Type.DYNAMIC_NUMBER,
          Value.Type.TEXT,
          Value.Type.STRING,
          Value.Type.LOCATION,
          Value.Type.VECTOR,
          Value.Type.SOUND,
          Value.Type.POTION);

  private final Map<String, Signature> functionsByName = new LinkedHashMap<>();
  private final Map<String, Signature> processesByName = new LinkedHashMap<>();
  private final Map<String, AST.Event> eventsByName = new HashMap<>();

  public Optional<Signature> function(String name) {
    return Optional.ofNullable(functionsByName.get(name));
  }

  public Optional<Signature> process(String name) {
    return Optional.ofNullable(processesByName.get(name));
  }

  @Override
  public void visitImpl(AST ast) {
    // Unit bodies are checked by the later passes.
    ast.units().forEach(unit -> unit.accept(this, null));
  }

  @Override
  public void visitImpl(AST.Event event) {
    AST.Event prev = eventsByName.putIfAbsent(event.name(), event);
    if (prev != null) {
      reject(
          event,
          CompilerException.Kind.DUPLICATE_DECLARATION,
          event.pos(),
          String.format(
              "duplicate event '%s', previous definition at %s", event.name(), prev.pos()));
    }
  }

  @Override
  public void visitImpl(AST.Function function) {
    checkParams(function);

    Signature signature = Signature.of(function);
    Signature prev = functionsByName.putIfAbsent(function.name(), signature);
    if (prev != null) {
      reject(
          function,
          CompilerException.Kind.DUPLICATE_DECLARATION,
          function.pos(),
          String.format(
              "duplicate function '%s', previous definition at %s", function.name(), prev.pos()));
    }
  }

  @Override
  public void visitImpl(AST.Process process) {
    Signature signature = Signature.of(process);
    Signature prev = processesByName.putIfAbsent(process.name(), signature);
    if (prev != null) {
      reject(
          process,
          CompilerException.Kind.DUPLICATE_DECLARATION,
          process.pos(),
          String.format(
              "duplicate process '%s', previous definition at %s", process.name(), prev.pos()));
    }
  }

  /** Whether a parameter default of this type can be encoded in a function header. */
  static boolean isDefaultValueType(Value.Type type) {
    return DEFAULT_TYPES.contains(type);
  }

  // Required parameters come first; a variadic one may only come last.
  private void checkParams(AST.Function function) {
    boolean seenOptional = false;
    for (int i = 0; i < function.params().size(); i++) {
      AST.Param param = function.params().get(i);
      if (param.optional()) {
        seenOptional = true;
      } else if (seenOptional) {
        reject(
            function,
            CompilerException.Kind.INVALID_DECLARATION,
            param.pos(),
            String.format("required parameter '%s' follows an optional one", param.name()));
      }

      if (param.variadic() && i != function.params().size() - 1) {
        reject(
            function,
            CompilerException.Kind.INVALID_DECLARATION,
            param.pos(),
            String.format("variadic parameter '%s' must be the last one", param.name()));
      }

      if (param.defaultValue().isPresent()) {
        checkDefault(function, param, param.defaultValue().get());
      }
    }
  }

  private void checkDefault(AST.Function function, AST.Param param, Value value) {
    if (!param.optional()) {
      reject(
          function,
          CompilerException.Kind.INVALID_DECLARATION,
          value.pos(),
          String.format("required parameter '%s' cannot have a default value", param.name()));
    } else if (!isDefaultValueType(value.type())) {
      reject(
          function,
          CompilerException.Kind.INVALID_DECLARATION,
          value.pos(),
          String.format(
              "default value of parameter '%s' must be a literal, found %s",
              param.name(),
              value.type().name().toLowerCase()));
    } else if (!param.kind().accepts(value)) {
      reject(
          function,
          CompilerException.Kind.INVALID_ARGUMENT,
          value.pos(),
          String.format(
              "default value of parameter '%s' must be a %s value",
              param.name(),
              param.kind().sourceName()));
    }
  }
}
