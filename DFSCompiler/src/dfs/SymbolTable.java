package dfs;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;

/**
 * A stack of lexical frames. The bottom frame holds the file-level game and save variables and is
 * visible from everywhere; each unit body and nested body pushes its own frame.
 */
final class SymbolTable {
  private static final class Frame {
    private final Table<String, VariableScope, Symbol> declared = HashBasedTable.create();
    // The latest declaration of each name, whatever its scope kind.
    private final Map<String, Symbol> visible = new HashMap<>();
  }

  private final Deque<Frame> frames = new ArrayDeque<>();

  SymbolTable() {
    frames.push(new Frame());
  }

  void push() {
    frames.push(new Frame());
  }

  void pop() {
    Preconditions.checkState(frames.size() > 1, "cannot pop the file frame");
    frames.pop();
  }

  /** Declares in the innermost frame, returning the clashing declaration if there is one. */
  Optional<Symbol> declare(Symbol symbol) {
    Frame frame = frames.peek();
    Symbol prev = frame.declared.get(symbol.name(), symbol.scope());
    if (prev != null) {
      return Optional.of(prev);
    }

    frame.declared.put(symbol.name(), symbol.scope(), symbol);
    frame.visible.put(symbol.name(), symbol);
    return Optional.empty();
  }

  Optional<Symbol> resolve(String name) {
    for (Iterator<Frame> it = frames.iterator(); it.hasNext(); ) {
      Symbol symbol = it.next().visible.get(name);
      if (symbol != null) {
        return Optional.of(symbol);
      }
    }
    return Optional.empty();
  }
}
