package dfs;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** The blocks of one code line: a header block followed by the flattened, bracketed body. */
@AutoValue
public abstract class BlockGraph {
  public abstract ImmutableList<CodeBlock> blocks();

  public CodeBlock header() {
    Preconditions.checkState(!blocks().isEmpty(), "empty code line");
    return blocks().get(0);
  }

  public static BlockGraph create(Iterable<CodeBlock> blocks) {
    return new AutoValue_BlockGraph(ImmutableList.copyOf(blocks));
  }

  /**
   * Returns the index of the first bracket that closes nothing or closes the wrong type, the
   * block count if a bracket is left open, or -1 when the brackets balance.
   */
  public static int findUnbalancedBracket(List<CodeBlock> blocks) {
    Deque<CodeBlock.BracketType> open = new ArrayDeque<>();
    for (int i = 0; i < blocks.size(); i++) {
      CodeBlock block = blocks.get(i);
      if (!block.isBracket()) {
        continue;
      }

      CodeBlock.BracketType type = block.bracketType().get();
      if (block.isOpen()) {
        open.push(type);
      } else if (open.isEmpty() || open.pop() != type) {
        return i;
      }
    }
    return open.isEmpty() ? -1 : blocks.size();
  }
}
