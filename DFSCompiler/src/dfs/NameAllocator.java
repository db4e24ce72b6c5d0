package dfs;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.base.CharMatcher;

/**
 * Hands out source identifiers for raw names read from block graphs. The same key always gets the
 * same identifier, and distinct keys never share one.
 */
final class NameAllocator {
  private static final CharMatcher IDENTIFIER_PART =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'));

  private final String fallback;
  private final Map<Object, String> allocated = new HashMap<>();
  private final Set<String> taken = new HashSet<>();

  NameAllocator(String fallback) {
    this.fallback = fallback;
  }

  String allocate(Object key, String raw) {
    String existing = allocated.get(key);
    if (existing != null) {
      return existing;
    }

    String base = sanitize(raw, fallback);
    String name = base;
    for (int i = 2; !taken.add(name); i++) {
      name = base + "_" + i;
    }
    allocated.put(key, name);
    return name;
  }

  /** Turns {@code raw} into a valid identifier, e.g. {@code "Player Count"} to Player_Count. */
  static String sanitize(String raw, String fallback) {
    String name = IDENTIFIER_PART.negate().trimAndCollapseFrom(raw, '_');
    if (name.isEmpty()) {
      name = fallback;
    } else if (CharMatcher.inRange('0', '9').matches(name.charAt(0))) {
      name = "_" + name;
    }

    if (Tokenizer.KEYWORDS.contains(name) || Tokenizer.COMPOSITE_HEADS.contains(name)) {
      name = name + "_";
    }
    return name;
  }
}
