package dfs;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableSet;

/** The action families, keyed by their one-letter source prefix. */
public enum Category {
  PLAYER("p", "player_action", "ifp", "if_player", Selectors.PLAYER),
  ENTITY("e", "entity_action", "ife", "if_entity", Selectors.ENTITY),
  GAME("g", "game_action", "ifg", "if_game", ImmutableSet.of()),
  VARIABLE("v", "set_var", "ifv", "if_var", ImmutableSet.of()),
  CONTROL("c", "control", null, null, ImmutableSet.of()),
  SELECT("s", "select_obj", null, null, ImmutableSet.of());

  private static final class Selectors {
    private static final ImmutableSet<Selector> PLAYER =
        ImmutableSet.of(
            Selector.DEFAULT,
            Selector.SELECTION,
            Selector.KILLER,
            Selector.DAMAGER,
            Selector.SHOOTER,
            Selector.VICTIM,
            Selector.ALL_PLAYERS);

    private static final ImmutableSet<Selector> ENTITY =
        ImmutableSet.of(
            Selector.DEFAULT,
            Selector.SELECTION,
            Selector.KILLER,
            Selector.DAMAGER,
            Selector.SHOOTER,
            Selector.VICTIM,
            Selector.PROJECTILE,
            Selector.ALL_ENTITIES,
            Selector.ALL_MOBS,
            Selector.LAST_SPAWNED);
  }

  private final String prefix;
  private final String actionBlock;
  private final String conditionalKeyword;
  private final String conditionalBlock;
  private final ImmutableSet<Selector> selectors;

  Category(
      String prefix,
      String actionBlock,
      String conditionalKeyword,
      String conditionalBlock,
      ImmutableSet<Selector> selectors) {
    this.prefix = prefix;
    this.actionBlock = actionBlock;
    this.conditionalKeyword = conditionalKeyword;
    this.conditionalBlock = conditionalBlock;
    this.selectors = selectors;
  }

  public String prefix() {
    return prefix;
  }

  public String actionBlock() {
    return actionBlock;
  }

  public Optional<String> conditionalKeyword() {
    return Optional.ofNullable(conditionalKeyword);
  }

  public Optional<String> conditionalBlock() {
    return Optional.ofNullable(conditionalBlock);
  }

  /** Selectors a block of this category may carry unless its schema narrows them. */
  public ImmutableSet<Selector> selectors() {
    return selectors;
  }

  public boolean isTargeted() {
    return !selectors.isEmpty();
  }

  public static Optional<Category> fromPrefix(String prefix) {
    return Arrays.stream(values()).filter(c -> c.prefix.equals(prefix)).findFirst();
  }

  public static Optional<Category> fromConditionalKeyword(String keyword) {
    return Arrays.stream(values())
        .filter(c -> keyword.equals(c.conditionalKeyword))
        .findFirst();
  }

  public static Optional<Category> fromActionBlock(String block) {
    return Arrays.stream(values()).filter(c -> c.actionBlock.equals(block)).findFirst();
  }

  public static Optional<Category> fromConditionalBlock(String block) {
    return Arrays.stream(values()).filter(c -> block.equals(c.conditionalBlock)).findFirst();
  }
}
