package dfs;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;

/**
 * The events, actions, conditionals, repeats and game values valid for one platform version.
 *
 * <p>Lookups by source name serve compilation; lookups by external name serve decompilation and
 * are indexed lazily.
 */
@AutoValue
public abstract class ActionCatalogue {

  abstract ImmutableMap<String, EventSchema> events();

  abstract ImmutableTable<Category, String, ActionSchema> actions();

  abstract ImmutableTable<Category, String, ActionSchema> conditionals();

  abstract ImmutableMap<String, ActionSchema> repeats();

  /** Tags accepted by {@code start}, encoded on the start_process block. */
  public abstract ImmutableList<TagSpec> startProcessTags();

  // Source name to external name.
  abstract ImmutableBiMap<String, String> gameValues();

  public Optional<EventSchema> event(String name) {
    return Optional.ofNullable(events().get(name));
  }

  public Optional<ActionSchema> action(Category category, String name) {
    return Optional.ofNullable(actions().get(category, name));
  }

  public Optional<ActionSchema> conditional(Category category, String name) {
    return Optional.ofNullable(conditionals().get(category, name));
  }

  public Optional<ActionSchema> repeat(String name) {
    return Optional.ofNullable(repeats().get(name));
  }

  public Optional<String> gameValue(String name) {
    return Optional.ofNullable(gameValues().get(name));
  }

  public Optional<TagSpec> startProcessTag(String name) {
    return startProcessTags().stream().filter(t -> t.name().equals(name)).findFirst();
  }

  public Optional<TagSpec> startProcessTagByExternalName(String externalName) {
    return startProcessTags().stream()
        .filter(t -> t.externalName().equals(externalName))
        .findFirst();
  }

  public Optional<EventSchema> eventByExternalName(String externalName) {
    return Optional.ofNullable(eventsByExternalName().get(externalName));
  }

  public Optional<ActionSchema> actionByExternalName(Category category, String externalName) {
    return Optional.ofNullable(actionsByExternalName().get(category, externalName));
  }

  public Optional<ActionSchema> conditionalByExternalName(Category category, String externalName) {
    return Optional.ofNullable(conditionalsByExternalName().get(category, externalName));
  }

  public Optional<ActionSchema> repeatByExternalName(String externalName) {
    return Optional.ofNullable(repeatsByExternalName().get(externalName));
  }

  public Optional<String> gameValueByExternalName(String externalName) {
    return Optional.ofNullable(gameValues().inverse().get(externalName));
  }

  @Memoized
  ImmutableMap<String, EventSchema> eventsByExternalName() {
    ImmutableMap.Builder<String, EventSchema> builder = ImmutableMap.builder();
    events().values().forEach(e -> builder.put(e.externalName(), e));
    return builder.buildOrThrow();
  }

  @Memoized
  ImmutableTable<Category, String, ActionSchema> actionsByExternalName() {
    return indexByExternalName(actions());
  }

  @Memoized
  ImmutableTable<Category, String, ActionSchema> conditionalsByExternalName() {
    return indexByExternalName(conditionals());
  }

  @Memoized
  ImmutableMap<String, ActionSchema> repeatsByExternalName() {
    ImmutableMap.Builder<String, ActionSchema> builder = ImmutableMap.builder();
    repeats().values().forEach(r -> builder.put(r.externalName(), r));
    return builder.buildOrThrow();
  }

  private static ImmutableTable<Category, String, ActionSchema> indexByExternalName(
      ImmutableTable<Category, String, ActionSchema> table) {
    ImmutableTable.Builder<Category, String, ActionSchema> builder = ImmutableTable.builder();
    for (Table.Cell<Category, String, ActionSchema> cell : table.cellSet()) {
      builder.put(cell.getRowKey(), cell.getValue().externalName(), cell.getValue());
    }
    return builder.build();
  }

  public static Builder builder() {
    return new AutoValue_ActionCatalogue.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract ImmutableMap.Builder<String, EventSchema> eventsBuilder();

    abstract ImmutableTable.Builder<Category, String, ActionSchema> actionsBuilder();

    abstract ImmutableTable.Builder<Category, String, ActionSchema> conditionalsBuilder();

    abstract ImmutableMap.Builder<String, ActionSchema> repeatsBuilder();

    abstract ImmutableList.Builder<TagSpec> startProcessTagsBuilder();

    abstract ImmutableBiMap.Builder<String, String> gameValuesBuilder();

    public Builder addEvent(String name, String externalName, boolean entity) {
      eventsBuilder().put(name, EventSchema.create(name, externalName, entity));
      return this;
    }

    public Builder addAction(Category category, ActionSchema action) {
      actionsBuilder().put(category, action.name(), action);
      return this;
    }

    public Builder addConditional(Category category, ActionSchema conditional) {
      conditionalsBuilder().put(category, conditional.name(), conditional);
      return this;
    }

    public Builder addRepeat(ActionSchema repeat) {
      repeatsBuilder().put(repeat.name(), repeat);
      return this;
    }

    public Builder addStartProcessTag(TagSpec tag) {
      startProcessTagsBuilder().add(tag);
      return this;
    }

    public Builder addGameValue(String name, String externalName) {
      gameValuesBuilder().put(name, externalName);
      return this;
    }

    public abstract ActionCatalogue build();
  }
}
