package dfs;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** The signature of one catalogue action, conditional or repeat. */
@AutoValue
public abstract class ActionSchema {
  public abstract String name();

  public abstract String externalName();

  public abstract ImmutableList<ParamSpec> params();

  public abstract ImmutableList<TagSpec> tags();

  /** Selectors the action accepts; empty means every selector of its category. */
  public abstract ImmutableSet<Selector> allowedSelectors();

  public Optional<TagSpec> tag(String name) {
    return tags().stream().filter(t -> t.name().equals(name)).findFirst();
  }

  public Optional<TagSpec> tagByExternalName(String externalName) {
    return tags().stream().filter(t -> t.externalName().equals(externalName)).findFirst();
  }

  public boolean allowsSelector(Category category, Selector selector) {
    if (!category.selectors().contains(selector)) {
      return false;
    }
    return allowedSelectors().isEmpty()
        || selector == Selector.DEFAULT
        || allowedSelectors().contains(selector);
  }

  public static Builder builder(String name, String externalName) {
    return new AutoValue_ActionSchema.Builder()
        .setName(name)
        .setExternalName(externalName)
        .setAllowedSelectors(ImmutableSet.of());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setName(String name);

    abstract Builder setExternalName(String externalName);

    abstract ImmutableList.Builder<ParamSpec> paramsBuilder();

    abstract ImmutableList.Builder<TagSpec> tagsBuilder();

    public abstract Builder setAllowedSelectors(Iterable<Selector> selectors);

    public Builder addParam(String name, ValueKind kind) {
      return addParam(ParamSpec.create(name, kind, false, false));
    }

    public Builder addParam(ParamSpec param) {
      paramsBuilder().add(param);
      return this;
    }

    public Builder addTag(TagSpec tag) {
      tagsBuilder().add(tag);
      return this;
    }

    public abstract ActionSchema build();
  }
}
