package dfs;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class EventSchema {
  public abstract String name();

  public abstract String externalName();

  // Entity events are encoded with the entity_event header block.
  public abstract boolean entity();

  public String block() {
    return entity() ? "entity_event" : "event";
  }

  public static EventSchema create(String name, String externalName, boolean entity) {
    return new AutoValue_EventSchema(name, externalName, entity);
  }
}
