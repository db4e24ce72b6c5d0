package dfs;

import java.util.Arrays;
import java.util.Optional;

/** Narrows which players or entities a targeted block applies to. */
public enum Selector {
  DEFAULT("default", "Default"),
  SELECTION("selection", "Selection"),
  KILLER("killer", "Killer"),
  DAMAGER("damager", "Damager"),
  SHOOTER("shooter", "Shooter"),
  VICTIM("victim", "Victim"),
  ALL_PLAYERS("all", "AllPlayers"),
  PROJECTILE("projectile", "Projectile"),
  ALL_ENTITIES("allEntities", "AllEntities"),
  ALL_MOBS("allMobs", "AllMobs"),
  LAST_SPAWNED("last", "LastSpawned");

  private final String sourceName;
  private final String externalName;

  Selector(String sourceName, String externalName) {
    this.sourceName = sourceName;
    this.externalName = externalName;
  }

  public String sourceName() {
    return sourceName;
  }

  public String externalName() {
    return externalName;
  }

  public static Optional<Selector> fromSourceName(String name) {
    return Arrays.stream(values()).filter(s -> s.sourceName.equals(name)).findFirst();
  }

  public static Optional<Selector> fromExternalName(String name) {
    return Arrays.stream(values()).filter(s -> s.externalName.equals(name)).findFirst();
  }
}
