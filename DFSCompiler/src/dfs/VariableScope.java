package dfs;

import java.util.Arrays;
import java.util.Optional;

public enum VariableScope {
  LINE("line", "line"),
  LOCAL("local", "local"),
  GAME("game", "unsaved"),
  SAVE("save", "saved");

  private final String keyword;
  private final String externalName;

  VariableScope(String keyword, String externalName) {
    this.keyword = keyword;
    this.externalName = externalName;
  }

  public String keyword() {
    return keyword;
  }

  public String externalName() {
    return externalName;
  }

  /** Game and save variables outlive a single code line and are declared at file level. */
  public boolean isGlobal() {
    return this == GAME || this == SAVE;
  }

  public static Optional<VariableScope> fromKeyword(String keyword) {
    return Arrays.stream(values()).filter(s -> s.keyword.equals(keyword)).findFirst();
  }

  public static Optional<VariableScope> fromExternalName(String name) {
    return Arrays.stream(values()).filter(s -> s.externalName.equals(name)).findFirst();
  }
}
