package dfs;

import com.google.common.collect.ImmutableList;

/** A small catalogue covering every category, used as a fixture by the pipeline tests. */
final class TestCatalogue {

  static final TagSpec ALIGNMENT_MODE =
      TagSpec.create(
          "alignmentMode",
          "Alignment Mode",
          ImmutableList.of("Regular", "Centered"),
          "Regular",
          26);

  static ActionCatalogue create() {
    return ActionCatalogue.builder()
        .addEvent("join", "Join", false)
        .addEvent("mobDamage", "EntityDmg", true)
        .addAction(
            Category.PLAYER,
            ActionSchema.builder("sendMessage", "SendMessage")
                .addParam(ParamSpec.create("message", ValueKind.TEXT, true, true))
                .addTag(ALIGNMENT_MODE)
                .build())
        .addAction(
            Category.PLAYER,
            ActionSchema.builder("giveItems", "GiveItems")
                .addParam(ParamSpec.create("items", ValueKind.ITEM, false, true))
                .setAllowedSelectors(ImmutableList.of(Selector.SELECTION, Selector.ALL_PLAYERS))
                .build())
        .addAction(
            Category.PLAYER,
            ActionSchema.builder("playSound", "PlaySound")
                .addParam("sound", ValueKind.SOUND)
                .addParam(ParamSpec.create("location", ValueKind.LOCATION, true, false))
                .build())
        .addAction(
            Category.PLAYER,
            ActionSchema.builder("teleport", "Teleport").addParam("location", ValueKind.LOCATION)
                .build())
        .addAction(
            Category.PLAYER,
            ActionSchema.builder("givePotion", "GivePotion")
                .addParam("potion", ValueKind.POTION)
                .build())
        .addAction(
            Category.ENTITY,
            ActionSchema.builder("heal", "Heal")
                .addParam(ParamSpec.create("amount", ValueKind.NUMBER, true, false))
                .build())
        .addAction(
            Category.GAME,
            ActionSchema.builder("spawnParticle", "Particle")
                .addParam("particle", ValueKind.PARTICLE)
                .addParam("location", ValueKind.LOCATION)
                .build())
        .addAction(
            Category.VARIABLE,
            ActionSchema.builder("set", "=")
                .addParam("variable", ValueKind.VARIABLE)
                .addParam("value", ValueKind.ANY)
                .build())
        .addAction(
            Category.VARIABLE,
            ActionSchema.builder("add", "+=")
                .addParam("variable", ValueKind.VARIABLE)
                .addParam("amount", ValueKind.NUMBER)
                .build())
        .addAction(
            Category.VARIABLE,
            ActionSchema.builder("shift", "ShiftVector")
                .addParam("variable", ValueKind.VARIABLE)
                .addParam("vector", ValueKind.VECTOR)
                .build())
        .addAction(
            Category.CONTROL,
            ActionSchema.builder("wait", "Wait")
                .addParam(ParamSpec.create("duration", ValueKind.NUMBER, true, false))
                .addTag(
                    TagSpec.create(
                        "timeUnit", "Time Unit", ImmutableList.of("Ticks", "Seconds"), "Ticks", 26))
                .build())
        .addAction(
            Category.SELECT,
            ActionSchema.builder("randomPlayer", "RandomPlayer").build())
        .addConditional(
            Category.PLAYER, ActionSchema.builder("isSneaking", "IsSneaking").build())
        .addConditional(
            Category.ENTITY, ActionSchema.builder("isMob", "IsMob").build())
        .addConditional(
            Category.VARIABLE,
            ActionSchema.builder("equals", "=")
                .addParam("value", ValueKind.ANY)
                .addParam(ParamSpec.create("compare", ValueKind.ANY, false, true))
                .build())
        .addConditional(
            Category.VARIABLE,
            ActionSchema.builder("lessThan", "<")
                .addParam("value", ValueKind.NUMBER)
                .addParam("compare", ValueKind.NUMBER)
                .build())
        .addRepeat(
            ActionSchema.builder("multiple", "Multiple")
                .addParam("times", ValueKind.NUMBER)
                .build())
        .addStartProcessTag(
            TagSpec.create(
                "localVariables",
                "Local Variables",
                ImmutableList.of("Don't copy", "Copy", "Share"),
                "Don't copy",
                25))
        .addStartProcessTag(
            TagSpec.create(
                "targetMode",
                "Target Mode",
                ImmutableList.of("With current targets", "With no targets"),
                "With current targets",
                26))
        .addGameValue("playerCount", "Player Count")
        .addGameValue("location", "Location")
        .build();
  }

  private TestCatalogue() {}
}
