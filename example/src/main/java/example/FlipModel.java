package example;

import com.obsidiandynamics.rulecheck.*;

/**
 *  The smallest useful model: one boolean that a single rule keeps flipping. The passing variant
 *  covers two states; the failing variant asserts that the boolean is never set and is refuted
 *  after one step.
 */
public final class FlipModel {
  private FlipModel() {}

  public static Model passing() {
    return build("flip", false);
  }

  public static Model failing() {
    return build("flip-failing", true);
  }

  private static Model build(String name, boolean refuted) {
    final var layout = Layout.builder();
    final var x = layout.bool("x");
    final var model = Model.builder(name, layout.build())
        .startRule(StartRule.of("init", (s, __) -> x.setBoolean(s, false)))
        .rule(Rule.of("flip", Rule.Guard.ALWAYS, (s, __) -> x.setBoolean(s, ! x.getBoolean(s))))
        .invariant(new Invariant("x is defined", x::isDefined));
    if (refuted) {
      model.invariant(new Invariant("x is false", s -> ! x.getBoolean(s)));
    }
    return model.build();
  }
}
