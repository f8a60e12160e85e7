package example;

import com.obsidiandynamics.rulecheck.*;

import java.util.*;

/**
 *  A bank of independent bounded counters, each incremented or reset by rules quantified over the
 *  counter index. Every combination of counter values is reachable, giving
 *  {@code (max + 1)^counters} states. Useful for sizing runs.
 */
public final class CounterModel {
  private CounterModel() {}

  public static Model build(int counters, int max) {
    final var layout = Layout.builder();
    final var c = new Field[counters];
    for (var i = 0; i < counters; i++) {
      c[i] = layout.range("c[" + i + "]", 0, max);
    }
    final var indexes = List.of(Quantifier.over("i", Domain.range(0, counters - 1)));

    return Model.builder("counters-" + counters + "x" + max, layout.build())
        .startRule(StartRule.of("zero", (s, __) -> {
          for (var field : c) {
            field.set(s, 0);
          }
        }))
        .rule(new Rule("increment", indexes,
                       (s, b) -> c[b.getInt("i")].get(s) < max,
                       (s, b) -> {
                         final var field = c[b.getInt("i")];
                         field.set(s, field.get(s) + 1);
                       }))
        .rule(new Rule("reset", indexes,
                       (s, b) -> c[b.getInt("i")].get(s) == max,
                       (s, b) -> c[b.getInt("i")].set(s, 0)))
        .invariant(new Invariant("bounded", s -> {
          for (var field : c) {
            if (field.get(s) > max) return false;
          }
          return true;
        }))
        .build();
  }
}
