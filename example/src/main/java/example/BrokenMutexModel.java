package example;

import com.obsidiandynamics.rulecheck.*;

import java.util.*;

/**
 *  A naive lock that checks the other process's flag and only then raises its own. Both processes
 *  can pass the check before either flag is raised, so mutual exclusion fails.
 */
public final class BrokenMutexModel {
  static final int PROCESSES = 2;

  private BrokenMutexModel() {}

  public static Model build() {
    final var layout = Layout.builder();
    final var pc = new Field[PROCESSES];
    final var flag = new Field[PROCESSES];
    for (var p = 0; p < PROCESSES; p++) {
      pc[p] = layout.enumeration("pc[" + p + "]", "NCS", "CHECK", "SET", "CS");
      flag[p] = layout.bool("flag[" + p + "]");
    }
    final var processes = List.of(Quantifier.over("p", Domain.scalarset(PROCESSES)));

    return Model.builder("broken-mutex", layout.build())
        .startRule(StartRule.of("init", (s, __) -> {
          for (var p = 0; p < PROCESSES; p++) {
            pc[p].set(s, "NCS");
            flag[p].setBoolean(s, false);
          }
        }))
        .rule(new Rule("try", processes,
                       (s, b) -> pc[b.getInt("p")].is(s, "NCS"),
                       (s, b) -> pc[b.getInt("p")].set(s, "CHECK")))
        .rule(new Rule("check", processes,
                       (s, b) -> {
                         final var p = b.getInt("p");
                         return pc[p].is(s, "CHECK") && ! flag[1 - p].getBoolean(s);
                       },
                       (s, b) -> pc[b.getInt("p")].set(s, "SET")))
        .rule(new Rule("lock", processes,
                       (s, b) -> pc[b.getInt("p")].is(s, "SET"),
                       (s, b) -> {
                         final var p = b.getInt("p");
                         flag[p].setBoolean(s, true);
                         pc[p].set(s, "CS");
                       }))
        .rule(new Rule("unlock", processes,
                       (s, b) -> pc[b.getInt("p")].is(s, "CS"),
                       (s, b) -> {
                         final var p = b.getInt("p");
                         flag[p].setBoolean(s, false);
                         pc[p].set(s, "NCS");
                       }))
        .invariant(new Invariant("mutual exclusion", s -> ! (pc[0].is(s, "CS") && pc[1].is(s, "CS"))))
        .build();
  }
}
