package example;

import com.obsidiandynamics.rulecheck.*;

import java.util.*;

/**
 *  Peterson's algorithm for two processes. Each process raises its flag, cedes the turn to the
 *  other, and enters its critical section only once the other process has either lowered its flag
 *  or ceded the turn back. Mutual exclusion holds.
 */
public final class MutexModel {
  static final int PROCESSES = 2;

  private MutexModel() {}

  public static Model build() {
    final var layout = Layout.builder();
    final var pc = new Field[PROCESSES];
    final var flag = new Field[PROCESSES];
    for (var p = 0; p < PROCESSES; p++) {
      pc[p] = layout.enumeration("pc[" + p + "]", "NCS", "TRY", "WAIT", "CS");
      flag[p] = layout.bool("flag[" + p + "]");
    }
    final var turn = layout.range("turn", 0, PROCESSES - 1);
    final var processes = List.of(Quantifier.over("p", Domain.range(0, PROCESSES - 1)));

    return Model.builder("peterson", layout.build())
        .startRule(new StartRule("init", List.of(Quantifier.over("t", Domain.range(0, PROCESSES - 1))), (s, b) -> {
          for (var p = 0; p < PROCESSES; p++) {
            pc[p].set(s, "NCS");
            flag[p].setBoolean(s, false);
          }
          turn.set(s, b.get("t"));
        }))
        .rule(new Rule("request", processes,
                       (s, b) -> pc[b.getInt("p")].is(s, "NCS"),
                       (s, b) -> {
                         final var p = b.getInt("p");
                         flag[p].setBoolean(s, true);
                         pc[p].set(s, "TRY");
                       }))
        .rule(new Rule("yield", processes,
                       (s, b) -> pc[b.getInt("p")].is(s, "TRY"),
                       (s, b) -> {
                         final var p = b.getInt("p");
                         turn.set(s, 1 - p);
                         pc[p].set(s, "WAIT");
                       }))
        .rule(new Rule("enter", processes,
                       (s, b) -> {
                         final var p = b.getInt("p");
                         return pc[p].is(s, "WAIT") && (! flag[1 - p].getBoolean(s) || turn.getInt(s) == p);
                       },
                       (s, b) -> pc[b.getInt("p")].set(s, "CS")))
        .rule(new Rule("exit", processes,
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
