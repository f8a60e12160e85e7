package com.obsidiandynamics.rulecheck.explore;

import com.obsidiandynamics.rulecheck.*;

import java.util.*;

/**
 *  Rebuilds a replayable trace from a state's predecessor chain. States carry no record of the
 *  rule that produced them, so each step is attributed by replaying the model's rules against the
 *  previous step until one reproduces it.
 */
final class Counterexample {
  private Counterexample() {}

  static List<Step> reconstruct(Model model, State last) {
    if (last == null) {
      return List.of();
    }

    final var states = last.trace();
    final var steps = new ArrayList<Step>(states.size());
    State previous = null;
    for (var state : states) {
      steps.add(attribute(model, steps.size(), previous, state));
      previous = state;
    }
    return Collections.unmodifiableList(steps);
  }

  private static Step attribute(Model model, int index, State previous, State state) {
    if (previous == null) {
      for (var startRule : model.getStartRules()) {
        for (var bindings = startRule.bindings(); bindings.hasNext(); ) {
          final var binding = bindings.next();
          if (state.equals(replay(() -> startRule.apply(model.getLayout(), binding)))) {
            return new Step(index, state, startRule.getName(), binding);
          }
        }
      }
    } else {
      for (var rule : model.getRules()) {
        for (var bindings = rule.bindings(); bindings.hasNext(); ) {
          final var binding = bindings.next();
          if (state.equals(replay(() -> rule.apply(previous, binding)))) {
            return new Step(index, state, rule.getName(), binding);
          }
        }
      }
    }
    return new Step(index, state, null, Bindings.EMPTY);
  }

  @FunctionalInterface
  private interface Replay {
    State run() throws ModelFailure;
  }

  private static State replay(Replay replay) {
    try {
      return replay.run();
    } catch (ModelFailure | RuntimeException e) {
      // a failing application cannot have produced a state in the trace
      return null;
    }
  }
}
