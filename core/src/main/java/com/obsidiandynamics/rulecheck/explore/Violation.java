package com.obsidiandynamics.rulecheck.explore;

import com.obsidiandynamics.rulecheck.*;

import java.util.*;

/**
 *  A failure as recorded by a worker, before its counterexample is reconstructed. Ordered by
 *  rule index, then invariant index, then depth, so that the least of several concurrently
 *  recorded failures can be retained.
 */
final class Violation implements Comparable<Violation> {
  static final int SEEDING = -1;

  static final int NO_INVARIANT = -1;

  private static final Comparator<Violation> ORDER = Comparator.<Violation>comparingInt(v -> v.ruleIndex)
      .thenComparingInt(v -> v.invariantIndex)
      .thenComparingInt(v -> v.depth);

  final Failure.Kind kind;

  final String name;

  final String message;

  final State state;

  final Bindings bindings;

  final ModelFailure cause;

  final int ruleIndex;

  final int invariantIndex;

  final int depth;

  private Violation(Failure.Kind kind, String name, String message, State state, Bindings bindings, ModelFailure cause,
                    int ruleIndex, int invariantIndex) {
    this.kind = kind;
    this.name = name;
    this.message = message;
    this.state = state;
    this.bindings = bindings;
    this.cause = cause;
    this.ruleIndex = ruleIndex;
    this.invariantIndex = invariantIndex;
    depth = state == null ? -1 : state.getDepth();
  }

  static Violation ofInvariant(Invariant invariant, int invariantIndex, State state, int ruleIndex, ModelFailure cause) {
    final var message = cause == null ?
        "Invariant " + invariant.getName() + " failed" :
        "Invariant " + invariant.getName() + " could not be evaluated: " + cause.getMessage();
    return new Violation(Failure.Kind.INVARIANT_VIOLATION, invariant.getName(), message, state, Bindings.EMPTY, cause, ruleIndex, invariantIndex);
  }

  static Violation ofRuleFault(RuleApplicationException e, int ruleIndex) {
    return new Violation(Failure.Kind.RULE_FAULT, e.getRuleName(), e.getMessage(), e.getPredecessor(), e.getBindings(), e.getCause(), ruleIndex, NO_INVARIANT);
  }

  Failure toFailure(Model model) {
    return new Failure(kind, name, message, bindings, Counterexample.reconstruct(model, state), cause);
  }

  @Override
  public int compareTo(Violation o) {
    return ORDER.compare(this, o);
  }

  @Override
  public String toString() {
    return Violation.class.getSimpleName() + "[kind=" + kind + ", name=" + name + ", ruleIndex=" + ruleIndex +
        ", invariantIndex=" + invariantIndex + ", depth=" + depth + ']';
  }
}
