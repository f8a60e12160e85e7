package com.obsidiandynamics.rulecheck;

import java.util.*;

public final class Invariant {
  @FunctionalInterface
  public interface Predicate {
    boolean test(StateView state) throws ModelFailure;
  }

  private final String name;

  private final Predicate predicate;

  public Invariant(String name, Predicate predicate) {
    this.name = Objects.requireNonNull(name);
    this.predicate = Objects.requireNonNull(predicate);
  }

  public String getName() {
    return name;
  }

  public boolean holds(State state) throws ModelFailure {
    return predicate.test(state);
  }

  @Override
  public String toString() {
    return Invariant.class.getSimpleName() + "[name=" + name + ']';
  }
}
