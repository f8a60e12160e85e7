package com.obsidiandynamics.rulecheck;

import java.util.*;

public final class StartRule {
  @FunctionalInterface
  public interface Initializer {
    void initialize(StateBuffer state, Bindings bindings) throws ModelFailure;
  }

  private final String name;

  private final List<Quantifier> quantifiers;

  private final Initializer initializer;

  public StartRule(String name, List<Quantifier> quantifiers, Initializer initializer) {
    this.name = Objects.requireNonNull(name);
    this.quantifiers = List.copyOf(quantifiers);
    this.initializer = Objects.requireNonNull(initializer);
  }

  public static StartRule of(String name, Initializer initializer) {
    return new StartRule(name, List.of(), initializer);
  }

  public String getName() {
    return name;
  }

  public List<Quantifier> getQuantifiers() {
    return quantifiers;
  }

  public State apply(Layout layout, Bindings bindings) throws ModelFailure {
    return State.fromStart(layout, initializer, bindings);
  }

  /**
   *  Enumerates every binding combination of this rule's quantifiers in declaration order.
   *
   *  @return A fresh binding iterator.
   */
  public Iterator<Bindings> bindings() {
    return BindingSpace.of(quantifiers);
  }

  /**
   *  Lazily produces one start state per binding combination, each from a blank buffer.
   *
   *  @param layout The layout that fixes the buffer width.
   *  @return The start-state iterator.
   */
  public Iterator<State> candidates(Layout layout) {
    final var bindings = bindings();
    return new Iterator<>() {
      @Override
      public boolean hasNext() {
        return bindings.hasNext();
      }

      @Override
      public State next() {
        final var binding = bindings.next();
        try {
          return apply(layout, binding);
        } catch (ModelFailure e) {
          throw new RuleApplicationException(name, binding, null, e);
        }
      }
    };
  }

  @Override
  public String toString() {
    return StartRule.class.getSimpleName() + "[name=" + name + ", quantifiers=" + quantifiers + ']';
  }
}
