package com.obsidiandynamics.rulecheck;

import java.util.*;

/**
 *  A guarded, quantified transition. For every combination of quantifier bindings whose guard
 *  holds on a predecessor, the body is applied to a copy of that predecessor to yield a
 *  successor.
 */
public final class Rule {
  @FunctionalInterface
  public interface Guard {
    Guard ALWAYS = (state, bindings) -> true;

    boolean test(StateView state, Bindings bindings) throws ModelFailure;
  }

  @FunctionalInterface
  public interface Body {
    void apply(StateBuffer state, Bindings bindings) throws ModelFailure;
  }

  private final String name;

  private final List<Quantifier> quantifiers;

  private final Guard guard;

  private final Body body;

  public Rule(String name, List<Quantifier> quantifiers, Guard guard, Body body) {
    this.name = Objects.requireNonNull(name);
    this.quantifiers = List.copyOf(quantifiers);
    this.guard = Objects.requireNonNull(guard);
    this.body = Objects.requireNonNull(body);
  }

  public static Rule of(String name, Guard guard, Body body) {
    return new Rule(name, List.of(), guard, body);
  }

  public String getName() {
    return name;
  }

  public List<Quantifier> getQuantifiers() {
    return quantifiers;
  }

  /**
   *  Lazily produces the successors of {@code predecessor}. The returned iterator is single-use;
   *  each call to {@link Iterator#next()} evaluates guards until one holds and applies the body
   *  for that binding only. A {@link ModelFailure} surfaces as a {@link RuleApplicationException}.
   *
   *  @param predecessor The state to expand.
   *  @return The successor iterator.
   */
  public Iterator<State> candidates(State predecessor) {
    return new Candidates(predecessor);
  }

  /**
   *  Applies this rule for a single binding.
   *
   *  @param predecessor The state to expand.
   *  @param bindings The quantifier bindings.
   *  @return The successor, or {@code null} if the guard does not hold.
   *  @throws ModelFailure If the guard or body fails.
   */
  public State apply(State predecessor, Bindings bindings) throws ModelFailure {
    return guard.test(predecessor, bindings) ? State.successor(predecessor, body, bindings) : null;
  }

  /**
   *  Enumerates every binding combination of this rule's quantifiers in declaration order.
   *
   *  @return A fresh binding iterator.
   */
  public Iterator<Bindings> bindings() {
    return BindingSpace.of(quantifiers);
  }

  private final class Candidates implements Iterator<State> {
    private final State predecessor;

    private final Iterator<Bindings> bindings = bindings();

    private State next;

    Candidates(State predecessor) {
      this.predecessor = predecessor;
    }

    @Override
    public boolean hasNext() {
      while (next == null && bindings.hasNext()) {
        final var binding = bindings.next();
        try {
          next = apply(predecessor, binding);
        } catch (ModelFailure e) {
          throw new RuleApplicationException(name, binding, predecessor, e);
        }
      }
      return next != null;
    }

    @Override
    public State next() {
      if (! hasNext()) {
        throw new NoSuchElementException();
      }
      final var candidate = next;
      next = null;
      return candidate;
    }
  }

  @Override
  public String toString() {
    return Rule.class.getSimpleName() + "[name=" + name + ", quantifiers=" + quantifiers + ']';
  }
}
