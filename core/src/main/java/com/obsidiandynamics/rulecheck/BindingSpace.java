package com.obsidiandynamics.rulecheck;

import java.util.*;

/**
 *  Enumerates the Cartesian product of a list of quantifier domains in nested ascending order,
 *  the first-declared quantifier varying slowest. An empty quantifier list yields a single empty
 *  binding; any empty domain yields nothing.
 */
final class BindingSpace implements Iterator<Bindings> {
  private final String[] names;

  private final Domain[] domains;

  private final int[] indexes;

  private boolean exhausted;

  private BindingSpace(List<Quantifier> quantifiers) {
    final var arity = quantifiers.size();
    names = new String[arity];
    domains = new Domain[arity];
    indexes = new int[arity];
    for (var i = 0; i < arity; i++) {
      final var quantifier = quantifiers.get(i);
      names[i] = quantifier.getName();
      domains[i] = quantifier.getDomain();
      if (domains[i].isEmpty()) {
        exhausted = true;
      }
    }
  }

  static Iterator<Bindings> of(List<Quantifier> quantifiers) {
    return quantifiers.isEmpty() ? List.of(Bindings.EMPTY).iterator() : new BindingSpace(quantifiers);
  }

  static long count(List<Quantifier> quantifiers) {
    var count = 1L;
    for (var quantifier : quantifiers) {
      count *= quantifier.getDomain().size();
    }
    return count;
  }

  @Override
  public boolean hasNext() {
    return !exhausted;
  }

  @Override
  public Bindings next() {
    if (exhausted) {
      throw new NoSuchElementException();
    }

    final var values = new long[indexes.length];
    for (var i = 0; i < indexes.length; i++) {
      values[i] = domains[i].valueAt(indexes[i]);
    }
    advance();
    return new Bindings(names, values, domains);
  }

  private void advance() {
    for (var i = indexes.length - 1; i >= 0; i--) {
      if (++indexes[i] < domains[i].size()) {
        return;
      }
      indexes[i] = 0;
    }
    exhausted = true;
  }
}
