package com.obsidiandynamics.rulecheck;

import java.util.*;

/**
 *  The values bound to a rule's quantifiers for one application, in declaration order.
 */
public final class Bindings {
  public static final Bindings EMPTY = new Bindings(new String[0], new long[0], new Domain[0]);

  private final String[] names;

  private final long[] values;

  private final Domain[] domains;

  Bindings(String[] names, long[] values, Domain[] domains) {
    this.names = names;
    this.values = values;
    this.domains = domains;
  }

  public int size() {
    return values.length;
  }

  public long get(int index) {
    return values[index];
  }

  public long get(String name) {
    for (var i = 0; i < names.length; i++) {
      if (names[i].equals(name)) {
        return values[i];
      }
    }
    throw new NoSuchElementException("No quantifier " + name);
  }

  public int getInt(String name) {
    return Math.toIntExact(get(name));
  }

  public String render() {
    final var sb = new StringBuilder();
    for (var i = 0; i < names.length; i++) {
      if (i != 0) sb.append(", ");
      sb.append(names[i]).append(':').append(domains[i].render(values[i]));
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (o instanceof Bindings) {
      final var that = (Bindings) o;
      return Arrays.equals(names, that.names) && Arrays.equals(values, that.values);
    } else {
      return false;
    }
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(names) + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return Bindings.class.getSimpleName() + '[' + render() + ']';
  }
}
