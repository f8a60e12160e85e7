package com.obsidiandynamics.rulecheck;

import com.obsidiandynamics.rulecheck.util.*;

import java.util.*;

/**
 *  A finite, ordered set of values that a {@link Quantifier} ranges over.
 */
public abstract class Domain {
  private Domain() {}

  public abstract int size();

  public abstract long valueAt(int index);

  public abstract String render(long value);

  public final boolean isEmpty() {
    return size() == 0;
  }

  public static Domain range(long from, long to) {
    return range(from, to, 1);
  }

  /**
   *  An integer range {@code from..to} stepping by {@code step}. A range whose lower bound
   *  exceeds its upper bound is empty.
   *
   *  @param from The first value.
   *  @param to The inclusive upper bound.
   *  @param step The positive increment.
   *  @return The domain.
   */
  public static Domain range(long from, long to, long step) {
    Assert.that(step > 0, IllegalArgumentException::new, () -> "Step must be positive");
    if (from > to) {
      return new Range(from, step, 0);
    }
    // unsigned: to - from overflows a signed long for the widest ranges
    final var lastIndex = Long.divideUnsigned(to - from, step);
    Assert.that(Long.compareUnsigned(lastIndex, Integer.MAX_VALUE - 1) <= 0, IllegalArgumentException::new,
                () -> "Range " + from + ".." + to + " too large");
    return new Range(from, step, (int) lastIndex + 1);
  }

  public static Domain enumeration(String... members) {
    return new Enumeration(List.of(members));
  }

  public static Domain scalarset(int size) {
    Assert.that(size >= 0, IllegalArgumentException::new, () -> "Negative scalarset size");
    return new Scalarset(size);
  }

  private static final class Range extends Domain {
    private final long from, step;
    private final int size;

    Range(long from, long step, int size) {
      this.from = from;
      this.step = step;
      this.size = size;
    }

    @Override
    public int size() {
      return size;
    }

    @Override
    public long valueAt(int index) {
      Objects.checkIndex(index, size);
      return from + step * index;
    }

    @Override
    public String render(long value) {
      return String.valueOf(value);
    }

    @Override
    public String toString() {
      return "Range[from=" + from + ", step=" + step + ", size=" + size + ']';
    }
  }

  private static final class Enumeration extends Domain {
    private final List<String> members;

    Enumeration(List<String> members) {
      this.members = members;
    }

    @Override
    public int size() {
      return members.size();
    }

    @Override
    public long valueAt(int index) {
      Objects.checkIndex(index, members.size());
      return index;
    }

    @Override
    public String render(long value) {
      return members.get((int) value);
    }

    @Override
    public String toString() {
      return "Enumeration" + members;
    }
  }

  private static final class Scalarset extends Domain {
    private final int size;

    Scalarset(int size) {
      this.size = size;
    }

    @Override
    public int size() {
      return size;
    }

    @Override
    public long valueAt(int index) {
      Objects.checkIndex(index, size);
      return index;
    }

    @Override
    public String render(long value) {
      return "s" + (value + 1);
    }

    @Override
    public String toString() {
      return "Scalarset[size=" + size + ']';
    }
  }
}
