package com.obsidiandynamics.rulecheck;

import com.obsidiandynamics.rulecheck.util.*;

import java.util.*;

/**
 *  A named slot within a {@link Layout}. A stored value of 0 denotes <i>undefined</i>; a defined
 *  value is stored as its ordinal plus one, so a blank buffer leaves every field undefined.
 */
public final class Field {
  public enum Kind {
    RANGE, BOOLEAN, ENUMERATION
  }

  private static final String UNDEFINED = "Undefined";

  private final String name;

  private final Kind kind;

  private final int offset;

  private final int length;

  private final long min;

  private final long cardinality;

  private final List<String> members;

  private Field(String name, Kind kind, int offset, long min, long cardinality, List<String> members) {
    Assert.that(cardinality > 0, IllegalArgumentException::new, () -> "Field " + name + " has an empty domain");
    this.name = name;
    this.kind = kind;
    this.offset = offset;
    this.min = min;
    this.cardinality = cardinality;
    this.members = members;
    length = lengthFor(cardinality);
    Assert.that(length <= Bits.MAX_RUN, IllegalArgumentException::new, () -> "Field " + name + " is too wide");
  }

  static int lengthFor(long cardinality) {
    return 64 - Long.numberOfLeadingZeros(cardinality);
  }

  static Field range(String name, int offset, long min, long max) {
    Assert.that(max >= min, IllegalArgumentException::new, () -> "Field " + name + " has an empty range " + min + ".." + max);
    return new Field(name, Kind.RANGE, offset, min, max - min + 1, List.of());
  }

  static Field bool(String name, int offset) {
    return new Field(name, Kind.BOOLEAN, offset, 0, 2, List.of("false", "true"));
  }

  static Field enumeration(String name, int offset, List<String> members) {
    return new Field(name, Kind.ENUMERATION, offset, 0, members.size(), List.copyOf(members));
  }

  public String getName() {
    return name;
  }

  public Kind getKind() {
    return kind;
  }

  public int getOffset() {
    return offset;
  }

  public int getLength() {
    return length;
  }

  public boolean isDefined(StateView state) {
    return state.bits(offset, length) != 0;
  }

  /**
   *  Reads the value of this field. Ranges yield the integer value; booleans yield 0 or 1;
   *  enumerations yield the member ordinal.
   *
   *  @param state The state to read from.
   *  @return The value.
   *  @throws UndefinedValueFailure If the field is undefined.
   */
  public long get(StateView state) throws UndefinedValueFailure {
    final var raw = state.bits(offset, length);
    if (raw == 0) {
      throw new UndefinedValueFailure(name);
    }
    return raw - 1 + min;
  }

  public int getInt(StateView state) throws UndefinedValueFailure {
    return Math.toIntExact(get(state));
  }

  public boolean getBoolean(StateView state) throws UndefinedValueFailure {
    return get(state) != 0;
  }

  public boolean is(StateView state, String member) throws UndefinedValueFailure {
    return get(state) == ordinalOf(member);
  }

  public void set(StateBuffer state, long value) throws ModelFailure {
    if (value < min || value - min >= cardinality) {
      throw new ModelFailure("Value " + value + " out of range for " + name);
    }
    state.setBits(offset, length, value - min + 1);
  }

  public void setBoolean(StateBuffer state, boolean value) throws ModelFailure {
    set(state, value ? 1 : 0);
  }

  public void set(StateBuffer state, String member) throws ModelFailure {
    set(state, ordinalOf(member));
  }

  public void clear(StateBuffer state) {
    state.setBits(offset, length, 0);
  }

  public int ordinalOf(String member) {
    final var ordinal = members.indexOf(member);
    Assert.that(ordinal != -1, IllegalArgumentException::new, () -> "No member " + member + " in " + name);
    return ordinal;
  }

  public String render(StateView state) {
    final var raw = state.bits(offset, length);
    if (raw == 0) {
      return UNDEFINED;
    }
    return switch (kind) {
      case BOOLEAN, ENUMERATION -> members.get((int) (raw - 1));
      case RANGE -> String.valueOf(raw - 1 + min);
    };
  }

  @Override
  public String toString() {
    return Field.class.getSimpleName() + "[name=" + name + ", kind=" + kind + ", offset=" + offset + ", length=" + length + ']';
  }
}
