package com.obsidiandynamics.rulecheck;

import com.obsidiandynamics.rulecheck.util.*;

import java.util.*;

/**
 *  A thread-confined, writable buffer handed to rule bodies and start-state initializers. Once
 *  sealed into a {@link State} the buffer rejects further writes.
 */
public final class StateBuffer implements StateView {
  private final int width;

  private long[] words;

  StateBuffer(int width, long[] words) {
    this.width = width;
    this.words = words;
  }

  static StateBuffer blank(int width) {
    return new StateBuffer(width, new long[Bits.wordsFor(width)]);
  }

  static StateBuffer copyOf(State state) {
    return new StateBuffer(state.width(), state.copyWords());
  }

  @Override
  public int width() {
    return width;
  }

  @Override
  public long bits(int offset, int length) {
    ensureOpen();
    checkBounds(offset, length);
    return Bits.read(words, offset, length);
  }

  public void setBits(int offset, int length, long value) {
    ensureOpen();
    checkBounds(offset, length);
    Bits.write(words, offset, length, value);
  }

  State seal(State previous) {
    ensureOpen();
    final var sealed = words;
    words = null;
    return new State(width, sealed, previous);
  }

  private void ensureOpen() {
    if (words == null) {
      throw new IllegalStateException("Buffer has already been sealed");
    }
  }

  private void checkBounds(int offset, int length) {
    Objects.checkFromIndexSize(offset, length, width);
    Assert.inRange(length, 1, Bits.MAX_RUN, () -> "Invalid run length " + length);
  }

  @Override
  public String toString() {
    return StateBuffer.class.getSimpleName() + "[width=" + width + ", sealed=" + (words == null) + ']';
  }
}
