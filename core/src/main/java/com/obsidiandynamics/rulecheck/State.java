package com.obsidiandynamics.rulecheck;

import com.obsidiandynamics.rulecheck.util.*;

import java.util.*;

/**
 *  An immutable, content-addressed point in the state space. Two states are equal if and only if
 *  their buffers are bit-identical; the predecessor link and depth play no part in equality.<p>
 *
 *  The predecessor of a state is always a state accepted strictly earlier, so the predecessor
 *  links form a forest rooted at the distinct start states.
 */
public final class State implements StateView {
  private final int width;

  private final long[] words;

  private final State previous;

  private final int depth;

  private final long hash;

  State(int width, long[] words, State previous) {
    this.width = width;
    this.words = words;
    this.previous = previous;
    depth = previous == null ? 0 : previous.depth + 1;
    hash = Hash.ofWords(words, width);
  }

  public static State fromStart(Layout layout, StartRule.Initializer initializer, Bindings bindings) throws ModelFailure {
    final var buffer = StateBuffer.blank(layout.width());
    initializer.initialize(buffer, bindings);
    return buffer.seal(null);
  }

  public static State successor(State previous, Rule.Body body, Bindings bindings) throws ModelFailure {
    final var buffer = StateBuffer.copyOf(previous);
    body.apply(buffer, bindings);
    return buffer.seal(previous);
  }

  @Override
  public int width() {
    return width;
  }

  @Override
  public long bits(int offset, int length) {
    Objects.checkFromIndexSize(offset, length, width);
    return Bits.read(words, offset, length);
  }

  long[] copyWords() {
    return words.clone();
  }

  public State getPrevious() {
    return previous;
  }

  /**
   *  The number of predecessor hops back to a start state.
   *
   *  @return The depth, 0 for a start state.
   */
  public int getDepth() {
    return depth;
  }

  public long contentHash() {
    return hash;
  }

  /**
   *  Walks the predecessor chain.
   *
   *  @return The states from the root start state up to and including this one.
   */
  public List<State> trace() {
    final var trace = new ArrayList<State>(depth + 1);
    for (var state = this; state != null; state = state.previous) {
      trace.add(state);
    }
    Collections.reverse(trace);
    return trace;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (o instanceof State) {
      final var that = (State) o;
      return width == that.width && hash == that.hash && Arrays.equals(words, that.words);
    } else {
      return false;
    }
  }

  @Override
  public int hashCode() {
    return (int) (hash ^ (hash >>> 32));
  }

  public String toHexString() {
    final var sb = new StringBuilder();
    for (var i = words.length - 1; i >= 0; i--) {
      sb.append(String.format("%016x", words[i]));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return State.class.getSimpleName() + "[width=" + width + ", depth=" + depth + ", bits=" + toHexString() + ']';
  }
}
