package com.obsidiandynamics.rulecheck.explore;

import java.util.*;

public final class Result {
  public enum Verdict {
    COMPLETED, FAILED
  }

  public static final int EXIT_SUCCESS = 0;

  public static final int EXIT_FAILURE = 1;

  private final Verdict verdict;

  private final long states;

  private final long elapsedMs;

  private final Failure failure;

  private Result(Verdict verdict, long states, long elapsedMs, Failure failure) {
    this.verdict = verdict;
    this.states = states;
    this.elapsedMs = elapsedMs;
    this.failure = failure;
  }

  static Result completed(long states, long elapsedMs) {
    return new Result(Verdict.COMPLETED, states, elapsedMs, null);
  }

  static Result failed(long states, long elapsedMs, Failure failure) {
    return new Result(Verdict.FAILED, states, elapsedMs, Objects.requireNonNull(failure));
  }

  public Verdict getVerdict() {
    return verdict;
  }

  public boolean isSuccess() {
    return verdict == Verdict.COMPLETED;
  }

  /**
   *  The number of distinct states discovered. Complete for a {@link Verdict#COMPLETED} run; the
   *  count at the point of abort otherwise.
   *
   *  @return The state count.
   */
  public long getStates() {
    return states;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  public Optional<Failure> getFailure() {
    return Optional.ofNullable(failure);
  }

  public int exitStatus() {
    return isSuccess() ? EXIT_SUCCESS : EXIT_FAILURE;
  }

  @Override
  public String toString() {
    return Result.class.getSimpleName() + "[verdict=" + verdict + ", states=" + states + ", elapsedMs=" + elapsedMs +
        ", failure=" + failure + ']';
  }
}
