package com.obsidiandynamics.rulecheck.seen;

public final class SeenSetExhaustedException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  SeenSetExhaustedException(String m) {
    super(m);
  }
}
