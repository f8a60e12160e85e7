package com.obsidiandynamics.rulecheck;

/**
 *  An {@code assert} or {@code error} statement in the model that did not hold.
 */
public final class ModelAssertionFailure extends ModelFailure {
  private static final long serialVersionUID = 1L;

  public ModelAssertionFailure(String m) {
    super(m);
  }

  public static void check(boolean condition, String message) throws ModelAssertionFailure {
    if (! condition) {
      throw new ModelAssertionFailure(message);
    }
  }
}
