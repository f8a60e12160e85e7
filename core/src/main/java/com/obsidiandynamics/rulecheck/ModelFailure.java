package com.obsidiandynamics.rulecheck;

/**
 *  Raised by model code (guards, bodies, initializers and invariant predicates) when evaluation
 *  cannot proceed: reading an undefined value, writing an out-of-range value, or an explicit
 *  {@code error} statement in the model.
 */
public class ModelFailure extends Exception {
  private static final long serialVersionUID = 1L;

  public ModelFailure(String m) {
    super(m);
  }

  public ModelFailure(String m, Throwable cause) {
    super(m, cause);
  }
}
