package com.obsidiandynamics.rulecheck.explore;

/**
 *  A fatal condition that ended a run without a verdict: the seen set could not grow, an internal
 *  consistency check failed, or a worker died unexpectedly.
 */
public final class CheckerFaultException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  CheckerFaultException(String m, Throwable cause) {
    super(m, cause);
  }
}
