package com.obsidiandynamics.rulecheck.explore;

import com.obsidiandynamics.rulecheck.*;

import java.util.*;

/**
 *  The finding of a failed run: what went wrong, which rule or invariant is responsible, and the
 *  counterexample leading to it.
 */
public final class Failure {
  public enum Kind {
    /** A newly discovered state failed an invariant. */
    INVARIANT_VIOLATION,

    /** A rule or start rule raised a {@link ModelFailure} while producing a successor. */
    RULE_FAULT
  }

  private final Kind kind;

  private final String name;

  private final String message;

  private final Bindings bindings;

  private final List<Step> trace;

  private final ModelFailure cause;

  Failure(Kind kind, String name, String message, Bindings bindings, List<Step> trace, ModelFailure cause) {
    this.kind = kind;
    this.name = name;
    this.message = message;
    this.bindings = bindings;
    this.trace = trace;
    this.cause = cause;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   *  The responsible invariant (for a violation) or rule (for a fault).
   *
   *  @return The name.
   */
  public String getName() {
    return name;
  }

  public String getMessage() {
    return message;
  }

  /**
   *  For a rule fault, the bindings the faulting rule was applied with.
   *
   *  @return The bindings, empty for an invariant violation.
   */
  public Bindings getBindings() {
    return bindings;
  }

  /**
   *  The counterexample, from a start state up to the violating state (for a violation) or the
   *  state the faulting rule was applied to (for a rule fault). Empty if a start rule faulted.
   *
   *  @return The trace, in discovery order.
   */
  public List<Step> getTrace() {
    return trace;
  }

  public Optional<ModelFailure> getCause() {
    return Optional.ofNullable(cause);
  }

  @Override
  public String toString() {
    return Failure.class.getSimpleName() + "[kind=" + kind + ", name=" + name + ", message=" + message + ", trace.size=" + trace.size() + ']';
  }
}
