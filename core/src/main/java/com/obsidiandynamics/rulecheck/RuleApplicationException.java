package com.obsidiandynamics.rulecheck;

/**
 *  Wraps a {@link ModelFailure} raised while applying a rule or start rule, identifying where it
 *  happened.
 */
public final class RuleApplicationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String ruleName;

  private final transient Bindings bindings;

  private final transient State predecessor;

  public RuleApplicationException(String ruleName, Bindings bindings, State predecessor, ModelFailure cause) {
    super("Rule " + ruleName + (bindings.size() == 0 ? "" : " [" + bindings.render() + "]") + " caused: " + cause.getMessage(), cause);
    this.ruleName = ruleName;
    this.bindings = bindings;
    this.predecessor = predecessor;
  }

  public String getRuleName() {
    return ruleName;
  }

  public Bindings getBindings() {
    return bindings;
  }

  /**
   *  The state the rule was applied to.
   *
   *  @return The predecessor, or {@code null} for a start rule.
   */
  public State getPredecessor() {
    return predecessor;
  }

  @Override
  public synchronized ModelFailure getCause() {
    return (ModelFailure) super.getCause();
  }
}
