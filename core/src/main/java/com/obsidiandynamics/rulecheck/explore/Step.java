package com.obsidiandynamics.rulecheck.explore;

import com.obsidiandynamics.rulecheck.*;

/**
 *  One state of a counterexample, with the rule and bindings that produced it from the previous
 *  step (or the start rule, for step 0).
 */
public final class Step {
  private final int index;

  private final State state;

  private final String ruleName;

  private final Bindings bindings;

  Step(int index, State state, String ruleName, Bindings bindings) {
    this.index = index;
    this.state = state;
    this.ruleName = ruleName;
    this.bindings = bindings;
  }

  public int getIndex() {
    return index;
  }

  public State getState() {
    return state;
  }

  /**
   *  The rule that produced this step.
   *
   *  @return The rule name, or {@code null} if no rule in the model reproduces the step.
   */
  public String getRuleName() {
    return ruleName;
  }

  public Bindings getBindings() {
    return bindings;
  }

  @Override
  public String toString() {
    return Step.class.getSimpleName() + "[index=" + index + ", ruleName=" + ruleName + ", bindings=" + bindings + ", state=" + state + ']';
  }
}
