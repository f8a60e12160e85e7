package com.obsidiandynamics.rulecheck;

import java.util.*;

/**
 *  A model as handed over by a front end: the state layout and the start-rule, rule and
 *  invariant tables, each in declaration order. Immutable once built.
 */
public final class Model {
  public static final class Builder {
    private final String name;

    private final Layout layout;

    private final List<StartRule> startRules = new ArrayList<>();

    private final List<Rule> rules = new ArrayList<>();

    private final List<Invariant> invariants = new ArrayList<>();

    private Builder(String name, Layout layout) {
      this.name = Objects.requireNonNull(name);
      this.layout = Objects.requireNonNull(layout);
    }

    public Builder startRule(StartRule startRule) {
      startRules.add(startRule);
      return this;
    }

    public Builder rule(Rule rule) {
      rules.add(rule);
      return this;
    }

    public Builder invariant(Invariant invariant) {
      invariants.add(invariant);
      return this;
    }

    public Model build() {
      return new Model(this);
    }
  }

  public static Builder builder(String name, Layout layout) {
    return new Builder(name, layout);
  }

  private final String name;

  private final Layout layout;

  private final List<StartRule> startRules;

  private final List<Rule> rules;

  private final List<Invariant> invariants;

  private Model(Builder builder) {
    name = builder.name;
    layout = builder.layout;
    startRules = List.copyOf(builder.startRules);
    rules = List.copyOf(builder.rules);
    invariants = List.copyOf(builder.invariants);
  }

  public String getName() {
    return name;
  }

  public Layout getLayout() {
    return layout;
  }

  public List<StartRule> getStartRules() {
    return startRules;
  }

  public List<Rule> getRules() {
    return rules;
  }

  public List<Invariant> getInvariants() {
    return invariants;
  }

  @Override
  public String toString() {
    return Model.class.getSimpleName() + "[name=" + name + ", layout=" + layout + ", startRules=" + startRules.size() +
        ", rules=" + rules.size() + ", invariants=" + invariants.size() + ']';
  }
}
