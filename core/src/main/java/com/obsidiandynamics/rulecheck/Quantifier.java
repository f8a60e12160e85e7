package com.obsidiandynamics.rulecheck;

import java.util.*;

public final class Quantifier {
  private final String name;

  private final Domain domain;

  private Quantifier(String name, Domain domain) {
    this.name = Objects.requireNonNull(name);
    this.domain = Objects.requireNonNull(domain);
  }

  public static Quantifier over(String name, Domain domain) {
    return new Quantifier(name, domain);
  }

  public String getName() {
    return name;
  }

  public Domain getDomain() {
    return domain;
  }

  @Override
  public String toString() {
    return Quantifier.class.getSimpleName() + "[name=" + name + ", domain=" + domain + ']';
  }
}
