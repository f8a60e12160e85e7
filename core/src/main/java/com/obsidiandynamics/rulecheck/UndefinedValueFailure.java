package com.obsidiandynamics.rulecheck;

public final class UndefinedValueFailure extends ModelFailure {
  private static final long serialVersionUID = 1L;

  private final String fieldName;

  public UndefinedValueFailure(String fieldName) {
    super("Read of undefined value " + fieldName);
    this.fieldName = fieldName;
  }

  public String getFieldName() {
    return fieldName;
  }
}
