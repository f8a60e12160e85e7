package com.obsidiandynamics.rulecheck;

/**
 *  Read access to a fixed-width state buffer.
 */
public interface StateView {
  int width();

  long bits(int offset, int length);
}
