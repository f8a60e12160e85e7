package com.obsidiandynamics.rulecheck.explore;

import java.util.concurrent.atomic.*;

/**
 *  Holds the failure that ends a run. The first offer sets the abort flag; offers that race
 *  with it before the workers have stopped are kept only if they rank strictly lower.
 */
final class FailureSlot {
  private final AtomicReference<Violation> slot = new AtomicReference<>();

  /**
   *  Offers a failure.
   *
   *  @param violation The failure.
   *  @return {@code true} if this was the first failure offered.
   */
  boolean offer(Violation violation) {
    while (true) {
      final var existing = slot.get();
      if (existing != null && existing.compareTo(violation) <= 0) {
        return false;
      }
      if (slot.compareAndSet(existing, violation)) {
        return existing == null;
      }
    }
  }

  boolean isSet() {
    return slot.get() != null;
  }

  Violation get() {
    return slot.get();
  }
}
