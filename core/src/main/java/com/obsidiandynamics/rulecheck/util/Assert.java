package com.obsidiandynamics.rulecheck.util;

import java.util.function.*;

public final class Assert {
  private Assert() {}

  public static void that(boolean condition) {
    that(condition, () -> "");
  }

  public static Supplier<String> withMessage(String message) {
    return () -> message;
  }

  public static void that(boolean condition, Supplier<String> messageBuilder) {
    that(condition, AssertionError::new, messageBuilder);
  }

  public static <X extends Throwable> void that(boolean condition, Function<String, X> errorMaker, Supplier<String> messageBuilder) throws X {
    if (! condition) {
      throw errorMaker.apply(messageBuilder.get());
    }
  }

  public static void isNotNull(Object obj, Supplier<String> messageBuilder) {
    that(obj != null, NullPointerException::new, messageBuilder);
  }

  public static void inRange(long value, long min, long max, Supplier<String> messageBuilder) {
    that(value >= min && value <= max, IllegalArgumentException::new, messageBuilder);
  }
}
