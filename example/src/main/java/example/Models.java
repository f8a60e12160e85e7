package example;

import com.obsidiandynamics.rulecheck.*;

import java.util.*;
import java.util.function.*;

/**
 *  The sample models, by name.
 */
public final class Models {
  private static final Map<String, Supplier<Model>> MODELS = new LinkedHashMap<>();

  static {
    MODELS.put("flip", FlipModel::passing);
    MODELS.put("flip-failing", FlipModel::failing);
    MODELS.put("peterson", MutexModel::build);
    MODELS.put("broken-mutex", BrokenMutexModel::build);
    MODELS.put("counters", () -> CounterModel.build(6, 7));
  }

  private Models() {}

  public static Set<String> names() {
    return Collections.unmodifiableSet(MODELS.keySet());
  }

  public static Optional<Model> byName(String name) {
    return Optional.ofNullable(MODELS.get(name)).map(Supplier::get);
  }
}
