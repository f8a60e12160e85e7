package example;

import com.obsidiandynamics.rulecheck.explore.*;
import org.slf4j.*;

import java.util.*;
import java.util.Map.*;

/**
 *  Checks one of the sample models and exits with the verdict: 0 if no error was found, 1 if a
 *  counterexample was reported, 2 if the run could not complete.<p>
 *
 *  The model is named by the first argument, or the {@code model} environment variable. The
 *  {@code threads} and {@code debug} environment variables override the checker defaults.
 */
public final class RunModel {
  private static final Logger LOG = LoggerFactory.getLogger(RunModel.class);

  static final int EXIT_FAULT = 2;

  private static final String DEFAULT_MODEL = "peterson";

  private RunModel() {}

  private static Optional<String> getEnvIgnoreCase(String key) {
    return System.getenv().entrySet().stream().filter(entry -> entry.getKey().equalsIgnoreCase(key)).map(Entry::getValue).findAny();
  }

  static Checker.Options options(Map<String, String> env) {
    final var defaults = new Checker.Options();
    final var threadCount = Optional.ofNullable(env.get("threads")).map(Integer::parseInt).orElse(defaults.threads);
    final var debugMode = Optional.ofNullable(env.get("debug")).map(Boolean::parseBoolean).orElse(defaults.debug);
    return new Checker.Options() {{
      threads = threadCount;
      debug = debugMode;
    }};
  }

  static int run(String modelName, Map<String, String> env, Reporter reporter) throws InterruptedException {
    final Checker.Options options;
    try {
      options = options(env);
    } catch (NumberFormatException e) {
      System.err.format("Invalid option: %s\n", e.getMessage());
      return EXIT_FAULT;
    }
    return run(modelName, options, reporter);
  }

  static int run(String modelName, Checker.Options options, Reporter reporter) throws InterruptedException {
    final var model = Models.byName(modelName);
    if (model.isEmpty()) {
      System.err.format("Unknown model '%s'; choose from %s\n", modelName, Models.names());
      return EXIT_FAULT;
    }

    final Checker checker;
    try {
      checker = new Checker(model.get(), options, reporter);
    } catch (IllegalArgumentException e) {
      System.err.format("Invalid options: %s\n", e.getMessage());
      return EXIT_FAULT;
    }

    try {
      return checker.run().exitStatus();
    } catch (CheckerFaultException e) {
      LOG.error("Could not complete the check of {}", modelName, e);
      return EXIT_FAULT;
    }
  }

  public static void main(String[] args) throws InterruptedException {
    final var modelName = args.length > 0 ? args[0] : getEnvIgnoreCase("model").orElse(DEFAULT_MODEL);
    final var env = new HashMap<String, String>();
    getEnvIgnoreCase("threads").ifPresent(threads -> env.put("threads", threads));
    getEnvIgnoreCase("debug").ifPresent(debug -> env.put("debug", debug));
    System.exit(run(modelName, env, PrintStreamReporter.console()));
  }
}
