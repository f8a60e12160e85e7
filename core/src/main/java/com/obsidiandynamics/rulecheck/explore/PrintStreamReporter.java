package com.obsidiandynamics.rulecheck.explore;

import com.obsidiandynamics.rulecheck.*;

import java.io.*;

public final class PrintStreamReporter implements Reporter {
  private static final String SEPARATOR = "-".repeat(60);

  private final PrintStream out;

  private final PrintStream err;

  public PrintStreamReporter(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  public static PrintStreamReporter console() {
    return new PrintStreamReporter(System.out, System.err);
  }

  @Override
  public void onStart(Model model, Checker.Options options) {
    out.format("Checking %s...\n", model.getName());
    out.format("- State size: %d bits\n", model.getLayout().width());
    out.format("- Threads: %d\n", options.threads);
  }

  @Override
  public void onProgress(long states, long elapsedMs, long queueDepth) {
    out.format("%,d states seen in %,d seconds, %,d states in queue\n", states, elapsedMs / 1000, queueDepth);
  }

  @Override
  public void onCompleted(Model model, Result result) {
    out.format("%,d states covered in %,.3f seconds, no errors found\n", result.getStates(), result.getElapsedMs() / 1000f);
  }

  @Override
  public void onFailed(Model model, Result result) {
    final var failure = result.getFailure().orElseThrow();
    for (var step : failure.getTrace()) {
      err.format("State %d:\n", step.getIndex());
      if (step.getRuleName() != null) {
        final var origin = step.getIndex() == 0 ? "Startstate" : "Rule";
        final var bindings = step.getBindings().size() == 0 ? "" : " [" + step.getBindings().render() + "]";
        err.format("%s %s%s fired\n", origin, step.getRuleName(), bindings);
      }
      err.print(model.getLayout().render(step.getState()));
      err.println(SEPARATOR);
    }
    err.format("%s: %s\n", failure.getKind(), failure.getMessage());
    out.format("%,d states covered in %,.3f seconds\n", result.getStates(), result.getElapsedMs() / 1000f);
  }
}
