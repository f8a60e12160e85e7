package com.obsidiandynamics.rulecheck.explore;

import com.obsidiandynamics.rulecheck.*;

/**
 *  Receives the user-facing account of a run. {@link #onProgress} may be called from any worker
 *  thread; the other callbacks are called from the thread running the checker.
 */
public interface Reporter {
  Reporter NOP = new Reporter() {
    @Override
    public void onStart(Model model, Checker.Options options) {}

    @Override
    public void onProgress(long states, long elapsedMs, long queueDepth) {}

    @Override
    public void onCompleted(Model model, Result result) {}

    @Override
    public void onFailed(Model model, Result result) {}
  };

  void onStart(Model model, Checker.Options options);

  void onProgress(long states, long elapsedMs, long queueDepth);

  void onCompleted(Model model, Result result);

  void onFailed(Model model, Result result);
}
