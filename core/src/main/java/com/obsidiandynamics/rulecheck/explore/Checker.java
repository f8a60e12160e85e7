package com.obsidiandynamics.rulecheck.explore;

import com.obsidiandynamics.rulecheck.*;
import com.obsidiandynamics.rulecheck.queue.*;
import com.obsidiandynamics.rulecheck.seen.*;
import com.obsidiandynamics.rulecheck.util.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;

/**
 *  Exhaustively explores the reachable states of a {@link Model}, checking every invariant on
 *  every distinct state. A checker is single-use.<p>
 *
 *  Start states are inserted and checked on the calling thread. A fixed pool of workers then
 *  expands queued states until the queue drains with every worker idle, or until a failure is
 *  recorded, whereupon the workers stop at the next candidate or rule boundary.
 */
public final class Checker {
  private static final Logger LOG = LoggerFactory.getLogger(Checker.class);

  public static class Options {
    public int threads = Runtime.getRuntime().availableProcessors();

    public int setCapacity = 8_192;

    /** Percentage occupancy of a seen-set shard that triggers its growth. */
    public int setExpandThreshold = 75;

    public int setShards = 64;

    public long progressInterval = 10_000;

    /** Enables internal consistency checks. */
    public boolean debug;

    void validate() {
      Assert.inRange(threads, 1, Short.MAX_VALUE, () -> "Thread count must be positive");
      Assert.inRange(setCapacity, 1, Integer.MAX_VALUE, () -> "Set capacity must be positive");
      Assert.inRange(setExpandThreshold, 1, 100, () -> "Set expand threshold must be a percentage in 1..100");
      Assert.inRange(setShards, 1, Short.MAX_VALUE, () -> "Set shard count must be positive");
      Assert.inRange(progressInterval, 1, Long.MAX_VALUE, () -> "Progress interval must be positive");
    }

    @Override
    public String toString() {
      return Options.class.getSimpleName() + "[threads=" + threads + ", setCapacity=" + setCapacity +
          ", setExpandThreshold=" + setExpandThreshold + ", setShards=" + setShards +
          ", progressInterval=" + progressInterval + ", debug=" + debug + ']';
    }
  }

  public enum Phase {
    INIT, SEEDING, RUNNING, COMPLETED, FAILED
  }

  private final Model model;

  private final Options options;

  private final Reporter reporter;

  private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.INIT);

  private final AtomicBoolean started = new AtomicBoolean();

  private final SeenSet seen;

  private final WorkQueue queue;

  private final FailureSlot failures = new FailureSlot();

  private final AtomicReference<Throwable> fault = new AtomicReference<>();

  private final AtomicLong discovered = new AtomicLong();

  private long startTime;

  public Checker(Model model, Options options, Reporter reporter) {
    options.validate();
    this.model = Objects.requireNonNull(model);
    this.options = options;
    this.reporter = Objects.requireNonNull(reporter);
    seen = new SeenSet(options.setCapacity, options.setExpandThreshold, options.setShards, options.debug);
    queue = new WorkQueue(options.threads);
  }

  public Phase getPhase() {
    return phase.get();
  }

  /**
   *  Runs the exploration to a verdict.
   *
   *  @return The result.
   *  @throws InterruptedException If the calling thread is interrupted while awaiting the workers.
   *  @throws CheckerFaultException If the run ended on a fatal fault rather than a verdict.
   */
  public Result run() throws InterruptedException {
    if (! started.compareAndSet(false, true)) {
      throw new IllegalStateException("Checker has already been run");
    }

    startTime = System.currentTimeMillis();
    reporter.onStart(model, options);
    LOG.debug("Checking {} with {}", model, options);

    transition(Phase.SEEDING);
    try {
      seed();
    } catch (RuntimeException | Error e) {
      fault.compareAndSet(null, e);
    }
    if (fault.get() == null && ! failures.isSet()) {
      transition(Phase.RUNNING);
      explore();
    }

    final var faultCause = fault.get();
    if (faultCause != null) {
      transition(Phase.FAILED);
      LOG.error("Run of {} aborted on a fatal fault", model.getName(), faultCause);
      throw new CheckerFaultException("Fatal fault while checking " + model.getName(), faultCause);
    }

    final var elapsedMs = elapsed();
    final var violation = failures.get();
    if (violation != null) {
      transition(Phase.FAILED);
      final var result = Result.failed(seen.size(), elapsedMs, violation.toFailure(model));
      reporter.onFailed(model, result);
      return result;
    } else {
      if (options.debug) {
        Assert.that(queue.isDrained() && queue.size() == 0, () -> "Queue not drained on completion: " + queue);
        Assert.that(seen.size() == discovered.get(), () -> "Seen set holds " + seen.size() + " states, discovered " + discovered.get());
      }
      transition(Phase.COMPLETED);
      final var result = Result.completed(seen.size(), elapsedMs);
      reporter.onCompleted(model, result);
      return result;
    }
  }

  private void transition(Phase next) {
    final var previous = phase.getAndSet(next);
    LOG.debug("{}: {} -> {}", model.getName(), previous, next);
  }

  private long elapsed() {
    return System.currentTimeMillis() - startTime;
  }

  private void seed() {
    var worker = 0;
    final var startRules = model.getStartRules();
    for (var ruleIndex = 0; ruleIndex < startRules.size(); ruleIndex++) {
      final var candidates = startRules.get(ruleIndex).candidates(model.getLayout());
      try {
        while (candidates.hasNext()) {
          if (! admit(candidates.next(), Violation.SEEDING, worker)) {
            return;
          }
          worker = (worker + 1) % options.threads;
        }
      } catch (RuleApplicationException e) {
        abort(Violation.ofRuleFault(e, Violation.SEEDING));
        return;
      }
    }
  }

  private void explore() throws InterruptedException {
    final var executor = Executors.newFixedThreadPool(options.threads);
    try {
      final var futures = new ArrayList<Future<?>>(options.threads);
      for (var worker = 0; worker < options.threads; worker++) {
        final var _worker = worker;
        futures.add(executor.submit(() -> {
          try {
            work(_worker);
          } catch (Throwable e) {
            fault.compareAndSet(null, e);
            queue.close();
            throw e;
          }
          return null;
        }));
      }

      for (var future : futures) {
        try {
          future.get();
        } catch (ExecutionException e) {
          fault.compareAndSet(null, e.getCause());
        } catch (InterruptedException e) {
          queue.close();
          throw e;
        }
      }
    } finally {
      executor.shutdown();
    }
  }

  private void work(int worker) throws InterruptedException {
    LOG.debug("Worker {} started", worker);
    State state;
    while ((state = queue.pop(worker)) != null) {
      expand(state, worker);
    }
    LOG.debug("Worker {} finished", worker);
  }

  private void expand(State state, int worker) {
    final var rules = model.getRules();
    for (var ruleIndex = 0; ruleIndex < rules.size(); ruleIndex++) {
      final var candidates = rules.get(ruleIndex).candidates(state);
      try {
        while (candidates.hasNext()) {
          if (! admit(candidates.next(), ruleIndex, worker) || failures.isSet()) {
            return;
          }
        }
      } catch (RuleApplicationException e) {
        abort(Violation.ofRuleFault(e, ruleIndex));
        return;
      }

      if (failures.isSet()) {
        return;
      }
    }
  }

  /**
   *  Deduplicates a candidate and, if it is new, checks the invariants and queues it.
   *
   *  @return {@code false} if the candidate violated an invariant.
   */
  private boolean admit(State candidate, int ruleIndex, int worker) {
    if (! seen.insert(candidate)) {
      return true;
    }

    final var states = discovered.incrementAndGet();
    if (states % options.progressInterval == 0) {
      reporter.onProgress(states, elapsed(), queue.size());
    }

    final var violation = checkInvariants(candidate, ruleIndex);
    if (violation != null) {
      abort(violation);
      return false;
    }

    queue.push(worker, candidate);
    return true;
  }

  private Violation checkInvariants(State state, int ruleIndex) {
    final var invariants = model.getInvariants();
    for (var invariantIndex = 0; invariantIndex < invariants.size(); invariantIndex++) {
      final var invariant = invariants.get(invariantIndex);
      try {
        if (! invariant.holds(state)) {
          return Violation.ofInvariant(invariant, invariantIndex, state, ruleIndex, null);
        }
      } catch (ModelFailure e) {
        return Violation.ofInvariant(invariant, invariantIndex, state, ruleIndex, e);
      }
    }
    return null;
  }

  private void abort(Violation violation) {
    if (failures.offer(violation)) {
      LOG.debug("Aborting on {}", violation);
    }
    queue.close();
  }

  @Override
  public String toString() {
    return Checker.class.getSimpleName() + "[model=" + model.getName() + ", phase=" + phase + ", seen=" + seen + ", queue=" + queue + ']';
  }
}
