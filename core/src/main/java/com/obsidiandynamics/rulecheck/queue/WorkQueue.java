package com.obsidiandynamics.rulecheck.queue;

import com.obsidiandynamics.rulecheck.*;
import com.obsidiandynamics.rulecheck.util.*;

import java.util.*;
import java.util.concurrent.atomic.*;

/**
 *  States pending expansion, split into one FIFO deque per worker. A worker drains its own deque
 *  first and then steals from the others, starting at its right-hand neighbour.<p>
 *
 *  Termination: a worker that finds nothing to pop registers as idle and waits on a shared
 *  monitor. The queue is drained at the instant every worker is idle and nothing is pending.
 *  A push increments the pending count before reading the idle count and notifies under the
 *  monitor whenever a worker may be waiting, so an idle worker cannot miss it.
 */
public final class WorkQueue {
  private final Deque<State>[] deques;

  private final AtomicLong pending = new AtomicLong();

  private final AtomicInteger idle = new AtomicInteger();

  private final Object monitor = new Object();

  private volatile boolean closed;

  private volatile boolean drained;

  @SuppressWarnings("unchecked")
  public WorkQueue(int workers) {
    Assert.inRange(workers, 1, Integer.MAX_VALUE, () -> "Worker count must be positive");
    deques = new Deque[workers];
    for (var i = 0; i < workers; i++) {
      deques[i] = new ArrayDeque<>();
    }
  }

  public int workers() {
    return deques.length;
  }

  /**
   *  Appends a state to the given worker's deque.
   *
   *  @param worker The pushing worker's index.
   *  @param state The state.
   *  @return The approximate number of pending states, including this one.
   */
  public long push(int worker, State state) {
    final var deque = deques[worker];
    synchronized (deque) {
      deque.addLast(state);
    }
    final var size = pending.incrementAndGet();
    if (idle.get() != 0) {
      synchronized (monitor) {
        monitor.notifyAll();
      }
    }
    return size;
  }

  /**
   *  Takes the next state for the given worker, blocking while other workers may still produce
   *  work.
   *
   *  @param worker The popping worker's index.
   *  @return The next state, or {@code null} once the queue is drained or closed.
   *  @throws InterruptedException If interrupted while waiting.
   */
  public State pop(int worker) throws InterruptedException {
    while (true) {
      if (closed) {
        return null;
      }

      final var state = poll(worker);
      if (state != null) {
        pending.decrementAndGet();
        return state;
      }

      synchronized (monitor) {
        idle.incrementAndGet();
        try {
          while (pending.get() == 0 && !closed) {
            if (idle.get() == deques.length) {
              drained = true;
              closed = true;
              monitor.notifyAll();
              return null;
            }
            monitor.wait();
          }
        } finally {
          idle.decrementAndGet();
        }
      }
    }
  }

  private State poll(int worker) {
    for (var i = 0; i < deques.length; i++) {
      final var deque = deques[(worker + i) % deques.length];
      final State state;
      synchronized (deque) {
        state = deque.pollFirst();
      }
      if (state != null) {
        return state;
      }
    }
    return null;
  }

  /**
   *  Releases every waiting worker and causes all subsequent pops to return {@code null}.
   */
  public void close() {
    synchronized (monitor) {
      closed = true;
      monitor.notifyAll();
    }
  }

  /**
   *  Whether the queue ran out of work with every worker idle, as opposed to having been closed.
   *
   *  @return {@code true} if drained.
   */
  public boolean isDrained() {
    return drained;
  }

  public boolean isClosed() {
    return closed;
  }

  public long size() {
    return pending.get();
  }

  @Override
  public String toString() {
    return WorkQueue.class.getSimpleName() + "[workers=" + deques.length + ", pending=" + pending + ", idle=" + idle +
        ", closed=" + closed + ", drained=" + drained + ']';
  }
}
