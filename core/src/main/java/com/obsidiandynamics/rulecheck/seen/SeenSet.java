package com.obsidiandynamics.rulecheck.seen;

import com.obsidiandynamics.rulecheck.*;
import com.obsidiandynamics.rulecheck.util.*;

import java.util.concurrent.atomic.*;
import java.util.concurrent.locks.*;

/**
 *  The record of every distinct state discovered. A fixed array of shards, each an
 *  open-addressing table with linear probing.<p>
 *
 *  Inserts into a shard hold that shard's read lock and claim empty slots by CAS, so any number
 *  of threads may insert into the same shard concurrently. A shard grows under its own write
 *  lock, which excludes inserts into that shard only. Slots are never vacated.
 */
public final class SeenSet {
  public static final int MAX_SHARD_CAPACITY = 1 << 30;

  private static final int MIN_SHARD_CAPACITY = 2;

  private enum Outcome {
    ADDED, PRESENT, FULL
  }

  private static final class Shard {
    final ReadWriteLock lock = new ReentrantReadWriteLock();

    final AtomicInteger occupancy = new AtomicInteger();

    volatile AtomicReferenceArray<State> table;

    Shard(int capacity) {
      table = new AtomicReferenceArray<>(capacity);
    }
  }

  private final Shard[] shards;

  private final int expandThreshold;

  private final boolean debug;

  private final AtomicLong size = new AtomicLong();

  /**
   *  Creates a set.
   *
   *  @param initialCapacity The total initial capacity, divided evenly among the shards.
   *  @param expandThreshold The occupancy percentage of a shard beyond which it doubles.
   *  @param shards The number of shards.
   *  @param debug Whether to verify hash and equality consistency on every duplicate.
   */
  public SeenSet(int initialCapacity, int expandThreshold, int shards, boolean debug) {
    Assert.inRange(initialCapacity, 1, Integer.MAX_VALUE, () -> "Initial capacity must be positive");
    Assert.inRange(expandThreshold, 1, 100, () -> "Expand threshold must be a percentage in 1..100");
    Assert.inRange(shards, 1, Integer.MAX_VALUE, () -> "Shard count must be positive");
    this.expandThreshold = expandThreshold;
    this.debug = debug;
    final var shardCapacity = shardCapacityFor(initialCapacity, shards);
    this.shards = new Shard[shards];
    for (var i = 0; i < shards; i++) {
      this.shards[i] = new Shard(shardCapacity);
    }
  }

  static int shardCapacityFor(int initialCapacity, int shards) {
    final var perShard = Math.max(MIN_SHARD_CAPACITY, (initialCapacity + shards - 1) / shards);
    final var rounded = Integer.highestOneBit(perShard);
    if (rounded == perShard) {
      return perShard;
    } else {
      return Math.min(MAX_SHARD_CAPACITY, rounded << 1);
    }
  }

  /**
   *  Records {@code state} if no state with identical content has been recorded before.
   *  Exactly one of any number of concurrent calls with equal content returns {@code true}.
   *
   *  @param state The candidate state.
   *  @return {@code true} if the state is new and has been recorded, {@code false} if an equal
   *  state was already present.
   *  @throws SeenSetExhaustedException If the owning shard is full and cannot grow.
   */
  public boolean insert(State state) {
    final var hash = state.contentHash();
    final var shard = shards[Hash.byModulo(hash & Long.MAX_VALUE, shards.length)];
    while (true) {
      final Outcome outcome;
      final var readLock = shard.lock.readLock();
      readLock.lock();
      try {
        outcome = probe(shard.table, state, hash);
      } finally {
        readLock.unlock();
      }

      switch (outcome) {
        case ADDED -> {
          size.incrementAndGet();
          shard.occupancy.incrementAndGet();
          if (overThreshold(shard)) {
            expand(shard, false);
          }
          return true;
        }
        case PRESENT -> {
          return false;
        }
        case FULL -> expand(shard, true);
      }
    }
  }

  private Outcome probe(AtomicReferenceArray<State> table, State state, long hash) {
    final var mask = table.length() - 1;
    var index = slotFor(hash, mask);
    for (var probes = 0; probes <= mask; probes++) {
      final var existing = table.get(index);
      if (existing == null) {
        if (table.compareAndSet(index, null, state)) {
          return Outcome.ADDED;
        }
        // lost the race for this slot; the winner may hold the same content
        if (matches(table.get(index), state)) {
          return Outcome.PRESENT;
        }
      } else if (matches(existing, state)) {
        return Outcome.PRESENT;
      }
      index = (index + 1) & mask;
    }
    return Outcome.FULL;
  }

  private boolean matches(State existing, State candidate) {
    final var equal = existing.equals(candidate);
    if (debug) {
      final var rawEqual = existing.width() == candidate.width() && existing.toHexString().equals(candidate.toHexString());
      Assert.that(equal == rawEqual, () -> "Equality inconsistent with content for " + existing + " and " + candidate);
      Assert.that(!equal || existing.contentHash() == candidate.contentHash(),
                  () -> "Hash inconsistent with equality for " + existing + " and " + candidate);
    }
    return equal;
  }

  private static int slotFor(long hash, int mask) {
    return (int) (hash >>> 32) & mask;
  }

  private boolean overThreshold(Shard shard) {
    return shard.occupancy.get() * 100L > (long) shard.table.length() * expandThreshold;
  }

  private void expand(Shard shard, boolean force) {
    final var writeLock = shard.lock.writeLock();
    writeLock.lock();
    try {
      final var table = shard.table;
      final var needed = force ? countOccupied(table) == table.length() : overThreshold(shard);
      if (! needed) {
        // another thread expanded the shard while we waited for the lock
        return;
      }

      if (table.length() >= MAX_SHARD_CAPACITY) {
        throw new SeenSetExhaustedException("Shard cannot grow beyond " + table.length() + " slots");
      }

      final var expanded = new AtomicReferenceArray<State>(table.length() << 1);
      final var mask = expanded.length() - 1;
      for (var i = 0; i < table.length(); i++) {
        final var state = table.get(i);
        if (state != null) {
          var index = slotFor(state.contentHash(), mask);
          while (expanded.get(index) != null) {
            index = (index + 1) & mask;
          }
          expanded.set(index, state);
        }
      }
      shard.table = expanded;
    } finally {
      writeLock.unlock();
    }
  }

  private static int countOccupied(AtomicReferenceArray<State> table) {
    var occupied = 0;
    for (var i = 0; i < table.length(); i++) {
      if (table.get(i) != null) occupied++;
    }
    return occupied;
  }

  /**
   *  An approximate count of the distinct states recorded. Never decreases.
   *
   *  @return The number of states.
   */
  public long size() {
    return size.get();
  }

  public long capacity() {
    var capacity = 0L;
    for (var shard : shards) {
      capacity += shard.table.length();
    }
    return capacity;
  }

  public int shards() {
    return shards.length;
  }

  @Override
  public String toString() {
    return SeenSet.class.getSimpleName() + "[shards=" + shards.length + ", size=" + size + ", expandThreshold=" + expandThreshold + ']';
  }
}
