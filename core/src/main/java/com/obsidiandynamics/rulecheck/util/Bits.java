package com.obsidiandynamics.rulecheck.util;

/**
 *  Reads and writes little-endian bit runs of up to 63 bits within a {@code long[]}.
 */
public final class Bits {
  public static final int MAX_RUN = 63;

  private Bits() {}

  public static int wordsFor(int width) {
    return (width + 63) >>> 6;
  }

  public static long read(long[] words, int offset, int length) {
    final var word = offset >>> 6;
    final var shift = offset & 63;
    var value = words[word] >>> shift;
    if (shift + length > 64) {
      value |= words[word + 1] << (64 - shift);
    }
    return value & mask(length);
  }

  public static void write(long[] words, int offset, int length, long value) {
    final var mask = mask(length);
    final var word = offset >>> 6;
    final var shift = offset & 63;
    final var masked = value & mask;
    words[word] = (words[word] & ~(mask << shift)) | (masked << shift);
    if (shift + length > 64) {
      final var spill = 64 - shift;
      final var highMask = mask >>> spill;
      words[word + 1] = (words[word + 1] & ~highMask) | (masked >>> spill);
    }
  }

  private static long mask(int length) {
    return (1L << length) - 1;
  }
}
