package com.obsidiandynamics.rulecheck.util;

public final class Hash {
  private static final long SEED = 0x9E3779B97F4A7C15L;

  private Hash() {}

  public static int byModulo(long value, int modulo) {
    final var rawModHash = (int) (value % modulo);
    return rawModHash < 0 ? rawModHash + modulo : rawModHash;
  }

  /**
   *  The 64-bit finalisation step of Murmur3. Every input bit affects every output bit.
   *
   *  @param k The value to mix.
   *  @return The mixed value.
   */
  public static long mix(long k) {
    k ^= k >>> 33;
    k *= 0xFF51AFD7ED558CCDL;
    k ^= k >>> 33;
    k *= 0xC4CEB9FE1A85EC53L;
    k ^= k >>> 33;
    return k;
  }

  public static long ofWords(long[] words, int width) {
    var h = SEED ^ width;
    for (var word : words) {
      h = Long.rotateLeft(h ^ mix(word), 27) * 5 + 0x52DCE729;
    }
    return mix(h);
  }
}
