package com.obsidiandynamics.rulecheck.util;

import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

final class HashTest {
  @Test
  void testByModulo() {
    assertThat(Hash.byModulo(0, 5)).isEqualTo(0);
    assertThat(Hash.byModulo(4, 5)).isEqualTo(4);
    assertThat(Hash.byModulo(6, 5)).isEqualTo(1);
    assertThat(Hash.byModulo(-1, 5)).isEqualTo(4);
    assertThat(Hash.byModulo(-5, 5)).isEqualTo(0);
    assertThat(Hash.byModulo(Long.MIN_VALUE, 7)).isBetween(0, 6);
  }

  @Test
  void testMixIsDeterministicAndSpreads() {
    assertThat(Hash.mix(42)).isEqualTo(Hash.mix(42));
    assertThat(Hash.mix(1)).isNotEqualTo(Hash.mix(2));
    assertThat(Hash.mix(0)).isEqualTo(0);
  }

  @Test
  void testOfWordsDependsOnContentAndWidth() {
    final var a = new long[] {1, 2};
    final var b = new long[] {1, 2};
    final var c = new long[] {2, 1};
    assertThat(Hash.ofWords(a, 100)).isEqualTo(Hash.ofWords(b, 100));
    assertThat(Hash.ofWords(a, 100)).isNotEqualTo(Hash.ofWords(c, 100));
    assertThat(Hash.ofWords(a, 100)).isNotEqualTo(Hash.ofWords(a, 101));
  }
}
