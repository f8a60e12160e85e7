package com.obsidiandynamics.rulecheck;

import org.junit.jupiter.api.*;

import java.util.*;
import java.util.concurrent.atomic.*;

import static org.assertj.core.api.Assertions.*;

final class RuleTest {
  private Layout layout;

  private Field a;

  private Field b;

  private State start;

  @BeforeEach
  void beforeEach() throws ModelFailure {
    final var builder = Layout.builder();
    a = builder.range("a", 0, 15);
    b = builder.range("b", 0, 15);
    layout = builder.build();
    start = State.fromStart(layout, (s, __) -> {
      a.set(s, 0);
      b.set(s, 0);
    }, Bindings.EMPTY);
  }

  private static List<State> drain(Iterator<State> it) {
    final var states = new ArrayList<State>();
    it.forEachRemaining(states::add);
    return states;
  }

  @Test
  void testCartesianProductOrder() throws ModelFailure {
    final var rule = new Rule("assign",
                              List.of(Quantifier.over("i", Domain.range(2, 4)), Quantifier.over("j", Domain.range(7, 8))),
                              Rule.Guard.ALWAYS,
                              (s, bindings) -> {
                                a.set(s, bindings.get("i"));
                                b.set(s, bindings.get("j"));
                              });
    final var successors = drain(rule.candidates(start));
    assertThat(successors).hasSize((4 - 2 + 1) * (8 - 7 + 1));

    final var pairs = new ArrayList<String>();
    for (var successor : successors) {
      pairs.add(a.get(successor) + "," + b.get(successor));
      assertThat(successor.getPrevious()).isSameAs(start);
    }
    assertThat(pairs).containsExactly("2,7", "2,8", "3,7", "3,8", "4,7", "4,8");
  }

  @Test
  void testGuardFiltersBindings() {
    final var rule = new Rule("evens", List.of(Quantifier.over("i", Domain.range(0, 9))),
                              (s, bindings) -> bindings.get("i") % 2 == 0,
                              (s, bindings) -> a.set(s, bindings.get("i")));
    assertThat(drain(rule.candidates(start))).hasSize(5);
  }

  @Test
  void testGuardSeesUnmutatedPredecessor() throws ModelFailure {
    final var guardSaw = new ArrayList<Long>();
    final var rule = new Rule("inc", List.of(Quantifier.over("i", Domain.range(0, 2))),
                              (s, __) -> {
                                guardSaw.add(a.get(s));
                                return true;
                              },
                              (s, __) -> a.set(s, a.get(s) + 1));
    final var successors = drain(rule.candidates(start));
    assertThat(guardSaw).containsExactly(0L, 0L, 0L);
    for (var successor : successors) {
      assertThat(a.get(successor)).isEqualTo(1);
    }
    assertThat(a.get(start)).isEqualTo(0);
  }

  @Test
  void testEmptyQuantifierYieldsNoCandidates() {
    final var bodyCalls = new AtomicInteger();
    final var rule = new Rule("never", List.of(Quantifier.over("i", Domain.range(1, 0))), Rule.Guard.ALWAYS,
                              (s, __) -> bodyCalls.incrementAndGet());
    final var it = rule.candidates(start);
    assertThat(it.hasNext()).isFalse();
    assertThat(catchThrowable(it::next)).isInstanceOf(NoSuchElementException.class);
    assertThat(bodyCalls.get()).isZero();
  }

  @Test
  void testCandidatesAreLazy() {
    final var bodyCalls = new AtomicInteger();
    final var rule = new Rule("count", List.of(Quantifier.over("i", Domain.range(0, 9))), Rule.Guard.ALWAYS,
                              (s, bindings) -> {
                                bodyCalls.incrementAndGet();
                                a.set(s, bindings.get("i"));
                              });
    final var it = rule.candidates(start);
    it.next();
    it.next();
    assertThat(bodyCalls.get()).isEqualTo(2);
  }

  @Test
  void testBodyFaultIsWrapped() {
    final var rule = new Rule("overflow", List.of(Quantifier.over("i", Domain.range(15, 16))), Rule.Guard.ALWAYS,
                              (s, bindings) -> a.set(s, bindings.get("i")));
    final var it = rule.candidates(start);
    assertThat(it.next()).isNotNull();
    final var e = catchThrowableOfType(it::hasNext, RuleApplicationException.class);
    assertThat(e.getRuleName()).isEqualTo("overflow");
    assertThat(e.getBindings().get("i")).isEqualTo(16);
    assertThat(e.getPredecessor()).isSameAs(start);
    assertThat(e.getCause()).isExactlyInstanceOf(ModelFailure.class);
    assertThat(e).hasMessageContaining("overflow").hasMessageContaining("i:16");
  }

  @Test
  void testGuardFaultIsWrapped() {
    final var builder = Layout.builder();
    final var undefined = builder.bool("undefined");
    final var blank = new StateBuffer(builder.build().width(), new long[1]).seal(null);
    final var rule = Rule.of("readsUndefined", (s, __) -> undefined.getBoolean(s), (s, __) -> {});
    final var e = catchThrowableOfType(() -> rule.candidates(blank).hasNext(), RuleApplicationException.class);
    assertThat(e.getCause()).isInstanceOf(UndefinedValueFailure.class);
    assertThat(e.getBindings()).isEqualTo(Bindings.EMPTY);
  }

  @Test
  void testApplySingleBinding() throws ModelFailure {
    final var rule = Rule.of("setA", (s, __) -> a.get(s) == 0, (s, __) -> a.set(s, 9));
    final var next = rule.apply(start, Bindings.EMPTY);
    assertThat(a.get(next)).isEqualTo(9);
    assertThat(rule.apply(next, Bindings.EMPTY)).isNull();
  }

  @Test
  void testToString() {
    final var rule = Rule.of("name", Rule.Guard.ALWAYS, (s, __) -> {});
    assertThat(rule.toString()).contains(Rule.class.getSimpleName()).contains("name=name");
    assertThat(rule.getQuantifiers()).isEmpty();
  }
}
