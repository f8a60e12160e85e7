package com.obsidiandynamics.rulecheck.explore;

import com.obsidiandynamics.rulecheck.*;
import com.obsidiandynamics.rulecheck.explore.Checker.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.*;
import org.junit.jupiter.params.provider.*;

import java.util.*;
import java.util.concurrent.atomic.*;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

final class CheckerTest {
  private static Options options(int threads) {
    return new Options() {{
      this.threads = threads;
      setCapacity = 16;
      setShards = 4;
      debug = true;
    }};
  }

  private static Result run(Model model, int threads) throws InterruptedException {
    return new Checker(model, options(threads), Reporter.NOP).run();
  }

  @Nested
  class CompletionTests {
    @Test
    void testFlipCoversBothStates() throws InterruptedException {
      final var model = TestModels.flip(new Invariant("true", __ -> true));
      final var result = run(model, 1);
      assertThat(result.getVerdict()).isEqualTo(Result.Verdict.COMPLETED);
      assertThat(result.isSuccess()).isTrue();
      assertThat(result.getStates()).isEqualTo(2);
      assertThat(result.getFailure()).isEmpty();
      assertThat(result.exitStatus()).isEqualTo(Result.EXIT_SUCCESS);
    }

    @Test
    void testEmptyQuantifierRangeProducesNoSuccessors() throws InterruptedException {
      final var builder = Layout.builder();
      final var n = builder.range("n", 0, 10);
      final var model = Model.builder("empty", builder.build())
          .startRule(StartRule.of("init", (s, __) -> n.set(s, 0)))
          .rule(new Rule("never",
                         List.of(Quantifier.over("i", Domain.range(1, 0))),
                         Rule.Guard.ALWAYS,
                         (s, b) -> n.set(s, b.get("i"))))
          .build();
      final var result = run(model, 2);
      assertThat(result.getVerdict()).isEqualTo(Result.Verdict.COMPLETED);
      assertThat(result.getStates()).isEqualTo(1);
    }

    @Test
    void testIdenticalStartStatesAreCheckedOnce() throws InterruptedException {
      final var builder = Layout.builder();
      final var x = builder.bool("x");
      final var evaluations = new AtomicInteger();
      final var model = Model.builder("twins", builder.build())
          .startRule(StartRule.of("first", (s, __) -> x.setBoolean(s, true)))
          .startRule(StartRule.of("second", (s, __) -> x.setBoolean(s, true)))
          .invariant(new Invariant("counted", __ -> {
            evaluations.incrementAndGet();
            return true;
          }))
          .build();
      final var result = run(model, 2);
      assertThat(result.getStates()).isEqualTo(1);
      assertThat(evaluations.get()).isEqualTo(1);
    }

    @Test
    void testModelWithoutRulesOrStartRules() throws InterruptedException {
      final var model = Model.builder("void", Layout.builder().build()).build();
      final var result = run(model, 3);
      assertThat(result.getVerdict()).isEqualTo(Result.Verdict.COMPLETED);
      assertThat(result.getStates()).isEqualTo(0);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 4, 8})
    void testStateCountIndependentOfThreads(int threads) throws InterruptedException {
      final var result = run(TestModels.counters(3, 4), threads);
      assertThat(result.getVerdict()).isEqualTo(Result.Verdict.COMPLETED);
      assertThat(result.getStates()).isEqualTo(125);
    }

    @Test
    void testLargerStateSpaceWithGrowth() throws InterruptedException {
      final var result = run(TestModels.counters(4, 9), 4);
      assertThat(result.getStates()).isEqualTo(10_000);
    }
  }

  @Nested
  class ViolationTests {
    @Test
    void testInvariantViolationAfterOneStep() throws InterruptedException {
      final var model = TestModels.flip();
      final var violating = TestModels.flip(TestModels.xIsFalse(model.getLayout()));
      final var result = run(violating, 1);
      assertThat(result.getVerdict()).isEqualTo(Result.Verdict.FAILED);
      assertThat(result.exitStatus()).isEqualTo(Result.EXIT_FAILURE);

      final var failure = result.getFailure().orElseThrow();
      assertThat(failure.getKind()).isEqualTo(Failure.Kind.INVARIANT_VIOLATION);
      assertThat(failure.getName()).isEqualTo("x is false");
      assertThat(failure.getMessage()).isEqualTo("Invariant x is false failed");
      assertThat(failure.getCause()).isEmpty();

      final var trace = failure.getTrace();
      assertThat(trace).hasSize(2);
      assertThat(trace.get(0).getIndex()).isEqualTo(0);
      assertThat(trace.get(0).getRuleName()).isEqualTo("init");
      assertThat(trace.get(1).getIndex()).isEqualTo(1);
      assertThat(trace.get(1).getRuleName()).isEqualTo("flip");
      assertThat(violating.getLayout().render(trace.get(1).getState())).isEqualTo("x:true\n");
    }

    @Test
    void testViolatingStartState() throws InterruptedException {
      final var builder = Layout.builder();
      final var x = builder.bool("x");
      final var model = Model.builder("bad start", builder.build())
          .startRule(StartRule.of("init", (s, __) -> x.setBoolean(s, true)))
          .invariant(new Invariant("x is false", s -> ! x.getBoolean(s)))
          .build();
      final var failure = run(model, 2).getFailure().orElseThrow();
      assertThat(failure.getTrace()).hasSize(1);
      assertThat(failure.getTrace().get(0).getRuleName()).isEqualTo("init");
    }

    @Test
    void testFirstDeclaredInvariantIsReported() throws InterruptedException {
      final var builder = Layout.builder();
      final var x = builder.bool("x");
      final var model = Model.builder("two", builder.build())
          .startRule(StartRule.of("init", (s, __) -> x.setBoolean(s, true)))
          .invariant(new Invariant("first", __ -> false))
          .invariant(new Invariant("second", __ -> false))
          .build();
      assertThat(run(model, 1).getFailure().orElseThrow().getName()).isEqualTo("first");
    }

    @Test
    void testInvariantEvaluationFailureCountsAsViolation() throws InterruptedException {
      final var builder = Layout.builder();
      final var x = builder.bool("x");
      final var y = builder.bool("y");
      final var model = Model.builder("undefined", builder.build())
          .startRule(StartRule.of("init", (s, __) -> x.setBoolean(s, true)))
          .invariant(new Invariant("y is set", y::getBoolean))
          .build();
      final var failure = run(model, 1).getFailure().orElseThrow();
      assertThat(failure.getKind()).isEqualTo(Failure.Kind.INVARIANT_VIOLATION);
      assertThat(failure.getName()).isEqualTo("y is set");
      assertThat(failure.getCause()).containsInstanceOf(UndefinedValueFailure.class);
      assertThat(failure.getMessage()).startsWith("Invariant y is set could not be evaluated: ");
    }

    @Test
    void testTraceIsReplayable() throws Exception {
      final var builder = Layout.builder();
      final var a = builder.range("a", 0, 3);
      final var b = builder.range("b", 0, 3);
      final var model = Model.builder("sum", builder.build())
          .startRule(StartRule.of("init", (s, __) -> {
            a.set(s, 0);
            b.set(s, 0);
          }))
          .rule(Rule.of("incA", (s, __) -> a.get(s) < 3, (s, __) -> a.set(s, a.get(s) + 1)))
          .rule(Rule.of("incB", (s, __) -> b.get(s) < 3, (s, __) -> b.set(s, b.get(s) + 1)))
          .invariant(new Invariant("sum below 5", s -> a.get(s) + b.get(s) < 5))
          .build();

      for (var threads : new int[] {1, 4}) {
        final var failure = run(model, threads).getFailure().orElseThrow();
        final var trace = failure.getTrace();
        assertThat(trace).hasSize(6);
        var state = model.getStartRules().get(0).apply(model.getLayout(), Bindings.EMPTY);
        assertThat(trace.get(0).getState()).isEqualTo(state);
        for (var step : trace.subList(1, trace.size())) {
          final var rule = model.getRules().stream().filter(r -> r.getName().equals(step.getRuleName())).findFirst().orElseThrow();
          state = rule.apply(state, step.getBindings());
          assertThat(state).isEqualTo(step.getState());
        }
        assertThat(a.get(state) + b.get(state)).isEqualTo(5);
      }
    }
  }

  @Nested
  class AttributionTests {
    @Test
    void testRuleThrowingOnReplayIsSkipped() throws InterruptedException {
      final var builder = Layout.builder();
      final var x = builder.bool("x");
      final var guardCalls = new AtomicInteger();
      final var model = Model.builder("flaky", builder.build())
          .startRule(StartRule.of("init", (s, __) -> x.setBoolean(s, false)))
          .rule(Rule.of("flaky", (s, __) -> {
            if (guardCalls.incrementAndGet() > 1) {
              throw new IllegalStateException("flaky guard");
            }
            return false;
          }, (s, __) -> {}))
          .rule(Rule.of("flip", Rule.Guard.ALWAYS, (s, __) -> x.setBoolean(s, ! x.getBoolean(s))))
          .invariant(new Invariant("x is false", s -> ! x.getBoolean(s)))
          .build();

      final var failure = run(model, 1).getFailure().orElseThrow();
      assertThat(guardCalls.get()).isGreaterThan(1);
      assertThat(failure.getTrace()).extracting(Step::getRuleName).containsExactly("init", "flip");
    }
  }

  @Nested
  class RuleFaultTests {
    @Test
    void testOutOfRangeWriteInRule() throws InterruptedException {
      final var builder = Layout.builder();
      final var n = builder.range("n", 0, 3);
      final var model = Model.builder("overflow", builder.build())
          .startRule(StartRule.of("init", (s, __) -> n.set(s, 0)))
          .rule(new Rule("inc",
                         List.of(Quantifier.over("by", Domain.range(1, 1))),
                         Rule.Guard.ALWAYS,
                         (s, b) -> n.set(s, n.get(s) + b.get("by"))))
          .build();
      final var result = run(model, 1);
      assertThat(result.getVerdict()).isEqualTo(Result.Verdict.FAILED);

      final var failure = result.getFailure().orElseThrow();
      assertThat(failure.getKind()).isEqualTo(Failure.Kind.RULE_FAULT);
      assertThat(failure.getName()).isEqualTo("inc");
      assertThat(failure.getBindings().getInt("by")).isEqualTo(1);
      assertThat(failure.getMessage()).startsWith("Rule inc [by:1] caused: ");
      assertThat(failure.getCause()).isPresent();
      assertThat(failure.getTrace()).hasSize(4);
      assertThat(model.getLayout().render(failure.getTrace().get(3).getState())).isEqualTo("n:3\n");
    }

    @Test
    void testUndefinedReadInGuard() throws InterruptedException {
      final var builder = Layout.builder();
      final var x = builder.bool("x");
      final var y = builder.bool("y");
      final var model = Model.builder("undefined guard", builder.build())
          .startRule(StartRule.of("init", (s, __) -> x.setBoolean(s, false)))
          .rule(Rule.of("peek", (s, __) -> y.getBoolean(s), (s, __) -> {}))
          .build();
      final var failure = run(model, 2).getFailure().orElseThrow();
      assertThat(failure.getKind()).isEqualTo(Failure.Kind.RULE_FAULT);
      assertThat(failure.getCause()).containsInstanceOf(UndefinedValueFailure.class);
      assertThat(failure.getTrace()).hasSize(1);
    }

    @Test
    void testStartRuleFaultHasEmptyTrace() throws InterruptedException {
      final var builder = Layout.builder();
      builder.bool("x");
      final var model = Model.builder("bad init", builder.build())
          .startRule(StartRule.of("init", (s, __) -> ModelAssertionFailure.check(false, "refused")))
          .build();
      final var result = run(model, 2);
      final var failure = result.getFailure().orElseThrow();
      assertThat(failure.getKind()).isEqualTo(Failure.Kind.RULE_FAULT);
      assertThat(failure.getName()).isEqualTo("init");
      assertThat(failure.getCause()).containsInstanceOf(ModelAssertionFailure.class);
      assertThat(failure.getTrace()).isEmpty();
      assertThat(result.getStates()).isEqualTo(0);
    }
  }

  @Nested
  class LifecycleTests {
    @Test
    void testPhases() throws InterruptedException {
      final var checker = new Checker(TestModels.flip(), options(1), Reporter.NOP);
      assertThat(checker.getPhase()).isEqualTo(Phase.INIT);
      checker.run();
      assertThat(checker.getPhase()).isEqualTo(Phase.COMPLETED);

      final var layout = TestModels.flip().getLayout();
      final var failing = new Checker(TestModels.flip(TestModels.xIsFalse(layout)), options(1), Reporter.NOP);
      failing.run();
      assertThat(failing.getPhase()).isEqualTo(Phase.FAILED);
    }

    @Test
    void testSingleUse() throws InterruptedException {
      final var checker = new Checker(TestModels.flip(), options(1), Reporter.NOP);
      checker.run();
      assertThat(catchThrowable(checker::run)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testInvalidOptions() {
      final var model = TestModels.flip();
      assertThat(catchThrowable(() -> new Checker(model, new Options() {{ threads = 0; }}, Reporter.NOP)))
          .isInstanceOf(IllegalArgumentException.class);
      assertThat(catchThrowable(() -> new Checker(model, new Options() {{ setExpandThreshold = 150; }}, Reporter.NOP)))
          .isInstanceOf(IllegalArgumentException.class);
      assertThat(catchThrowable(() -> new Checker(model, new Options() {{ progressInterval = 0; }}, Reporter.NOP)))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testUnexpectedRuntimeExceptionIsFatal() {
      final var builder = Layout.builder();
      final var x = builder.bool("x");
      final var model = Model.builder("broken", builder.build())
          .startRule(StartRule.of("init", (s, __) -> x.setBoolean(s, false)))
          .rule(Rule.of("explode", Rule.Guard.ALWAYS, (s, __) -> {
            throw new IllegalStateException("boom");
          }))
          .build();
      final var checker = new Checker(model, options(3), Reporter.NOP);
      final var e = catchThrowableOfType(checker::run, CheckerFaultException.class);
      assertThat(e).hasMessageContaining("broken");
      assertThat(e.getCause()).isInstanceOf(IllegalStateException.class).hasMessage("boom");
      assertThat(checker.getPhase()).isEqualTo(Phase.FAILED);
    }

    @Test
    void testUnexpectedRuntimeExceptionInStartRuleIsFatal() {
      final var builder = Layout.builder();
      final var colour = builder.enumeration("colour", "RED", "GREEN");
      final var model = Model.builder("broken start", builder.build())
          .startRule(StartRule.of("init", (s, __) -> colour.set(s, "BLUE")))
          .build();
      final var checker = new Checker(model, options(2), Reporter.NOP);
      final var e = catchThrowableOfType(checker::run, CheckerFaultException.class);
      assertThat(e).hasMessageContaining("broken start");
      assertThat(e.getCause()).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("BLUE");
      assertThat(checker.getPhase()).isEqualTo(Phase.FAILED);
    }
  }

  @Nested
  class ReporterTests {
    @Test
    void testCompletionCallbacks() throws InterruptedException {
      final var reporter = mock(Reporter.class);
      final var model = TestModels.counters(3, 4);
      final var options = new Options() {{
        threads = 2;
        progressInterval = 10;
      }};
      final var result = new Checker(model, options, reporter).run();

      verify(reporter).onStart(model, options);
      verify(reporter, times(12)).onProgress(anyLong(), anyLong(), anyLong());
      verify(reporter).onCompleted(model, result);
      verify(reporter, never()).onFailed(any(), any());
    }

    @Test
    void testFailureCallback() throws InterruptedException {
      final var reporter = mock(Reporter.class);
      final var layout = TestModels.flip().getLayout();
      final var model = TestModels.flip(TestModels.xIsFalse(layout));
      final var result = new Checker(model, options(1), reporter).run();

      verify(reporter).onFailed(model, result);
      verify(reporter, never()).onCompleted(any(), any());
    }
  }
}
