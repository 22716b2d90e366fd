// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.test;

import java.util.ArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import panprob.util.Trace;
import panprob.util.condition.Condition;
import panprob.util.condition.ConditionContext;
import panprob.util.condition.Handler;
import panprob.util.condition.Restart;
import panprob.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.Test;

final class ConditionContextTest {
    @Test
    void unhandledErrorThrows() {
        final var condition = new TestCondition("boom");
        final var error = catchThrowableOfType(() -> {
            throw ConditionContext.error(condition);
        }, UnhandledErrorError.class);
        assertThat(error.condition()).isSameAs(condition);
        assertThat(error).hasMessageContaining("boom");
    }

    @Test
    void declinedSignalReturns() {
        final var seen = new ArrayList<String>();
        try (final var outer = new Handler(signaled -> seen.add("outer " + signaled.condition().message()))) {
            outer.use();
            try (final var inner = new Handler(signaled -> seen.add("inner " + signaled.isFatal()))) {
                inner.use();
                ConditionContext.signal(new TestCondition("note"));
            }
        }
        assertThat(seen).containsExactly("inner false", "outer note");
    }

    @Test
    void restartsAreListedInnermostFirst() {
        final var names = new ArrayList<String>();
        ConditionContext.withRestart("abort-process", outer ->
            ConditionContext.withRestart("skip-problem", inner -> {
                for (final var restart : ConditionContext.restarts()) {
                    names.add(restart.name());
                }
                return null;
            }));
        assertThat(names).containsExactly("skip-problem", "abort-process");
        assertThat(ConditionContext.restarts()).isEmpty();
    }

    @Test
    void unwindingSkipsOnlyInnerWork() {
        final var completed = new ArrayList<String>();
        final var result = ConditionContext.withRestart("abort-process", outer -> {
            try (final var handler = new Handler(signaled -> {
                if (signaled.isFatal()) {
                    findRestart("skip-problem").unwindTo();
                }
            })) {
                handler.use();
                for (final var name : new String[] {"01", "02", "03"}) {
                    final var rendered = ConditionContext.withRestart("skip-problem", restart -> {
                        if ("02".equals(name)) {
                            throw ConditionContext.error(new TestCondition("bad problem " + name));
                        }
                        return name;
                    });
                    if (rendered != null) {
                        completed.add(rendered);
                    }
                }
            }
            return "done";
        });
        assertThat(result).isEqualTo("done");
        assertThat(completed).containsExactly("01", "03");
    }

    @Test
    void tracesAreListedInnermostFirst() {
        try (final var outer = new Trace(() -> "Loading problem 07")) {
            outer.use();
            try (final var inner = new Trace(() -> "Converting command '\\textbf'")) {
                inner.use();
                assertThat(Trace.activeTraces()).containsExactly("Converting command '\\textbf'", "Loading problem 07");
            }
            assertThat(Trace.activeTraces()).containsExactly("Loading problem 07");
        }
        assertThat(Trace.activeTraces()).isEmpty();
    }

    @Test
    void traceMessagesAreBuiltOnDemand() {
        final var calls = new AtomicInteger();
        try (final var trace = new Trace(() -> "Rendering problem " + calls.incrementAndGet())) {
            trace.use();
            assertThat(calls).hasValue(0);
            assertThat(Trace.activeTraces()).containsExactly("Rendering problem 1");
        }
    }

    private static Restart findRestart(final String name) {
        for (final var restart : ConditionContext.restarts()) {
            if (restart.name().equals(name)) {
                return restart;
            }
        }
        throw new AssertionError("No restart named " + name);
    }

    private static final class TestCondition extends Condition {
        private TestCondition(final String message) {
            super(message);
        }
    }
}
