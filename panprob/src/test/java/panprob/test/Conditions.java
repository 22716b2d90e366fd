// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.test;

import java.util.ArrayList;
import panprob.util.condition.Condition;
import panprob.util.condition.ConditionContext;
import panprob.util.condition.Handler;
import static org.assertj.core.api.Assertions.assertThat;
import org.jetbrains.annotations.NotNull;

final class Conditions {
    private Conditions() {
    }

    /**
     * Runs {@code action} and returns the fatal condition it signals, failing the test if it signals none or one of
     * a different type.
     */
    static <C extends Condition> @NotNull C catchFatal(
        final @NotNull Class<C> conditionType,
        final @NotNull Runnable action
    ) {
        final var caught = new ArrayList<Condition>(1);
        ConditionContext.withRestart("catch-fatal", restart -> {
            try (final var handler = new Handler(signaled -> {
                if (signaled.isFatal()) {
                    caught.add(signaled.condition());
                    restart.unwindTo();
                }
            })) {
                handler.use();
                action.run();
            }
            return null;
        });
        assertThat(caught).as("fatal conditions signaled").hasSize(1);
        assertThat(caught.get(0)).isInstanceOf(conditionType);
        return conditionType.cast(caught.get(0));
    }
}
