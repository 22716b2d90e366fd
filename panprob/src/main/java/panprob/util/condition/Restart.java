// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.util.condition;

import panprob.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A named point the stack can be unwound to.
 * <p>
 * Restarts are created by {@link ConditionContext#withRestart(String, RestartCallback)} and listed by
 * {@link ConditionContext#restarts()}. The command line tool, for example, offers {@code skip-problem} around each
 * problem it renders and {@code abort-process} around the whole run.
 */
public final class Restart {
    Restart(final @NotNull String name) {
        final var context = ConditionContext.localContext();
        next = context.firstRestart;
        this.name = name;
        ownerContext = context;
        context.firstRestart = this;
    }

    /**
     * Returns the user-readable name of this restart.
     */
    public @NotNull String name() {
        return name;
    }

    /**
     * Unwinds the stack to this restart by throwing {@link Unwind}. Never returns.
     */
    public void unwindTo() {
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    // Only ConditionContext creates restarts, so a package-private unlink suffices.
    void unlink() {
        checkUnlinkInvariants();
        ownerContext.firstRestart = next;
    }

    private void checkUnlinkInvariants() {
        assert ownerContext == ConditionContext.localContext() : "Restart unlinked by a different thread";
        assert ownerContext.firstRestart == this : "Restart chain corrupt";
    }

    final @Nullable Restart next;
    private final @NotNull String name;
    private final @NotNull ConditionContext ownerContext;
}
