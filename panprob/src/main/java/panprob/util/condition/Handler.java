// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.util.condition;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A condition handler, meant for try-with-resources.
 * <p>
 * Handlers are consulted newest first every time a condition is signaled on the thread that created them.
 */
public final class Handler implements AutoCloseable {
    /**
     * Registers a handler running {@code procedure} in the calling thread's {@link ConditionContext}.
     */
    public Handler(final @NotNull HandlerProcedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.firstHandler;
        this.procedure = procedure;
        ownerContext = context;
        context.firstHandler = this;
    }

    /**
     * Does nothing; referencing the resource variable keeps "unused resource" warnings quiet.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Unregisters the handler. Let try-with-resources call it.
     */
    @Override
    public void close() {
        checkUnlinkInvariants();
        ownerContext.firstHandler = next;
    }

    void handle(final @NotNull SignaledCondition condition) {
        procedure.handle(condition);
    }

    private void checkUnlinkInvariants() {
        assert ownerContext == ConditionContext.localContext() : "Handler closed by a different thread";
        assert ownerContext.firstHandler == this : "Handler chain corrupt";
    }

    final @Nullable Handler next;
    private final @NotNull HandlerProcedure procedure;
    private final @NotNull ConditionContext ownerContext;
}
