// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Base class of everything that can be signaled through {@link ConditionContext}.
 * <p>
 * A condition describes a situation that code further up the stack may want to react to: a malformed
 * {@code \begin{choices}} block, a missing image, an unreadable problem directory. Handlers see the condition
 * <em>before</em> anything is unwound, so they can still pick any restart point established below them.
 */
public abstract class Condition {
    /**
     * Creates a condition carrying the given user-readable message.
     */
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Returns the short user-readable message.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Returns the long form of the message, for instance including a stack trace. Defaults to {@link #message()}.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getName() + ": " + message;
    }

    private final @NotNull String message;
}
