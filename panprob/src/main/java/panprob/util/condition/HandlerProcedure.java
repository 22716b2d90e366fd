// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The body of a {@link Handler}.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Reacts to a signaled condition.
     * <p>
     * Returning normally declines the condition. Handling it means leaving non-locally, usually through
     * {@link Restart#unwindTo()}, which throws {@link Unwind} without declaring it.
     */
    void handle(@NotNull SignaledCondition condition);
}
