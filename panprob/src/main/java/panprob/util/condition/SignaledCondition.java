// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * What a {@link Handler} receives: the condition plus how it was signaled.
 *
 * @param condition The condition itself.
 * @param isFatal   Whether it came from {@link ConditionContext#error(Condition)}.
 */
public record SignaledCondition(@NotNull Condition condition, boolean isFatal) {
}
