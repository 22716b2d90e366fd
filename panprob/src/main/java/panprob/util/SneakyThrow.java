// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.util;

import org.jetbrains.annotations.NotNull;

/**
 * Escape hatch from checked exception declarations.
 * <p>
 * Reserved for throwables that every caller would otherwise have to declare for no benefit: restart unwinding
 * ({@link panprob.util.condition.Unwind}) and thread interruption.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws {@code throwable} without the compiler requiring a {@code throws} clause for it.
     * <p>
     * Never returns; the declared {@link UnreachableCodeReachedError} return type lets call sites write
     * {@code throw SneakyThrow.doThrow(e)} so that control flow analysis sees the jump.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw doThrowImpl(throwable);
    }

    // E erases to Throwable, so the cast vanishes from the bytecode, while the compiler infers E as RuntimeException
    // at the call site above.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError doThrowImpl(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
