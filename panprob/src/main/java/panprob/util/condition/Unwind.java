// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The throwable carrying control to a {@link Restart}.
 * <p>
 * Public only so signatures can declare it. Code outside this package should neither catch nor throw it.
 * <p>
 * It is neither an {@link Exception} nor an {@link Error}: it is not a failure, and an ordinary
 * {@code catch (Exception e)} must not intercept it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    // Unwinds are never serialized.
    private final transient @NotNull Restart target;
}
