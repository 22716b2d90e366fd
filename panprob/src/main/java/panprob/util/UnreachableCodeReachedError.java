// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.util;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when execution arrives somewhere the surrounding logic rules out, such as an exhausted sealed hierarchy.
 * <p>
 * It is a programming error, hence an {@link AssertionError}.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }
}
