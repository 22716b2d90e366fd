// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.ast;

import panprob.util.condition.Condition;
import org.jetbrains.annotations.NotNull;

/**
 * A condition type signaled when a node is built with an unknown, mistyped, duplicated or missing attribute.
 */
public final class IllegalAttributeCondition extends Condition {
    IllegalAttributeCondition(
        final @NotNull NodeType type,
        final @NotNull String attributeName,
        final @NotNull String problem
    ) {
        super("Attribute '" + attributeName + "' of " + type + ": " + problem);
        this.type = type;
        this.attributeName = attributeName;
    }

    public @NotNull NodeType type() {
        return type;
    }

    public @NotNull String attributeName() {
        return attributeName;
    }

    private final @NotNull NodeType type;
    private final @NotNull String attributeName;
}
