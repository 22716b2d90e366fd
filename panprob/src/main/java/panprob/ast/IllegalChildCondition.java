// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.ast;

import java.util.Set;
import panprob.util.condition.Condition;
import org.jetbrains.annotations.NotNull;

/**
 * A condition type signaled when a node is given a child its type does not accept.
 */
public final class IllegalChildCondition extends Condition {
    IllegalChildCondition(final @NotNull NodeType parentType, final @NotNull NodeType childType) {
        super("A " + childType + " node cannot be a child of " + parentType);
        this.parentType = parentType;
        this.childType = childType;
    }

    /**
     * Returns the type of the node that rejected the child.
     */
    public @NotNull NodeType parentType() {
        return parentType;
    }

    /**
     * Returns the type of the rejected child.
     */
    public @NotNull NodeType childType() {
        return childType;
    }

    /**
     * Returns the child types the parent would have accepted.
     */
    public @NotNull Set<NodeType> allowedChildTypes() {
        return parentType.allowedChildTypes();
    }

    @Override
    public @NotNull String detailedMessage() {
        final var allowed = allowedChildTypes();
        return message() + (allowed.isEmpty()
            ? "; " + parentType + " nodes cannot have children"
            : "; allowed children: " + allowed);
    }

    private final @NotNull NodeType parentType;
    private final @NotNull NodeType childType;
}
