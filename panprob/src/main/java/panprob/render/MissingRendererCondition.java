// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.render;

import panprob.ast.NodeType;
import panprob.util.condition.Condition;

/**
 * A condition type indicating that the renderer was given a node type it has no rendering for.
 */
public final class MissingRendererCondition extends Condition {
    MissingRendererCondition(final NodeType type) {
        super("No renderer for node type " + type);
        this.type = type;
    }

    public NodeType type() {
        return type;
    }

    private final NodeType type;
}
