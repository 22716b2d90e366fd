// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.ast;

import java.util.ArrayList;
import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import panprob.util.condition.ConditionContext;

/**
 * A node of a problem tree.
 * <p>
 * Nodes are immutable and validated on construction: attributes are checked against the node type's declarations,
 * missing optional attributes are filled in with their defaults, and every child is checked against the set of
 * children the type allows. An invalid tree therefore cannot be built at all; the attempt signals
 * {@link IllegalChildCondition} or {@link IllegalAttributeCondition}.
 * <p>
 * Equality is structural: same type, same attributes, same children in the same order.
 */
public sealed interface Node {
    /**
     * Returns a node of the given type, choosing {@link Leaf} or {@link Internal} according to the type.
     * <p>
     * Passing children to a leaf type signals {@link IllegalChildCondition}, just like passing a disallowed child to
     * an internal one.
     */
    static Node of(final NodeType type, final List<Attribute> attributes, final List<Node> children) {
        if (!type.isLeaf()) {
            return new Internal(type, attributes, children);
        }
        if (!children.isEmpty()) {
            throw ConditionContext.error(new IllegalChildCondition(type, children.get(0).type()));
        }
        return new Leaf(type, attributes);
    }

    /**
     * Returns the type of this node.
     */
    NodeType type();

    /**
     * Returns the attributes of this node, in the order the node type declares them.
     */
    List<Attribute> attributes();

    /**
     * Returns the children of this node in order. Always empty for leaves.
     */
    default List<Node> children() {
        return List.of();
    }

    /**
     * A node that never has children, such as a piece of text, a formula or an image.
     */
    record Leaf(NodeType type, List<Attribute> attributes) implements Node {
        public Leaf {
            if (!type.isLeaf()) {
                throw new IllegalArgumentException(type + " is not a leaf node type");
            }
            attributes = Verifier.normalizeAttributes(type, attributes);
        }
    }

    /**
     * A node that contains other nodes.
     */
    record Internal(NodeType type, List<Attribute> attributes, List<Node> children) implements Node {
        public Internal {
            if (type.isLeaf()) {
                throw new IllegalArgumentException(type + " is a leaf node type");
            }
            attributes = Verifier.normalizeAttributes(type, attributes);
            children = List.copyOf(children);
            Verifier.verifyChildren(type, children);
        }

        /**
         * Returns a copy of this node with {@code child} added after the existing children.
         * <p>
         * Signals {@link IllegalChildCondition} if this node's type does not accept children of the given type.
         */
        @CheckReturnValue
        public Internal appended(final Node child) {
            final var newChildren = new ArrayList<Node>(children.size() + 1);
            newChildren.addAll(children);
            newChildren.add(child);
            return new Internal(type, attributes, newChildren);
        }

        /**
         * Returns a node of the same type and with the same attributes, but no children.
         */
        @CheckReturnValue
        public Internal withoutChildren() {
            return new Internal(type, attributes, List.of());
        }
    }
}
