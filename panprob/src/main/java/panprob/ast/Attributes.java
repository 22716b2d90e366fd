// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.ast;

import java.util.List;
import panprob.util.annotation.Nullable;

/**
 * Typed attribute lookups.
 * <p>
 * The typed getters are meant for attributes the node type declares; since nodes are validated on construction,
 * such attributes are always present and of the declared type. Asking for anything else is a programming error.
 */
public final class Attributes {
    private Attributes() {
    }

    /**
     * Retrieves the attribute with the given name, or {@code null} if no such attribute is present.
     */
    public static @Nullable Attribute get(final List<Attribute> attributes, final String name) {
        for (final var attribute : attributes) {
            if (name.equals(attribute.name())) {
                return attribute;
            }
        }
        return null;
    }

    /**
     * Retrieves the value of a string attribute of {@code node}.
     */
    public static String getString(final Node node, final String name) {
        if (get(node.attributes(), name) instanceof Attribute.String string) {
            return string.value();
        }
        throw missing(node, name, "string");
    }

    /**
     * Retrieves the value of a boolean attribute of {@code node}.
     */
    public static boolean getBoolean(final Node node, final String name) {
        if (get(node.attributes(), name) instanceof Attribute.Boolean bool) {
            return bool.value();
        }
        throw missing(node, name, "boolean");
    }

    /**
     * Retrieves a copy of the value of a binary attribute of {@code node}.
     */
    public static byte[] getBytes(final Node node, final String name) {
        if (get(node.attributes(), name) instanceof Attribute.Bytes bytes) {
            return bytes.value();
        }
        throw missing(node, name, "binary");
    }

    private static IllegalArgumentException missing(final Node node, final String name, final String kind) {
        return new IllegalArgumentException(node.type() + " has no " + kind + " attribute named '" + name + '\'');
    }
}
