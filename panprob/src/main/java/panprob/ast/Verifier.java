// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.ast;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import panprob.util.condition.ConditionContext;
import panprob.util.condition.UnhandledErrorError;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Construction-time checks of the node model.
 */
final class Verifier {
    private Verifier() {
    }

    /**
     * Checks {@code attributes} against the declarations of {@code type} and returns them in declaration order, with
     * defaults filled in for omitted optional attributes.
     */
    static @NotNull List<Attribute> normalizeAttributes(
        final @NotNull NodeType type,
        final @NotNull List<Attribute> attributes
    ) {
        final var byName = new HashMap<String, Attribute>();
        for (final var attribute : attributes) {
            final var name = attribute.name();
            final var spec = findSpec(type, name);
            if (spec == null) {
                throw error(type, name, "not a valid attribute for this node type");
            }
            if (byName.put(name, attribute) != null) {
                throw error(type, name, "attribute given more than once");
            }
            final var problem = spec.verifier().verify(attribute);
            if (problem != null) {
                throw error(type, name, problem);
            }
        }

        final var specs = type.attributeSpecs();
        final var result = new ArrayList<Attribute>(specs.size());
        for (final var spec : specs) {
            var attribute = byName.get(spec.name());
            if (attribute == null) {
                attribute = spec.defaultValue();
            }
            if (attribute == null) {
                throw error(type, spec.name(), "required attribute not found");
            }
            result.add(attribute);
        }
        return List.copyOf(result);
    }

    /**
     * Signals {@link IllegalChildCondition} for the first child {@code type} does not accept.
     */
    static void verifyChildren(final @NotNull NodeType type, final @NotNull List<Node> children) {
        for (final var child : children) {
            if (!type.allowsChild(child.type())) {
                throw ConditionContext.error(new IllegalChildCondition(type, child.type()));
            }
        }
    }

    private static NodeType.@Nullable AttributeSpec findSpec(final @NotNull NodeType type, final @NotNull String name) {
        for (final var spec : type.attributeSpecs()) {
            if (spec.name().equals(name)) {
                return spec;
            }
        }
        return null;
    }

    private static @NotNull UnhandledErrorError error(
        final @NotNull NodeType type,
        final @NotNull String attributeName,
        final @NotNull String problem
    ) {
        return ConditionContext.error(new IllegalAttributeCondition(type, attributeName, problem));
    }

    static final AttributeVerifier attributeIsBoolean =
        new AttributeTypeVerifier(Attribute.Boolean.class, "incorrect type, boolean expected");
    static final AttributeVerifier attributeIsString =
        new AttributeTypeVerifier(Attribute.String.class, "incorrect type, string expected");
    static final AttributeVerifier attributeIsBytes =
        new AttributeTypeVerifier(Attribute.Bytes.class, "incorrect type, binary data expected");

    /**
     * Checks a single attribute value, returning a description of the problem or {@code null} if it is fine.
     */
    interface AttributeVerifier {
        @Nullable String verify(@NotNull Attribute attribute);
    }

    private record AttributeTypeVerifier(
        @NotNull Class<? extends Attribute> type,
        @NotNull String message
    ) implements AttributeVerifier {
        @Override
        public @Nullable String verify(final @NotNull Attribute attribute) {
            return type.isInstance(attribute) ? null : message;
        }
    }
}
