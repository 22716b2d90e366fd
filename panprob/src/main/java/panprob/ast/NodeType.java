// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Every kind of node a problem tree can contain.
 * <p>
 * Each type states which {@link Context}s it may appear in and, unless it is a leaf, which context its children are
 * in. The set of types a node accepts as children is derived from that, so there is exactly one place that describes
 * the shape of a valid tree.
 */
public enum NodeType {
    PROBLEM(build(Context.ROOT, Context.PROBLEM_BODY)),
    SUBPROBLEM(build(Context.PROBLEM_BODY, Context.SUBPROBLEM_BODY)),
    PARAGRAPH(build(
        EnumSet.of(Context.PROBLEM_BODY, Context.SUBPROBLEM_BODY, Context.RICH_CONTENT),
        Context.PHRASING
    )),
    NORMAL_TEXT(build(phrasingContexts(), null)
        .addAttribute("text", Verifier.attributeIsString)
    ),
    BOLD_TEXT(build(phrasingContexts(), null)
        .addAttribute("text", Verifier.attributeIsString)
    ),
    ITALIC_TEXT(build(phrasingContexts(), null)
        .addAttribute("text", Verifier.attributeIsString)
    ),
    DISPLAY_MATH(build(blockContexts(), null)
        .addAttribute("latex", Verifier.attributeIsString)
    ),
    INLINE_MATH(build(phrasingContexts(), null)
        .addAttribute("latex", Verifier.attributeIsString)
    ),
    CODE(build(blockContexts(), null)
        .addAttribute("language", Verifier.attributeIsString)
        .addAttribute("code", Verifier.attributeIsString)
    ),
    INLINE_CODE(build(phrasingContexts(), null)
        .addAttribute("language", Verifier.attributeIsString)
        .addAttribute("code", Verifier.attributeIsString)
    ),
    IMAGE(build(blockContexts(), null)
        .addAttribute("relativePath", Verifier.attributeIsString)
        .addAttribute("data", Verifier.attributeIsBytes)
    ),
    MULTIPLE_CHOICES(build(EnumSet.of(Context.PROBLEM_BODY, Context.SUBPROBLEM_BODY), Context.CHOICE_LIST)),
    MULTIPLE_SELECT(build(EnumSet.of(Context.PROBLEM_BODY, Context.SUBPROBLEM_BODY), Context.CHOICE_LIST)),
    CHOICE(build(EnumSet.of(Context.CHOICE_LIST), Context.RICH_CONTENT)
        .addOptionalAttribute("correct", Verifier.attributeIsBoolean, Attribute.of("correct", false))
    ),
    /**
     * A true/false question; {@code solution} is the correct answer.
     */
    TRUE_FALSE(build(EnumSet.of(Context.PROBLEM_BODY, Context.SUBPROBLEM_BODY), null)
        .addAttribute("solution", Verifier.attributeIsBoolean)
    ),
    FILL_IN_THE_BLANK(build(EnumSet.of(Context.PROBLEM_BODY, Context.SUBPROBLEM_BODY), Context.RICH_CONTENT)),
    SOLUTION(build(EnumSet.of(Context.PROBLEM_BODY, Context.SUBPROBLEM_BODY), Context.RICH_CONTENT));

    NodeType(final Builder builder) {
        displayName = Arrays.stream(name().split("_"))
            .map((final String word) -> word.charAt(0) + word.substring(1).toLowerCase(Locale.ROOT))
            .collect(Collectors.joining());
        allowedContexts = builder.allowedContexts;
        childContext = builder.childContext;
        attributes = List.copyOf(builder.attributes);
    }

    /**
     * Returns the type's name in the form used by messages and by the HTML renderer's class names, e.g.
     * {@code "MultipleChoices"}.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Returns {@code true} if nodes of this type never have children.
     */
    public boolean isLeaf() {
        return childContext == null;
    }

    /**
     * Returns the types that nodes of this type accept as direct children. Empty for leaves.
     */
    public Set<NodeType> allowedChildTypes() {
        return allowedChildTypes.get(this);
    }

    /**
     * Returns {@code true} if a node of this type accepts a child of type {@code childType}.
     */
    public boolean allowsChild(final NodeType childType) {
        return childContext != null && childType.allowedIn(childContext);
    }

    /**
     * Returns {@code true} if nodes of this type may live inside a {@link #PARAGRAPH}.
     */
    public boolean isParagraphEligible() {
        return allowedIn(Context.PHRASING);
    }

    /**
     * Returns the names of the attributes nodes of this type carry, in canonical order.
     */
    public List<String> attributeNames() {
        return attributes.stream().map(AttributeSpec::name).toList();
    }

    @Override
    public String toString() {
        return displayName;
    }

    boolean allowedIn(final Context context) {
        return allowedContexts.contains(context);
    }

    @Nullable Context childContext() {
        return childContext;
    }

    List<AttributeSpec> attributeSpecs() {
        return attributes;
    }

    private static EnumSet<Context> phrasingContexts() {
        return EnumSet.of(Context.PROBLEM_BODY, Context.SUBPROBLEM_BODY, Context.RICH_CONTENT, Context.PHRASING);
    }

    private static EnumSet<Context> blockContexts() {
        return EnumSet.of(Context.PROBLEM_BODY, Context.SUBPROBLEM_BODY, Context.RICH_CONTENT);
    }

    private static Builder build(final Context allowedContext, final @Nullable Context childContext) {
        return new Builder(EnumSet.of(allowedContext), childContext);
    }

    private static Builder build(final EnumSet<Context> allowedContexts, final @Nullable Context childContext) {
        return new Builder(allowedContexts, childContext);
    }

    private static Map<NodeType, Set<NodeType>> computeAllowedChildTypes() {
        final var result = new EnumMap<NodeType, Set<NodeType>>(NodeType.class);
        for (final var type : values()) {
            final var children = EnumSet.noneOf(NodeType.class);
            for (final var candidate : values()) {
                if (type.allowsChild(candidate)) {
                    children.add(candidate);
                }
            }
            result.put(type, Collections.unmodifiableSet(children));
        }
        return result;
    }

    private static final Map<NodeType, Set<NodeType>> allowedChildTypes = computeAllowedChildTypes();

    private final String displayName;
    private final EnumSet<Context> allowedContexts;
    private final @Nullable Context childContext;
    private final List<AttributeSpec> attributes;

    /**
     * Declaration of one attribute of a node type.
     *
     * @param defaultValue The value used when the attribute is omitted, or {@code null} if it is required.
     */
    record AttributeSpec(String name, Verifier.AttributeVerifier verifier, @Nullable Attribute defaultValue) {
    }

    private static final class Builder {
        private Builder(final EnumSet<Context> allowedContexts, final @Nullable Context childContext) {
            this.allowedContexts = allowedContexts;
            this.childContext = childContext;
        }

        private Builder addAttribute(final String name, final Verifier.AttributeVerifier verifier) {
            attributes.add(new AttributeSpec(name, verifier, null));
            return this;
        }

        private Builder addOptionalAttribute(
            final String name,
            final Verifier.AttributeVerifier verifier,
            final Attribute defaultValue
        ) {
            attributes.add(new AttributeSpec(name, verifier, defaultValue));
            return this;
        }

        private final EnumSet<Context> allowedContexts;
        private final @Nullable Context childContext;
        private final ArrayList<AttributeSpec> attributes = new ArrayList<>();
    }
}
