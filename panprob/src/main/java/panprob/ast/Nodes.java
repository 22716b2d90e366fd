// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.ast;

import java.util.List;

/**
 * Factories for every node type.
 * <p>
 * Each factory goes through the validating constructors of {@link Node}, so passing a child the node type does not
 * accept signals {@link IllegalChildCondition}.
 */
public final class Nodes {
    private Nodes() {
    }

    public static Node.Internal problem(final List<Node> children) {
        return internal(NodeType.PROBLEM, children);
    }

    public static Node.Internal problem(final Node... children) {
        return problem(List.of(children));
    }

    public static Node.Internal subproblem(final List<Node> children) {
        return internal(NodeType.SUBPROBLEM, children);
    }

    public static Node.Internal subproblem(final Node... children) {
        return subproblem(List.of(children));
    }

    public static Node.Internal paragraph(final List<Node> children) {
        return internal(NodeType.PARAGRAPH, children);
    }

    public static Node.Internal paragraph(final Node... children) {
        return paragraph(List.of(children));
    }

    public static Node.Leaf normalText(final String text) {
        return text(NodeType.NORMAL_TEXT, text);
    }

    public static Node.Leaf boldText(final String text) {
        return text(NodeType.BOLD_TEXT, text);
    }

    public static Node.Leaf italicText(final String text) {
        return text(NodeType.ITALIC_TEXT, text);
    }

    /**
     * Returns a display formula. {@code latex} is the formula source without delimiters.
     */
    public static Node.Leaf displayMath(final String latex) {
        return new Node.Leaf(NodeType.DISPLAY_MATH, List.of(Attribute.of("latex", latex)));
    }

    /**
     * Returns an inline formula. {@code latex} is the formula source without delimiters.
     */
    public static Node.Leaf inlineMath(final String latex) {
        return new Node.Leaf(NodeType.INLINE_MATH, List.of(Attribute.of("latex", latex)));
    }

    public static Node.Leaf code(final String language, final String code) {
        return new Node.Leaf(NodeType.CODE, List.of(Attribute.of("language", language), Attribute.of("code", code)));
    }

    public static Node.Leaf inlineCode(final String language, final String code) {
        return new Node.Leaf(
            NodeType.INLINE_CODE,
            List.of(Attribute.of("language", language), Attribute.of("code", code))
        );
    }

    /**
     * Returns an image.
     *
     * @param relativePath The path as written in the source, relative to the problem directory.
     * @param data         The image file's contents.
     */
    public static Node.Leaf image(final String relativePath, final byte[] data) {
        return new Node.Leaf(
            NodeType.IMAGE,
            List.of(Attribute.of("relativePath", relativePath), Attribute.of("data", data))
        );
    }

    public static Node.Internal multipleChoices(final List<Node> choices) {
        return internal(NodeType.MULTIPLE_CHOICES, choices);
    }

    public static Node.Internal multipleChoices(final Node... choices) {
        return multipleChoices(List.of(choices));
    }

    public static Node.Internal multipleSelect(final List<Node> choices) {
        return internal(NodeType.MULTIPLE_SELECT, choices);
    }

    public static Node.Internal multipleSelect(final Node... choices) {
        return multipleSelect(List.of(choices));
    }

    @SuppressWarnings("BooleanParameter")
    public static Node.Internal choice(final boolean correct, final List<Node> children) {
        return new Node.Internal(NodeType.CHOICE, List.of(Attribute.of("correct", correct)), children);
    }

    @SuppressWarnings("BooleanParameter")
    public static Node.Internal choice(final boolean correct, final Node... children) {
        return choice(correct, List.of(children));
    }

    @SuppressWarnings("BooleanParameter")
    public static Node.Leaf trueFalse(final boolean solution) {
        return new Node.Leaf(NodeType.TRUE_FALSE, List.of(Attribute.of("solution", solution)));
    }

    public static Node.Internal fillInTheBlank(final List<Node> children) {
        return internal(NodeType.FILL_IN_THE_BLANK, children);
    }

    public static Node.Internal fillInTheBlank(final Node... children) {
        return fillInTheBlank(List.of(children));
    }

    public static Node.Internal solution(final List<Node> children) {
        return internal(NodeType.SOLUTION, children);
    }

    public static Node.Internal solution(final Node... children) {
        return solution(List.of(children));
    }

    private static Node.Internal internal(final NodeType type, final List<Node> children) {
        return new Node.Internal(type, List.of(), children);
    }

    private static Node.Leaf text(final NodeType type, final String text) {
        return new Node.Leaf(type, List.of(Attribute.of("text", text)));
    }
}
