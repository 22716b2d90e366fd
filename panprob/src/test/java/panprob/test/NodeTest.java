// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import panprob.ast.Attribute;
import panprob.ast.Attributes;
import panprob.ast.IllegalAttributeCondition;
import panprob.ast.IllegalChildCondition;
import panprob.ast.Node;
import panprob.ast.NodeType;
import panprob.ast.Nodes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

final class NodeTest {
    @Test
    void problemCannotContainProblem() {
        final var problem = Nodes.problem();
        final var condition = Conditions.catchFatal(IllegalChildCondition.class, () -> problem.appended(Nodes.problem()));
        assertThat(condition.parentType()).isEqualTo(NodeType.PROBLEM);
        assertThat(condition.childType()).isEqualTo(NodeType.PROBLEM);
        assertThat(condition.message()).isEqualTo("A Problem node cannot be a child of Problem");
        assertThat(condition.allowedChildTypes()).contains(NodeType.SUBPROBLEM, NodeType.PARAGRAPH)
            .doesNotContain(NodeType.PROBLEM, NodeType.CHOICE);
    }

    @Test
    void choiceOnlyInsideChoiceList() {
        final var condition = Conditions.catchFatal(IllegalChildCondition.class, () ->
            Nodes.problem(Nodes.choice(true, Nodes.normalText("x"))));
        assertThat(condition.childType()).isEqualTo(NodeType.CHOICE);
        assertThat(NodeType.MULTIPLE_SELECT.allowedChildTypes()).containsExactly(NodeType.CHOICE);
    }

    @Test
    void paragraphCannotNest() {
        assertThat(NodeType.PARAGRAPH.allowsChild(NodeType.PARAGRAPH)).isFalse();
        assertThat(NodeType.PARAGRAPH.allowsChild(NodeType.INLINE_MATH)).isTrue();
        assertThat(NodeType.PARAGRAPH.allowsChild(NodeType.DISPLAY_MATH)).isFalse();
        Conditions.catchFatal(IllegalChildCondition.class, () ->
            Nodes.paragraph(Nodes.paragraph(Nodes.normalText("x"))));
    }

    @Test
    void leafTypesRejectChildren() {
        assertThat(NodeType.NORMAL_TEXT.isLeaf()).isTrue();
        assertThat(NodeType.NORMAL_TEXT.allowedChildTypes()).isEmpty();
        final var condition = Conditions.catchFatal(IllegalChildCondition.class, () -> Node.of(
            NodeType.NORMAL_TEXT,
            List.of(Attribute.of("text", "x")),
            List.of(Nodes.normalText("y"))
        ));
        assertThat(condition.parentType()).isEqualTo(NodeType.NORMAL_TEXT);
        assertThat(condition.detailedMessage()).contains("cannot have children");
    }

    @Test
    void constructorsRejectWrongKindOfType() {
        assertThatExceptionOfType(IllegalArgumentException.class)
            .isThrownBy(() -> new Node.Leaf(NodeType.PROBLEM, List.of()));
        assertThatExceptionOfType(IllegalArgumentException.class)
            .isThrownBy(() -> new Node.Internal(NodeType.NORMAL_TEXT, List.of(Attribute.of("text", "x")), List.of()));
    }

    @Test
    void nodeOfPicksRepresentation() {
        assertThat(Node.of(NodeType.SOLUTION, List.of(), List.of())).isInstanceOf(Node.Internal.class);
        assertThat(Node.of(NodeType.TRUE_FALSE, List.of(Attribute.of("solution", true)), List.of()))
            .isInstanceOf(Node.Leaf.class);
    }

    @Test
    void equalityIsStructural() {
        final var first = Nodes.problem(Nodes.normalText("hello"), Nodes.normalText("world"));
        final var second = Nodes.problem().appended(Nodes.normalText("hello")).appended(Nodes.normalText("world"));
        assertThat(first).isEqualTo(second);
        assertThat(first.children()).isEqualTo(second.children());
        assertThat(first).isNotEqualTo(Nodes.problem(Nodes.normalText("world"), Nodes.normalText("hello")));
        assertThat(Nodes.choice(true)).isNotEqualTo(Nodes.choice(false));
    }

    @Test
    void appendedLeavesOriginalUntouched() {
        final var original = Nodes.solution(Nodes.normalText("a"));
        final var extended = original.appended(Nodes.normalText("b"));
        assertThat(original.children()).hasSize(1);
        assertThat(extended.children()).hasSize(2);
        assertThat(extended.withoutChildren()).isEqualTo(Nodes.solution());
    }

    @Test
    void imageDataComparesByContent() {
        final var data = new byte[] {1, 2, 3};
        final var image = Nodes.image("a.png", data);
        data[0] = 42;
        assertThat(image).isEqualTo(Nodes.image("a.png", new byte[] {1, 2, 3}));
        assertThat(image).isNotEqualTo(Nodes.image("a.png", new byte[] {1, 2}));
        Attributes.getBytes(image, "data")[1] = 42;
        assertThat(Attributes.getBytes(image, "data")).containsExactly(1, 2, 3);
    }

    @Test
    void optionalAttributeGetsDefault() {
        final var choice = Node.of(NodeType.CHOICE, List.of(), List.of());
        assertThat(Attributes.getBoolean(choice, "correct")).isFalse();
        assertThat(choice).isEqualTo(Nodes.choice(false));
    }

    @Test
    void attributesAreKeptInDeclarationOrder() {
        final var code = Node.of(
            NodeType.INLINE_CODE,
            List.of(Attribute.of("code", "x + 1"), Attribute.of("language", "python")),
            List.of()
        );
        assertThat(NodeType.INLINE_CODE.attributeNames()).containsExactly("language", "code");
        assertThat(code.attributes()).containsExactly(Attribute.of("language", "python"), Attribute.of("code", "x + 1"));
        assertThat(code).isEqualTo(Nodes.inlineCode("python", "x + 1"));
    }

    @Test
    void unknownAttributeIsRejected() {
        final var condition = Conditions.catchFatal(IllegalAttributeCondition.class, () -> Node.of(
            NodeType.BOLD_TEXT,
            List.of(Attribute.of("text", "x"), Attribute.of("colour", "red")),
            List.of()
        ));
        assertThat(condition.type()).isEqualTo(NodeType.BOLD_TEXT);
        assertThat(condition.attributeName()).isEqualTo("colour");
    }

    @Test
    void missingAttributeIsRejected() {
        final var condition = Conditions.catchFatal(IllegalAttributeCondition.class, () ->
            Node.of(NodeType.TRUE_FALSE, List.of(), List.of()));
        assertThat(condition.message()).isEqualTo("Attribute 'solution' of TrueFalse: required attribute not found");
    }

    @Test
    void mistypedAttributeIsRejected() {
        final var condition = Conditions.catchFatal(IllegalAttributeCondition.class, () ->
            Node.of(NodeType.TRUE_FALSE, List.of(Attribute.of("solution", "yes")), List.of()));
        assertThat(condition.attributeName()).isEqualTo("solution");
    }

    @Test
    void displayNamesAreCamelCase() {
        assertThat(NodeType.MULTIPLE_CHOICES.displayName()).isEqualTo("MultipleChoices");
        assertThat(NodeType.FILL_IN_THE_BLANK).hasToString("FillInTheBlank");
    }

    @ParameterizedTest
    @MethodSource("allowedChildren")
    void allowedChildTable(final NodeType parentType, final Set<NodeType> expected) {
        assertThat(parentType.allowedChildTypes()).containsExactlyInAnyOrderElementsOf(expected);
        final var parent = emptyNode(parentType);
        for (final var childType : NodeType.values()) {
            final var child = sampleNode(childType);
            if (expected.contains(childType)) {
                assertThat(parent.appended(child).children()).containsExactly(child);
            } else {
                final var condition = Conditions.catchFatal(IllegalChildCondition.class, () -> parent.appended(child));
                assertThat(condition.parentType()).isEqualTo(parentType);
                assertThat(condition.childType()).isEqualTo(childType);
            }
        }
    }

    static Stream<Arguments> allowedChildren() {
        final var phrasing = EnumSet.of(
            NodeType.NORMAL_TEXT,
            NodeType.BOLD_TEXT,
            NodeType.ITALIC_TEXT,
            NodeType.INLINE_MATH,
            NodeType.INLINE_CODE
        );
        final var richContent = EnumSet.copyOf(phrasing);
        richContent.addAll(List.of(NodeType.PARAGRAPH, NodeType.DISPLAY_MATH, NodeType.CODE, NodeType.IMAGE));
        final var subproblemBody = EnumSet.copyOf(richContent);
        subproblemBody.addAll(List.of(
            NodeType.MULTIPLE_CHOICES,
            NodeType.MULTIPLE_SELECT,
            NodeType.TRUE_FALSE,
            NodeType.FILL_IN_THE_BLANK,
            NodeType.SOLUTION
        ));
        final var problemBody = EnumSet.copyOf(subproblemBody);
        problemBody.add(NodeType.SUBPROBLEM);
        return Stream.of(
            Arguments.of(NodeType.PROBLEM, problemBody),
            Arguments.of(NodeType.SUBPROBLEM, subproblemBody),
            Arguments.of(NodeType.PARAGRAPH, phrasing),
            Arguments.of(NodeType.MULTIPLE_CHOICES, EnumSet.of(NodeType.CHOICE)),
            Arguments.of(NodeType.MULTIPLE_SELECT, EnumSet.of(NodeType.CHOICE)),
            Arguments.of(NodeType.CHOICE, richContent),
            Arguments.of(NodeType.FILL_IN_THE_BLANK, richContent),
            Arguments.of(NodeType.SOLUTION, richContent)
        );
    }

    private static Node.Internal emptyNode(final NodeType type) {
        return switch (type) {
            case PROBLEM -> Nodes.problem();
            case SUBPROBLEM -> Nodes.subproblem();
            case PARAGRAPH -> Nodes.paragraph();
            case MULTIPLE_CHOICES -> Nodes.multipleChoices();
            case MULTIPLE_SELECT -> Nodes.multipleSelect();
            case CHOICE -> Nodes.choice(false);
            case FILL_IN_THE_BLANK -> Nodes.fillInTheBlank();
            case SOLUTION -> Nodes.solution();
            default -> throw new IllegalArgumentException(type + " is a leaf type");
        };
    }

    private static Node sampleNode(final NodeType type) {
        return switch (type) {
            case NORMAL_TEXT -> Nodes.normalText("x");
            case BOLD_TEXT -> Nodes.boldText("x");
            case ITALIC_TEXT -> Nodes.italicText("x");
            case DISPLAY_MATH -> Nodes.displayMath("x^2");
            case INLINE_MATH -> Nodes.inlineMath("x");
            case CODE -> Nodes.code("python", "pass");
            case INLINE_CODE -> Nodes.inlineCode("python", "x");
            case IMAGE -> Nodes.image("a.png", new byte[] {1, 2});
            case TRUE_FALSE -> Nodes.trueFalse(true);
            default -> emptyNode(type);
        };
    }
}
