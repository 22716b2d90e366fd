// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.test;

import java.nio.file.Path;
import panprob.ast.Nodes;
import panprob.parser.ParagraphPass;
import panprob.parser.ProblemParser;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class ParagraphPassTest {
    @Test
    void inlineMathJoinsParagraph() {
        final var tree = ProblemParser.parse("\\begin{prob}This is $x^2$.\\end{prob}", Path.of("."));
        assertThat(tree).isEqualTo(Nodes.problem(Nodes.paragraph(
            Nodes.normalText("This is "),
            Nodes.inlineMath("x^2"),
            Nodes.normalText(".")
        )));
    }

    @Test
    void blankLinesSeparateParagraphs() {
        final var tree = ParagraphPass.apply(Nodes.problem(Nodes.normalText("a\n\nb"), Nodes.boldText("c\n\nd")));
        assertThat(tree).isEqualTo(Nodes.problem(
            Nodes.paragraph(Nodes.normalText("a")),
            Nodes.paragraph(Nodes.normalText("b"), Nodes.boldText("c\n\nd"))
        ));
    }

    @Test
    void everySeparatorStartsParagraph() {
        final var tree = ParagraphPass.apply(Nodes.solution(Nodes.normalText("a\n\nb\n\nc")));
        assertThat(tree.children()).hasSize(3);
    }

    @Test
    void trailingBlankLineLeavesEmptyParagraph() {
        final var tree = ParagraphPass.apply(Nodes.problem(Nodes.normalText("a\n\n")));
        assertThat(tree).isEqualTo(Nodes.problem(
            Nodes.paragraph(Nodes.normalText("a")),
            Nodes.paragraph(Nodes.normalText(""))
        ));
    }

    @Test
    void blocksInterruptParagraphs() {
        final var tree = ParagraphPass.apply(Nodes.problem(
            Nodes.normalText("before"),
            Nodes.displayMath("x"),
            Nodes.inlineCode("python", "y"),
            Nodes.trueFalse(true)
        ));
        assertThat(tree).isEqualTo(Nodes.problem(
            Nodes.paragraph(Nodes.normalText("before")),
            Nodes.displayMath("x"),
            Nodes.paragraph(Nodes.inlineCode("python", "y")),
            Nodes.trueFalse(true)
        ));
    }

    @Test
    void recursesIntoContainers() {
        final var tree = ParagraphPass.apply(Nodes.problem(
            Nodes.subproblem(Nodes.normalText("s")),
            Nodes.multipleChoices(Nodes.choice(true, Nodes.normalText("c"))),
            Nodes.fillInTheBlank(Nodes.inlineMath("n")),
            Nodes.solution(Nodes.normalText("x"), Nodes.code("python", "pass"))
        ));
        assertThat(tree).isEqualTo(Nodes.problem(
            Nodes.subproblem(Nodes.paragraph(Nodes.normalText("s"))),
            Nodes.multipleChoices(Nodes.choice(true, Nodes.paragraph(Nodes.normalText("c")))),
            Nodes.fillInTheBlank(Nodes.paragraph(Nodes.inlineMath("n"))),
            Nodes.solution(Nodes.paragraph(Nodes.normalText("x")), Nodes.code("python", "pass"))
        ));
    }

    @Test
    void existingParagraphIsKept() {
        final var paragraph = Nodes.paragraph(Nodes.normalText("a\n\nb"));
        assertThat(ParagraphPass.apply(paragraph)).isEqualTo(paragraph);
    }

    @Test
    void inputIsUntouched() {
        final var input = Nodes.problem(Nodes.normalText("a\n\nb"));
        ParagraphPass.apply(input);
        assertThat(input).isEqualTo(Nodes.problem(Nodes.normalText("a\n\nb")));
    }

    @Test
    void solutionGetsParagraphs() {
        final var tree = ProblemParser.parse(
            "\\begin{prob}\n"
                + "    Question.\n"
                + "    \\begin{soln}\n"
                + "        First.\n"
                + "\n"
                + "        Second.\n"
                + "    \\end{soln}\n"
                + "\\end{prob}\n",
            Path.of(".")
        );
        assertThat(tree).isEqualTo(Nodes.problem(
            Nodes.paragraph(Nodes.normalText("\n    Question.\n    ")),
            Nodes.solution(
                Nodes.paragraph(Nodes.normalText("\n        First.")),
                Nodes.paragraph(Nodes.normalText("        Second.\n    "))
            )
        ));
    }
}
