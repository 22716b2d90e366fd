// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.test;

import java.nio.file.Path;
import java.util.List;
import panprob.markup.Markup;
import panprob.markup.MarkupReadErrorCondition;
import panprob.markup.MarkupReader;
import panprob.markup.SourceLocation;
import panprob.parser.ProblemParser;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class MarkupReaderTest {
    @Test
    void rootWrapsDocument() {
        final var root = MarkupReader.read("\\begin{prob}hi\\end{prob}\n");
        assertThat(root.name()).isEqualTo(MarkupReader.rootName);
        assertThat(root.contents()).containsExactly(new Markup.Environment(
            "prob",
            List.of(),
            List.of(new Markup.Text("hi")),
            "hi",
            line(1)
        ));
    }

    @Test
    void readsEnvironmentArguments() {
        final var root = MarkupReader.read("\\begin{choices}[rectangle]\\choice a\\end{choices}");
        final var choices = (Markup.Environment) root.contents().get(0);
        assertThat(choices.arguments()).containsExactly(new Markup.Argument(true, "rectangle", line(1), 1));
        assertThat(choices.requiredArguments()).isEmpty();
        assertThat(choices.contents()).containsExactly(
            new Markup.Command("choice", List.of(), line(1)),
            new Markup.Text(" a")
        );
    }

    @Test
    void commandArgumentsMustFollowName() {
        final var root = MarkupReader.read("\\mintinline{python}{f({x})} {y}");
        assertThat(root.contents()).containsExactly(
            new Markup.Command("mintinline", List.of(
                new Markup.Argument(false, "python", line(1), 1),
                new Markup.Argument(false, "f({x})", line(1), 1)
            ), line(1)),
            new Markup.Text(" y")
        );
    }

    @Test
    void spaceSeparatesGroupFromCommand() {
        final var root = MarkupReader.read("\\textbf {x}");
        assertThat(root.contents()).containsExactly(
            new Markup.Command("textbf", List.of(), line(1)),
            new Markup.Text(" x")
        );
    }

    @Test
    void escapesBecomeText() {
        final var root = MarkupReader.read("50\\% of \\$5\\\\next \\{line\\}");
        assertThat(root.contents()).containsExactly(new Markup.Text("50% of $5\nnext {line}"));
    }

    @Test
    void commentsRunToEndOfLine() {
        final var root = MarkupReader.read("a % a comment\nb%\nc");
        assertThat(root.contents()).containsExactly(new Markup.Text("a bc"));
    }

    @Test
    void whitespaceOnlyTextIsDropped() {
        final var root = MarkupReader.read("  \n\\textbf{x}\n\n  \\textit{y} ");
        assertThat(root.contents()).extracting(markup -> markup.getClass().getSimpleName())
            .containsExactly("Command", "Command");
    }

    @Test
    void mathDelimiters() {
        final var root = MarkupReader.read("$a$ $$b$$ \\(c\\) \\[d\\]");
        assertThat(root.contents()).filteredOn(Markup.Environment.class::isInstance)
            .extracting(markup -> ((Markup.Environment) markup).name() + ':' + ((Markup.Environment) markup).source())
            .containsExactly("$:a", "$$:b", "math:c", "displaymath:d");
    }

    @Test
    void dollarInsideMathCanBeEscaped() {
        final var root = MarkupReader.read("$\\$5$");
        final var math = (Markup.Environment) root.contents().get(0);
        assertThat(math.source()).isEqualTo("\\$5");
    }

    @Test
    void rawEnvironmentKeepsSource() {
        final var root = MarkupReader.read("\\begin{minted}{python}\nd = {\n  % not a comment\n\\end{minted}");
        final var minted = (Markup.Environment) root.contents().get(0);
        assertThat(minted.requiredArguments()).extracting(Markup.Argument::source).containsExactly("python");
        assertThat(minted.source()).isEqualTo("\nd = {\n  % not a comment\n");
        assertThat(minted.contents()).containsExactly(new Markup.Text(minted.source()));
    }

    @Test
    void groupsAreFlattened() {
        final var root = MarkupReader.read("a{b{c}}d");
        assertThat(root.contents()).containsExactly(new Markup.Text("abcd"));
    }

    @Test
    void tracksLineNumbers() {
        final var root = MarkupReader.read("\n\n\\textbf{x}\n\\begin{soln}\n\\end{soln}");
        assertThat(root.contents()).extracting(markup -> markup instanceof Markup.Command command
                ? command.location()
                : ((Markup.Environment) markup).location())
            .containsExactly(line(3), line(4));
    }

    @Test
    void readArgumentTokenizesSource() {
        final var root = MarkupReader.read("\n\\inlineresponsebox{$\\Theta(n^2)$ or \\textbf{so}}");
        final var command = (Markup.Command) root.contents().get(0);
        final var contents = MarkupReader.readArgument(command.requiredArguments().get(0));
        assertThat(contents).containsExactly(
            new Markup.Environment("$", List.of(), List.of(new Markup.Text("\\Theta(n^2)")), "\\Theta(n^2)", line(2)),
            new Markup.Text(" or "),
            new Markup.Command("textbf", List.of(new Markup.Argument(false, "so", line(2), 2)), line(2))
        );
    }

    @Test
    void mismatchedEndIsAnError() {
        final var condition = Conditions.catchFatal(MarkupReadErrorCondition.class, () ->
            MarkupReader.read("\\begin{prob}\n\\end{soln}"));
        assertThat(condition.message()).isEqualTo("Expected \\end{prob} but found \\end{soln} instead");
        assertThat(condition.location()).isEqualTo(line(2));
        assertThat(condition.detailedMessage()).endsWith("In line 2");
    }

    @ParameterizedTest
    @ValueSource(strings = {"$x", "\\begin{prob}", "{", "}", "\\end{prob}", "\\textbf{x", "\\)", "\\begin{minted}x"})
    void malformedInputIsAnError(final String input) {
        Conditions.catchFatal(MarkupReadErrorCondition.class, () -> MarkupReader.read(input));
    }

    @Test
    void nestingIsLimited() {
        final var condition = Conditions.catchFatal(MarkupReadErrorCondition.class, () ->
            MarkupReader.read("{".repeat(500)));
        assertThat(condition.message()).startsWith("Nesting limit reached");
    }

    @Test
    void nestingLimitCoversArguments() {
        final var depth = 200;
        final var source = "\\begin{prob}" + "\\inlineresponsebox{".repeat(depth) + "x" + "}".repeat(depth)
            + "\\end{prob}";
        final var condition = Conditions.catchFatal(MarkupReadErrorCondition.class, () ->
            ProblemParser.convert(source, Path.of(".")));
        assertThat(condition.message()).startsWith("Nesting limit reached");
    }

    private static SourceLocation line(final int lineNumber) {
        return new SourceLocation(lineNumber);
    }
}
