// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import panprob.ast.Node;
import panprob.ast.Nodes;
import panprob.markup.Markup;
import panprob.markup.MarkupReader;
import panprob.markup.SourceLocation;
import panprob.util.Trace;
import panprob.util.UnreachableCodeReachedError;
import panprob.util.condition.ConditionContext;
import panprob.util.condition.UnhandledErrorError;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The converter: turns a {@link Markup} tree into a problem tree.
 * <p>
 * Environments and commands are looked up by name in two separate tables. Text becomes
 * {@link panprob.ast.NodeType#NORMAL_TEXT} directly. The result contains no paragraphs; grouping text into paragraphs
 * is left to {@link ParagraphPass}.
 * <p>
 * On error, a fatal condition is signaled and no tree is returned:
 * <ul>
 * <li>{@link UnknownConstructCondition} if a name is missing from the table it was looked up in;
 * <li>{@link MalformedConstructCondition} if a known construct lacks arguments or has an invalid shape;
 * <li>{@link ResourceResolutionErrorCondition} if a file referenced by the document cannot be read;
 * <li>{@link panprob.ast.IllegalChildCondition} if a construct ends up somewhere its node type is not allowed.
 * </ul>
 */
public final class Converter {
    private Converter(final @NotNull ConversionContext context) {
        this.context = context;
    }

    /**
     * Converts {@code markup}, usually the root environment returned by {@link MarkupReader#read(String)}, into a
     * problem tree.
     */
    public static @NotNull Node convert(final @NotNull Markup markup, final @NotNull ConversionContext context) {
        return new Converter(context).convertMarkup(markup);
    }

    private @NotNull Node convertMarkup(final @NotNull Markup markup) {
        if (markup instanceof Markup.Text text) {
            return Nodes.normalText(text.text());
        } else if (markup instanceof Markup.Environment environment) {
            return convertEnvironment(environment);
        } else if (markup instanceof Markup.Command command) {
            return convertCommand(command);
        }
        throw new UnreachableCodeReachedError("Unknown markup node " + markup);
    }

    private @NotNull List<Node> convertAll(final @NotNull List<Markup> markups) {
        final var result = new ArrayList<Node>(markups.size());
        for (final var markup : markups) {
            result.add(convertMarkup(markup));
        }
        return result;
    }

    private @NotNull Node convertEnvironment(final @NotNull Markup.Environment environment) {
        final var name = environment.name();
        try (final var trace = new Trace(() ->
            "Converting environment '" + name + "' at " + environment.location())) {
            trace.use();
            final var converter = environmentConverters.get(name);
            if (converter == null) {
                throw ConditionContext.error(new UnknownConstructCondition("environment", name, environment.location()));
            }
            return converter.convert(this, environment);
        }
    }

    private @NotNull Node convertCommand(final @NotNull Markup.Command command) {
        final var name = command.name();
        try (final var trace = new Trace(() -> "Converting command '\\" + name + "' at " + command.location())) {
            trace.use();
            final var converter = commandConverters.get(name);
            if (converter == null) {
                throw ConditionContext.error(new UnknownConstructCondition("command", name, command.location()));
            }
            return converter.convert(this, command);
        }
    }

    private @NotNull Node convertDocument(final @NotNull Markup.Environment root) {
        final var contents = root.contents();
        if (contents.size() != 1
            || !(contents.get(0) instanceof Markup.Environment problem)
            || !"prob".equals(problem.name())) {
            throw signalMalformed(
                root.name(),
                "a document must consist of exactly one \\begin{prob} environment, found " + describe(contents),
                root.location());
        }
        return convertEnvironment(problem);
    }

    private @NotNull Node convertProblem(final @NotNull Markup.Environment environment) {
        final var children = new ArrayList<Node>();
        for (final var content : environment.contents()) {
            // A subproblem set only groups subproblems in the source; they become direct children of the problem.
            if (content instanceof Markup.Environment nested && "subprobset".equals(nested.name())) {
                try (final var trace = new Trace(() -> "Unwrapping subproblem set at " + nested.location())) {
                    trace.use();
                    children.addAll(convertAll(nested.contents()));
                }
            } else {
                children.add(convertMarkup(content));
            }
        }
        return Nodes.problem(children);
    }

    private @NotNull Node convertSubproblem(final @NotNull Markup.Environment environment) {
        return Nodes.subproblem(convertAll(environment.contents()));
    }

    private @NotNull Node convertSolution(final @NotNull Markup.Environment environment) {
        return Nodes.solution(convertAll(environment.contents()));
    }

    private @NotNull Node convertInlineMath(final @NotNull Markup.Environment environment) {
        return Nodes.inlineMath(environment.source());
    }

    private @NotNull Node convertDisplayMath(final @NotNull Markup.Environment environment) {
        return Nodes.displayMath(environment.source());
    }

    private @NotNull Node convertAlign(final @NotNull Markup.Environment environment) {
        final var name = environment.name();
        return Nodes.displayMath("\\begin{" + name + '}' + environment.source() + "\\end{" + name + '}');
    }

    private @NotNull Node convertMinted(final @NotNull Markup.Environment environment) {
        final var arguments = environment.requiredArguments();
        if (arguments.isEmpty()) {
            throw signalMalformed(environment.name(), "the language argument is missing", environment.location());
        }
        return Nodes.code(arguments.get(0).source(), Dedent.dedent(environment.source()));
    }

    private @NotNull Node convertChoices(final @NotNull Markup.Environment environment) {
        final var arguments = environment.arguments();
        final var isMultipleSelect = !arguments.isEmpty() && "rectangle".equals(arguments.get(0).source().strip());

        final var choices = new ArrayList<Node>();
        Markup.@Nullable Command marker = null;
        var segment = new ArrayList<Markup>();
        for (final var content : environment.contents()) {
            if (content instanceof Markup.Command command && isChoiceMarker(command)) {
                if (marker != null) {
                    choices.add(convertChoice(marker, segment));
                }
                marker = command;
                segment = new ArrayList<>();
            } else if (marker == null) {
                throw signalMalformed(
                    environment.name(),
                    "content found before the first \\choice or \\correctchoice",
                    environment.location());
            } else {
                segment.add(content);
            }
        }
        if (marker != null) {
            choices.add(convertChoice(marker, segment));
        }
        return isMultipleSelect ? Nodes.multipleSelect(choices) : Nodes.multipleChoices(choices);
    }

    private @NotNull Node convertChoice(final Markup.@NotNull Command marker, final @NotNull List<Markup> segment) {
        try (final var trace = new Trace(() -> "Converting choice starting at " + marker.location())) {
            trace.use();
            return Nodes.choice(correctChoiceMarker.equals(marker.name()), convertAll(segment));
        }
    }

    private @NotNull Node convertBold(final Markup.@NotNull Command command) {
        return Nodes.boldText(requiredArgument(command, 0));
    }

    private @NotNull Node convertItalic(final Markup.@NotNull Command command) {
        return Nodes.italicText(requiredArgument(command, 0));
    }

    private @NotNull Node convertMintInline(final Markup.@NotNull Command command) {
        return Nodes.inlineCode(requiredArgument(command, 0), requiredArgument(command, 1));
    }

    private @NotNull Node convertTrueSolution(final Markup.@NotNull Command command) {
        return Nodes.trueFalse(true);
    }

    private @NotNull Node convertFalseSolution(final Markup.@NotNull Command command) {
        return Nodes.trueFalse(false);
    }

    private @NotNull Node convertResponseBox(final Markup.@NotNull Command command) {
        final var arguments = command.requiredArguments();
        if (arguments.isEmpty()) {
            throw signalMalformed(command.name(), "the expected answer argument is missing", command.location());
        }
        return Nodes.fillInTheBlank(convertAll(MarkupReader.readArgument(arguments.get(0))));
    }

    private @NotNull Node convertIncludeGraphics(final Markup.@NotNull Command command) {
        final var relativePath = resourcePath(requiredArgument(command, 0));
        try {
            return Nodes.image(relativePath, Files.readAllBytes(context.directory().resolve(relativePath)));
        } catch (final IOException | InvalidPathException e) {
            throw ConditionContext.error(new ResourceResolutionErrorCondition(command.name(), relativePath, e));
        }
    }

    private @NotNull Node convertInputMinted(final Markup.@NotNull Command command) {
        final var language = requiredArgument(command, 0);
        final var relativePath = resourcePath(requiredArgument(command, 1));
        final String code;
        try {
            code = Files.readString(context.directory().resolve(relativePath), StandardCharsets.UTF_8);
        } catch (final IOException | InvalidPathException e) {
            throw ConditionContext.error(new ResourceResolutionErrorCondition(command.name(), relativePath, e));
        }
        return Nodes.code(language, normalizeLineEndings(code));
    }

    private static @NotNull String requiredArgument(final Markup.@NotNull Command command, final int index) {
        final var arguments = command.requiredArguments();
        if (index >= arguments.size()) {
            throw signalMalformed(
                command.name(),
                "expected at least " + (index + 1) + " argument(s), found " + arguments.size(),
                command.location());
        }
        return arguments.get(index).source();
    }

    private static @NotNull String resourcePath(final @NotNull String path) {
        return path.replace(thisDirectoryPlaceholder, "");
    }

    private static @NotNull String normalizeLineEndings(final @NotNull String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    private static boolean isChoiceMarker(final Markup.@NotNull Command command) {
        final var name = command.name();
        return choiceMarker.equals(name) || correctChoiceMarker.equals(name);
    }

    private static @NotNull String describe(final @NotNull List<Markup> contents) {
        if (contents.isEmpty()) {
            return "nothing";
        }
        final var builder = new StringBuilder();
        for (final var markup : contents) {
            if (builder.length() > 0) {
                builder.append(", ");
            }
            if (markup instanceof Markup.Environment environment) {
                builder.append("\\begin{").append(environment.name()).append('}');
            } else if (markup instanceof Markup.Command command) {
                builder.append('\\').append(command.name());
            } else {
                builder.append("text");
            }
        }
        return builder.toString();
    }

    private static @NotNull UnhandledErrorError signalMalformed(
        final @NotNull String name,
        final @NotNull String problem,
        final @NotNull SourceLocation location
    ) {
        return ConditionContext.error(new MalformedConstructCondition(name, problem, location));
    }

    private static final String choiceMarker = "choice";
    private static final String correctChoiceMarker = "correctchoice";
    private static final String thisDirectoryPlaceholder = "\\thisdir/";

    private static final Map<String, EnvironmentConverter> environmentConverters = Map.ofEntries(
        Map.entry(MarkupReader.rootName, Converter::convertDocument),
        Map.entry("prob", Converter::convertProblem),
        Map.entry("subprob", Converter::convertSubproblem),
        Map.entry("soln", Converter::convertSolution),
        Map.entry("$", Converter::convertInlineMath),
        Map.entry("math", Converter::convertInlineMath),
        Map.entry("$$", Converter::convertDisplayMath),
        Map.entry("displaymath", Converter::convertDisplayMath),
        Map.entry("align", Converter::convertAlign),
        Map.entry("align*", Converter::convertAlign),
        Map.entry("minted", Converter::convertMinted),
        Map.entry("choices", Converter::convertChoices)
    );
    private static final Map<String, CommandConverter> commandConverters = Map.of(
        "textbf", Converter::convertBold,
        "textit", Converter::convertItalic,
        "emph", Converter::convertItalic,
        "mintinline", Converter::convertMintInline,
        "Tf", Converter::convertTrueSolution,
        "tF", Converter::convertFalseSolution,
        "inlineresponsebox", Converter::convertResponseBox,
        "includegraphics", Converter::convertIncludeGraphics,
        "inputminted", Converter::convertInputMinted
    );

    private final @NotNull ConversionContext context;

    @FunctionalInterface
    private interface EnvironmentConverter {
        @NotNull Node convert(@NotNull Converter converter, Markup.@NotNull Environment environment);
    }

    @FunctionalInterface
    private interface CommandConverter {
        @NotNull Node convert(@NotNull Converter converter, Markup.@NotNull Command command);
    }
}
