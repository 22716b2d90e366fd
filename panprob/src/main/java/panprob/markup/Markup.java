// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.markup;

import java.util.List;

/**
 * A node of the generic markup tree produced by {@link MarkupReader}.
 * <p>
 * The markup tree knows nothing about problems: it only distinguishes text, environments
 * ({@code \begin{name}…\end{name}} and the math delimiters) and commands ({@code \name[opt]{arg}}). Giving meaning to
 * the names is the job of the converter.
 */
public sealed interface Markup {
    /**
     * A span of literal text, with escapes already resolved and comments removed.
     */
    record Text(String text) implements Markup {
    }

    /**
     * A block with a body.
     * <p>
     * The math delimiters are environments too: {@code $…$} is named {@code $}, {@code $$…$$} is named {@code $$},
     * {@code \(…\)} is named {@code math} and {@code \[…\]} is named {@code displaymath}. Environments with raw bodies,
     * math and {@code minted} among them, have a single text node as their contents; {@link #source()} holds the
     * body of any environment exactly as written.
     *
     * @param source The raw text between the opening and closing delimiters, arguments excluded.
     */
    record Environment(
        String name,
        List<Argument> arguments,
        List<Markup> contents,
        String source,
        SourceLocation location
    ) implements Markup {
        public Environment {
            arguments = List.copyOf(arguments);
            contents = List.copyOf(contents);
        }

        /**
         * Returns the required ({@code {…}}) arguments, in order.
         */
        public List<Argument> requiredArguments() {
            return Argument.required(arguments);
        }
    }

    /**
     * An invocation of a command, such as {@code \textbf{word}} or {@code \choice}.
     */
    record Command(String name, List<Argument> arguments, SourceLocation location) implements Markup {
        public Command {
            arguments = List.copyOf(arguments);
        }

        /**
         * Returns the required ({@code {…}}) arguments, in order.
         */
        public List<Argument> requiredArguments() {
            return Argument.required(arguments);
        }
    }

    /**
     * An argument of a command or environment, kept as raw source.
     * <p>
     * Arguments are only tokenized when a converter asks for it, through {@link MarkupReader#readArgument(Argument)};
     * most of them are plain strings such as a language name or a file path.
     *
     * @param optional Whether the argument was written in square brackets.
     * @param source   The text between the brackets or braces.
     * @param depth    How deeply nested the argument was when read; tokenizing it continues from there, so the
     *                 reader's nesting limit also covers arguments nested inside arguments.
     */
    record Argument(boolean optional, String source, SourceLocation location, int depth) {
        private static List<Argument> required(final List<Argument> arguments) {
            return arguments.stream().filter((final Argument argument) -> !argument.optional()).toList();
        }
    }
}
