// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.markup;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import panprob.util.condition.ConditionContext;
import panprob.util.condition.UnhandledErrorError;

/**
 * The markup reader: turns a LaTeX-like document into a {@link Markup} tree.
 * <p>
 * Only the subset of LaTeX syntax problems are written in is understood:
 * <ul>
 * <li>{@code \begin{name}…\end{name}} environments, with arguments directly after the name;
 * <li>{@code $…$}, {@code $$…$$}, {@code \(…\)} and {@code \[…\]} math, read raw;
 * <li>commands, whose arguments are the {@code [opt]} and {@code {req}} groups immediately following the name. Unlike
 * LaTeX, no whitespace may separate them: in {@code \textbf {x}} the group is ordinary content, which keeps
 * {@code \choice {x}} meaning a choice whose text is {@code x};
 * <li>the escapes {@code \$ \% \& \# \_ \{ \} \ } and {@code \\}, the latter read as a line feed;
 * <li>{@code %} comments, which extend to the end of the line;
 * <li>bare {@code {…}} groups, which are flattened into the surrounding contents.
 * </ul>
 * <p>
 * Adjacent text is merged into a single text node, and text consisting only of whitespace is dropped.
 * <p>
 * Malformed input signals a fatal {@link MarkupReadErrorCondition}.
 */
public final class MarkupReader {
    private MarkupReader(final String input, final int firstLineNumber, final int initialDepth) {
        this.input = input;
        lineNumber = firstLineNumber;
        currentDepth = initialDepth;
    }

    /**
     * Reads a whole document, returning a root environment named {@value #rootName} that wraps it.
     */
    public static Markup.Environment read(final String input) {
        final var reader = new MarkupReader(input, 1, 0);
        final var location = reader.location();
        final var contents = reader.readContents();
        return new Markup.Environment(rootName, List.of(), contents, input, location);
    }

    /**
     * Tokenizes the source of a command or environment argument.
     * <p>
     * Line numbers in the result continue from the argument's own location, and so does the nesting depth.
     */
    public static List<Markup> readArgument(final Markup.Argument argument) {
        final var reader =
            new MarkupReader(argument.source(), argument.location().lineNumber(), argument.depth());
        return reader.readContents();
    }

    private List<Markup> readContents() {
        final var contents = new ContentsBuilder();
        readInto(contents, Terminator.END_OF_INPUT, "");
        return contents.build();
    }

    /**
     * Reads markup into {@code contents} up to and including the given terminator.
     *
     * @return The position where the terminator starts, that is, the end of the body just read.
     */
    private int readInto(
        final ContentsBuilder contents,
        final Terminator terminator,
        final String environmentName
    ) {
        enter();
        try {
            while (true) {
                if (atEnd()) {
                    return switch (terminator) {
                        case END_OF_INPUT -> position;
                        case GROUP -> throw signalReadError("Unbalanced braces: '{' is never closed");
                        case ENVIRONMENT -> throw signalReadError(
                            "Expected \\end{" + environmentName + "} but found end of input instead");
                    };
                }
                final var ch = input.charAt(position);
                switch (ch) {
                    case '\\' -> {
                        final var end = readBackslash(contents, terminator, environmentName);
                        if (end >= 0) {
                            return end;
                        }
                    }
                    case '%' -> skipComment();
                    case '{' -> {
                        advance();
                        readInto(contents, Terminator.GROUP, environmentName);
                    }
                    case '}' -> {
                        if (terminator != Terminator.GROUP) {
                            throw signalReadError("Unbalanced braces: unexpected '}'");
                        }
                        final var end = position;
                        advance();
                        return end;
                    }
                    case '$' -> contents.add(readDollarMath());
                    default -> {
                        contents.appendText(ch);
                        advance();
                    }
                }
            }
        } finally {
            leave();
        }
    }

    /**
     * Reads whatever starts with a backslash at the current position.
     *
     * @return The position of the backslash if it started the {@code \end} the caller is waiting for, -1 otherwise.
     */
    private int readBackslash(
        final ContentsBuilder contents,
        final Terminator terminator,
        final String environmentName
    ) {
        final var start = position;
        final var location = location();
        advance();
        if (atEnd()) {
            throw signalReadError("Expected a command name after '\\' but found end of input instead");
        }
        final var ch = input.charAt(position);
        if (isLetter(ch)) {
            final var name = readLetters();
            if ("begin".equals(name)) {
                contents.add(readEnvironment(location));
            } else if ("end".equals(name)) {
                readEnd(terminator, environmentName);
                return start;
            } else {
                contents.add(new Markup.Command(name, readArguments(), location));
            }
            return -1;
        }

        advance();
        switch (ch) {
            case '\\' -> contents.appendText('\n');
            case '$', '%', '&', '#', '_', '{', '}', ' ' -> contents.appendText(ch);
            case '\n', '\t' -> contents.appendText(' ');
            case '(' -> contents.add(readRawMath("math", "\\)", location));
            case '[' -> contents.add(readRawMath("displaymath", "\\]", location));
            case ')', ']' -> throw signalReadError("Unexpected '\\" + ch + "' without matching opening delimiter");
            default -> contents.add(new Markup.Command(String.valueOf(ch), List.of(), location));
        }
        return -1;
    }

    private Markup.Environment readEnvironment(final SourceLocation location) {
        final var name = readEnvironmentName("\\begin");
        final var arguments = readArguments();
        final var bodyStart = position;
        if (rawEnvironments.contains(name)) {
            final var closing = "\\end{" + name + '}';
            final var bodyEnd = input.indexOf(closing, position);
            if (bodyEnd < 0) {
                throw signalReadError("Environment '" + name + "' is never closed", location);
            }
            final var body = input.substring(bodyStart, bodyEnd);
            advanceTo(bodyEnd + closing.length());
            return new Markup.Environment(name, arguments, rawContents(body), body, location);
        }

        final var contents = new ContentsBuilder();
        final var bodyEnd = readInto(contents, Terminator.ENVIRONMENT, name);
        final var body = input.substring(bodyStart, bodyEnd);
        return new Markup.Environment(name, arguments, contents.build(), body, location);
    }

    private void readEnd(final Terminator terminator, final String environmentName) {
        final var name = readEnvironmentName("\\end");
        switch (terminator) {
            case ENVIRONMENT -> {
                if (!name.equals(environmentName)) {
                    throw signalReadError(
                        "Expected \\end{" + environmentName + "} but found \\end{" + name + "} instead");
                }
            }
            case GROUP -> throw signalReadError(
                "Unbalanced braces: \\end{" + name + "} found inside an unclosed '{' group");
            case END_OF_INPUT -> throw signalReadError("Found \\end{" + name + "} without a matching \\begin");
        }
    }

    private String readEnvironmentName(final String keyword) {
        if (atEnd() || input.charAt(position) != '{') {
            throw signalReadError("Expected '{' after " + keyword);
        }
        advance();
        final var start = position;
        while (!atEnd() && (isLetter(input.charAt(position)) || input.charAt(position) == '*')) {
            advance();
        }
        if (start == position || atEnd() || input.charAt(position) != '}') {
            throw signalReadError("Invalid environment name after " + keyword);
        }
        final var name = input.substring(start, position);
        advance();
        return name;
    }

    private List<Markup.Argument> readArguments() {
        final var arguments = new ArrayList<Markup.Argument>();
        while (!atEnd()) {
            final var ch = input.charAt(position);
            if (ch == '{') {
                arguments.add(readArgumentSource('}', false));
            } else if (ch == '[') {
                arguments.add(readArgumentSource(']', true));
            } else {
                break;
            }
        }
        return arguments;
    }

    private Markup.Argument readArgumentSource(final char closer, final boolean optional) {
        final var location = location();
        advance();
        final var start = position;
        var depth = 0;
        while (true) {
            if (atEnd()) {
                throw signalReadError("Argument is never closed, expected '" + closer + '\'', location);
            }
            final var ch = input.charAt(position);
            if (ch == '\\') {
                advance();
                if (!atEnd()) {
                    advance();
                }
                continue;
            }
            if (ch == '{') {
                depth += 1;
            } else if (ch == '}') {
                if (depth == 0) {
                    if (closer != '}') {
                        throw signalReadError("Unbalanced braces: unexpected '}' in optional argument");
                    }
                    break;
                }
                depth -= 1;
            } else if (ch == closer && depth == 0) {
                break;
            }
            advance();
        }
        final var source = input.substring(start, position);
        advance();
        return new Markup.Argument(optional, source, location, currentDepth);
    }

    private Markup.Environment readDollarMath() {
        final var location = location();
        if (input.startsWith("$$", position)) {
            advanceTo(position + 2);
            return readRawMath("$$", "$$", location);
        }
        advance();
        return readRawMath("$", "$", location);
    }

    private Markup.Environment readRawMath(final String name, final String closing, final SourceLocation location) {
        final var bodyEnd = findClosingDelimiter(closing);
        if (bodyEnd < 0) {
            throw signalReadError("Math is never closed, expected '" + closing + '\'', location);
        }
        final var body = input.substring(position, bodyEnd);
        advanceTo(bodyEnd + closing.length());
        return new Markup.Environment(name, List.of(), rawContents(body), body, location);
    }

    private int findClosingDelimiter(final String closing) {
        final var length = input.length();
        var i = position;
        while (i < length) {
            if (input.startsWith(closing, i)) {
                return i;
            }
            i += (input.charAt(i) == '\\') ? 2 : 1;
        }
        return -1;
    }

    private void skipComment() {
        while (!atEnd()) {
            final var ch = input.charAt(position);
            advance();
            if (ch == '\n') {
                break;
            }
        }
    }

    private String readLetters() {
        final var start = position;
        while (!atEnd() && isLetter(input.charAt(position))) {
            advance();
        }
        return input.substring(start, position);
    }

    private boolean atEnd() {
        return position >= input.length();
    }

    private void advance() {
        if (input.charAt(position) == '\n') {
            lineNumber += 1;
        }
        position += 1;
    }

    private void advanceTo(final int newPosition) {
        while (position < newPosition) {
            advance();
        }
    }

    private SourceLocation location() {
        return new SourceLocation(lineNumber);
    }

    private void enter() {
        currentDepth += 1;
        if (currentDepth > maxDepth) {
            throw signalReadError("Nesting limit reached, try to limit nesting");
        }
    }

    private void leave() {
        currentDepth -= 1;
    }

    private UnhandledErrorError signalReadError(final String message) {
        return signalReadError(message, location());
    }

    private static UnhandledErrorError signalReadError(final String message, final SourceLocation location) {
        return ConditionContext.error(new MarkupReadErrorCondition(message, location));
    }

    private static List<Markup> rawContents(final String body) {
        return body.isEmpty() ? List.of() : List.of(new Markup.Text(body));
    }

    private static boolean isLetter(final char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    /**
     * The name of the environment {@link #read(String)} wraps documents in.
     */
    public static final String rootName = "[tex]";

    private static final Set<String> rawEnvironments =
        Set.of("minted", "verbatim", "displaymath", "math", "align", "align*", "equation");
    private static final int maxDepth = 150;

    private final String input;
    private int position = 0;
    private int lineNumber;
    private int currentDepth;

    private enum Terminator {
        END_OF_INPUT,
        GROUP,
        ENVIRONMENT
    }

    private static final class ContentsBuilder {
        private void appendText(final char ch) {
            text.append(ch);
        }

        private void add(final Markup markup) {
            flushText();
            contents.add(markup);
        }

        private List<Markup> build() {
            flushText();
            return List.copyOf(contents);
        }

        private void flushText() {
            if (text.isEmpty()) {
                return;
            }
            final var string = text.toString();
            text.setLength(0);
            if (!string.isBlank()) {
                contents.add(new Markup.Text(string));
            }
        }

        private final StringBuilder text = new StringBuilder();
        private final ArrayList<Markup> contents = new ArrayList<>();
    }
}
