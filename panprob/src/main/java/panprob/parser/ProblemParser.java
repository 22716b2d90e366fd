// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.parser;

import java.nio.file.Path;
import panprob.ast.Node;
import panprob.markup.Markup;
import panprob.markup.MarkupReader;
import panprob.util.Trace;

/**
 * Entry point of the parsing pipeline: markup text in, problem tree out.
 * <p>
 * Both methods signal fatal conditions on malformed input, see {@link MarkupReader} and {@link Converter}; no partial
 * tree is ever returned.
 */
public final class ProblemParser {
    private ProblemParser() {
    }

    /**
     * Parses a problem document into its final tree, with paragraphs.
     *
     * @param markup    The document source.
     * @param directory The problem directory, used to resolve referenced images and code files.
     */
    public static Node parse(final String markup, final Path directory) {
        final var tree = convert(markup, directory);
        try (final var trace = new Trace(() -> "Reconstructing paragraphs")) {
            trace.use();
            return ParagraphPass.apply(tree);
        }
    }

    /**
     * Parses a problem document into a tree without paragraphs, exactly as the converter produces it.
     */
    public static Node convert(final String markup, final Path directory) {
        final var document = readDocument(markup);
        return Converter.convert(document, new ConversionContext(directory));
    }

    private static Markup.Environment readDocument(final String markup) {
        try (final var trace = new Trace(() -> "Reading markup")) {
            trace.use();
            return MarkupReader.read(markup);
        }
    }
}
